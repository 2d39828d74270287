package ai.codetrace.patcher.cli;

import ai.codetrace.patcher.apply.SkipSet;
import ai.codetrace.patcher.apply.TransformApplier;
import ai.codetrace.patcher.config.Config;
import ai.codetrace.patcher.config.ConfigLoader;
import ai.codetrace.patcher.config.EnvironmentReader;
import ai.codetrace.patcher.config.ModelConfig;
import ai.codetrace.patcher.config.Secrets;
import ai.codetrace.patcher.git.WorkspaceStatusException;
import ai.codetrace.patcher.git.WorkspaceStatusService;
import ai.codetrace.patcher.io.AtomicFileWriter;
import ai.codetrace.patcher.llm.ChatModelTransformClient;
import ai.codetrace.patcher.llm.MockTransformClient;
import ai.codetrace.patcher.llm.PassThroughTransformClient;
import ai.codetrace.patcher.llm.RetryingTransformClient;
import ai.codetrace.patcher.llm.TransformClient;
import ai.codetrace.patcher.llm.TransformClientFactory;
import ai.codetrace.patcher.llm.TransformException;
import ai.codetrace.patcher.llm.TransformMode;
import ai.codetrace.patcher.logging.LoggingConfigurator;
import ai.codetrace.patcher.processor.FailedSymbolsRecorder;
import ai.codetrace.patcher.processor.FileProcessor;
import ai.codetrace.patcher.processor.RunCancellation;
import ai.codetrace.patcher.processor.RunOptions;
import ai.codetrace.patcher.processor.RunReportWriter;
import ai.codetrace.patcher.processor.RunSummary;
import ai.codetrace.patcher.processor.SourceFileResolver;
import ai.codetrace.patcher.store.FileLockTable;
import ai.codetrace.patcher.store.RecordIngestor;
import ai.codetrace.patcher.store.StateLayout;
import ai.codetrace.patcher.store.TransformationStore;
import ai.codetrace.patcher.symbol.SymbolIndexExtractor;
import ai.codetrace.patcher.verify.ProcessCommandRunner;
import ai.codetrace.patcher.verify.Verifier;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the file pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL_HALT = 1;
    static final int EXIT_SETUP_FAILURE = 3;

    // initial attempt, retry and recovery run
    private static final int VERIFY_RUNS_PER_FILE = 3;
    private static final Duration SHUTDOWN_MARGIN = Duration.ofMinutes(1);

    private final ConfigLoader configLoader;
    private final Clock clock;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), Clock.systemDefaultZone());
    }

    CliApplication(ConfigLoader configLoader, Clock clock) {
        this.configLoader = configLoader;
        this.clock = clock;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());

        String runId = RUN_ID_FORMAT.format(clock.instant().atZone(ZoneId.systemDefault()))
                + "-" + UUID.randomUUID().toString().substring(0, 8);
        LOGGER.info("Run {} in {} mode: root={} workers={} verify='{}'", runId, config.transformMode(),
                config.projectRoot(), config.workers(), config.verifyCommand());

        RunSummary summary;
        try {
            summary = execute(config, runId);
        } catch (IllegalStateException ex) {
            LOGGER.error("Run {} aborted: {}", runId, ex.getMessage(), ex);
            return EXIT_SETUP_FAILURE;
        }
        return summary.hasFatalHalts() ? EXIT_FATAL_HALT : EXIT_OK;
    }

    RunSummary execute(Config config, String runId) {
        StateLayout layout = new StateLayout(config.projectRoot(), config.stateDirectory());
        AtomicFileWriter writer = new AtomicFileWriter();
        RecordIngestor ingestor = new RecordIngestor(clock);
        TransformationStore store = new TransformationStore(layout, runId,
                new FileLockTable(), ingestor, writer);
        TransformApplier applier = new TransformApplier(store, writer, clock);
        Verifier verifier = new Verifier(new ProcessCommandRunner(), applier, config.projectRoot());
        RunCancellation cancellation = new RunCancellation();
        FileProcessor processor = new FileProcessor(new SymbolIndexExtractor(layout), selectClient(config), store,
                ingestor, applier, verifier, new FailedSymbolsRecorder(layout, writer, clock), cancellation);
        RunOptions options = new RunOptions(config.instruction(), config.verifyCommand(), config.verifyTimeout(),
                config.workers(), SkipSet.of(config.projectRoot(), config.skipSymbols(), config.skipCrc32()));

        Duration drainTimeout = config.verifyTimeout().multipliedBy(VERIFY_RUNS_PER_FILE).plus(SHUTDOWN_MARGIN);
        Thread hook = new Thread(() -> {
            LOGGER.warn("Shutdown requested; no further files will be started");
            cancellation.cancel();
            awaitDrain(cancellation, drainTimeout);
        }, "run-cancellation");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            RunSummary summary = config.isReplay()
                    ? processor.replay(config.applyTransform().get(), options)
                    : processor.run(resolveFiles(config, layout), options);
            Path report = new RunReportWriter(layout, writer).write(summary);
            LOGGER.info("Run report written to {}", report);
            return summary;
        } finally {
            cancellation.markDrained();
            removeHook(hook);
        }
    }

    private static void awaitDrain(RunCancellation cancellation, Duration timeout) {
        try {
            if (!cancellation.awaitDrained(timeout)) {
                LOGGER.error("Files still in flight after {} s; exiting without their results", timeout.toSeconds());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for in-flight files");
        }
    }

    private List<Path> resolveFiles(Config config, StateLayout layout) {
        List<Path> files = new SourceFileResolver(config.projectRoot(), layout.stateDirectory())
                .resolve(config.sourcePatterns(), config.files());
        try {
            return new WorkspaceStatusService(config.projectRoot()).excludeDirty(files);
        } catch (WorkspaceStatusException ex) {
            LOGGER.warn("Could not check for uncommitted changes: {}", ex.getMessage());
            return files;
        }
    }

    private void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOGGER.debug("JVM already shutting down; cancellation hook stays registered");
        }
    }

    private TransformClient selectClient(Config config) {
        TransformClient production = config.transformMode() == TransformMode.PRODUCTION
                ? createProductionClient(config)
                : (text, instruction) -> {
                    throw new TransformException("Production client is not configured in " + config.transformMode()
                            + " mode", null);
                };
        TransformClientFactory factory = new TransformClientFactory(production, new PassThroughTransformClient(),
                new MockTransformClient());
        return factory.select(config.transformMode());
    }

    private TransformClient createProductionClient(Config config) {
        ModelConfig modelConfig = config.modelConfig();
        ChatModel chatModel = switch (modelConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(modelConfig);
            case GEMINI -> createGeminiChatModel(modelConfig, config.secrets());
        };
        TransformClient client = new ChatModelTransformClient(chatModel, modelConfig.provider().name(),
                modelConfig.modelName());
        return new RetryingTransformClient(client, modelConfig.maxRetryAttempts(),
                modelConfig.initialBackoffSeconds(), modelConfig.maxBackoffSeconds(), modelConfig.retryJitterFactor());
    }

    private ChatModel createOllamaChatModel(ModelConfig modelConfig) {
        try {
            String baseUrl = modelConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", modelConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(modelConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(5))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(ModelConfig modelConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", modelConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(modelConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(5))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
