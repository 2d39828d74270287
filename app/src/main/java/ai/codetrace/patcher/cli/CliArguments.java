package ai.codetrace.patcher.cli;

import ai.codetrace.patcher.config.LogFormat;
import ai.codetrace.patcher.llm.TransformMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-codetrace-patcher", mixinStandardHelpOptions = true,
        description = "Applies model-proposed symbol edits with checksum guards, verification and rollback")
public class CliArguments {

    @CommandLine.Option(names = {"-c", "--config"}, description = "YAML trace config (source_files, verify_cmd, skip lists)", paramLabel = "FILE")
    private Path configFile;

    @CommandLine.Option(names = {"-f", "--file"}, description = "Source file to process; repeatable", paramLabel = "FILE")
    private List<String> files = new ArrayList<>();

    @CommandLine.Option(names = "--apply-transform", description = "Replay a stored transformation file instead of querying the model", paramLabel = "FILE")
    private Path applyTransform;

    @CommandLine.Option(names = "--skip-symbols", split = ",", description = "Symbols to leave untouched: name, or path/to/file/name; wildcards allowed", paramLabel = "RULE")
    private List<String> skipSymbols = new ArrayList<>();

    @CommandLine.Option(names = "--skip-crc32", split = ",", description = "CRC32 values (hex) of original symbol text to leave untouched", paramLabel = "HEX")
    private List<String> skipCrc32 = new ArrayList<>();

    @CommandLine.Option(names = "--verify-cmd", description = "Command run after edits; {files} expands to the edited files", paramLabel = "COMMAND")
    private String verifyCommand;

    @CommandLine.Option(names = "--verify-timeout", description = "Verification timeout in seconds", paramLabel = "SECONDS")
    private Integer verifyTimeoutSeconds;

    @CommandLine.Option(names = "--workers", description = "Number of files processed in parallel", paramLabel = "COUNT")
    private Integer workers;

    @CommandLine.Option(names = "--project-root", description = "Project root; defaults to the working directory", paramLabel = "DIR")
    private Path projectRoot;

    @CommandLine.Option(names = "--state-dir", description = "State directory relative to the project root (default trace_debug)", paramLabel = "DIR")
    private Path stateDirectory;

    @CommandLine.Option(names = "--transform-mode", description = "Transformation mode: production, dry-run, or mock", converter = TransformModeConverter.class)
    private TransformMode transformMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--instruction", description = "Instruction sent to the model with every symbol", paramLabel = "TEXT")
    private String instruction;

    public Path configFile() {
        return configFile;
    }

    public List<String> files() {
        return files;
    }

    public Path applyTransform() {
        return applyTransform;
    }

    public List<String> skipSymbols() {
        return skipSymbols;
    }

    public List<String> skipCrc32() {
        return skipCrc32;
    }

    public String verifyCommand() {
        return verifyCommand;
    }

    public Integer verifyTimeoutSeconds() {
        return verifyTimeoutSeconds;
    }

    public Integer workers() {
        return workers;
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public Path stateDirectory() {
        return stateDirectory;
    }

    public TransformMode transformMode() {
        return transformMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public String instruction() {
        return instruction;
    }
}
