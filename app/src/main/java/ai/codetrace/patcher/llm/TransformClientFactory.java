package ai.codetrace.patcher.llm;

import java.util.Objects;

/**
 * Provides client instances based on the desired execution mode.
 */
public class TransformClientFactory {

    private final TransformClient productionClient;
    private final TransformClient dryRunClient;
    private final TransformClient mockClient;

    public TransformClientFactory(TransformClient productionClient,
                                  TransformClient dryRunClient,
                                  TransformClient mockClient) {
        this.productionClient = Objects.requireNonNull(productionClient, "productionClient");
        this.dryRunClient = Objects.requireNonNull(dryRunClient, "dryRunClient");
        this.mockClient = Objects.requireNonNull(mockClient, "mockClient");
    }

    public TransformClient select(TransformMode mode) {
        return switch (mode) {
            case PRODUCTION -> productionClient;
            case DRY_RUN -> dryRunClient;
            case MOCK -> mockClient;
        };
    }
}
