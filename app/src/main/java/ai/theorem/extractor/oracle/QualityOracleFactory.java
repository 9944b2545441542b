package ai.theorem.extractor.oracle;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides oracle instances based on the desired execution mode.
 * The production oracle is only created when it is selected, so a dry run never builds a model client.
 */
public class QualityOracleFactory {

    private final Supplier<QualityOracle> productionOracle;
    private final QualityOracle dryRunOracle;

    public QualityOracleFactory(Supplier<QualityOracle> productionOracle, QualityOracle dryRunOracle) {
        this.productionOracle = Objects.requireNonNull(productionOracle, "productionOracle");
        this.dryRunOracle = Objects.requireNonNull(dryRunOracle, "dryRunOracle");
    }

    public QualityOracle select(OracleMode mode) {
        return switch (mode) {
            case PRODUCTION -> Objects.requireNonNull(productionOracle.get(), "production oracle");
            case DRY_RUN -> dryRunOracle;
        };
    }
}
