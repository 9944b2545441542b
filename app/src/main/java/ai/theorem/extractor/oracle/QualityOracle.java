package ai.theorem.extractor.oracle;

/**
 * Judges theorem bodies. Implementations throw {@link OracleException} when no usable verdict was obtained.
 */
public interface QualityOracle {

    QualityVerdict evaluate(String theoremBody);
}
