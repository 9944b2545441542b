package ai.theorem.extractor.oracle;

/**
 * Accepts every theorem without consulting a model. Used for dry runs.
 */
public class PassThroughQualityOracle implements QualityOracle {

    @Override
    public QualityVerdict evaluate(String theoremBody) {
        return new QualityVerdict(true, "");
    }
}
