package ai.theorem.extractor.oracle;

/**
 * Raised when the model answered but the answer is not a complete verdict.
 */
public class MalformedVerdictException extends OracleException {

    public MalformedVerdictException(String message) {
        super(message, null);
    }

    public MalformedVerdictException(String message, Throwable cause) {
        super(message, cause);
    }
}
