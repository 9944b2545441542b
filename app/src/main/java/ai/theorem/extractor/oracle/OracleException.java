package ai.theorem.extractor.oracle;

/**
 * Runtime exception used to propagate oracle call failures.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
