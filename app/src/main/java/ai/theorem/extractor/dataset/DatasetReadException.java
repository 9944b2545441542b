package ai.theorem.extractor.dataset;

/**
 * Raised when the paper dataset cannot be read.
 */
public class DatasetReadException extends RuntimeException {

    public DatasetReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
