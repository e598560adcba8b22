package cex.spot.matching.exception;

/**
 * Exception thrown when the order/trade store rejects or cannot complete a write
 */
public class PersistenceFailureException extends BusinessException {

    public PersistenceFailureException(String message) {
        super(message);
    }

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
