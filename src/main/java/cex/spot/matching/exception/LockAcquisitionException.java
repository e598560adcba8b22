package cex.spot.matching.exception;

/**
 * Exception thrown when a symbol lock cannot be acquired within the configured wait time
 */
public class LockAcquisitionException extends BusinessException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
