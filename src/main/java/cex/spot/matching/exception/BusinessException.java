package cex.spot.matching.exception;

/**
 * Base class of matching engine business exceptions
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
