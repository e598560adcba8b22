package cex.spot.matching.exception;

/**
 * Invalid order or unknown symbol, raised before any state is touched
 */
public class InvalidOrderException extends BusinessException {
    public InvalidOrderException(String message) {
        super(message);
    }
}
