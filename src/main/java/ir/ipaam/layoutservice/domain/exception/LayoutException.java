package ir.ipaam.layoutservice.domain.exception;

/** Base type of fatal layout failures. */
public class LayoutException extends RuntimeException {

    public LayoutException(String message) {
        super(message);
    }

    public LayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
