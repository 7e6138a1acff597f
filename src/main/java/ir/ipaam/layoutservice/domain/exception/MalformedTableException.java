package ir.ipaam.layoutservice.domain.exception;

/** Raised while a table is being built, never during pagination. */
public class MalformedTableException extends LayoutException {

    public MalformedTableException(String message) {
        super(message);
    }
}
