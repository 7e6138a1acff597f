package ir.ipaam.layoutservice.domain.exception;

/** Thrown when a style references a font the metrics collaborator cannot resolve. */
public class InvalidStyleException extends LayoutException {

    private final String fontFamily;

    public InvalidStyleException(String fontFamily) {
        super("Unknown font family: " + fontFamily);
        this.fontFamily = fontFamily;
    }

    public String getFontFamily() {
        return fontFamily;
    }
}
