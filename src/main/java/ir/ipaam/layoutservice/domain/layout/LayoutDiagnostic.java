package ir.ipaam.layoutservice.domain.layout;

/** A non-fatal condition reported while laying out a document. */
public record LayoutDiagnostic(Kind kind, int page, String message) {

    public enum Kind {
        CONTENT_OVERFLOW
    }
}
