package ir.ipaam.layoutservice.domain.model.valueobject;

/** Page dimensions in PDF points. */
public record PageSize(double width, double height) {

    public static final PageSize A4 = new PageSize(595, 842);
    public static final PageSize LETTER = new PageSize(612, 792);

    public PageSize {
        if (!(width > 0) || !(height > 0)) {
            throw new IllegalArgumentException("Page size must be positive: " + width + "x" + height);
        }
    }
}
