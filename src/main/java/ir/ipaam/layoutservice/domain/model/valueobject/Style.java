package ir.ipaam.layoutservice.domain.model.valueobject;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable text style. Every field is optional; an unset field falls through to the
 * style it is merged over, and to the documented default when nothing sets it.
 *
 * <p>Defaults: {@value #DEFAULT_FONT_FAMILY}, size 12, line spacing 1.0, black, no emphasis.
 */
@Value
public class Style {

    public static final String DEFAULT_FONT_FAMILY = "Helvetica";
    public static final double DEFAULT_FONT_SIZE = 12.0;
    public static final double DEFAULT_LINE_SPACING = 1.0;

    private static final Style EMPTY = Style.builder().build();

    String fontFamily;
    Double fontSize;
    Boolean bold;
    Boolean italic;
    Boolean underline;
    Boolean strikethrough;
    RgbColor color;
    Double lineSpacing;

    @Builder(toBuilder = true)
    private Style(String fontFamily, Double fontSize, Boolean bold, Boolean italic,
                  Boolean underline, Boolean strikethrough, RgbColor color, Double lineSpacing) {
        if (fontSize != null && !(fontSize > 0)) {
            throw new IllegalArgumentException("Font size must be positive: " + fontSize);
        }
        if (lineSpacing != null && !(lineSpacing > 0)) {
            throw new IllegalArgumentException("Line spacing must be positive: " + lineSpacing);
        }
        this.fontFamily = fontFamily;
        this.fontSize = fontSize;
        this.bold = bold;
        this.italic = italic;
        this.underline = underline;
        this.strikethrough = strikethrough;
        this.color = color;
        this.lineSpacing = lineSpacing;
    }

    public static Style empty() {
        return EMPTY;
    }

    /** A style with every field set to its default. */
    public static Style defaults() {
        return Style.builder()
                .fontFamily(DEFAULT_FONT_FAMILY)
                .fontSize(DEFAULT_FONT_SIZE)
                .bold(false)
                .italic(false)
                .underline(false)
                .strikethrough(false)
                .color(RgbColor.BLACK)
                .lineSpacing(DEFAULT_LINE_SPACING)
                .build();
    }

    /**
     * Returns a new style that takes every field {@code override} sets and the value of
     * {@code base} for the others. Neither argument is modified.
     */
    public static Style merge(Style base, Style override) {
        if (base == null) {
            return override == null ? EMPTY : override;
        }
        if (override == null || override.equals(EMPTY)) {
            return base;
        }
        return new Style(
                pick(override.fontFamily, base.fontFamily),
                pick(override.fontSize, base.fontSize),
                pick(override.bold, base.bold),
                pick(override.italic, base.italic),
                pick(override.underline, base.underline),
                pick(override.strikethrough, base.strikethrough),
                pick(override.color, base.color),
                pick(override.lineSpacing, base.lineSpacing));
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    public Style and(Style override) {
        return merge(this, override);
    }

    public static Style ofSize(double size) {
        return Style.builder().fontSize(size).build();
    }

    public static Style ofBold() {
        return Style.builder().bold(true).build();
    }

    public static Style ofItalic() {
        return Style.builder().italic(true).build();
    }

    public static Style ofColor(RgbColor color) {
        return Style.builder().color(color).build();
    }

    public String resolvedFontFamily() {
        return fontFamily != null ? fontFamily : DEFAULT_FONT_FAMILY;
    }

    public double resolvedFontSize() {
        return fontSize != null ? fontSize : DEFAULT_FONT_SIZE;
    }

    public double resolvedLineSpacing() {
        return lineSpacing != null ? lineSpacing : DEFAULT_LINE_SPACING;
    }

    public RgbColor resolvedColor() {
        return color != null ? color : RgbColor.BLACK;
    }

    public boolean isBold() {
        return Boolean.TRUE.equals(bold);
    }

    public boolean isItalic() {
        return Boolean.TRUE.equals(italic);
    }

    public boolean isUnderline() {
        return Boolean.TRUE.equals(underline);
    }

    public boolean isStrikethrough() {
        return Boolean.TRUE.equals(strikethrough);
    }
}
