package ir.ipaam.layoutservice.domain.text;

/**
 * Font-metrics collaborator. Implementations must answer identically for identical input.
 */
public interface FontMetrics {

    /**
     * @throws ir.ipaam.layoutservice.domain.exception.InvalidStyleException if the family is unknown
     */
    FontHandle resolve(String family, boolean bold, boolean italic);

    double glyphWidth(int codePoint, FontHandle font, double size);

    LineMetrics lineMetrics(FontHandle font, double size);
}
