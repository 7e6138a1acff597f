package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.model.valueobject.Margins;
import ir.ipaam.layoutservice.domain.model.valueobject.PageSize;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Page geometry and defaults for one document. Defaults: A4, 36pt margins, the default
 * style, a 0.5pt allocation threshold and no hyphenation.
 */
@Value
@Builder(toBuilder = true)
public class DocumentConfig {

    public static final double DEFAULT_MARGIN = 36;
    public static final double DEFAULT_MIN_REMAINING_HEIGHT = 0.5;

    @Builder.Default
    PageSize pageSize = PageSize.A4;
    @Builder.Default
    Margins margins = Margins.all(DEFAULT_MARGIN);
    @Builder.Default
    Style defaultStyle = Style.defaults();
    /** Below this remaining height the allocator moves on to a new page. */
    @Builder.Default
    double minRemainingHeight = DEFAULT_MIN_REMAINING_HEIGHT;
    /** Locale handed to the hyphenator; {@code null} disables hyphenation. */
    Locale hyphenationLocale;

    public static DocumentConfig defaults() {
        return DocumentConfig.builder().build();
    }

    public double contentWidth() {
        return pageSize.width() - margins.horizontal();
    }

    public double contentHeight() {
        return pageSize.height() - margins.vertical();
    }

    public void validate() {
        if (!(minRemainingHeight > 0)) {
            throw new IllegalArgumentException("Minimum remaining height must be positive: " + minRemainingHeight);
        }
        if (!(contentWidth() > 0)) {
            throw new IllegalArgumentException("Margins leave no horizontal space on the page");
        }
        if (contentHeight() <= minRemainingHeight) {
            throw new IllegalArgumentException("Margins leave no vertical space on the page");
        }
    }
}
