package ir.ipaam.layoutservice.config;

import ir.ipaam.layoutservice.domain.layout.DocumentConfig;
import ir.ipaam.layoutservice.domain.model.valueobject.Margins;
import ir.ipaam.layoutservice.domain.model.valueobject.PageSize;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Defaults applied to every document the service lays out. */
@ConfigurationProperties(prefix = "layout")
@Getter
@Setter
public class LayoutProperties {

    private PageSettings page = new PageSettings();
    private StyleSettings style = new StyleSettings();
    private Hyphenation hyphenation = new Hyphenation();

    /** Below this remaining height (points) a new page is started. */
    private double minRemainingHeight = DocumentConfig.DEFAULT_MIN_REMAINING_HEIGHT;

    @Getter
    @Setter
    public static class PageSettings {
        private double width = 595;
        private double height = 842;
        private double marginTop = 36;
        private double marginRight = 36;
        private double marginBottom = 36;
        private double marginLeft = 36;
    }

    @Getter
    @Setter
    public static class StyleSettings {
        private String fontFamily = Style.DEFAULT_FONT_FAMILY;
        private double fontSize = Style.DEFAULT_FONT_SIZE;
        private double lineSpacing = Style.DEFAULT_LINE_SPACING;
    }

    @Getter
    @Setter
    public static class Hyphenation {
        private boolean enabled = false;
        private String locale = "en-US";

        /** Words with their break points marked by '-', e.g. "hy-phen-ation". */
        private List<String> dictionary = new ArrayList<>();
    }

    public Locale hyphenationLocale() {
        return Locale.forLanguageTag(hyphenation.getLocale());
    }

    public DocumentConfig toDocumentConfig() {
        return DocumentConfig.builder()
                .pageSize(new PageSize(page.getWidth(), page.getHeight()))
                .margins(new Margins(page.getMarginTop(), page.getMarginRight(),
                        page.getMarginBottom(), page.getMarginLeft()))
                .defaultStyle(Style.defaults().and(Style.builder()
                        .fontFamily(style.getFontFamily())
                        .fontSize(style.getFontSize())
                        .lineSpacing(style.getLineSpacing())
                        .build()))
                .minRemainingHeight(minRemainingHeight)
                .hyphenationLocale(hyphenation.isEnabled() ? hyphenationLocale() : null)
                .build();
    }
}
