package ir.ipaam.layoutservice.domain.text;

import ir.ipaam.layoutservice.domain.exception.CollaboratorFailureException;
import ir.ipaam.layoutservice.domain.exception.LayoutException;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Measures styled text against the font-metrics collaborator and asks the hyphenator
 * for break candidates. Holds no mutable state.
 */
public class TextMeasurer {

    private final FontMetrics fontMetrics;
    private final Hyphenator hyphenator;
    private final Locale locale;

    public TextMeasurer(FontMetrics fontMetrics) {
        this(fontMetrics, null, Locale.ROOT);
    }

    public TextMeasurer(FontMetrics fontMetrics, Hyphenator hyphenator, Locale locale) {
        this.fontMetrics = Objects.requireNonNull(fontMetrics, "fontMetrics");
        this.hyphenator = hyphenator;
        this.locale = locale == null ? Locale.ROOT : locale;
    }

    public FontHandle font(Style style) {
        try {
            return fontMetrics.resolve(style.resolvedFontFamily(), style.isBold(), style.isItalic());
        } catch (LayoutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("font-metrics", "resolving " + style.resolvedFontFamily(), e);
        }
    }

    public double measure(String text, Style style) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        FontHandle font = font(style);
        double size = style.resolvedFontSize();
        double width = 0;
        try {
            for (int i = 0; i < text.length(); ) {
                int cp = text.codePointAt(i);
                if (cp != '\n' && cp != '\r') {
                    width += fontMetrics.glyphWidth(cp, font, size);
                }
                i += Character.charCount(cp);
            }
        } catch (LayoutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("font-metrics", "measuring \"" + text + "\"", e);
        }
        return width;
    }

    public LineMetrics lineMetrics(Style style) {
        FontHandle font = font(style);
        try {
            return fontMetrics.lineMetrics(font, style.resolvedFontSize());
        } catch (LayoutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("font-metrics", "line metrics of " + font.name(), e);
        }
    }

    /** Resolved font size times the line-spacing multiplier. */
    public double lineHeight(Style style) {
        return style.resolvedFontSize() * style.resolvedLineSpacing();
    }

    public boolean isHyphenationEnabled() {
        return hyphenator != null;
    }

    /**
     * Intra-word break offsets, ascending and strictly inside the word. Empty when
     * hyphenation is disabled, leaving only whole-word boundaries.
     */
    public List<Integer> breakCandidates(String word) {
        if (hyphenator == null || word == null || word.length() < 2) {
            return List.of();
        }
        List<Integer> offsets;
        try {
            offsets = hyphenator.hyphenate(word, locale);
        } catch (LayoutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("hyphenator", "hyphenating \"" + word + "\"", e);
        }
        if (offsets == null) {
            return List.of();
        }
        return offsets.stream()
                .filter(o -> o != null && o > 0 && o < word.length())
                .distinct()
                .sorted()
                .toList();
    }
}
