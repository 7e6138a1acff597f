package ir.ipaam.layoutservice.application.service.font;

import ir.ipaam.layoutservice.domain.exception.CollaboratorFailureException;
import ir.ipaam.layoutservice.domain.exception.InvalidStyleException;
import ir.ipaam.layoutservice.domain.text.FontHandle;
import ir.ipaam.layoutservice.domain.text.FontMetrics;
import ir.ipaam.layoutservice.domain.text.LineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.fontbox.util.BoundingBox;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Font metrics of the PDF Standard 14 Type 1 fonts, read from the AFM files bundled
 * with PDFBox. Family names are matched case-insensitively; generic CSS names map to
 * the closest standard family.
 */
@Slf4j
@Service
public class PdfBoxFontMetrics implements FontMetrics {

    private enum Family {
        HELVETICA(Standard14Fonts.FontName.HELVETICA, Standard14Fonts.FontName.HELVETICA_BOLD,
                Standard14Fonts.FontName.HELVETICA_OBLIQUE, Standard14Fonts.FontName.HELVETICA_BOLD_OBLIQUE),
        TIMES(Standard14Fonts.FontName.TIMES_ROMAN, Standard14Fonts.FontName.TIMES_BOLD,
                Standard14Fonts.FontName.TIMES_ITALIC, Standard14Fonts.FontName.TIMES_BOLD_ITALIC),
        COURIER(Standard14Fonts.FontName.COURIER, Standard14Fonts.FontName.COURIER_BOLD,
                Standard14Fonts.FontName.COURIER_OBLIQUE, Standard14Fonts.FontName.COURIER_BOLD_OBLIQUE);

        private final Standard14Fonts.FontName regular;
        private final Standard14Fonts.FontName bold;
        private final Standard14Fonts.FontName italic;
        private final Standard14Fonts.FontName boldItalic;

        Family(Standard14Fonts.FontName regular, Standard14Fonts.FontName bold,
               Standard14Fonts.FontName italic, Standard14Fonts.FontName boldItalic) {
            this.regular = regular;
            this.bold = bold;
            this.italic = italic;
            this.boldItalic = boldItalic;
        }

        Standard14Fonts.FontName variant(boolean isBold, boolean isItalic) {
            if (isBold && isItalic) return boldItalic;
            if (isBold) return bold;
            if (isItalic) return italic;
            return regular;
        }
    }

    private static final Map<String, Family> FAMILIES = Map.ofEntries(
            Map.entry("helvetica", Family.HELVETICA),
            Map.entry("arial", Family.HELVETICA),
            Map.entry("sans-serif", Family.HELVETICA),
            Map.entry("sans", Family.HELVETICA),
            Map.entry("times", Family.TIMES),
            Map.entry("times-roman", Family.TIMES),
            Map.entry("times new roman", Family.TIMES),
            Map.entry("serif", Family.TIMES),
            Map.entry("courier", Family.COURIER),
            Map.entry("courier new", Family.COURIER),
            Map.entry("monospace", Family.COURIER)
    );

    private final Map<Standard14Fonts.FontName, PDType1Font> fonts = new EnumMap<>(Standard14Fonts.FontName.class);
    private final Map<String, Standard14Fonts.FontName> byName = new ConcurrentHashMap<>();
    private final Map<String, Float> widthCache = new ConcurrentHashMap<>();

    public PdfBoxFontMetrics() {
        for (Family family : Family.values()) {
            for (Standard14Fonts.FontName name : new Standard14Fonts.FontName[]{
                    family.regular, family.bold, family.italic, family.boldItalic}) {
                fonts.put(name, new PDType1Font(name));
                byName.put(name.getName(), name);
            }
        }
        log.debug("Registered {} standard fonts", fonts.size());
    }

    @Override
    public FontHandle resolve(String family, boolean bold, boolean italic) {
        Family match = family == null ? null : FAMILIES.get(family.trim().toLowerCase(Locale.ROOT));
        if (match == null) {
            throw new InvalidStyleException(family);
        }
        Standard14Fonts.FontName name = match.variant(bold, italic);
        return new FontHandle(family, bold, italic, name.getName());
    }

    @Override
    public double glyphWidth(int codePoint, FontHandle font, double size) {
        PDFont pdFont = pdFont(font);
        String key = font.name() + ':' + codePoint;
        Float units = widthCache.get(key);
        if (units == null) {
            try {
                units = pdFont.getStringWidth(new String(Character.toChars(codePoint)));
            } catch (IOException | IllegalArgumentException e) {
                throw new CollaboratorFailureException("font-metrics",
                        String.format("no glyph for U+%04X in %s", codePoint, font.name()), e);
            }
            widthCache.put(key, units);
        }
        return units / 1000.0 * size;
    }

    @Override
    public LineMetrics lineMetrics(FontHandle font, double size) {
        PDFont pdFont = pdFont(font);
        PDFontDescriptor descriptor = pdFont.getFontDescriptor();
        float ascent = descriptor != null ? descriptor.getAscent() : 0;
        float descent = descriptor != null ? descriptor.getDescent() : 0;
        if (ascent == 0) {
            try {
                BoundingBox box = pdFont.getBoundingBox();
                ascent = box.getUpperRightY();
                descent = box.getLowerLeftY();
            } catch (IOException e) {
                throw new CollaboratorFailureException("font-metrics", "no bounding box for " + font.name(), e);
            }
        }
        return new LineMetrics(ascent / 1000.0 * size, Math.abs(descent) / 1000.0 * size);
    }

    /** The PDFBox font behind a handle returned by {@link #resolve}. */
    public PDFont pdFont(FontHandle font) {
        Standard14Fonts.FontName name = byName.get(font.name());
        if (name == null) {
            throw new InvalidStyleException(font.family());
        }
        return fonts.get(name);
    }
}
