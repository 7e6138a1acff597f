package ir.ipaam.layoutservice.domain.model.page;

import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import ir.ipaam.layoutservice.domain.text.FontHandle;

/** A glyph run placed on its baseline. */
public record DrawText(double x, double baselineY, String text, FontHandle font, Style style)
        implements DrawInstruction {

    @Override
    public DrawText translate(double dx, double dy) {
        return new DrawText(x + dx, baselineY + dy, text, font, style);
    }
}
