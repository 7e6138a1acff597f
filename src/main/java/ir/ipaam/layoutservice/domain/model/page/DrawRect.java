package ir.ipaam.layoutservice.domain.model.page;

import ir.ipaam.layoutservice.domain.model.valueobject.RgbColor;

public record DrawRect(double x, double y, double width, double height, RgbColor fill)
        implements DrawInstruction {

    @Override
    public DrawRect translate(double dx, double dy) {
        return new DrawRect(x + dx, y + dy, width, height, fill);
    }
}
