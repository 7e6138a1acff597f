package ir.ipaam.layoutservice.domain.model.page;

import ir.ipaam.layoutservice.domain.model.valueobject.ImageHandle;

public record DrawImage(double x, double y, double width, double height, ImageHandle image)
        implements DrawInstruction {

    @Override
    public DrawImage translate(double dx, double dy) {
        return new DrawImage(x + dx, y + dy, width, height, image);
    }
}
