package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.Alignment;
import ir.ipaam.layoutservice.domain.model.valueobject.ImageHandle;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import lombok.Getter;

/**
 * A raster image of fixed size, one pixel per point unless a width or height is given.
 * Wider than the area it is scaled down keeping its aspect ratio. It is never split: if
 * it does not fit what is left of the page it moves to the next page unchanged.
 */
@Getter
public class ImageElement implements Element {

    private final ImageHandle image;
    private final Double width;
    private final Double height;
    private final Alignment alignment;

    public ImageElement(ImageHandle image) {
        this(image, null, null, Alignment.LEFT);
    }

    public ImageElement(ImageHandle image, Double width, Double height, Alignment alignment) {
        if ((width != null && !(width > 0)) || (height != null && !(height > 0))) {
            throw new IllegalArgumentException("Image dimensions must be positive");
        }
        this.image = image;
        this.width = width;
        this.height = height;
        this.alignment = alignment == null ? Alignment.LEFT : alignment;
    }

    public ImageElement aligned(Alignment value) {
        return new ImageElement(image, width, height, value);
    }

    /** Display size for the given available width. */
    public double[] displaySize(double maxWidth) {
        double naturalW = image.getNaturalWidth();
        double naturalH = image.getNaturalHeight();
        double w = width != null ? width : naturalW;
        double h = height != null ? height : naturalH;
        if (width != null && height == null) {
            h = naturalH * (w / naturalW);
        }
        if (height != null && width == null) {
            w = naturalW * (h / naturalH);
        }
        double scale = w > maxWidth ? maxWidth / w : 1.0;
        return new double[]{w * scale, h * scale};
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style style) {
        double[] size = displaySize(area.getWidth());
        double remaining = area.getRemainingHeight();
        if (size[1] > remaining) {
            if (!area.isPageBlank()) {
                return RenderResult.nothingFits(this);
            }
            context.reportOverflow("image " + image.getId() + " (" + size[1] + "pt) is taller than the "
                    + remaining + "pt of an empty page");
        }
        double x = Math.max(0, alignment.offset(size[0], area.getWidth()));
        area.drawImage(x, 0, size[0], size[1], image);
        return RenderResult.done(Math.min(size[1], remaining));
    }
}
