package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.page.DrawInstruction;
import ir.ipaam.layoutservice.domain.model.valueobject.Alignment;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import lombok.Getter;

import java.util.List;

/**
 * Content measured and drawn by an outside renderer, for example a formula or a
 * highlighted code listing. Instructions are relative to the block's top-left corner and
 * copied unchanged; like an image the block is never split.
 */
@Getter
public class ExternalBlock implements Element {

    private final String kind;
    private final double width;
    private final double height;
    private final List<DrawInstruction> instructions;
    private final Alignment alignment;

    public ExternalBlock(String kind, double width, double height, List<DrawInstruction> instructions) {
        this(kind, width, height, instructions, Alignment.LEFT);
    }

    public ExternalBlock(String kind, double width, double height, List<DrawInstruction> instructions,
                         Alignment alignment) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("External block size must not be negative");
        }
        this.kind = kind;
        this.width = width;
        this.height = height;
        this.instructions = List.copyOf(instructions);
        this.alignment = alignment == null ? Alignment.LEFT : alignment;
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style style) {
        double remaining = area.getRemainingHeight();
        if (height > remaining) {
            if (!area.isPageBlank()) {
                return RenderResult.nothingFits(this);
            }
            context.reportOverflow(kind + " block (" + height + "pt) is taller than the "
                    + remaining + "pt of an empty page");
        }
        if (width > area.getWidth()) {
            context.reportOverflow(kind + " block (" + width + "pt) is wider than " + area.getWidth() + "pt");
        }
        double x = Math.max(0, alignment.offset(width, area.getWidth()));
        area.drawAll(instructions, x, 0);
        return RenderResult.done(Math.min(height, remaining));
    }
}
