package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.model.element.Element;
import lombok.Getter;

/**
 * Outcome of one render call: the height consumed and, when the element did not
 * finish, the element holding what is left.
 */
@Getter
public final class RenderResult {

    public enum Status {
        DONE,
        PARTIAL
    }

    private final double height;
    private final Element remainder;
    private final boolean pageBreak;

    private RenderResult(double height, Element remainder, boolean pageBreak) {
        if (height < 0) {
            throw new IllegalArgumentException("Consumed height must not be negative: " + height);
        }
        this.height = height;
        this.remainder = remainder;
        this.pageBreak = pageBreak;
    }

    public static RenderResult done(double height) {
        return new RenderResult(height, null, false);
    }

    public static RenderResult partial(double height, Element remainder) {
        if (remainder == null) {
            throw new IllegalArgumentException("A partial result needs a remainder");
        }
        return new RenderResult(height, remainder, false);
    }

    /** Nothing was drawn; the element must move to the next page as it is. */
    public static RenderResult nothingFits(Element element) {
        return partial(0, element);
    }

    /** Done, and the page must end here. */
    public static RenderResult pageBreak(double height) {
        return new RenderResult(height, null, true);
    }

    /** A forced page break inside the element; {@code remainder} starts the next page. */
    public static RenderResult pageBreak(double height, Element remainder) {
        if (remainder == null) {
            throw new IllegalArgumentException("A partial result needs a remainder");
        }
        return new RenderResult(height, remainder, true);
    }

    public Status getStatus() {
        return remainder == null ? Status.DONE : Status.PARTIAL;
    }

    public boolean isDone() {
        return remainder == null;
    }

    public boolean isPartial() {
        return remainder != null;
    }
}
