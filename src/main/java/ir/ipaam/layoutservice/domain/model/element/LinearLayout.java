package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Container that stacks its children vertically, or places them side by side in
 * weighted columns.
 *
 * <p>Vertically, children render strictly in order: once a child stops early the
 * container stops too, and its remainder holds the child's remainder followed by every
 * sibling not yet attempted.
 */
public class LinearLayout implements Element {

    public enum Orientation {
        VERTICAL,
        HORIZONTAL
    }

    private final Orientation orientation;
    private final List<Element> children;
    private final double[] weights;

    private LinearLayout(Orientation orientation, List<? extends Element> children, double[] weights) {
        this.orientation = orientation;
        this.children = new ArrayList<>(children);
        this.weights = weights;
    }

    public static LinearLayout vertical() {
        return new LinearLayout(Orientation.VERTICAL, List.of(), null);
    }

    public static LinearLayout vertical(List<? extends Element> children) {
        return new LinearLayout(Orientation.VERTICAL, children, null);
    }

    /** Columns sized by {@code weights}; every pushed child takes the next column. */
    public static LinearLayout horizontal(double... weights) {
        if (weights.length == 0) {
            throw new IllegalArgumentException("A horizontal layout needs at least one column");
        }
        for (double w : weights) {
            if (!(w >= 0)) {
                throw new IllegalArgumentException("Column weight must not be negative: " + w);
            }
        }
        return new LinearLayout(Orientation.HORIZONTAL, List.of(), weights.clone());
    }

    public LinearLayout push(Element child) {
        if (orientation == Orientation.HORIZONTAL && children.size() == weights.length) {
            throw new IllegalArgumentException("All " + weights.length + " columns are already taken");
        }
        children.add(child);
        return this;
    }

    public Orientation getOrientation() {
        return orientation;
    }

    public List<Element> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style style) {
        return orientation == Orientation.VERTICAL
                ? renderVertical(context, area, style)
                : renderHorizontal(context, area, style);
    }

    private RenderResult renderVertical(RenderContext context, Area area, Style style) {
        double used = 0;
        for (int i = 0; i < children.size(); i++) {
            Element child = children.get(i);
            RenderResult result = child.render(context, area.copy(), style);
            area.consume(result.getHeight());
            used += result.getHeight();

            List<Element> rest = new ArrayList<>();
            if (result.isPartial()) {
                if (i == 0 && used == 0 && result.getRemainder() == child && !result.isPageBreak()) {
                    return RenderResult.nothingFits(this);
                }
                rest.add(result.getRemainder());
            }
            if (result.isPartial() || result.isPageBreak()) {
                rest.addAll(children.subList(i + 1, children.size()));
                if (rest.isEmpty()) {
                    return RenderResult.pageBreak(used);
                }
                LinearLayout remainder = new LinearLayout(Orientation.VERTICAL, rest, null);
                return result.isPageBreak()
                        ? RenderResult.pageBreak(used, remainder)
                        : RenderResult.partial(used, remainder);
            }
        }
        return RenderResult.done(used);
    }

    private RenderResult renderHorizontal(RenderContext context, Area area, Style style) {
        List<Area> columns = area.splitHorizontally(weights);
        List<Element> remainders = new ArrayList<>(Collections.nCopies(weights.length, null));
        double height = 0;
        boolean partial = false;
        boolean progress = false;
        for (int i = 0; i < children.size(); i++) {
            Element child = children.get(i);
            RenderResult result = child.render(context, columns.get(i), style);
            height = Math.max(height, result.getHeight());
            if (result.isPartial()) {
                partial = true;
                remainders.set(i, result.getRemainder());
                progress |= result.getHeight() > 0 || result.getRemainder() != child;
            } else {
                progress = true;
            }
        }
        if (!partial) {
            return RenderResult.done(height);
        }
        if (!progress) {
            return RenderResult.nothingFits(this);
        }
        LinearLayout rest = new LinearLayout(Orientation.HORIZONTAL, List.of(), weights);
        for (int i = 0; i < children.size(); i++) {
            Element remainder = remainders.get(i);
            rest.children.add(remainder != null ? remainder : LinearLayout.vertical());
        }
        return RenderResult.partial(height, rest);
    }

    @Override
    public String toString() {
        return "LinearLayout[" + orientation + ", " + children.size() + " children"
                + (weights != null ? ", weights=" + Arrays.toString(weights) : "") + "]";
    }
}
