package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;

import java.util.List;

/**
 * Ordered or unordered list. Markers are assigned when an item is pushed, so the
 * numbering stays the same however the list is broken across pages.
 */
public class ListLayout implements Element {

    private final LinearLayout items = LinearLayout.vertical();
    private final String bullet;
    private int next;

    private ListLayout(String bullet, int start) {
        this.bullet = bullet;
        this.next = start;
    }

    /** Items numbered {@code "1."}, {@code "2."} and so on. */
    public static ListLayout ordered() {
        return ordered(1);
    }

    public static ListLayout ordered(int start) {
        return new ListLayout(null, start);
    }

    public static ListLayout unordered() {
        return unordered(BulletPoint.DEFAULT_BULLET);
    }

    public static ListLayout unordered(String bullet) {
        return new ListLayout(bullet, 0);
    }

    public boolean isOrdered() {
        return bullet == null;
    }

    public ListLayout push(Element item) {
        String marker = isOrdered() ? (next++) + "." : bullet;
        items.push(new BulletPoint(item, marker));
        return this;
    }

    public ListLayout push(String text) {
        return push(new Paragraph(text));
    }

    public List<Element> getItems() {
        return items.getChildren();
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style style) {
        RenderResult result = items.render(context, area, style);
        if (result.isPartial() && result.getRemainder() == items) {
            return RenderResult.nothingFits(this);
        }
        return result;
    }
}
