package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.page.DrawLine;
import ir.ipaam.layoutservice.domain.model.valueobject.LineStyle;
import ir.ipaam.layoutservice.domain.model.valueobject.Point;
import ir.ipaam.layoutservice.domain.model.valueobject.RgbColor;
import ir.ipaam.layoutservice.support.LayoutFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static ir.ipaam.layoutservice.support.LayoutFixtures.STYLE;
import static ir.ipaam.layoutservice.support.LayoutFixtures.area;
import static ir.ipaam.layoutservice.support.LayoutFixtures.texts;
import static org.assertj.core.api.Assertions.assertThat;

class FramedElementTest {

    private static final LineStyle ONE_POINT = new LineStyle(1, RgbColor.BLACK);

    private final RenderContext context = LayoutFixtures.context();

    @Test
    void closedFrameAroundContentThatFits() {
        Element framed = new Paragraph("boxed").framed(ONE_POINT);
        Area area = area(100, 100);

        RenderResult result = framed.render(context, area, STYLE);

        assertThat(result.getHeight()).isEqualTo(12.0);
        assertThat(lines(area)).hasSize(4);
        assertThat(horizontalEdgesAt(area)).containsExactly(0.5, 11.5);
    }

    @Test
    void splitFrameStaysOpenBetweenPages() {
        Element framed = new Paragraph("a\nb").framed(ONE_POINT);
        Area first = area(100, 15);

        RenderResult result = framed.render(context, first, STYLE);

        assertThat(result.isPartial()).isTrue();
        assertThat(result.getHeight()).isEqualTo(11.0);
        assertThat(texts(first)).containsExactly("a");
        assertThat(horizontalEdgesAt(first)).containsExactly(0.5);

        Area second = area(100, 100);
        RenderResult rest = result.getRemainder().render(context, second, STYLE);
        assertThat(rest.getHeight()).isEqualTo(11.0);
        assertThat(texts(second)).containsExactly("b");
        assertThat(horizontalEdgesAt(second)).containsExactly(10.5);
    }

    private static List<DrawLine> lines(Area area) {
        return area.getCanvas().getInstructions().stream()
                .filter(DrawLine.class::isInstance)
                .map(DrawLine.class::cast)
                .toList();
    }

    private static List<Double> horizontalEdgesAt(Area area) {
        return lines(area).stream()
                .filter(line -> {
                    List<Point> p = line.points();
                    return p.get(0).y() == p.get(p.size() - 1).y();
                })
                .map(line -> line.points().get(0).y())
                .toList();
    }
}
