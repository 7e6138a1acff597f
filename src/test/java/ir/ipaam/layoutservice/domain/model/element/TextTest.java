package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.page.DrawText;
import ir.ipaam.layoutservice.domain.model.valueobject.Alignment;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import ir.ipaam.layoutservice.support.LayoutFixtures;
import org.junit.jupiter.api.Test;

import static ir.ipaam.layoutservice.support.LayoutFixtures.STYLE;
import static ir.ipaam.layoutservice.support.LayoutFixtures.area;
import static org.assertj.core.api.Assertions.assertThat;

class TextTest {

    private final RenderContext context = LayoutFixtures.context();

    @Test
    void drawsOneLineOnItsBaseline() {
        Area area = area(100, 100);

        RenderResult result = new Text("single line").render(context, area, STYLE);

        assertThat(result.getHeight()).isEqualTo(10.0);
        DrawText run = (DrawText) area.getCanvas().getInstructions().get(0);
        assertThat(run.text()).isEqualTo("single line");
        assertThat(run.baselineY()).isEqualTo(8.0);
    }

    @Test
    void centeredText() {
        Area area = area(100, 100);

        new Text("abcd", Style.empty(), Alignment.CENTER).render(context, area, STYLE);

        assertThat(((DrawText) area.getCanvas().getInstructions().get(0)).x()).isEqualTo(40.0);
    }

    @Test
    void tooWideTextIsDrawnAndReported() {
        Area area = area(20, 100);

        RenderResult result = new Text("much too wide").render(context, area, STYLE);

        assertThat(result.isDone()).isTrue();
        assertThat(area.getCanvas().hasContent()).isTrue();
        assertThat(context.getDiagnostics()).hasSize(1);
    }

    @Test
    void tooTallTextMovesToTheNextPage() {
        Text text = new Text("later");
        Area area = area(100, 15);
        new Text("first").render(context, area.copy(), STYLE);
        area.consume(10);

        RenderResult result = text.render(context, area, STYLE);

        assertThat(result.getRemainder()).isSameAs(text);
        assertThat(context.getDiagnostics()).isEmpty();
    }
}
