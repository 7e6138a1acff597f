package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.page.DrawImage;
import ir.ipaam.layoutservice.domain.model.valueobject.Alignment;
import ir.ipaam.layoutservice.domain.model.valueobject.ImageHandle;
import ir.ipaam.layoutservice.support.LayoutFixtures;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static ir.ipaam.layoutservice.support.LayoutFixtures.STYLE;
import static ir.ipaam.layoutservice.support.LayoutFixtures.area;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageElementTest {

    private final RenderContext context = LayoutFixtures.context();
    private final ImageHandle logo = new ImageHandle("logo", new BufferedImage(100, 50, BufferedImage.TYPE_INT_RGB));

    @Test
    void naturalSizeIsOnePointPerPixel() {
        Area area = area(200, 200);

        RenderResult result = new ImageElement(logo).render(context, area, STYLE);

        assertThat(result.getHeight()).isEqualTo(50.0);
        DrawImage image = (DrawImage) area.getCanvas().getInstructions().get(0);
        assertThat(image.width()).isEqualTo(100.0);
        assertThat(image.height()).isEqualTo(50.0);
    }

    @Test
    void scaledDownToTheAreaWidth() {
        assertThat(new ImageElement(logo).displaySize(50)).containsExactly(50.0, 25.0);
    }

    @Test
    void givenWidthKeepsTheAspectRatio() {
        assertThat(new ImageElement(logo, 40.0, null, null).displaySize(500)).containsExactly(40.0, 20.0);
        assertThat(new ImageElement(logo, null, 10.0, null).displaySize(500)).containsExactly(20.0, 10.0);
    }

    @Test
    void rightAligned() {
        Area area = area(300, 200);

        new ImageElement(logo).aligned(Alignment.RIGHT).render(context, area, STYLE);

        assertThat(((DrawImage) area.getCanvas().getInstructions().get(0)).x()).isEqualTo(200.0);
    }

    @Test
    void imageIsNeverSplit() {
        ImageElement image = new ImageElement(logo);
        Area area = area(200, 60);
        new Text("caption").render(context, area.copy(), STYLE);
        area.consume(20);

        RenderResult result = image.render(context, area, STYLE);

        assertThat(result.getRemainder()).isSameAs(image);
        assertThat(area.getCanvas().getInstructions()).hasSize(1);
    }

    @Test
    void imageTallerThanAnEmptyPageIsDrawnAndReported() {
        Area area = area(200, 30);

        RenderResult result = new ImageElement(logo).render(context, area, STYLE);

        assertThat(result.isDone()).isTrue();
        assertThat(result.getHeight()).isEqualTo(30.0);
        assertThat(context.getDiagnostics()).hasSize(1);
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThatThrownBy(() -> new ImageElement(logo, 0.0, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
