package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.PageCanvas;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.page.DrawRect;
import ir.ipaam.layoutservice.domain.model.page.DrawText;
import ir.ipaam.layoutservice.domain.model.valueobject.Alignment;
import ir.ipaam.layoutservice.domain.model.valueobject.Span;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import ir.ipaam.layoutservice.support.LayoutFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static ir.ipaam.layoutservice.support.LayoutFixtures.STYLE;
import static ir.ipaam.layoutservice.support.LayoutFixtures.area;
import static ir.ipaam.layoutservice.support.LayoutFixtures.texts;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ParagraphTest {

    // 12 four-letter words fill three 100pt lines; "tailpart" is 40pt, 0.4 of a line
    private static final String THREE_AND_A_BIT =
            "ab01 ab02 ab03 ab04 ab05 ab06 ab07 ab08 ab09 ab10 ab11 ab12 tailpart";

    private final RenderContext context = LayoutFixtures.context();

    @Test
    void drawsWhatFitsAndReturnsTheTrailingLineAsRemainder() {
        Paragraph paragraph = new Paragraph(THREE_AND_A_BIT);
        Area page1 = area(100, 30);

        RenderResult first = paragraph.render(context, page1, STYLE);

        assertThat(first.isPartial()).isTrue();
        assertThat(first.getHeight()).isEqualTo(30.0);
        assertThat(texts(page1)).containsExactly("ab01 ab02 ab03 ab04 ", "ab05 ab06 ab07 ab08 ", "ab09 ab10 ab11 ab12 ");
        Paragraph remainder = (Paragraph) first.getRemainder();
        assertThat(remainder.text()).isEqualTo("tailpart");

        Area page2 = area(100, 30);
        RenderResult second = remainder.render(context, page2, STYLE);

        assertThat(second.isDone()).isTrue();
        assertThat(second.getHeight()).isEqualTo(10.0);
        assertThat(texts(page2)).containsExactly("tailpart");
    }

    @Test
    void drawnTextAndRemainderTogetherEqualTheOriginal() {
        Paragraph paragraph = new Paragraph(THREE_AND_A_BIT);
        Area page = area(100, 20);

        RenderResult result = paragraph.render(context, page, STYLE);

        String drawn = String.join("", texts(page));
        assertThat(drawn + ((Paragraph) result.getRemainder()).text()).isEqualTo(THREE_AND_A_BIT);
    }

    @Test
    void originalParagraphIsNotModifiedAndCanBeRenderedAgain() {
        Paragraph paragraph = new Paragraph(THREE_AND_A_BIT);

        paragraph.render(context, area(100, 30), STYLE);
        Area tall = area(100, 100);
        RenderResult again = paragraph.render(context, tall, STYLE);

        assertThat(paragraph.text()).isEqualTo(THREE_AND_A_BIT);
        assertThat(again.isDone()).isTrue();
        assertThat(again.getHeight()).isEqualTo(40.0);
    }

    @Test
    void remainderIsBrokenAgainForANewWidth() {
        Paragraph paragraph = new Paragraph(THREE_AND_A_BIT);
        RenderResult first = paragraph.render(context, area(100, 10), STYLE);

        Area wide = area(150, 100);
        RenderResult second = first.getRemainder().render(context, wide, STYLE);

        assertThat(second.getHeight()).isEqualTo(20.0);
        assertThat(texts(wide)).hasSize(2);
    }

    @Test
    void nothingFitsOnAPartlyFilledPage() {
        PageCanvas canvas = new PageCanvas();
        Area area = new Area(canvas, 0, 0, 100, 5);
        new Text("above").render(context, area.copy(), STYLE);

        Paragraph paragraph = new Paragraph("hello");
        RenderResult result = paragraph.render(context, area, STYLE);

        assertThat(result.getHeight()).isZero();
        assertThat(result.getRemainder()).isSameAs(paragraph);
    }

    @Test
    void lineTallerThanAnEmptyPageIsForcedAndReported() {
        Area area = area(100, 5);

        RenderResult result = new Paragraph("hello").render(context, area, STYLE);

        assertThat(result.isDone()).isTrue();
        assertThat(result.getHeight()).isEqualTo(5.0);
        assertThat(texts(area)).containsExactly("hello");
        assertThat(context.getDiagnostics()).hasSize(1);
    }

    @Test
    void alignsLinesWithinTheArea() {
        Area right = area(100, 50);
        new Paragraph("abcd").aligned(Alignment.RIGHT).render(context, right, STYLE);
        Area center = area(100, 50);
        new Paragraph("abcd").aligned(Alignment.CENTER).render(context, center, STYLE);

        assertThat(((DrawText) right.getCanvas().getInstructions().get(0)).x()).isEqualTo(80.0);
        assertThat(((DrawText) center.getCanvas().getInstructions().get(0)).x()).isEqualTo(40.0);
    }

    @Test
    void justifiedLinesStretchEveryLineButTheLast() {
        Area area = area(100, 50);
        // "aa bb cc" takes 40pt of the first line, the long word moves to the second
        new Paragraph("aa bb cc dddddddddddddddd").aligned(Alignment.JUSTIFIED).render(context, area, STYLE);

        List<DrawText> runs = area.getCanvas().getInstructions().stream()
                .map(DrawText.class::cast).toList();
        assertThat(runs).extracting(DrawText::text).containsExactly("aa ", "bb ", "cc ", "dddddddddddddddd");
        assertThat(runs.get(2).x() + 10).isEqualTo(100.0);
        assertThat(runs.get(3).x()).isZero();
    }

    @Test
    void keepsSpanStylesAndUnderlines() {
        Paragraph paragraph = new Paragraph(List.of(
                Span.of("plain "),
                new Span("bold", Style.ofBold()),
                new Span(" under", Style.builder().underline(true).build())));
        Area area = area(300, 50);

        paragraph.render(context, area, STYLE);

        List<DrawText> runs = area.getCanvas().getInstructions().stream()
                .filter(DrawText.class::isInstance).map(DrawText.class::cast).toList();
        assertThat(runs).extracting(DrawText::text).containsExactly("plain ", "bold", " under");
        assertThat(runs.get(1).style().isBold()).isTrue();
        assertThat(runs.get(1).font().name()).isEqualTo("Helvetica-Bold");
        assertThat(runs.get(0).baselineY()).isEqualTo(8.0);
        assertThat(area.getCanvas().getInstructions()).filteredOn(DrawRect.class::isInstance).hasSize(1);
    }

    @Test
    void strikethroughCrossesTheMiddleOfTheGlyphs() {
        Paragraph paragraph = new Paragraph(List.of(
                Span.of("keep "),
                new Span("gone", Style.builder().strikethrough(true).build())));
        Area area = area(300, 50);

        paragraph.render(context, area, STYLE);

        List<DrawRect> rects = area.getCanvas().getInstructions().stream()
                .filter(DrawRect.class::isInstance).map(DrawRect.class::cast).toList();
        assertThat(rects).hasSize(1);
        // glyph box spans 0..10 around the baseline at 8, so its middle is at 5
        assertThat(rects.get(0).y() + rects.get(0).height() / 2).isCloseTo(5.0, within(1e-9));
        assertThat(rects.get(0).x()).isCloseTo(25.0, within(1e-9));
        assertThat(rects.get(0).width()).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void splitsAcrossPagesWithoutLosingCharactersWhenHyphenating() {
        RenderContext hyphenating = LayoutFixtures.context(LayoutFixtures.hyphenationOnly());
        String text = "hyphenation ".repeat(12).strip();
        Element pending = new Paragraph(text);
        StringBuilder drawn = new StringBuilder();
        int pages = 0;
        while (pending != null) {
            Area page = area(80, 30);
            RenderResult result = pending.render(hyphenating, page, STYLE);
            texts(page).forEach(drawn::append);
            pending = result.getRemainder();
            pages++;
        }

        String letters = drawn.toString().replace("-", "").replace(" ", "");
        assertThat(letters).isEqualTo(text.replace(" ", ""));
        assertThat(drawn.toString()).contains("hy-");
        assertThat(pages).isGreaterThan(1);
    }
}
