package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.exception.CollaboratorFailureException;
import ir.ipaam.layoutservice.domain.exception.InvalidStyleException;
import ir.ipaam.layoutservice.domain.exception.PaginationException;
import ir.ipaam.layoutservice.domain.model.element.Element;
import ir.ipaam.layoutservice.domain.model.element.ExternalBlock;
import ir.ipaam.layoutservice.domain.model.element.ImageElement;
import ir.ipaam.layoutservice.domain.model.element.PageBreak;
import ir.ipaam.layoutservice.domain.model.element.Paragraph;
import ir.ipaam.layoutservice.domain.model.element.Spacer;
import ir.ipaam.layoutservice.domain.model.element.TableLayout;
import ir.ipaam.layoutservice.domain.model.element.Text;
import ir.ipaam.layoutservice.domain.model.page.DrawImage;
import ir.ipaam.layoutservice.domain.model.page.DrawRect;
import ir.ipaam.layoutservice.domain.model.page.DrawText;
import ir.ipaam.layoutservice.domain.model.page.Page;
import ir.ipaam.layoutservice.domain.model.valueobject.ImageHandle;
import ir.ipaam.layoutservice.domain.model.valueobject.RgbColor;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import ir.ipaam.layoutservice.domain.text.FontHandle;
import ir.ipaam.layoutservice.support.FixedAdvanceFontMetrics;
import ir.ipaam.layoutservice.support.LayoutFixtures;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static ir.ipaam.layoutservice.support.LayoutFixtures.config;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DocumentDriverTest {

    private final DocumentDriver driver = new DocumentDriver(new FixedAdvanceFontMetrics());

    private static String numberedLines(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> "line" + i).collect(Collectors.joining("\n"));
    }

    @Test
    void emptyDocumentHasNoPages() {
        LayoutResult result = driver.layout(new Document(config(160, 100)));

        assertThat(result.pageCount()).isZero();
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void paragraphFlowsOntoFollowingPages() {
        Document document = new Document(config(160, 100)).push(new Paragraph(numberedLines(25)));

        LayoutResult result = driver.layout(document);

        assertThat(result.pages()).extracting(Page::number).containsExactly(1, 2, 3);
        assertThat(result.pages().get(0).textLines()).hasSize(10).startsWith("line1").endsWith("line10");
        assertThat(result.pages().get(2).textLines()).containsExactly(
                "line21", "line22", "line23", "line24", "line25");
        // top margin 20 plus the first baseline
        assertThat(result.pages().get(1).textRuns().get(0).baselineY()).isEqualTo(28.0);
    }

    @Test
    void sameDocumentLaysOutIdentically() {
        Document document = new Document(config(160, 100))
                .push(new Paragraph(numberedLines(14)))
                .push(new Text("tail"));

        assertThat(driver.layout(document)).isEqualTo(driver.layout(document));
    }

    @Test
    void imageThatDoesNotFitMovesToTheTopOfTheNextPage() {
        ImageHandle handle = new ImageHandle("photo", new BufferedImage(100, 50, BufferedImage.TYPE_INT_RGB));
        Document document = new Document(config(160, 500))
                .push(new Text("title"))
                .push(Spacer.points(470))
                .push(new ImageElement(handle));

        LayoutResult result = driver.layout(document);

        assertThat(result.pages()).hasSize(2);
        assertThat(result.pages().get(0).instructions()).noneMatch(DrawImage.class::isInstance);
        DrawImage image = (DrawImage) result.pages().get(1).instructions().get(0);
        assertThat(image.y()).isEqualTo(20.0);
        assertThat(image.height()).isEqualTo(50.0);
        assertThat(result.hasOverflow()).isFalse();
    }

    @Test
    void imageAfterOnlyEmptySpaceMovesToTheNextPage() {
        ImageHandle handle = new ImageHandle("photo", new BufferedImage(100, 50, BufferedImage.TYPE_INT_RGB));
        Document document = new Document(config(160, 500))
                .push(Spacer.points(480))
                .push(new ImageElement(handle));

        LayoutResult result = driver.layout(document);

        assertThat(result.pages()).hasSize(2);
        assertThat(result.pages().get(0).instructions()).isEmpty();
        DrawImage image = (DrawImage) result.pages().get(1).instructions().get(0);
        assertThat(image.y()).isEqualTo(20.0);
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void paragraphAfterOnlyEmptySpaceMovesToTheNextPage() {
        Document document = new Document(config(160, 100))
                .push(Spacer.points(95))
                .push(new Paragraph("hello world"));

        LayoutResult result = driver.layout(document);

        assertThat(result.pages()).extracting(Page::textLines)
                .containsExactly(List.of(), List.of("hello world"));
        assertThat(result.pages().get(1).textRuns().get(0).baselineY()).isEqualTo(28.0);
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void externalBlockAfterOnlyEmptySpaceMovesToTheNextPage() {
        ExternalBlock block = new ExternalBlock("formula", 40, 50,
                List.of(new DrawRect(0, 0, 40, 50, RgbColor.BLACK)));
        Document document = new Document(config(160, 500))
                .push(Spacer.points(480))
                .push(block);

        LayoutResult result = driver.layout(document);

        assertThat(result.pages()).hasSize(2);
        assertThat(result.pages().get(0).instructions()).isEmpty();
        assertThat(result.pages().get(1).instructions())
                .containsExactly(new DrawRect(20, 20, 40, 50, RgbColor.BLACK));
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void tableRowAfterOnlyEmptySpaceIsDeferredWhole() {
        TableLayout table = TableLayout.equalColumns(2);
        table.row().text("a\nb\nc").text("d").push();
        Document document = new Document(config(160, 100))
                .push(Spacer.points(85))
                .push(table);

        LayoutResult result = driver.layout(document);

        assertThat(result.pages()).hasSize(2);
        assertThat(result.pages().get(0).textRuns()).isEmpty();
        assertThat(result.pages().get(1).textRuns()).extracting(DrawText::text)
                .containsExactly("a", "b", "c", "d");
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void explicitBreaksEndPagesButNoTrailingPageIsAdded() {
        Document document = new Document(config(160, 100))
                .push(new Text("one"))
                .push(PageBreak.INSTANCE)
                .push(PageBreak.INSTANCE)
                .push(new Text("three"))
                .push(PageBreak.INSTANCE);

        LayoutResult result = driver.layout(document);

        assertThat(result.pages()).extracting(Page::textLines)
                .containsExactly(List.of("one"), List.of(), List.of("three"));
    }

    @Test
    void fatalErrorKeepsThePagesAlreadyFinished() {
        Document document = new Document(config(160, 100))
                .push(new Text("fine"))
                .push(PageBreak.INSTANCE)
                .push(new Text("broken", Style.builder().fontFamily("NoSuchFont").build()));

        PaginationException error = catchThrowableOfType(() -> driver.layout(document), PaginationException.class);

        assertThat(error).isNotNull();
        assertThat(error.getCause()).isInstanceOf(InvalidStyleException.class);
        assertThat(error.getCompletedPages()).hasSize(1);
        assertThat(error.getCompletedPages().get(0).textLines()).containsExactly("fine");
    }

    @Test
    void failingFontMetricsAreReportedAsCollaboratorFailure() {
        FixedAdvanceFontMetrics broken = new FixedAdvanceFontMetrics() {
            @Override
            public double glyphWidth(int codePoint, FontHandle font, double size) {
                throw new IllegalStateException("metrics unavailable");
            }
        };
        Document document = new Document(config(160, 100)).push(new Paragraph("text"));

        assertThatThrownBy(() -> new DocumentDriver(broken).layout(document))
                .isInstanceOf(PaginationException.class)
                .cause()
                .isInstanceOf(CollaboratorFailureException.class)
                .hasRootCauseMessage("metrics unavailable");
    }

    @Test
    void elementThatNeverFitsFailsInsteadOfLooping() {
        Element stubborn = new Element() {
            @Override
            public RenderResult render(RenderContext context, Area area, Style style) {
                return RenderResult.nothingFits(this);
            }
        };
        Document document = new Document(config(160, 100)).push(new Text("before")).push(stubborn);

        PaginationException error = catchThrowableOfType(() -> driver.layout(document), PaginationException.class);

        assertThat(error).isNotNull();
        assertThat(error.getCompletedPages()).hasSize(1);
        assertThat(error.getMessage()).contains("empty page 2");
    }

    @Test
    void tooWideTextIsReportedNotFatal() {
        Document document = new Document(config(40, 100)).push(new Paragraph("unbreakable"));

        LayoutResult result = driver.layout(document);

        assertThat(result.pageCount()).isEqualTo(1);
        assertThat(result.hasOverflow()).isTrue();
        assertThat(result.diagnostics().get(0).page()).isEqualTo(1);
    }

    @Test
    void hyphenatesOnlyWhenTheDocumentNamesALocale() {
        DocumentDriver hyphenating = new DocumentDriver(new FixedAdvanceFontMetrics(),
                LayoutFixtures.hyphenationOnly(), null);
        Document plain = new Document(config(40, 100)).push(new Paragraph("hyphenation"));
        Document withLocale = plain.withConfig(plain.getConfig().toBuilder()
                .hyphenationLocale(Locale.ENGLISH)
                .build());

        assertThat(hyphenating.layout(plain).pages().get(0).textLines()).containsExactly("hyphenation");
        assertThat(hyphenating.layout(withLocale).pages().get(0).textLines()).containsExactly("hyphen-", "ation");
    }

    @Test
    void pageNumbersAreDrawnBelowTheBody() {
        DocumentDriver numbered = new DocumentDriver(new FixedAdvanceFontMetrics(), null,
                SimplePageDecorator.pageNumbers());
        Document document = new Document(config(160, 100)).push(new Paragraph(numberedLines(10)));

        LayoutResult result = numbered.layout(document);

        // the footer takes a 10pt line plus a 6pt gap, leaving room for 8 lines
        assertThat(result.pages()).hasSize(2);
        assertThat(result.pages().get(0).textLines()).hasSize(9).endsWith("line8", "page 1");
        assertThat(result.pages().get(1).textLines()).containsExactly("line9", "line10", "page 2");
    }

    @Test
    void documentCanBeLaidOutAgainWithAnotherPageSize() {
        Document document = new Document(config(160, 100)).push(new Paragraph(numberedLines(15)));
        Document taller = document.withConfig(config(160, 200));

        assertThat(driver.layout(document).pageCount()).isEqualTo(2);
        assertThat(driver.layout(taller).pageCount()).isEqualTo(1);
        assertThat(driver.layout(document).pageCount()).isEqualTo(2);
        assertThat(document.getElements()).hasSize(1);
    }
}
