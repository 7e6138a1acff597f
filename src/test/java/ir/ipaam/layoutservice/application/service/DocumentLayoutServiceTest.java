package ir.ipaam.layoutservice.application.service;

import ir.ipaam.layoutservice.application.service.font.PdfBoxFontMetrics;
import ir.ipaam.layoutservice.application.service.hyphenation.DictionaryHyphenator;
import ir.ipaam.layoutservice.application.service.pdf.PdfBoxDocumentWriter;
import ir.ipaam.layoutservice.config.LayoutProperties;
import ir.ipaam.layoutservice.domain.dto.PdfGenerationResult;
import ir.ipaam.layoutservice.domain.layout.Document;
import ir.ipaam.layoutservice.domain.layout.DocumentConfig;
import ir.ipaam.layoutservice.domain.layout.LayoutResult;
import ir.ipaam.layoutservice.domain.layout.SimplePageDecorator;
import ir.ipaam.layoutservice.domain.model.element.Paragraph;
import ir.ipaam.layoutservice.domain.model.element.TableLayout;
import ir.ipaam.layoutservice.domain.model.valueobject.PageSize;
import ir.ipaam.layoutservice.domain.text.Hyphenator;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentLayoutServiceTest {

    private final PdfBoxFontMetrics fontMetrics = new PdfBoxFontMetrics();

    private DocumentLayoutService service(LayoutProperties properties, Hyphenator hyphenator) {
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        if (hyphenator != null) {
            beans.addBean("hyphenator", hyphenator);
        }
        return new DocumentLayoutService(fontMetrics, beans.getBeanProvider(Hyphenator.class),
                new PdfBoxDocumentWriter(fontMetrics), properties);
    }

    @Test
    void defaultConfigComesFromProperties() {
        LayoutProperties properties = new LayoutProperties();
        properties.getPage().setMarginLeft(50);
        properties.getStyle().setFontSize(9);

        DocumentConfig config = service(properties, null).defaultConfig();

        assertThat(config.getMargins().left()).isEqualTo(50.0);
        assertThat(config.getDefaultStyle().resolvedFontSize()).isEqualTo(9.0);
        assertThat(config.getHyphenationLocale()).isNull();
    }

    @Test
    void generatesAReadablePdf() throws IOException {
        DocumentLayoutService service = service(new LayoutProperties(), null);
        Document document = new Document(service.defaultConfig())
                .push(new Paragraph("Hello world"))
                .push(TableLayout.equalColumns(2).row().text("Name").text("Value").push());

        PdfGenerationResult result = service.generatePdf(document, null, "report.pdf");

        assertNotNull(result.pdfBytes());
        assertThat(result.fileName()).isEqualTo("report.pdf");
        assertThat(result.pageCount()).isEqualTo(1);
        try (PDDocument pdf = Loader.loadPDF(result.pdfBytes())) {
            String text = new PDFTextStripper().getText(pdf);
            assertThat(text).contains("Hello world").contains("Name").contains("Value");
        }
    }

    @Test
    void longDocumentGetsNumberedPages() throws IOException {
        DocumentLayoutService service = service(new LayoutProperties(), null);
        Document document = new Document(service.defaultConfig());
        for (int i = 0; i < 120; i++) {
            document.push(new Paragraph("Paragraph number " + i));
        }

        PdfGenerationResult result = service.generatePdf(document, SimplePageDecorator.pageNumbers(), "long.pdf");

        assertTrue(result.pageCount() > 1, "120 paragraphs should not fit on one page");
        try (PDDocument pdf = Loader.loadPDF(result.pdfBytes())) {
            assertThat(pdf.getNumberOfPages()).isEqualTo(result.pageCount());
            assertThat(new PDFTextStripper().getText(pdf)).contains("page 2");
        }
    }

    @Test
    void emptyDocumentIsOneBlankPage() throws IOException {
        DocumentLayoutService service = service(new LayoutProperties(), null);

        PdfGenerationResult result = service.generatePdf(new Document(service.defaultConfig()), null, "empty.pdf");

        assertThat(result.pageCount()).isZero();
        try (PDDocument pdf = Loader.loadPDF(result.pdfBytes())) {
            assertThat(pdf.getNumberOfPages()).isEqualTo(1);
        }
    }

    @Test
    void configuredHyphenatorIsUsedWhenTheDocumentAsksForIt() {
        LayoutProperties properties = new LayoutProperties();
        properties.getHyphenation().setEnabled(true);
        DocumentLayoutService service = service(properties,
                new DictionaryHyphenator(Locale.US, List.of("hy-phen-ation")));
        // "hyphenation" in 12pt Helvetica is wider than 50pt, "hyphen-" is not
        DocumentConfig narrow = service.defaultConfig().toBuilder()
                .pageSize(new PageSize(122, 300))
                .build();

        LayoutResult result = service.layout(new Document(narrow).push(new Paragraph("hyphenation")), null);

        assertThat(result.pages().get(0).textLines()).containsExactly("hyphen-", "ation");
        assertThat(result.hasOverflow()).isFalse();
    }
}
