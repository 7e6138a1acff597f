package ir.ipaam.layoutservice.application.service;

import ir.ipaam.layoutservice.config.LayoutProperties;
import ir.ipaam.layoutservice.domain.dto.PdfGenerationResult;
import ir.ipaam.layoutservice.domain.layout.Document;
import ir.ipaam.layoutservice.domain.layout.DocumentConfig;
import ir.ipaam.layoutservice.domain.layout.DocumentDriver;
import ir.ipaam.layoutservice.domain.layout.DocumentWriter;
import ir.ipaam.layoutservice.domain.layout.LayoutResult;
import ir.ipaam.layoutservice.domain.layout.PageDecorator;
import ir.ipaam.layoutservice.domain.text.FontMetrics;
import ir.ipaam.layoutservice.domain.text.Hyphenator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Lays out documents and hands the pages to the PDF writer.
 */
@Slf4j
@Service
public class DocumentLayoutService {

    private final FontMetrics fontMetrics;
    private final Hyphenator hyphenator;
    private final DocumentWriter documentWriter;
    private final LayoutProperties properties;

    public DocumentLayoutService(FontMetrics fontMetrics,
                                 ObjectProvider<Hyphenator> hyphenator,
                                 DocumentWriter documentWriter,
                                 LayoutProperties properties) {
        this.fontMetrics = fontMetrics;
        this.hyphenator = hyphenator.getIfAvailable();
        this.documentWriter = documentWriter;
        this.properties = properties;
    }

    /** Configuration built from the {@code layout.*} properties. */
    public DocumentConfig defaultConfig() {
        return properties.toDocumentConfig();
    }

    public LayoutResult layout(Document document, PageDecorator decorator) {
        DocumentDriver driver = new DocumentDriver(fontMetrics, hyphenator, decorator);
        LayoutResult result = driver.layout(document);
        if (result.hasOverflow()) {
            log.info("Layout finished with {} overflow diagnostics on {} pages",
                    result.diagnostics().size(), result.pageCount());
        }
        return result;
    }

    public PdfGenerationResult generatePdf(Document document, PageDecorator decorator, String fileName) {
        LayoutResult result = layout(document, decorator);
        byte[] pdf = documentWriter.write(result.pages());
        log.info("Generated {} with {} pages ({} bytes)", fileName, result.pageCount(), pdf.length);
        return new PdfGenerationResult(fileName, pdf, result.pageCount(), result.diagnostics());
    }
}
