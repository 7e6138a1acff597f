package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.exception.LayoutException;
import ir.ipaam.layoutservice.domain.exception.PaginationException;
import ir.ipaam.layoutservice.domain.text.FontMetrics;
import ir.ipaam.layoutservice.domain.text.Hyphenator;
import ir.ipaam.layoutservice.domain.text.TextMeasurer;
import ir.ipaam.layoutservice.domain.text.WordSplitter;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Objects;

/**
 * Lays out whole documents. Every call builds its own allocator and context, so one
 * driver may serve several documents, also concurrently.
 */
@Slf4j
public class DocumentDriver {

    private final FontMetrics fontMetrics;
    private final Hyphenator hyphenator;
    private final PageDecorator decorator;

    public DocumentDriver(FontMetrics fontMetrics) {
        this(fontMetrics, null, null);
    }

    public DocumentDriver(FontMetrics fontMetrics, Hyphenator hyphenator, PageDecorator decorator) {
        this.fontMetrics = Objects.requireNonNull(fontMetrics, "fontMetrics");
        this.hyphenator = hyphenator;
        this.decorator = decorator;
    }

    /**
     * @throws PaginationException on a fatal error; it carries the pages finalized before it
     */
    public LayoutResult layout(Document document) {
        DocumentConfig config = document.getConfig();
        Locale locale = config.getHyphenationLocale();
        Hyphenator activeHyphenator = locale == null ? null : hyphenator;
        TextMeasurer measurer = new TextMeasurer(fontMetrics, activeHyphenator, locale);
        RenderContext context = new RenderContext(measurer, new WordSplitter(locale));
        PageAllocator allocator = new PageAllocator(config, decorator, context);

        try {
            allocator.run(document.getElements());
        } catch (LayoutException e) {
            log.debug("Layout stopped after {} pages: {}", allocator.getPages().size(), e.getMessage());
            throw new PaginationException(e, allocator.getPages());
        }
        log.debug("Laid out {} elements on {} pages", document.getElements().size(), allocator.getPages().size());
        return new LayoutResult(allocator.getPages(), context.getDiagnostics());
    }
}
