package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.text.LineBreaker;
import ir.ipaam.layoutservice.domain.text.TextMeasurer;
import ir.ipaam.layoutservice.domain.text.WordSplitter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-layout services handed to every render call, plus the diagnostics collected so far.
 * One instance per layout run; never shared between documents.
 */
@Slf4j
@Getter
public class RenderContext {

    private final TextMeasurer measurer;
    private final LineBreaker lineBreaker;
    private final WordSplitter wordSplitter;
    private final List<LayoutDiagnostic> diagnostics = new ArrayList<>();
    private int pageNumber = 1;

    public RenderContext(TextMeasurer measurer, WordSplitter wordSplitter) {
        this.measurer = measurer;
        this.lineBreaker = new LineBreaker(measurer);
        this.wordSplitter = wordSplitter;
    }

    void setPageNumber(int pageNumber) {
        this.pageNumber = pageNumber;
    }

    public void reportOverflow(String message) {
        log.warn("Content overflow on page {}: {}", pageNumber, message);
        diagnostics.add(new LayoutDiagnostic(LayoutDiagnostic.Kind.CONTENT_OVERFLOW, pageNumber, message));
    }

    public List<LayoutDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
