package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.model.page.Page;

import java.util.List;

public record LayoutResult(List<Page> pages, List<LayoutDiagnostic> diagnostics) {

    public LayoutResult {
        pages = List.copyOf(pages);
        diagnostics = List.copyOf(diagnostics);
    }

    public int pageCount() {
        return pages.size();
    }

    public boolean hasOverflow() {
        return diagnostics.stream().anyMatch(d -> d.kind() == LayoutDiagnostic.Kind.CONTENT_OVERFLOW);
    }
}
