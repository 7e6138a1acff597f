package ir.ipaam.layoutservice.api.dto;

import java.util.List;

public record LayoutSummaryResponse(int pageCount, List<PageSummary> pages, List<Diagnostic> diagnostics) {

    public record PageSummary(int number, int instructionCount, List<String> lines) {
    }

    public record Diagnostic(String kind, int page, String message) {
    }
}
