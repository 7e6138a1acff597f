package ir.ipaam.layoutservice.domain.dto;

import ir.ipaam.layoutservice.domain.layout.LayoutDiagnostic;

import java.util.List;
import java.util.Objects;

public record PdfGenerationResult(String fileName, byte[] pdfBytes, int pageCount, List<LayoutDiagnostic> diagnostics) {

    public PdfGenerationResult {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(pdfBytes, "pdfBytes");
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
