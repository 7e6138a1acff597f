package ir.ipaam.layoutservice.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import ir.ipaam.layoutservice.api.dto.DocumentRequest;
import ir.ipaam.layoutservice.api.dto.LayoutSummaryResponse;
import ir.ipaam.layoutservice.api.mapper.DocumentRequestMapper;
import ir.ipaam.layoutservice.application.service.DocumentLayoutService;
import ir.ipaam.layoutservice.config.LayoutProperties;
import ir.ipaam.layoutservice.domain.dto.PdfGenerationResult;
import ir.ipaam.layoutservice.domain.layout.Document;
import ir.ipaam.layoutservice.domain.layout.LayoutResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/layout")
@RequiredArgsConstructor
public class LayoutController {

    private final DocumentLayoutService layoutService;
    private final LayoutProperties properties;

    @PostMapping("/pdf")
    @Operation(summary = "Lay out a document and return it as PDF")
    public ResponseEntity<byte[]> generatePdf(@Valid @RequestBody DocumentRequest request) {
        PdfGenerationResult result = layoutService.generatePdf(
                toDocument(request),
                DocumentRequestMapper.toDecorator(request),
                DocumentRequestMapper.fileName(request));
        return buildPdfResponse(result);
    }

    @PostMapping(value = "/pages", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Lay out a document and describe the resulting pages")
    public LayoutSummaryResponse describePages(@Valid @RequestBody DocumentRequest request) {
        LayoutResult result = layoutService.layout(toDocument(request), DocumentRequestMapper.toDecorator(request));
        return new LayoutSummaryResponse(
                result.pageCount(),
                result.pages().stream()
                        .map(page -> new LayoutSummaryResponse.PageSummary(
                                page.number(), page.instructions().size(), page.textLines()))
                        .toList(),
                result.diagnostics().stream()
                        .map(d -> new LayoutSummaryResponse.Diagnostic(d.kind().name(), d.page(), d.message()))
                        .toList());
    }

    private Document toDocument(DocumentRequest request) {
        return DocumentRequestMapper.toDocument(request, layoutService.defaultConfig(), properties.hyphenationLocale());
    }

    private ResponseEntity<byte[]> buildPdfResponse(PdfGenerationResult result) {
        ContentDisposition contentDisposition = ContentDisposition.attachment()
                .filename(result.fileName(), StandardCharsets.UTF_8)
                .build();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(contentDisposition);
        headers.setContentType(MediaType.APPLICATION_PDF);
        headers.add("X-Page-Count", String.valueOf(result.pageCount()));
        return new ResponseEntity<>(result.pdfBytes(), headers, HttpStatus.OK);
    }
}
