package ir.ipaam.layoutservice.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A document to lay out. Everything but {@code elements} is optional and falls back to
 * the service's {@code layout.*} configuration.
 */
@Data
public class DocumentRequest {

    private String fileName;

    @Positive private Double pageWidth;
    @Positive private Double pageHeight;

    @Valid private MarginsRequest margins;

    @Valid private StyleRequest defaultStyle;

    /** Draws a centered "page N" footer on every page. */
    private boolean pageNumbers;

    /** Drawn at the top of every page. */
    @Valid private ElementRequest header;

    /** Overrides the configured hyphenation switch. */
    private Boolean hyphenate;

    @NotNull
    @Valid
    private List<ElementRequest> elements = new ArrayList<>();

    @Data
    public static class MarginsRequest {
        @PositiveOrZero private double top;
        @PositiveOrZero private double right;
        @PositiveOrZero private double bottom;
        @PositiveOrZero private double left;
    }
}
