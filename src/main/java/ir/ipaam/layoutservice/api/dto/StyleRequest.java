package ir.ipaam.layoutservice.api.dto;

import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class StyleRequest {
    private String fontFamily;
    @Positive private Double fontSize;
    private Boolean bold;
    private Boolean italic;
    private Boolean underline;
    private Boolean strikethrough;
    /** {@code #RGB}, {@code #RRGGBB} or a basic color name. */
    private String color;
    @Positive private Double lineSpacing;
}
