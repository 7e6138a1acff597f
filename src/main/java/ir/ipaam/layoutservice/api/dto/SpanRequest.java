package ir.ipaam.layoutservice.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SpanRequest {
    @NotNull private String text;
    @Valid private StyleRequest style;
}
