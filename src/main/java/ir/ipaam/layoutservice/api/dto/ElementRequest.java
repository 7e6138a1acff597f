package ir.ipaam.layoutservice.api.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of the requested element tree, told apart by its {@code type} property.
 * Every element may carry a style, padding and a frame.
 */
@Data
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ElementRequest.ParagraphRequest.class, name = "paragraph"),
        @JsonSubTypes.Type(value = ElementRequest.TextRequest.class, name = "text"),
        @JsonSubTypes.Type(value = ElementRequest.ContainerRequest.class, name = "container"),
        @JsonSubTypes.Type(value = ElementRequest.TableRequest.class, name = "table"),
        @JsonSubTypes.Type(value = ElementRequest.ListRequest.class, name = "list"),
        @JsonSubTypes.Type(value = ElementRequest.ImageRequest.class, name = "image"),
        @JsonSubTypes.Type(value = ElementRequest.BreakRequest.class, name = "break"),
        @JsonSubTypes.Type(value = ElementRequest.SpacerRequest.class, name = "spacer"),
        @JsonSubTypes.Type(value = ElementRequest.ExternalRequest.class, name = "external")
})
public abstract class ElementRequest {

    @Valid private StyleRequest style;
    @PositiveOrZero private Double padding;
    private boolean framed;

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class ParagraphRequest extends ElementRequest {
        /** Plain text; appended after the spans when both are given. */
        private String text;
        @Valid private List<SpanRequest> spans = new ArrayList<>();
        private String alignment;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class TextRequest extends ElementRequest {
        @NotNull private String text;
        private String alignment;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class ContainerRequest extends ElementRequest {
        /** {@code vertical} (default) or {@code horizontal}. */
        private String orientation;
        /** Column weights of a horizontal container; equal columns when absent. */
        private List<Double> weights;
        @Valid private List<ElementRequest> children = new ArrayList<>();
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class TableRequest extends ElementRequest {
        /** Column weights; {@code columns} equal columns when absent. */
        private List<Double> weights;
        private Integer columns;
        private boolean borders;
        @Valid private List<List<ElementRequest>> rows = new ArrayList<>();
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class ListRequest extends ElementRequest {
        private boolean ordered;
        private Integer start;
        private String bullet;
        @Valid private List<ElementRequest> items = new ArrayList<>();
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class ImageRequest extends ElementRequest {
        /** Base64 encoded PNG or JPEG. */
        @NotBlank private String data;
        @Positive private Double width;
        @Positive private Double height;
        private String alignment;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class BreakRequest extends ElementRequest {
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class SpacerRequest extends ElementRequest {
        @PositiveOrZero private Double lines;
        @PositiveOrZero private Double points;
    }

    /** Pre-rendered content, given as filled rectangles relative to the block. */
    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class ExternalRequest extends ElementRequest {
        @NotBlank private String kind;
        @PositiveOrZero private double width;
        @PositiveOrZero private double height;
        private String alignment;
        @Valid private List<RectRequest> rects = new ArrayList<>();
    }

    @Data
    public static class RectRequest {
        private double x;
        private double y;
        @PositiveOrZero private double width;
        @PositiveOrZero private double height;
        private String color;
    }
}
