package ir.ipaam.layoutservice.exception;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

    public static final String VALIDATION_ERROR = "VALIDATION_001";
    public static final String INVALID_STYLE = "LAYOUT_001";
    public static final String MALFORMED_TABLE = "LAYOUT_002";
    public static final String LAYOUT_FAILED = "LAYOUT_003";
    public static final String INTERNAL_ERROR = "INTERNAL_001";

    /** Unique error ID for log correlation. */
    private final String errorId;

    private final String code;

    private final String message;

    /** Pages laid out before a fatal layout error, if any. */
    private final Integer completedPages;

    private final Instant timestamp;

    private final String path;
}
