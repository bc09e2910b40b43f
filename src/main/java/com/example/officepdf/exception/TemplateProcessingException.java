package com.example.officepdf.exception;

import lombok.Getter;

/**
 * Domain failure carrying a machine-readable code and a human description.
 * Controllers map the code to an HTTP status; the batch runner maps it to an
 * {@code ERROR} row or, for batch-level codes, aborts the batch.
 *
 * Codes in use:
 * <ul>
 *   <li>{@code TEMPLATE_NOT_FOUND}, {@code INVALID_TEMPLATE_NAME}, {@code TEMPLATE_NAME_EMPTY}</li>
 *   <li>{@code TEMPLATE_UNREADABLE}, {@code UNSUPPORTED_TEMPLATE_FORMAT}, {@code TOKEN_PARSE_ERROR}</li>
 *   <li>{@code MISSING_REQUIRED_COLUMNS}, {@code UNSUPPORTED_DATA_SOURCE}, {@code DATA_SOURCE_UNREADABLE}</li>
 *   <li>{@code PATTERN_COLUMN_MISSING}, {@code RENDERER_UNAVAILABLE}, {@code INVALID_REQUEST}</li>
 *   <li>{@code PREFLIGHT_FAILED} (see {@link PreflightFailedException})</li>
 * </ul>
 */
@Getter
public class TemplateProcessingException extends RuntimeException {
    private final String code;
    private final String description;

    public TemplateProcessingException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public TemplateProcessingException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }
}
