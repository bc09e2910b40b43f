package com.example.officepdf.exception;

import com.example.officepdf.preflight.PreflightResult;
import lombok.Getter;

/**
 * Raised before any row is processed when the batch runs with
 * fail-on-missing-columns and preflight found tokens without a data column.
 */
@Getter
public class PreflightFailedException extends TemplateProcessingException {
    private final transient PreflightResult result;

    public PreflightFailedException(PreflightResult result) {
        super("PREFLIGHT_FAILED", "Missing data columns for tokens: " + result.getMissingColumns());
        this.result = result;
    }
}
