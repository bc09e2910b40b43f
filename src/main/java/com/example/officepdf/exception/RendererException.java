package com.example.officepdf.exception;

/**
 * Opaque failure of the external PDF renderer. The message is reported as-is;
 * renderer-specific codes are never interpreted.
 */
public class RendererException extends Exception {

    public RendererException(String message) {
        super(message);
    }

    public RendererException(String message, Throwable cause) {
        super(message, cause);
    }
}
