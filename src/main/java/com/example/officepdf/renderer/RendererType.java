package com.example.officepdf.renderer;

/**
 * Renderer selection. {@code AUTO} picks the first registered renderer able to
 * handle the document format.
 */
public enum RendererType {
    AUTO,
    LIBREOFFICE
}
