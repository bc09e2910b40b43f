package com.example.officepdf.document;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Template package formats the engine can open, and the legacy formats that are
 * converted to them before scanning.
 */
public enum DocumentFormat {
    DOCX("docx"),
    PPTX("pptx");

    private static final Map<String, DocumentFormat> LEGACY = Map.of(
            "doc", DOCX,
            "odt", DOCX,
            "rtf", DOCX,
            "ppt", PPTX,
            "odp", PPTX);

    private final String extension;

    DocumentFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static Optional<DocumentFormat> fromFileName(String fileName) {
        String ext = extensionOf(fileName);
        for (DocumentFormat format : values()) {
            if (format.extension.equals(ext)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * Target format for a legacy template ({@code .doc}, {@code .ppt}, {@code .odt}, ...).
     */
    public static Optional<DocumentFormat> legacyTarget(String fileName) {
        return Optional.ofNullable(LEGACY.get(extensionOf(fileName)));
    }

    public static boolean isSupported(String fileName) {
        return fromFileName(fileName).isPresent() || legacyTarget(fileName).isPresent();
    }

    static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
