package com.example.officepdf.service;

import com.example.officepdf.exception.TemplateProcessingException;
import com.example.officepdf.mapper.RowValues;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds output file names from a pattern such as {@code {ID}_{Name}.pdf} or
 * {@code {index:04d}.pdf}. {@code index} is the zero-based source row index; any
 * other placeholder names a column. A numeric format spec ({@code 04d}) is applied
 * to integer values and ignored otherwise. <code>{{</code> and <code>}}</code> produce
 * literal braces.
 */
@Component
public class OutputNameResolver {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{|}}|\\{([^{}:]+)(?::([^{}]*))?}");
    private static final Pattern INTEGER_SPEC = Pattern.compile("(0?[1-9]\\d{0,2})?d");
    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");
    private static final String UNSAFE = "<>:\"/\\|?*";
    private static final String INDEX = "index";

    /**
     * @throws TemplateProcessingException {@code PATTERN_COLUMN_MISSING} when a
     *         placeholder names a column the row does not have
     */
    public String fileName(String pattern, int index, RowValues row) {
        Matcher m = PLACEHOLDER.matcher(pattern);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String replacement;
            if ("{{".equals(m.group())) {
                replacement = "{";
            } else if ("}}".equals(m.group())) {
                replacement = "}";
            } else {
                String name = m.group(1).strip();
                String value;
                if (INDEX.equals(name)) {
                    value = Integer.toString(index);
                } else {
                    Optional<String> cell = row.lookup(name);
                    if (cell.isEmpty()) {
                        throw new TemplateProcessingException("PATTERN_COLUMN_MISSING",
                                "Filename pattern requires a missing column: '" + name + "'. Pattern: " + pattern);
                    }
                    value = cell.get();
                }
                replacement = applySpec(value, m.group(2));
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);

        String name = sanitize(sb.toString());
        if (name.isEmpty() || name.equalsIgnoreCase(".pdf")) {
            name = String.format("%04d", index);
        }
        if (!name.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            name = name + ".pdf";
        }
        return name;
    }

    /**
     * {@code outputDir/<subfolder>/fileName}; a blank subfolder means the output directory itself.
     */
    public Path targetPath(Path outputDir, String fileName, String subfolder) {
        String folder = subfolder == null ? "" : sanitize(subfolder);
        if (folder.isEmpty() || ".".equals(folder) || "..".equals(folder)) {
            return outputDir.resolve(fileName);
        }
        return outputDir.resolve(folder).resolve(fileName);
    }

    /**
     * Replaces file-system-unsafe characters with {@code _} and trims.
     */
    public static String sanitize(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            sb.append(UNSAFE.indexOf(c) >= 0 || c < 0x20 ? '_' : c);
        }
        return sb.toString().strip();
    }

    private static String applySpec(String value, String spec) {
        if (spec == null || spec.isEmpty()) {
            return value;
        }
        String trimmed = value.strip();
        if (INTEGER_SPEC.matcher(spec).matches() && INTEGER.matcher(trimmed).matches()) {
            return String.format("%" + spec, Long.parseLong(trimmed));
        }
        return value;
    }
}
