package com.example.officepdf.filter;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Reads amounts written with either separator convention:
 * {@code 1234.5}, {@code 1,234.50}, {@code 1.234,50}, {@code 1234,5}, {@code -12}.
 * When both separators appear the right-most one is the decimal separator;
 * a lone comma followed by exactly three digits is read as grouping.
 */
final class LenientNumbers {

    private LenientNumbers() {
    }

    static Optional<BigDecimal> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String s = raw.strip().replace(" ", "").replace("\u00a0", "");
        if (s.isEmpty()) {
            return Optional.empty();
        }
        int lastComma = s.lastIndexOf(',');
        int lastDot = s.lastIndexOf('.');
        String normalized;
        if (lastComma >= 0 && lastDot >= 0) {
            normalized = lastComma > lastDot
                    ? s.replace(".", "").replace(',', '.')
                    : s.replace(",", "");
        } else if (lastComma >= 0) {
            boolean grouping = s.indexOf(',') != lastComma || s.length() - lastComma - 1 == 3;
            normalized = grouping ? s.replace(",", "") : s.replace(',', '.');
        } else if (lastDot >= 0 && s.indexOf('.') != lastDot) {
            normalized = s.replace(".", "");
        } else {
            normalized = s;
        }
        try {
            return Optional.of(new BigDecimal(normalized));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
