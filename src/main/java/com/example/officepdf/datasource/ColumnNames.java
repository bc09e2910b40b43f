package com.example.officepdf.datasource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Header clean-up shared by the data sources: names are trimmed, blank headers
 * become {@code Unnamed: <i>} and repeated names get a {@code .1}, {@code .2} suffix.
 * Also the one case folding used wherever column names are matched ignoring case.
 */
public final class ColumnNames {

    private ColumnNames() {
    }

    static List<String> normalize(List<String> raw) {
        List<String> names = new ArrayList<>(raw.size());
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < raw.size(); i++) {
            String name = raw.get(i) == null ? "" : raw.get(i).strip();
            if (name.isEmpty()) {
                name = "Unnamed: " + i;
            }
            Integer count = seen.get(name);
            seen.put(name, count == null ? 1 : count + 1);
            if (count != null) {
                name = name + "." + count;
            }
            names.add(name);
        }
        return names;
    }

    /**
     * Case-insensitive match key, folded per code point through upper then lower case
     * (so {@code ı}, {@code I} and {@code i} share a key).
     */
    public static String fold(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        name.codePoints().forEach(cp -> sb.appendCodePoint(Character.toLowerCase(Character.toUpperCase(cp))));
        return sb.toString();
    }
}
