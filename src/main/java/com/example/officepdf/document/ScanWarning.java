package com.example.officepdf.document;

import lombok.Value;

/**
 * Soft finding of a scan. The document is still usable; the offending text is
 * left as it is.
 */
@Value
public class ScanWarning {

    public enum Kind {
        UNTERMINATED_TOKEN
    }

    Kind kind;
    int containerIndex;
    String region;
    String excerpt;

    public String getMessage() {
        return "Unterminated token in " + region + ": '" + excerpt + "'";
    }
}
