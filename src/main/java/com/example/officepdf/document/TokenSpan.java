package com.example.officepdf.document;

import lombok.Value;

/**
 * Position of a token inside one container: from {@code startOffset} in span
 * {@code firstSpan} to {@code endOffset} (exclusive) in span {@code lastSpan}.
 */
@Value
public class TokenSpan {
    int firstSpan;
    int startOffset;
    int lastSpan;
    int endOffset;

    public boolean isSingleSpan() {
        return firstSpan == lastSpan;
    }
}
