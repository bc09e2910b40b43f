package com.example.officepdf.document;

import lombok.Value;

@Value
public class TokenLocation {
    int containerIndex;
    String region;
    TokenSpan span;
}
