package com.example.officepdf.mapper;

import lombok.Value;

import java.util.List;

/**
 * Final substitution text for one token and how it was obtained.
 */
@Value
public class ResolvedValue {
    String value;
    /**
     * Whether the row has a column for the token's field.
     */
    boolean fieldPresent;
    boolean defaultUsed;
    List<String> warnings;
}
