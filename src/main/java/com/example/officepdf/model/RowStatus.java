package com.example.officepdf.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RowStatus {
    OK("OK"),
    ERROR("ERROR"),
    SKIPPED("SKIPPED"),
    DRY_RUN("DRY-RUN");

    private final String label;

    RowStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
