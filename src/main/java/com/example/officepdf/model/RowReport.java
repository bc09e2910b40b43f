package com.example.officepdf.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Status record of one data row. Every row of a batch yields exactly one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"row", "status", "template", "output", "bytes", "pages", "error", "warnings"})
public class RowReport {
    /**
     * Zero-based index of the row in the data source.
     */
    @JsonProperty("row")
    private int rowIndex;

    private RowStatus status;

    @JsonProperty("template")
    private String templateName;

    @JsonProperty("output")
    private String outputPath;

    private Long bytes;

    private Integer pages;

    private String error;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
