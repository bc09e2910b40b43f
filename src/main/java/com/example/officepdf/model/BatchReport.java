package com.example.officepdf.model;

import com.example.officepdf.preflight.PreflightResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a whole batch: the preflight findings and one record per selected row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchReport {
    private PreflightResult preflight;

    @Builder.Default
    private List<RowReport> rows = new ArrayList<>();

    private boolean cancelled;

    private boolean dryRun;

    public Map<RowStatus, Integer> countByStatus() {
        Map<RowStatus, Integer> counts = new EnumMap<>(RowStatus.class);
        for (RowReport row : rows) {
            counts.merge(row.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    public boolean hasErrors() {
        return rows.stream().anyMatch(r -> r.getStatus() == RowStatus.ERROR);
    }
}
