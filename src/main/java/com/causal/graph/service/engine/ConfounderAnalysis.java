package com.causal.graph.service.engine;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Classified common parents of the exposure and outcome.
 */
public record ConfounderAnalysis(
        String exposure,
        String outcome,
        int exposureParentCount,
        int outcomeParentCount,
        List<ConfounderRecord> records
) {

    public ConfounderAnalysis {
        records = List.copyOf(records);
    }

    public List<String> candidates() {
        return records.stream().map(ConfounderRecord::node).toList();
    }

    public List<ConfounderRecord> validRecords() {
        return records.stream().filter(ConfounderRecord::valid).toList();
    }

    public List<String> validConfounders() {
        return validRecords().stream().map(ConfounderRecord::node).toList();
    }

    public Map<ConfounderClassification, Long> countsByClassification() {
        var counts = new EnumMap<ConfounderClassification, Long>(ConfounderClassification.class);
        for (ConfounderRecord record : validRecords()) {
            counts.merge(record.classification(), 1L, Long::sum);
        }
        return counts;
    }
}
