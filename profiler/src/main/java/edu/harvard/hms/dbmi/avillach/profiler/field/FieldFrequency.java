package edu.harvard.hms.dbmi.avillach.profiler.field;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Distinct-token counts for one field.
 *
 * @param counts occurrences per distinct token
 * @param truncated true when the scan stopped because the distinct-token cap was reached, in which case the counts are
 *                  a partial view of the field
 * @param recordsScanned number of records counted into the map
 */
public record FieldFrequency(Map<String, Long> counts, boolean truncated, long recordsScanned) {

    public FieldFrequency {
        counts = ImmutableMap.copyOf(counts);
    }

    public int distinctCount() {
        return counts.size();
    }

    public long count(String token) {
        return counts.getOrDefault(token, 0L);
    }
}
