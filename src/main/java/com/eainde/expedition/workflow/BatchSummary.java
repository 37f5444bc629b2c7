package com.eainde.expedition.workflow;

import com.eainde.expedition.state.DiagnosisRecord;
import com.eainde.expedition.state.DiagnosisStatus;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch: one record per executed request, in submission order.
 *
 * @param filtered requests not run because of the severity filter or the count cap
 */
public record BatchSummary(List<DiagnosisRecord> records, int filtered, Duration elapsed) {

    public BatchSummary {
        records = List.copyOf(records);
    }

    public Map<DiagnosisStatus, Long> counts() {
        Map<DiagnosisStatus, Long> counts = new EnumMap<>(DiagnosisStatus.class);
        for (DiagnosisStatus status : DiagnosisStatus.values()) {
            counts.put(status, 0L);
        }
        records.forEach(r -> counts.merge(r.status(), 1L, Long::sum));
        return counts;
    }

    public long count(DiagnosisStatus status) {
        return counts().get(status);
    }

    public int totalActions() {
        return records.stream().mapToInt(r -> r.actions().size()).sum();
    }
}
