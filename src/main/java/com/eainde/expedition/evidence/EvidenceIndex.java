package com.eainde.expedition.evidence;

import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.InvestigationFinding;
import com.eainde.expedition.model.RetrievedIncident;
import com.eainde.expedition.model.SupplementaryData;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The evidence ids a diagnosis may cite, each with its rendered reading. After investigation this is the
 * finding's cited evidence plus one {@code incident:<id>} entry per retrieved incident.
 */
public final class EvidenceIndex {

    private final Map<String, String> entries;

    private EvidenceIndex(Map<String, String> entries) {
        this.entries = entries;
    }

    /** Everything an investigator may cite: the anomaly's own readings and the supplementary fields. */
    public static EvidenceIndex forInvestigation(AnomalyDescriptor anomaly, SupplementaryData data) {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("anomaly.observed_value", format(anomaly.observedValue()));
        entries.put("anomaly.expected_value", format(anomaly.expectedValue()));
        entries.put("anomaly.z_score", format(anomaly.zScore()));
        entries.put("anomaly.deviation_pct", format(anomaly.deviationPct()));
        entries.put("anomaly.direction", anomaly.direction().name().toLowerCase(Locale.ROOT));
        entries.put("anomaly.severity", anomaly.severity().name().toLowerCase(Locale.ROOT));
        data.fields().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> entries.putIfAbsent(e.getKey(), e.getValue()));
        return new EvidenceIndex(entries);
    }

    /** Everything a synthesized diagnosis may cite. */
    public static EvidenceIndex forDiagnosis(InvestigationFinding finding, Collection<RetrievedIncident> incidents) {
        Map<String, String> entries = new LinkedHashMap<>(finding.evidence());
        for (RetrievedIncident incident : incidents) {
            entries.put(incident.evidenceId(), String.format(Locale.ROOT, "%s (similarity %.2f) resolved by: %s",
                    incident.rootCause(), incident.similarity(), incident.resolutionSummary()));
        }
        return new EvidenceIndex(entries);
    }

    public boolean contains(String id) {
        return id != null && entries.containsKey(id.trim());
    }

    public Set<String> ids() {
        return entries.keySet();
    }

    public Map<String, String> readings(Collection<String> ids) {
        Map<String, String> subset = new LinkedHashMap<>();
        ids.stream().filter(this::contains).map(String::trim).forEach(id -> subset.put(id, entries.get(id)));
        return subset;
    }

    /** The ids that resolve, trimmed, de-duplicated, in citation order. */
    public List<String> resolve(Collection<String> citations) {
        if (citations == null) {
            return List.of();
        }
        return citations.stream()
                .filter(this::contains)
                .map(String::trim)
                .distinct()
                .toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** One {@code id: reading} line per entry, for prompts. */
    public String describe() {
        return entries.entrySet().stream()
                .map(e -> "- " + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
