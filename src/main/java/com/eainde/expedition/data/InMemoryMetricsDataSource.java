package com.eainde.expedition.data;

import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.model.MetricPoint;
import com.eainde.expedition.model.SupplementaryData;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Frozen snapshot of metric series and supplementary records. Useful for replays and for hosts that load a
 * daily extract up front. Not thread-safe while being built; safe for concurrent reads afterwards.
 */
public class InMemoryMetricsDataSource implements MetricsDataSource {

    private final Map<String, List<MetricPoint>> series = new HashMap<>();
    private final Map<String, SupplementaryData> supplementary = new HashMap<>();
    private Instant lastUpdated;

    public InMemoryMetricsDataSource withSeries(String channel, String metric, List<MetricPoint> points) {
        List<MetricPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparing(MetricPoint::timestamp));
        series.put(key(channel, metric), List.copyOf(sorted));
        return this;
    }

    public InMemoryMetricsDataSource withSupplementary(String channel, SupplementaryData data) {
        supplementary.put(channel, data);
        return this;
    }

    public InMemoryMetricsDataSource withLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
        return this;
    }

    @Override
    public List<MetricPoint> fetchMetricSeries(String channel, String metric, LocalDate asOf, int windowLength) {
        Instant cutoff = asOf.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC);
        List<MetricPoint> upToDate = series.getOrDefault(key(channel, metric), List.of()).stream()
                .filter(point -> point.timestamp().isBefore(cutoff))
                .toList();
        int from = Math.max(0, upToDate.size() - windowLength);
        return upToDate.subList(from, upToDate.size());
    }

    @Override
    public Optional<SupplementaryData> fetchSupplementaryData(String channel, ChannelFamily family, AnomalyDescriptor anomaly) {
        return Optional.ofNullable(supplementary.get(channel)).filter(data -> data.family() == family);
    }

    @Override
    public Optional<Instant> lastUpdated() {
        return Optional.ofNullable(lastUpdated);
    }

    private static String key(String channel, String metric) {
        return channel + "|" + metric;
    }
}
