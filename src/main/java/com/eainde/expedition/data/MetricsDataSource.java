package com.eainde.expedition.data;

import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.model.MetricPoint;
import com.eainde.expedition.model.SupplementaryData;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to channel metrics. Calls have no side effects and may be repeated; missing data is
 * signalled with empty results, not exceptions.
 */
public interface MetricsDataSource {

    /**
     * Up to {@code windowLength} observations of {@code metric} on {@code channel} ending at {@code asOf}
     * (inclusive), oldest first.
     */
    List<MetricPoint> fetchMetricSeries(String channel, String metric, LocalDate asOf, int windowLength);

    /** Family-specific breakdown for the anomaly, or empty when the source has nothing for this channel. */
    Optional<SupplementaryData> fetchSupplementaryData(String channel, ChannelFamily family, AnomalyDescriptor anomaly);

    /** When the source was last refreshed; empty if it cannot tell. */
    Optional<Instant> lastUpdated();
}
