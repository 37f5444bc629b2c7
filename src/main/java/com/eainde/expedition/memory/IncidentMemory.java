package com.eainde.expedition.memory;

import com.eainde.expedition.model.HistoricalIncident;
import com.eainde.expedition.model.RetrievedIncident;

import java.util.Collection;
import java.util.List;

/**
 * Similarity search over past incidents. The corpus is read-only while pipelines run; {@link #ingest} is for
 * out-of-band loading between batches.
 */
public interface IncidentMemory {

    /**
     * At most {@code k} incidents with similarity of at least {@code minSimilarity}, closest first.
     * An empty corpus yields an empty list.
     */
    List<RetrievedIncident> search(String queryText, int k, double minSimilarity);

    void ingest(Collection<HistoricalIncident> incidents);

    int size();
}
