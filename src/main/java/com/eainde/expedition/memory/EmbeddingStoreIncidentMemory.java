package com.eainde.expedition.memory;

import com.eainde.expedition.error.TransientBackendException;
import com.eainde.expedition.model.HistoricalIncident;
import com.eainde.expedition.model.RetrievedIncident;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import lombok.extern.log4j.Log4j2;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link IncidentMemory} over a langchain4j embedding model and embedding store. Relevance scores of the
 * store are already normalised to [0,1].
 */
@Log4j2
public class EmbeddingStoreIncidentMemory implements IncidentMemory {

    static final String INCIDENT_ID = "incidentId";
    static final String CHANNEL = "channel";
    static final String ROOT_CAUSE = "rootCause";
    static final String RESOLUTION = "resolution";

    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore<TextSegment> store;
    private final AtomicInteger size = new AtomicInteger();

    public EmbeddingStoreIncidentMemory(EmbeddingModel embeddingModel, EmbeddingStore<TextSegment> store) {
        this.embeddingModel = embeddingModel;
        this.store = store;
    }

    @Override
    public List<RetrievedIncident> search(String queryText, int k, double minSimilarity) {
        if (size.get() == 0) {
            return List.of();
        }
        try {
            Embedding query = embeddingModel.embed(queryText).content();
            List<EmbeddingMatch<TextSegment>> matches = store.search(EmbeddingSearchRequest.builder()
                    .queryEmbedding(query)
                    .maxResults(k)
                    .minScore(minSimilarity)
                    .build()).matches();
            return matches.stream()
                    .filter(match -> match.embedded() != null)
                    .sorted(Comparator.comparingDouble((EmbeddingMatch<TextSegment> m) -> m.score()).reversed())
                    .limit(k)
                    .map(EmbeddingStoreIncidentMemory::toIncident)
                    .toList();
        } catch (RuntimeException e) {
            throw new TransientBackendException("incident search failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void ingest(Collection<HistoricalIncident> incidents) {
        if (incidents.isEmpty()) {
            return;
        }
        List<TextSegment> segments = incidents.stream()
                .map(EmbeddingStoreIncidentMemory::toSegment)
                .toList();
        List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
        store.addAll(embeddings, segments);
        size.addAndGet(segments.size());
        log.info("Ingested {} historical incidents, corpus size {}", segments.size(), size.get());
    }

    @Override
    public int size() {
        return size.get();
    }

    private static TextSegment toSegment(HistoricalIncident incident) {
        Metadata metadata = Metadata.from(Map.of(
                INCIDENT_ID, incident.incidentId(),
                CHANNEL, nullToEmpty(incident.channel()),
                ROOT_CAUSE, nullToEmpty(incident.rootCause()),
                RESOLUTION, nullToEmpty(incident.resolution())));
        return TextSegment.from(incident.toDocument(), metadata);
    }

    private static RetrievedIncident toIncident(EmbeddingMatch<TextSegment> match) {
        Metadata metadata = match.embedded().metadata();
        double similarity = Math.max(0.0, Math.min(1.0, match.score()));
        return new RetrievedIncident(
                metadata.getString(INCIDENT_ID),
                similarity,
                metadata.getString(RESOLUTION),
                metadata.getString(ROOT_CAUSE),
                metadata.getString(CHANNEL));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
