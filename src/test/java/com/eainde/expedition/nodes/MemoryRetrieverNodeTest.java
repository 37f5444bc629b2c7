package com.eainde.expedition.nodes;

import com.eainde.expedition.DiagnosisFixtures;
import com.eainde.expedition.config.ExpeditionProperties;
import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.error.TransientBackendException;
import com.eainde.expedition.memory.IncidentMemory;
import com.eainde.expedition.model.RetrievedIncident;
import com.eainde.expedition.state.DiagnosisState;
import com.eainde.expedition.state.StepLogEntry;
import com.eainde.expedition.state.StepStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemoryRetrieverNodeTest {

    @Mock
    private IncidentMemory memory;

    private ExpeditionProperties properties;
    private MemoryRetrieverNode node;
    private DiagnosisState investigated;

    @BeforeEach
    void setUp() {
        properties = DiagnosisFixtures.properties();
        node = new MemoryRetrieverNode(memory, DiagnosisFixtures.stageExecutor(properties), properties);
        investigated = DiagnosisFixtures.state(Map.of(
                DiagnosisState.DESCRIPTOR, DiagnosisFixtures.anomaly(),
                DiagnosisState.FINDING, DiagnosisFixtures.finding()));
    }

    @SuppressWarnings("unchecked")
    private static List<RetrievedIncident> incidents(Map<String, Object> update) {
        return (List<RetrievedIncident>) update.get(DiagnosisState.INCIDENTS);
    }

    @SuppressWarnings("unchecked")
    private static StepLogEntry finalEntry(Map<String, Object> update) {
        List<StepLogEntry> log = (List<StepLogEntry>) update.get(DiagnosisState.STEP_LOG);
        return log.get(log.size() - 1);
    }

    @Test
    @DisplayName("should query with the anomaly and hypothesis and keep results above the floor")
    void retrieves() {
        RetrievedIncident weak = new RetrievedIncident("INC-2024-031", 0.3, "Restored pixel", "Pixel removed", "meta_ads");
        when(memory.search(anyString(), eq(3), eq(0.5))).thenReturn(List.of(DiagnosisFixtures.incident(), weak));

        Map<String, Object> update = node.execute(investigated, DiagnosisFixtures.context());

        assertThat(incidents(update)).containsExactly(DiagnosisFixtures.incident());
        assertThat(finalEntry(update).status()).isEqualTo(StepStatus.SUCCEEDED);
        verify(memory).search(contains("competitor entered the brand auction"), eq(3), eq(0.5));
    }

    @Test
    @DisplayName("should succeed with no incidents when the corpus is empty")
    void emptyCorpus() {
        when(memory.search(anyString(), anyInt(), anyDouble())).thenReturn(List.of());

        Map<String, Object> update = node.execute(investigated, DiagnosisFixtures.context());

        assertThat(incidents(update)).isEmpty();
        assertThat(finalEntry(update).status()).isEqualTo(StepStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("should degrade to no incidents when the memory is unavailable")
    void unavailable() {
        when(memory.search(anyString(), anyInt(), anyDouble())).thenThrow(new TransientBackendException("index down"));

        Map<String, Object> update = node.execute(investigated, DiagnosisFixtures.context());

        assertThat(incidents(update)).isEmpty();
        assertThat(update).doesNotContainKey(DiagnosisState.STATUS);
        StepLogEntry entry = finalEntry(update);
        assertThat(entry.status()).isEqualTo(StepStatus.DEGRADED);
        assertThat(entry.errorCode()).isEqualTo(ErrorCode.RETRIEVAL_UNAVAILABLE);
    }

    @Test
    @DisplayName("should clamp top-k into its allowed range")
    void clampsTopK() {
        properties.getRetrieval().setTopK(50);
        MemoryRetrieverNode wide = new MemoryRetrieverNode(memory, DiagnosisFixtures.stageExecutor(properties), properties);
        when(memory.search(anyString(), eq(10), anyDouble())).thenReturn(List.of());

        wide.execute(investigated, DiagnosisFixtures.context());

        verify(memory).search(anyString(), eq(10), anyDouble());
    }
}
