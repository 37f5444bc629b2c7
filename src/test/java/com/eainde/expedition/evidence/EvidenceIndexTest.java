package com.eainde.expedition.evidence;

import com.eainde.expedition.DiagnosisFixtures;
import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.model.SupplementaryData;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EvidenceIndexTest {

    @Test
    void forInvestigation_shouldExposeAnomalyReadingsAndSupplementaryFields() {
        EvidenceIndex index = EvidenceIndex.forInvestigation(DiagnosisFixtures.anomaly(),
                DiagnosisFixtures.paidMediaData());

        assertThat(index.ids()).startsWith("anomaly.observed_value", "anomaly.expected_value")
                .contains("anomaly.severity", "auction.impression_share", "competitor.overlap_rate")
                .hasSize(9);
        assertThat(index.readings(List.of("anomaly.z_score", "anomaly.direction")))
                .containsEntry("anomaly.z_score", "37.9000")
                .containsEntry("anomaly.direction", "spike");
    }

    @Test
    void forInvestigation_shouldStillCiteTheAnomalyWithoutSupplementaryData() {
        EvidenceIndex index = EvidenceIndex.forInvestigation(DiagnosisFixtures.anomaly(),
                SupplementaryData.empty(ChannelFamily.PAID_MEDIA));

        assertThat(index.isEmpty()).isFalse();
        assertThat(index.contains("anomaly.deviation_pct")).isTrue();
        assertThat(index.contains("competitor.overlap_rate")).isFalse();
    }

    @Test
    void forDiagnosis_shouldAddOneEntryPerRetrievedIncident() {
        EvidenceIndex index = EvidenceIndex.forDiagnosis(DiagnosisFixtures.finding(),
                List.of(DiagnosisFixtures.incident()));

        assertThat(index.ids()).hasSize(4).contains("incident:INC-2024-014");
        assertThat(index.describe()).contains("- incident:INC-2024-014: Competitor entered brand auction (similarity 0.82)");
    }

    @Test
    void resolve_shouldTrimDeduplicateAndDropUnknownIds() {
        EvidenceIndex index = EvidenceIndex.forDiagnosis(DiagnosisFixtures.finding(), List.of());

        List<String> resolved = index.resolve(Arrays.asList(
                " competitor.overlap_rate", "weather.rainfall", null, "competitor.overlap_rate", "campaign.brand.cpc"));

        assertThat(resolved).containsExactly("competitor.overlap_rate", "campaign.brand.cpc");
        assertThat(index.resolve(null)).isEmpty();
    }
}
