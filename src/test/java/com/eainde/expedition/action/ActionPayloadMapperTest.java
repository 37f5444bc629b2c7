package com.eainde.expedition.action;

import com.eainde.expedition.DiagnosisFixtures;
import com.eainde.expedition.catalog.ActionCatalog;
import com.eainde.expedition.catalog.ActionType;
import com.eainde.expedition.catalog.ChannelRoutingTable;
import com.eainde.expedition.model.ActionPayload;
import com.eainde.expedition.model.CandidateAction;
import com.eainde.expedition.model.ImpactRange;
import com.eainde.expedition.model.RiskTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ActionPayloadMapperTest {

    private final ActionPayloadMapper mapper = new ActionPayloadMapper();
    private final ActionCatalog catalog = DiagnosisFixtures.catalog();
    private final ChannelRoutingTable routingTable = DiagnosisFixtures.routingTable();

    private static CandidateAction candidate(int rank, ActionType type, String channel, Map<String, Double> params) {
        return new CandidateAction(rank, type, channel, params, "because", List.of("competitor.overlap_rate"),
                ImpactRange.of(0.05, 0.15));
    }

    @Test
    @DisplayName("should clamp parameters to catalog bounds and drop unknown ones")
    void clampsAndDrops() {
        ActionPayload payload = mapper.toPayload("rec-9",
                candidate(1, ActionType.BID_INCREASE, "google_search", Map.of("adjustment_pct", 80.0, "vibes", 3.0)),
                catalog, routingTable);

        assertThat(payload.parameters()).containsExactly(Map.entry("adjustment_pct", 40.0));
    }

    @Test
    @DisplayName("should fill missing parameters with their defaults")
    void defaults() {
        ActionPayload payload = mapper.toPayload("rec-9",
                candidate(1, ActionType.PAUSE_CAMPAIGN, "meta_ads", Map.of()), catalog, routingTable);

        assertThat(payload.parameters()).containsExactly(Map.entry("duration_hours", 24.0));
    }

    @Test
    @DisplayName("should carry catalog operation, platform and approval requirement")
    void catalogFields() {
        ActionPayload payload = mapper.toPayload("rec-9",
                candidate(2, ActionType.INFLUENCER_FRAUD, "influencer_campaigns", Map.of()), catalog, routingTable);

        assertThat(payload.actionId()).isEqualTo("rec-9-2");
        assertThat(payload.recordId()).isEqualTo("rec-9");
        assertThat(payload.rank()).isEqualTo(2);
        assertThat(payload.operation()).isEqualTo(catalog.require(ActionType.INFLUENCER_FRAUD).operation());
        assertThat(payload.platform()).isEqualTo("creatoriq");
        assertThat(payload.riskTier()).isEqualTo(RiskTier.HIGH);
        assertThat(payload.requiresApproval()).isTrue();
        assertThat(payload.evidence()).containsExactly("competitor.overlap_rate");
        assertThat(payload.impact()).isEqualTo(new ImpactRange(0.05, 0.15));
    }

    @Test
    @DisplayName("should map the same candidates to equal payloads every time")
    void deterministic() {
        List<CandidateAction> candidates = List.of(
                candidate(1, ActionType.BID_INCREASE, "google_search", Map.of("adjustment_pct", 12.0)),
                candidate(2, ActionType.MANUAL_REVIEW, "google_search", Map.of()));

        assertThat(mapper.toPayloads("rec-1", candidates, catalog, routingTable))
                .isEqualTo(mapper.toPayloads("rec-1", candidates, catalog, routingTable));
    }
}
