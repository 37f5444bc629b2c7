package com.eainde.expedition.nodes;

import com.eainde.expedition.DiagnosisFixtures;
import com.eainde.expedition.catalog.ActionCatalog;
import com.eainde.expedition.catalog.ActionType;
import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.error.MalformedResponseException;
import com.eainde.expedition.evidence.EvidenceIndex;
import com.eainde.expedition.inference.InferenceClient;
import com.eainde.expedition.inference.InferenceRequest;
import com.eainde.expedition.inference.PromptLibrary;
import com.eainde.expedition.inference.ResponseSchemas;
import com.eainde.expedition.inference.response.SynthesisResponse;
import com.eainde.expedition.model.AudienceLevel;
import com.eainde.expedition.model.CandidateAction;
import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.model.ImpactRange;
import com.eainde.expedition.model.SynthesizedDiagnosis;
import com.eainde.expedition.state.DiagnosisState;
import com.eainde.expedition.state.DiagnosisStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.eainde.expedition.DiagnosisFixtures.CHANNEL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExplainerNodeTest {

    @Mock
    private InferenceClient inferenceClient;

    private ExplainerNode node;
    private ActionCatalog catalog;
    private EvidenceIndex evidence;

    @BeforeEach
    void setUp() {
        node = new ExplainerNode(inferenceClient, new PromptLibrary(), new ResponseSchemas(new ObjectMapper()),
                DiagnosisFixtures.stageExecutor(DiagnosisFixtures.properties()));
        catalog = DiagnosisFixtures.catalog();
        evidence = EvidenceIndex.forDiagnosis(DiagnosisFixtures.finding(), List.of(DiagnosisFixtures.incident()));
    }

    private SynthesizedDiagnosis toDiagnosis(SynthesisResponse response) {
        return node.toDiagnosis(response, evidence, catalog, ChannelFamily.PAID_MEDIA, CHANNEL);
    }

    private static SynthesisResponse withActions(List<SynthesisResponse.Action> actions) {
        SynthesisResponse base = DiagnosisFixtures.synthesisResponse();
        return new SynthesisResponse(base.rootCause(), base.confidence(), base.claims(), base.explanations(), actions);
    }

    // =========================================================================
    //  Stage behaviour
    // =========================================================================

    @Test
    @DisplayName("should write the diagnosis and restrict the schema to the family's catalog")
    void execute() {
        when(inferenceClient.invoke(any(InferenceRequest.class), eq(SynthesisResponse.class)))
                .thenReturn(DiagnosisFixtures.synthesisResponse());
        DiagnosisState state = DiagnosisFixtures.state(Map.of(
                DiagnosisState.DESCRIPTOR, DiagnosisFixtures.anomaly(),
                DiagnosisState.FAMILY, ChannelFamily.PAID_MEDIA,
                DiagnosisState.FINDING, DiagnosisFixtures.finding(),
                DiagnosisState.INCIDENTS, List.of(DiagnosisFixtures.incident())));

        Map<String, Object> update = node.execute(state, DiagnosisFixtures.context());

        SynthesizedDiagnosis diagnosis = (SynthesizedDiagnosis) update.get(DiagnosisState.DIAGNOSIS);
        assertThat(diagnosis.rootCause()).isEqualTo("Competitor conquesting on brand keywords");
        assertThat(diagnosis.explanations()).containsOnlyKeys(AudienceLevel.values());

        ArgumentCaptor<InferenceRequest> request = ArgumentCaptor.forClass(InferenceRequest.class);
        verify(inferenceClient).invoke(request.capture(), eq(SynthesisResponse.class));
        assertThat(request.getValue().userPrompt())
                .contains("incident:INC-2024-014")
                .contains("bid_increase")
                .doesNotContain("make_good");
        assertThat(request.getValue().malformedCode()).isEqualTo(ErrorCode.MALFORMED_SYNTHESIS);
    }

    @Test
    @DisplayName("should fail the stage after repeated malformed syntheses")
    void repeatedlyMalformed() {
        SynthesisResponse base = DiagnosisFixtures.synthesisResponse();
        when(inferenceClient.invoke(any(InferenceRequest.class), eq(SynthesisResponse.class)))
                .thenReturn(new SynthesisResponse(base.rootCause(), base.confidence(), base.claims(), null, List.of()));
        DiagnosisState state = DiagnosisFixtures.state(Map.of(
                DiagnosisState.DESCRIPTOR, DiagnosisFixtures.anomaly(),
                DiagnosisState.FAMILY, ChannelFamily.PAID_MEDIA,
                DiagnosisState.FINDING, DiagnosisFixtures.finding()));

        Map<String, Object> update = node.execute(state, DiagnosisFixtures.context());

        assertThat(update.get(DiagnosisState.STATUS)).isEqualTo(DiagnosisStatus.FAILED);
        assertThat((String) update.get(DiagnosisState.FAILURE_REASON)).startsWith("[MALFORMED_SYNTHESIS]");
    }

    // =========================================================================
    //  Response mapping
    // =========================================================================

    @Nested
    @DisplayName("toDiagnosis()")
    class ToDiagnosis {

        @Test
        @DisplayName("should map a well-formed synthesis")
        void wellFormed() {
            SynthesizedDiagnosis diagnosis = toDiagnosis(DiagnosisFixtures.synthesisResponse());

            assertThat(diagnosis.claims()).hasSize(2);
            assertThat(diagnosis.explanationFor(AudienceLevel.EXECUTIVE)).startsWith("Brand search costs");
            CandidateAction action = diagnosis.actions().get(0);
            assertThat(action.rank()).isEqualTo(1);
            assertThat(action.actionType()).isEqualTo(ActionType.BID_INCREASE);
            assertThat(action.parameterChange()).containsEntry("adjustment_pct", 80.0);
            assertThat(action.citations()).containsExactly("competitor.overlap_rate", "incident:INC-2024-014");
            assertThat(action.impact()).isEqualTo(new ImpactRange(0.05, 0.15));
            assertThat(diagnosis.rejectedActions()).isEmpty();
        }

        @Test
        @DisplayName("should reject an action none of whose citations resolve and re-rank the rest")
        void orphanAction() {
            SynthesizedDiagnosis diagnosis = toDiagnosis(withActions(List.of(
                    DiagnosisFixtures.bidIncrease(20.0, "weather.rainfall"),
                    new SynthesisResponse.Action("manual_review", null, null, "Check auction insights",
                            List.of("auction.impression_share"), 0.0, 0.02))));

            assertThat(diagnosis.actions()).hasSize(1);
            CandidateAction kept = diagnosis.actions().get(0);
            assertThat(kept.rank()).isEqualTo(1);
            assertThat(kept.actionType()).isEqualTo(ActionType.MANUAL_REVIEW);
            assertThat(kept.targetChannel()).isEqualTo(CHANNEL);
            assertThat(diagnosis.rejectedActions()).singleElement().asString()
                    .startsWith("#1 bid_increase")
                    .contains("weather.rainfall");
        }

        @Test
        @DisplayName("should keep claim citations as returned for the critic to judge")
        void keepsClaimCitations() {
            SynthesisResponse base = DiagnosisFixtures.synthesisResponse();
            SynthesisResponse response = new SynthesisResponse(base.rootCause(), base.confidence(),
                    List.of(new SynthesisResponse.Claim("CPC rose", List.of(" campaign.brand.cpc ", "invented.id"))),
                    base.explanations(), List.of());

            assertThat(toDiagnosis(response).claims().get(0).citations())
                    .containsExactly("campaign.brand.cpc", "invented.id");
        }

        @Test
        @DisplayName("should order a reversed impact range")
        void reversedImpact() {
            SynthesisResponse.Action action = new SynthesisResponse.Action("bid_increase", CHANNEL, List.of(),
                    "Regain share", List.of("competitor.overlap_rate"), 0.2, 0.05);

            assertThat(toDiagnosis(withActions(List.of(action))).actions().get(0).impact())
                    .isEqualTo(new ImpactRange(0.05, 0.2));
        }

        @Test
        @DisplayName("should treat an action outside the family's catalog as malformed")
        void actionNotPermitted() {
            SynthesisResponse.Action action = new SynthesisResponse.Action("make_good", CHANNEL, List.of(),
                    "Ask for a make-good", List.of("competitor.overlap_rate"), 0.0, 0.1);

            assertThatThrownBy(() -> toDiagnosis(withActions(List.of(action))))
                    .isInstanceOf(MalformedResponseException.class)
                    .hasMessageContaining("make_good");
        }

        @Test
        @DisplayName("should treat an unknown action type as malformed")
        void unknownAction() {
            SynthesisResponse.Action action = new SynthesisResponse.Action("fire_agency", CHANNEL, List.of(),
                    "", List.of("competitor.overlap_rate"), 0.0, 0.1);

            assertThatThrownBy(() -> toDiagnosis(withActions(List.of(action))))
                    .isInstanceOfSatisfying(MalformedResponseException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.MALFORMED_SYNTHESIS));
        }

        @Test
        @DisplayName("should require all four audience explanations")
        void missingAudience() {
            SynthesisResponse base = DiagnosisFixtures.synthesisResponse();
            SynthesisResponse.Explanations partial = new SynthesisResponse.Explanations(
                    "exec", "director", "practitioner", " ");

            assertThatThrownBy(() -> toDiagnosis(new SynthesisResponse(base.rootCause(), base.confidence(),
                    base.claims(), partial, base.actions())))
                    .isInstanceOf(MalformedResponseException.class)
                    .hasMessageContaining("analyst");
        }
    }
}
