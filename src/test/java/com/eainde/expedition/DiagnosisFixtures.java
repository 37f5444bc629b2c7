package com.eainde.expedition;

import com.eainde.expedition.catalog.ActionCatalog;
import com.eainde.expedition.catalog.ChannelRoutingTable;
import com.eainde.expedition.config.ExpeditionProperties;
import com.eainde.expedition.execution.CancellationToken;
import com.eainde.expedition.execution.RunContext;
import com.eainde.expedition.execution.StageExecutor;
import com.eainde.expedition.inference.response.CritiqueResponse;
import com.eainde.expedition.inference.response.FindingResponse;
import com.eainde.expedition.inference.response.SynthesisResponse;
import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.ChannelFamily;
import com.eainde.expedition.model.ContributingFactor;
import com.eainde.expedition.model.DiagnosisRequest;
import com.eainde.expedition.model.Direction;
import com.eainde.expedition.model.InvestigationFinding;
import com.eainde.expedition.model.MetricPoint;
import com.eainde.expedition.model.RetrievedIncident;
import com.eainde.expedition.model.Severity;
import com.eainde.expedition.model.SupplementaryData;
import com.eainde.expedition.state.DiagnosisState;
import com.eainde.expedition.thread.MdcAwareThreadPoolExecutor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Shared test data: a brand-search CPA spike on google_search with a competitor-entry story behind it.
 */
public final class DiagnosisFixtures {

    public static final String CHANNEL = "google_search";
    public static final String METRIC = "cpa";
    public static final LocalDate EVALUATION_DATE = LocalDate.of(2024, 6, 10);
    public static final String RECORD_ID = "rec-1";

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final ExecutorService CALLS = MdcAwareThreadPoolExecutor.cached("test-call-");

    private DiagnosisFixtures() {
    }

    // =========================================================================
    //  Configuration
    // =========================================================================

    /** Defaults with a fast retry policy. */
    public static ExpeditionProperties properties() {
        ExpeditionProperties properties = new ExpeditionProperties();
        properties.getStage().setTimeout(Duration.ofSeconds(2));
        properties.getStage().setInitialBackoff(Duration.ofMillis(1));
        properties.getStage().setBackoffMultiplier(1.5);
        properties.getStage().setMaxAttempts(3);
        return properties;
    }

    public static StageExecutor stageExecutor(ExpeditionProperties properties) {
        return new StageExecutor(properties, CALLS);
    }

    public static ActionCatalog catalog() {
        try (InputStream in = resource("catalog/action-catalog.json")) {
            return ActionCatalog.read(MAPPER, in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ChannelRoutingTable routingTable() {
        try (InputStream in = resource("catalog/channel-routing.json")) {
            return ChannelRoutingTable.read(MAPPER, in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static RunContext context() {
        return context(CancellationToken.create());
    }

    public static RunContext context(CancellationToken token) {
        return new RunContext(RECORD_ID, catalog(), routingTable(), token);
    }

    /** A running state for the standard request with {@code values} already written by earlier stages. */
    public static DiagnosisState state(Map<String, Object> values) {
        return state(DiagnosisRequest.of(CHANNEL, METRIC, EVALUATION_DATE), values);
    }

    public static DiagnosisState state(DiagnosisRequest request, Map<String, Object> values) {
        Map<String, Object> data = new HashMap<>(DiagnosisState.initial(request, RECORD_ID));
        data.putAll(values);
        return new DiagnosisState(data);
    }

    // =========================================================================
    //  Domain data
    // =========================================================================

    public static List<MetricPoint> series(double... values) {
        List<MetricPoint> points = new ArrayList<>();
        LocalDate first = EVALUATION_DATE.minusDays(values.length - 1L);
        for (int i = 0; i < values.length; i++) {
            points.add(new MetricPoint(first.plusDays(i).atStartOfDay().toInstant(ZoneOffset.UTC), values[i]));
        }
        return points;
    }

    /** Five steady days then a jump to 160. */
    public static List<MetricPoint> spikingSeries() {
        return series(100, 102, 98, 101, 99, 160);
    }

    public static AnomalyDescriptor anomaly() {
        return anomaly(CHANNEL);
    }

    public static AnomalyDescriptor anomaly(String channel) {
        return new AnomalyDescriptor(channel, METRIC, 160.0, 100.0, 37.9, 60.0, Direction.SPIKE, Severity.CRITICAL,
                EVALUATION_DATE.atStartOfDay().toInstant(ZoneOffset.UTC), EVALUATION_DATE);
    }

    public static SupplementaryData paidMediaData() {
        return new SupplementaryData(ChannelFamily.PAID_MEDIA, Map.of(
                "campaign.brand.cpc", "4.10 (+38% wow)",
                "auction.impression_share", "0.52 (-21pts)",
                "competitor.overlap_rate", "0.44 (+30pts)"));
    }

    public static InvestigationFinding finding() {
        return new InvestigationFinding(
                ChannelFamily.PAID_MEDIA,
                "A competitor entered the brand auction and pushed CPCs up",
                0.8,
                List.of(new ContributingFactor("competitor overlap", 0.6, List.of("competitor.overlap_rate")),
                        new ContributingFactor("cpc inflation", 0.3, List.of("campaign.brand.cpc"))),
                List.of("competitor.overlap_rate", "campaign.brand.cpc", "auction.impression_share"),
                Map.of("competitor.overlap_rate", "0.44 (+30pts)",
                        "campaign.brand.cpc", "4.10 (+38% wow)",
                        "auction.impression_share", "0.52 (-21pts)"));
    }

    public static RetrievedIncident incident() {
        return new RetrievedIncident("INC-2024-014", 0.82,
                "Raised brand bids 20% and added competitor negatives",
                "Competitor entered brand auction", CHANNEL);
    }

    // =========================================================================
    //  Model responses
    // =========================================================================

    public static FindingResponse findingResponse() {
        return new FindingResponse(
                "A competitor entered the brand auction and pushed CPCs up",
                0.8,
                List.of(new FindingResponse.Factor("cpc inflation", 0.3, List.of("campaign.brand.cpc")),
                        new FindingResponse.Factor("competitor overlap", 0.6, List.of("competitor.overlap_rate"))),
                List.of("auction.impression_share", "competitor.overlap_rate"));
    }

    public static SynthesisResponse.Explanations explanations() {
        return new SynthesisResponse.Explanations(
                "Brand search costs rose 60% because a competitor started bidding on our name.",
                "Competitor conquesting on brand terms cut our impression share by 21 points.",
                "Brand campaign CPC is up 38% week over week; overlap with the competitor is 44%.",
                "Latest CPA is 37.9 standard deviations above the 5-day baseline.");
    }

    public static SynthesisResponse.Action bidIncrease(double adjustmentPct, String... citations) {
        return new SynthesisResponse.Action("bid_increase", CHANNEL,
                List.of(new SynthesisResponse.ParameterChange("adjustment_pct", adjustmentPct)),
                "Regain brand impression share lost to the competitor", List.of(citations), 0.05, 0.15);
    }

    public static SynthesisResponse synthesisResponse() {
        return new SynthesisResponse(
                "Competitor conquesting on brand keywords",
                0.75,
                List.of(new SynthesisResponse.Claim("Competitor overlap rose to 44%", List.of("competitor.overlap_rate")),
                        new SynthesisResponse.Claim("A similar entry was fixed with higher bids",
                                List.of("incident:INC-2024-014"))),
                explanations(),
                List.of(bidIncrease(80.0, "competitor.overlap_rate", "incident:INC-2024-014")));
    }

    public static SynthesisResponse ungroundedSynthesis() {
        return new SynthesisResponse(
                "Bid cap change",
                0.6,
                List.of(new SynthesisResponse.Claim("CPA spiked due to bid cap change", List.of())),
                explanations(),
                List.of(bidIncrease(20.0, "competitor.overlap_rate")));
    }

    public static CritiqueResponse cleanCritique() {
        return new CritiqueResponse(
                List.of(new CritiqueResponse.ActionAssessment(1, true, "higher bids answer lost impression share")),
                0.1,
                List.of());
    }

    private static InputStream resource(String path) {
        InputStream in = DiagnosisFixtures.class.getClassLoader().getResourceAsStream(path);
        if (in == null) {
            throw new IllegalStateException("missing test resource " + path);
        }
        return in;
    }
}
