package com.eainde.expedition.nodes;

import com.eainde.expedition.config.ExpeditionProperties;
import com.eainde.expedition.data.MetricsDataSource;
import com.eainde.expedition.error.DiagnosisException;
import com.eainde.expedition.error.ErrorCode;
import com.eainde.expedition.execution.RunContext;
import com.eainde.expedition.execution.StageExecutor;
import com.eainde.expedition.execution.StageJournal;
import com.eainde.expedition.state.DiagnosisState;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Refuses to diagnose today's data when the data source has not refreshed recently. Historical
 * ("as of") evaluations are not checked.
 */
@Log4j2
@Component
public class PreflightNode extends AbstractDiagnosisNode {

    public static final String STAGE = "preflight";

    private final MetricsDataSource dataSource;
    private final StageExecutor stageExecutor;
    private final ExpeditionProperties.Preflight settings;
    private final Clock clock;

    public PreflightNode(MetricsDataSource dataSource, StageExecutor stageExecutor,
                         ExpeditionProperties properties, Clock clock) {
        this.dataSource = dataSource;
        this.stageExecutor = stageExecutor;
        this.settings = properties.getPreflight();
        this.clock = clock;
    }

    @Override
    public String stageName() {
        return STAGE;
    }

    @Override
    protected Map<String, Object> process(DiagnosisState state, RunContext ctx, StageJournal journal) {
        if (!settings.isEnabled()) {
            journal.markSkipped(null, "freshness check disabled");
            return Map.of();
        }
        LocalDate evaluationDate = state.request().evaluationDate();
        if (evaluationDate.isBefore(LocalDate.now(clock.withZone(ZoneOffset.UTC)))) {
            journal.markSkipped(null, "historical evaluation for " + evaluationDate);
            return Map.of();
        }

        Optional<Instant> lastUpdated = stageExecutor.call("lastUpdated", journal, ctx, dataSource::lastUpdated);
        if (lastUpdated == null || lastUpdated.isEmpty()) {
            throw new DiagnosisException(ErrorCode.STALE_DATA, "data source does not report a refresh time");
        }
        Duration age = Duration.between(lastUpdated.get(), clock.instant());
        if (age.compareTo(settings.getMaxDataLatency()) > 0) {
            throw new DiagnosisException(ErrorCode.STALE_DATA, String.format(Locale.ROOT,
                    "data last refreshed %d minutes ago, limit is %d minutes",
                    age.toMinutes(), settings.getMaxDataLatency().toMinutes()));
        }
        log.debug("Data refreshed {} minutes ago", age.toMinutes());
        return Map.of();
    }
}
