package com.eainde.expedition.workflow;

import com.eainde.expedition.config.ExpeditionProperties;
import com.eainde.expedition.execution.CancellationToken;
import com.eainde.expedition.model.AnomalyDescriptor;
import com.eainde.expedition.model.DiagnosisRequest;
import com.eainde.expedition.model.Severity;
import com.eainde.expedition.state.DiagnosisRecord;
import com.eainde.expedition.thread.MdcAwareThreadPoolExecutor;
import jakarta.annotation.PreDestroy;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs many independent diagnoses on a bounded worker pool. Runs share nothing, so a failure or cancellation
 * of one never affects its siblings.
 */
@Log4j2
@Component
public class DiagnosisBatchRunner {

    private final DiagnosisEngine engine;
    private final ExecutorService workers;

    public DiagnosisBatchRunner(DiagnosisEngine engine, ExpeditionProperties properties) {
        this.engine = engine;
        int workerLimit = Math.max(1, properties.getBatch().getWorkerLimit());
        this.workers = MdcAwareThreadPoolExecutor.fixed(workerLimit, "diagnosis-worker-");
        log.info("Batch runner started with {} worker(s)", workerLimit);
    }

    public DiagnosisRun submit(DiagnosisRequest request) {
        CancellationToken token = CancellationToken.create();
        AtomicBoolean started = new AtomicBoolean();
        Future<DiagnosisRecord> future = workers.submit(() -> {
            if (!started.compareAndSet(false, true)) {
                throw new CancellationException("cancelled while queued");
            }
            return engine.diagnose(request, token);
        });
        return new DiagnosisRun(request, token, started, future);
    }

    public BatchSummary runAll(List<DiagnosisRequest> requests) {
        return runAll(requests, Severity.NONE, Integer.MAX_VALUE);
    }

    /**
     * Runs the requests and waits for all of them.
     * <p>
     * Requests carrying a caller-selected anomaly below {@code minSeverity} are skipped, and those anomalies
     * run most severe first. Requests without one are scanned by the detector in their own run. At most
     * {@code maxCount} requests are executed.
     */
    public BatchSummary runAll(List<DiagnosisRequest> requests, Severity minSeverity, int maxCount) {
        long start = System.nanoTime();
        List<DiagnosisRequest> selected = select(requests, minSeverity, maxCount);
        log.info("Running {} of {} request(s)", selected.size(), requests.size());

        List<DiagnosisRun> runs = selected.stream().map(this::submit).toList();
        List<DiagnosisRecord> records = new ArrayList<>(runs.size());
        for (DiagnosisRun run : runs) {
            records.add(run.await());
        }

        BatchSummary summary = new BatchSummary(records, requests.size() - selected.size(),
                Duration.ofNanos(System.nanoTime() - start));
        log.info("Batch finished in {}ms: {}", summary.elapsed().toMillis(), summary.counts());
        return summary;
    }

    static List<DiagnosisRequest> select(List<DiagnosisRequest> requests, Severity minSeverity, int maxCount) {
        Comparator<DiagnosisRequest> mostSevereFirst = Comparator.comparing(
                (DiagnosisRequest r) -> r.preset().map(AnomalyDescriptor::severity).orElse(Severity.NONE)).reversed()
                .thenComparing(r -> r.preset().map(a -> Math.abs(a.zScore())).orElse(0.0), Comparator.reverseOrder());

        List<DiagnosisRequest> preset = requests.stream()
                .filter(r -> r.preset().isPresent())
                .filter(r -> r.presetAnomaly().severity().isAtLeast(minSeverity))
                .sorted(mostSevereFirst)
                .toList();
        List<DiagnosisRequest> scanned = requests.stream()
                .filter(r -> r.preset().isEmpty())
                .toList();

        List<DiagnosisRequest> selected = new ArrayList<>(preset);
        selected.addAll(scanned);
        return selected.subList(0, Math.min(Math.max(0, maxCount), selected.size()));
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }
}
