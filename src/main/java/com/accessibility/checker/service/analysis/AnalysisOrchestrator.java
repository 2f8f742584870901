package com.accessibility.checker.service.analysis;

import com.accessibility.checker.config.AccessibilityProperties;
import com.accessibility.checker.config.AccessibilityProperties.DeadlinePolicy;
import com.accessibility.checker.dto.AnalysisReport;
import com.accessibility.checker.dto.BatchStatistics;
import com.accessibility.checker.dto.ImageFailure;
import com.accessibility.checker.dto.LabelDetection;
import com.accessibility.checker.exception.ImageAnalysisException;
import com.accessibility.checker.exception.InvalidAssessmentRequestException;
import com.accessibility.checker.exception.InvalidConfigurationException;
import com.accessibility.checker.model.AnalysisResult;
import com.accessibility.checker.model.FailureKind;
import com.accessibility.checker.model.ImageRef;
import com.accessibility.checker.model.Label;
import com.accessibility.checker.service.cache.ResultCache;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans per-image analysis out over a bounded worker pool and folds the outcomes back in.
 *
 * <h3>Per request:</h3>
 * <ol>
 *   <li>The image list is cut into waves by {@link BatchChunker}; waves run in input order.</li>
 *   <li>Each image is first looked up in the {@link ResultCache}; hits skip the live call.</li>
 *   <li>Misses are submitted to the shared pool, at most {@code maxConcurrency} of them in flight.</li>
 *   <li>Transient failures are retried with exponential backoff; permanent ones are not.</li>
 *   <li>Successful live results are written to the cache, then aggregated.</li>
 * </ol>
 *
 * <p>Every task returns an {@link AnalysisResult}; a failing image never cancels or blocks its
 * siblings. When the request deadline passes, results gathered so far are kept and the rest
 * are recorded as {@link FailureKind#TIMEOUT}.</p>
 */
@Service
@Slf4j
public class AnalysisOrchestrator {

    private final ImageLabelDetector labelDetector;
    private final ResultCache resultCache;
    private final BatchChunker batchChunker;
    private final AccessibilityLabelFilter labelFilter;
    private final AccessibilityProperties.Analysis settings;
    private final Clock clock;
    private final ExecutorService workers;

    public AnalysisOrchestrator(ImageLabelDetector labelDetector,
                                ResultCache resultCache,
                                BatchChunker batchChunker,
                                AccessibilityLabelFilter labelFilter,
                                AccessibilityProperties properties,
                                Clock clock) {
        this.labelDetector = labelDetector;
        this.resultCache = resultCache;
        this.batchChunker = batchChunker;
        this.labelFilter = labelFilter;
        this.settings = properties.getAnalysis();
        this.clock = clock;

        if (settings.getMaxConcurrency() < 1) {
            throw new InvalidConfigurationException(
                    "max-concurrency must be at least 1, got " + settings.getMaxConcurrency(),
                    "accessibility.analysis.max-concurrency");
        }
        this.workers = Executors.newFixedThreadPool(settings.getMaxConcurrency(), workerThreadFactory());
        log.info("Analysis orchestrator started with {} workers, chunk size {}",
                settings.getMaxConcurrency(), settings.getChunkSize());
    }

    public AnalysisReport analyze(List<ImageRef> images) {
        return analyze(images, settings.getMaxConcurrency());
    }

    /**
     * Analyzes all images, never failing for per-image problems.
     *
     * @param maxConcurrency cap on this request's simultaneous live calls; the pool size caps
     *                       all requests together
     */
    public AnalysisReport analyze(List<ImageRef> images, int maxConcurrency) {
        if (images == null || images.isEmpty()) {
            throw new InvalidAssessmentRequestException("No images provided");
        }
        if (maxConcurrency < 1) {
            throw new InvalidConfigurationException(
                    "maxConcurrency must be at least 1, got " + maxConcurrency,
                    "accessibility.analysis.max-concurrency");
        }

        long startNanos = System.nanoTime();
        RequestState state = new RequestState(images.size(), startNanos + settings.getDeadline().toNanos());
        List<List<ImageRef>> batches = batchChunker.chunk(images, settings.getChunkSize());
        log.info("Processing {} images in {} batches (maxConcurrency={})", images.size(), batches.size(), maxConcurrency);

        int offset = 0;
        for (List<ImageRef> batch : batches) {
            processBatch(batch, offset, maxConcurrency, state);
            offset += batch.size();
        }

        AnalysisReport report = buildReport(state);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        log.info("Analyzed {} images in {} ms: {} succeeded, {} failed, cache hits {}, misses {}",
                images.size(), elapsedMs, report.getSuccessfulImages(), report.getFailures().size(),
                report.getCacheHits(), report.getCacheMisses());
        if (!report.getFailures().isEmpty()) {
            log.warn("Encountered {} errors during image analysis", report.getFailures().size());
            for (ImageFailure failure : report.getFailures()) {
                log.warn("Image {} ({}): {}", failure.getImageRef(), failure.getKind(), failure.getReason());
            }
        }
        return report;
    }

    /**
     * Summary numbers for a set of per-image results.
     */
    public BatchStatistics getBatchStatistics(List<AnalysisResult> results) {
        int totalImages = results.size();
        int successful = 0;
        int totalLabels = 0;
        int accessibilityLabels = 0;
        for (AnalysisResult result : results) {
            if (result.isSucceeded()) {
                successful++;
                totalLabels += result.getTotalLabels();
                accessibilityLabels += result.getLabels().size();
            }
        }

        return BatchStatistics.builder()
                .totalImages(totalImages)
                .successfulAnalyses(successful)
                .failedAnalyses(totalImages - successful)
                .successRate(totalImages > 0 ? successful * 100.0 / totalImages : 0.0)
                .totalLabelsDetected(totalLabels)
                .accessibilityLabelsDetected(accessibilityLabels)
                .averageLabelsPerImage(successful > 0 ? (double) totalLabels / successful : 0.0)
                .build();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down analysis workers");
        workers.shutdownNow();
    }

    // ========================= WAVE PROCESSING =========================

    private void processBatch(List<ImageRef> batch, int offset, int maxConcurrency, RequestState state) {
        List<Integer> pending = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            int index = offset + i;
            ImageRef image = batch.get(i);
            Optional<AnalysisResult> cached = resultCache.get(fingerprint(image));
            if (cached.isPresent()) {
                state.results[index] = cached.get().toBuilder().imageRef(image).build();
                state.cacheHits++;
            } else {
                state.images[index] = image;
                pending.add(index);
                state.cacheMisses++;
            }
        }

        if (pending.isEmpty()) {
            return;
        }
        if (state.deadlineReached || System.nanoTime() >= state.deadlineNanos) {
            state.deadlineReached = true;
            pending.forEach(index -> state.timeOut(index, "Deadline exceeded before dispatch", clock));
            return;
        }

        dispatch(pending, maxConcurrency, state);
    }

    private void dispatch(List<Integer> pending, int maxConcurrency, RequestState state) {
        CompletionService<AnalysisResult> completionService = new ExecutorCompletionService<>(workers);
        Map<Future<AnalysisResult>, Integer> inFlight = new HashMap<>();
        Iterator<Integer> queue = pending.iterator();

        while (inFlight.size() < maxConcurrency && queue.hasNext()) {
            submit(queue.next(), completionService, inFlight, state);
        }

        while (!inFlight.isEmpty()) {
            Future<AnalysisResult> done = awaitNext(completionService, state);

            if (done == null) {
                // deadline reached with ABANDON policy, or the caller was interrupted
                inFlight.forEach((future, index) -> {
                    future.cancel(true);
                    state.timeOut(index, "Deadline exceeded, analysis abandoned", clock);
                });
                inFlight.clear();
                break;
            }

            int index = inFlight.remove(done);
            AnalysisResult result = collect(done, state.images[index]);
            if (result.isSucceeded()) {
                resultCache.put(fingerprint(state.images[index]), result);
            }
            state.results[index] = result;

            if (!state.deadlineReached && queue.hasNext()) {
                submit(queue.next(), completionService, inFlight, state);
            }
        }

        queue.forEachRemaining(index -> state.timeOut(index, "Deadline exceeded before dispatch", clock));
    }

    private Future<AnalysisResult> awaitNext(CompletionService<AnalysisResult> completionService, RequestState state) {
        try {
            if (state.deadlineReached) {
                // COMPLETE_IN_FLIGHT: wait for whatever is still running
                return completionService.take();
            }
            long remaining = state.deadlineNanos - System.nanoTime();
            Future<AnalysisResult> done = remaining > 0
                    ? completionService.poll(remaining, TimeUnit.NANOSECONDS)
                    : completionService.poll();
            if (done != null) {
                return done;
            }

            state.deadlineReached = true;
            log.warn("Analysis deadline of {} reached, policy {}", settings.getDeadline(), settings.getDeadlinePolicy());
            if (settings.getDeadlinePolicy() == DeadlinePolicy.COMPLETE_IN_FLIGHT) {
                return completionService.take();
            }
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.deadlineReached = true;
            log.warn("Interrupted while waiting for image analyses, abandoning in-flight calls");
            return null;
        }
    }

    private void submit(int index, CompletionService<AnalysisResult> completionService,
                        Map<Future<AnalysisResult>, Integer> inFlight, RequestState state) {
        ImageRef image = state.images[index];
        inFlight.put(completionService.submit(() -> analyzeWithRetry(image)), index);
    }

    private AnalysisResult collect(Future<AnalysisResult> future, ImageRef image) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Unexpected error analyzing {}", image, e.getCause());
            return AnalysisResult.failure(image, FailureKind.PERMANENT,
                    "Unexpected error: " + e.getCause(), 0, clock.instant());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AnalysisResult.failure(image, FailureKind.TIMEOUT, "Interrupted", 0, clock.instant());
        }
    }

    // ========================= PER-IMAGE TASK =========================

    private AnalysisResult analyzeWithRetry(ImageRef image) {
        AccessibilityProperties.Retry retry = settings.getRetry();
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        Duration backoff = retry.getInitialBackoff();

        for (int attempt = 1; ; attempt++) {
            try {
                LabelDetection detection = labelDetector.detectLabels(image);
                List<LabelDetection.DetectedLabel> detected = detection.getLabels() != null
                        ? detection.getLabels() : List.of();
                List<Label> labels = labelFilter.filter(detected);
                log.info("Analyzed {}: {} labels, {} accessibility-relevant", image, detected.size(), labels.size());
                return AnalysisResult.success(image, labels, detected.size(), attempt, clock.instant());

            } catch (ImageAnalysisException e) {
                if (Thread.currentThread().isInterrupted()) {
                    return AnalysisResult.failure(image, FailureKind.TIMEOUT, "Analysis abandoned", attempt, clock.instant());
                }
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    return AnalysisResult.failure(image, e.getKind(), e.getMessage(), attempt, clock.instant());
                }
                log.warn("Transient failure for {} (attempt {}/{}), retrying in {} ms: {}",
                        image, attempt, maxAttempts, backoff.toMillis(), e.getMessage());
                if (!sleep(backoff)) {
                    return AnalysisResult.failure(image, FailureKind.TIMEOUT,
                            "Interrupted while waiting to retry", attempt, clock.instant());
                }
                backoff = nextBackoff(backoff, retry);

            } catch (RuntimeException e) {
                log.error("Unexpected error from label detector for {}", image, e);
                return AnalysisResult.failure(image, FailureKind.PERMANENT,
                        e.getClass().getSimpleName() + ": " + e.getMessage(), attempt, clock.instant());
            }
        }
    }

    private static Duration nextBackoff(Duration current, AccessibilityProperties.Retry retry) {
        long next = (long) (current.toMillis() * retry.getMultiplier());
        return Duration.ofMillis(Math.min(next, retry.getMaxBackoff().toMillis()));
    }

    private static boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ========================= AGGREGATION =========================

    private AnalysisReport buildReport(RequestState state) {
        List<AnalysisResult> results = new ArrayList<>(state.results.length);
        List<Label> aggregated = new ArrayList<>();
        List<ImageFailure> failures = new ArrayList<>();

        for (AnalysisResult result : state.results) {
            results.add(result);
            if (result.isSucceeded()) {
                aggregated.addAll(result.getLabels());
            } else {
                failures.add(ImageFailure.builder()
                        .imageRef(result.getImageRef())
                        .reason(result.getError())
                        .kind(result.getFailureKind())
                        .build());
            }
        }
        log.info("Combined {} labels from {} images", aggregated.size(), results.size() - failures.size());

        return AnalysisReport.builder()
                .results(results)
                .aggregatedLabels(aggregated)
                .failures(failures)
                .cacheHits(state.cacheHits)
                .cacheMisses(state.cacheMisses)
                .build();
    }

    private String fingerprint(ImageRef image) {
        return ResultCache.fingerprint(image, settings.getAnalysisKind());
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "image-analysis-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Mutable bookkeeping for one request; confined to the calling thread.
     */
    private static final class RequestState {
        final AnalysisResult[] results;
        final ImageRef[] images;
        final long deadlineNanos;
        boolean deadlineReached;
        int cacheHits;
        int cacheMisses;

        RequestState(int size, long deadlineNanos) {
            this.results = new AnalysisResult[size];
            this.images = new ImageRef[size];
            this.deadlineNanos = deadlineNanos;
        }

        void timeOut(int index, String reason, Clock clock) {
            results[index] = AnalysisResult.failure(images[index], FailureKind.TIMEOUT, reason, 0, clock.instant());
        }
    }
}
