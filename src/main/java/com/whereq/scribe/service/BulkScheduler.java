package com.whereq.scribe.service;

import com.whereq.scribe.config.OptimizerProperties;
import com.whereq.scribe.dto.OptimizationRequest;
import com.whereq.scribe.exception.ConfigurationException;
import com.whereq.scribe.exception.JobTimeoutException;
import com.whereq.scribe.model.BatchSummary;
import com.whereq.scribe.model.BulkBatch;
import com.whereq.scribe.model.BulkJob;
import com.whereq.scribe.model.OptimizationResult;
import com.whereq.scribe.model.RunOptions;
import com.whereq.scribe.util.Slugs;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Run a batch of optimizations in waves of bounded size.
 *
 * Jobs of one wave run concurrently in silent mode; the next wave starts once every job of the
 * current wave settled, after a cooldown that keeps upstream services under their rate limits.
 * A job failure is recorded in its slot and never reaches sibling jobs or the batch.
 */
@Slf4j
@Service
public class BulkScheduler {

    private static final Pattern URL_SEPARATORS = Pattern.compile("[,\\s]+");

    @Autowired
    private OptimizerProperties properties;

    @Autowired
    private PhaseOrchestrator orchestrator;

    @Autowired
    private MeterRegistry meterRegistry;

    private final AtomicReference<BulkBatch> activeBatch = new AtomicReference<>();
    private volatile BatchSummary lastSummary;

    private Counter completedCounter;
    private Counter failedCounter;

    @PostConstruct
    public void initialize() {
        completedCounter = Counter.builder("scribe.bulk.jobs.completed")
            .description("Bulk jobs that passed the quality gate")
            .register(meterRegistry);

        failedCounter = Counter.builder("scribe.bulk.jobs.failed")
            .description("Bulk jobs that failed, timed out or missed the quality gate")
            .register(meterRegistry);

        Gauge.builder("scribe.bulk.jobs.running", activeBatch,
                ref -> ref.get() != null ? ref.get().runningCount() : 0)
            .description("Bulk jobs currently running")
            .register(meterRegistry);
    }

    /**
     * Split, trim, validate and deduplicate raw URL input, keeping first-seen order
     *
     * @param rawUrls entries that may each hold several URLs separated by commas or whitespace
     * @return distinct absolute http(s) URLs
     */
    public static List<String> normalizeUrls(Collection<String> rawUrls) {
        Set<String> urls = new LinkedHashSet<>();
        if (rawUrls == null) {
            return List.of();
        }
        for (String entry : rawUrls) {
            if (entry == null) {
                continue;
            }
            for (String candidate : URL_SEPARATORS.split(entry.trim())) {
                String url = candidate.trim();
                if (Slugs.isAbsoluteHttpUrl(url)) {
                    urls.add(url);
                }
            }
        }
        return List.copyOf(urls);
    }

    /**
     * Run a batch to completion
     *
     * @param rawUrls raw URL input
     * @param concurrency jobs per wave, at least 1
     * @return summary of the finished batch
     */
    public Mono<BatchSummary> run(Collection<String> rawUrls, int concurrency) {
        return Mono.defer(() -> execute(prepare(rawUrls, concurrency)));
    }

    /**
     * Validate the input and claim the batch slot
     *
     * @throws IllegalArgumentException if no valid URL remains or concurrency is below 1
     * @throws ConfigurationException if no AI key is configured
     * @throws IllegalStateException if another batch is running
     */
    public BulkBatch prepare(Collection<String> rawUrls, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1");
        }
        List<String> urls = normalizeUrls(rawUrls);
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("No valid URLs supplied");
        }
        if (!properties.getAi().hasAnyKey()) {
            throw new ConfigurationException("No AI API key configured");
        }

        BulkBatch batch = new BulkBatch(UUID.randomUUID().toString(), urls, concurrency, Instant.now());
        if (!activeBatch.compareAndSet(null, batch)) {
            throw new IllegalStateException("A bulk optimization is already running");
        }
        log.info("Bulk batch {} prepared: {} URLs, concurrency {}", batch.getId(), urls.size(), concurrency);
        return batch;
    }

    /**
     * Execute a prepared batch wave by wave
     */
    public Mono<BatchSummary> execute(BulkBatch batch) {
        List<List<BulkJob>> waves = batch.waves();

        return Flux.fromIterable(waves)
            .index()
            .concatMap(wave -> {
                if (batch.isAborted()) {
                    return Mono.<Void>empty();
                }
                boolean moreWaves = wave.getT1() < waves.size() - 1;
                log.info("Bulk batch {}: wave {}/{} with {} jobs",
                    batch.getId(), wave.getT1() + 1, waves.size(), wave.getT2().size());
                return runWave(batch, wave.getT2()).then(cooldown(batch, moreWaves));
            })
            .then(Mono.fromCallable(() -> finish(batch)))
            .doFinally(signal -> {
                if (batch.isRunning()) {
                    finish(batch);
                }
                activeBatch.compareAndSet(batch, null);
            });
    }

    private Mono<Void> runWave(BulkBatch batch, List<BulkJob> wave) {
        return Flux.fromIterable(wave)
            .flatMap(job -> runJob(batch, job), batch.getConcurrency())
            .then();
    }

    private Mono<Void> runJob(BulkBatch batch, BulkJob job) {
        return Mono.defer(() -> {
            if (batch.isAborted()) {
                log.info("Bulk batch {} aborted, skipping {}", batch.getId(), job.getUrl());
                return Mono.empty();
            }
            batch.markRunning(job, Instant.now());
            Duration timeout = properties.getBulk().getJobTimeout();

            return orchestrator.optimize(OptimizationRequest.forUrl(job.getUrl()), RunOptions.silent())
                .timeout(timeout, Mono.error(() -> new JobTimeoutException(timeout)))
                .doOnNext(result -> classify(batch, job, result))
                .onErrorResume(e -> {
                    String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    log.warn("Bulk job {} failed: {}", job.getUrl(), error);
                    batch.recordFailure(job, error, Instant.now());
                    failedCounter.increment();
                    return Mono.empty();
                })
                .then();
        });
    }

    /**
     * Success requires both a successful run and a score at the quality threshold
     */
    private void classify(BulkBatch batch, BulkJob job, OptimizationResult result) {
        int threshold = properties.getBulk().getQualityThreshold();
        if (result.isSuccess() && result.getScore() >= threshold) {
            batch.recordSuccess(job, result, Instant.now());
            completedCounter.increment();
            log.info("Bulk job {} completed: score {}, {} words", job.getUrl(), result.getScore(), result.getWordCount());
            return;
        }
        String error = result.getError() != null ? result.getError() : "Quality check failed";
        batch.recordFailure(job, error, Instant.now());
        failedCounter.increment();
        log.warn("Bulk job {} failed: {} (score {})", job.getUrl(), error, result.getScore());
    }

    private Mono<Void> cooldown(BulkBatch batch, boolean moreWaves) {
        return Mono.defer(() -> {
            Duration cooldown = properties.getBulk().getWaveCooldown();
            if (!moreWaves || batch.isAborted() || cooldown.isZero()) {
                return Mono.empty();
            }
            return Mono.delay(cooldown).then();
        });
    }

    private BatchSummary finish(BulkBatch batch) {
        batch.finish(Instant.now());
        BatchSummary summary = batch.toSummary();
        lastSummary = summary;
        log.info("Bulk batch {} finished{}: {} completed, {} failed, avg score {}, {} words in {} ms",
            batch.getId(), summary.isAborted() ? " (aborted)" : "", summary.getCompleted(), summary.getFailed(),
            summary.getAvgScore(), summary.getTotalWords(), summary.getTotalTime());
        return summary;
    }

    /**
     * Ask the running batch to stop before its next wave or job
     *
     * @return true if a batch was running
     */
    public boolean abort() {
        BulkBatch batch = activeBatch.get();
        if (batch == null) {
            return false;
        }
        batch.abort();
        log.info("Bulk batch {} abort requested", batch.getId());
        return true;
    }

    public boolean isRunning() {
        return activeBatch.get() != null;
    }

    /**
     * Running batch, or the last finished one
     */
    public Optional<BatchSummary> currentSummary() {
        BulkBatch batch = activeBatch.get();
        if (batch != null) {
            return Optional.of(batch.toSummary());
        }
        return Optional.ofNullable(lastSummary);
    }
}
