package com.whereq.scribe.service;

import com.whereq.scribe.config.OptimizerProperties;
import com.whereq.scribe.dto.OptimizationRequest;
import com.whereq.scribe.exception.ConfigurationException;
import com.whereq.scribe.model.BatchSummary;
import com.whereq.scribe.model.BulkJob;
import com.whereq.scribe.model.BulkJobStatus;
import com.whereq.scribe.model.OptimizationResult;
import com.whereq.scribe.model.RunOptions;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * BulkScheduler unit tests
 */
@ExtendWith(MockitoExtension.class)
class BulkSchedulerTest {

    private static final List<String> FIVE_URLS = List.of(
        "https://example.com/a",
        "https://example.com/b",
        "https://example.com/c",
        "https://example.com/d",
        "https://example.com/e");

    @Spy
    private OptimizerProperties properties = configuredProperties();

    @Spy
    private MeterRegistry meterRegistry = new SimpleMeterRegistry();

    @Mock
    private PhaseOrchestrator orchestrator;

    @InjectMocks
    private BulkScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler.initialize();
    }

    @Test
    @DisplayName("All successful jobs are aggregated into the summary")
    void aggregatesSuccessfulJobs() {
        // given
        when(orchestrator.optimize(any(OptimizationRequest.class), any(RunOptions.class)))
            .thenReturn(Mono.just(OptimizationResult.success(80, 4200)));

        // when
        BatchSummary summary = scheduler.run(FIVE_URLS, 2).block(Duration.ofSeconds(5));

        // then
        assertThat(summary.isRunning()).isFalse();
        assertThat(summary.isAborted()).isFalse();
        assertThat(summary.getTotal()).isEqualTo(5);
        assertThat(summary.getCompleted()).isEqualTo(5);
        assertThat(summary.getFailed()).isZero();
        assertThat(summary.getTotalWords()).isEqualTo(21000);
        assertThat(summary.getAvgScore()).isEqualTo(80);
        assertThat(summary.getJobs()).extracting(BulkJob::getStatus).containsOnly(BulkJobStatus.COMPLETED);
        verify(orchestrator, times(5)).optimize(any(OptimizationRequest.class), argThat(RunOptions::isSilent));
        assertThat(meterRegistry.get("scribe.bulk.jobs.completed").counter().count()).isEqualTo(5.0);
        assertThat(scheduler.isRunning()).isFalse();
        assertThat(scheduler.currentSummary()).contains(summary);
    }

    @Test
    @DisplayName("Low score and failed results fail their slot only")
    void qualityGate() {
        // given
        when(orchestrator.optimize(any(OptimizationRequest.class), any(RunOptions.class))).thenAnswer(invocation -> {
            OptimizationRequest request = invocation.getArgument(0);
            if (request.getUrl().endsWith("/b")) {
                return Mono.just(OptimizationResult.success(40, 3000));
            }
            if (request.getUrl().endsWith("/c")) {
                return Mono.just(OptimizationResult.failure("Publish failed: 401 Unauthorized"));
            }
            if (request.getUrl().endsWith("/d")) {
                return Mono.error(new IllegalStateException("boom"));
            }
            return Mono.just(OptimizationResult.success(90, 4000));
        });

        // when
        BatchSummary summary = scheduler.run(FIVE_URLS, 3).block(Duration.ofSeconds(5));

        // then
        assertThat(summary.getCompleted()).isEqualTo(2);
        assertThat(summary.getFailed()).isEqualTo(3);
        assertThat(summary.getAvgScore()).isEqualTo(90);
        assertThat(summary.getTotalWords()).isEqualTo(8000);
        assertThat(summary.getJobs().get(1).getError()).isEqualTo("Quality check failed");
        assertThat(summary.getJobs().get(2).getError()).isEqualTo("Publish failed: 401 Unauthorized");
        assertThat(summary.getJobs().get(3).getError()).isEqualTo("boom");
        assertThat(summary.getJobs().get(4).getStatus()).isEqualTo(BulkJobStatus.COMPLETED);
    }

    @Test
    @DisplayName("No more than the requested number of jobs run at once")
    void boundedConcurrency() {
        // given
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        when(orchestrator.optimize(any(OptimizationRequest.class), any(RunOptions.class)))
            .thenAnswer(invocation -> Mono.defer(() -> {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    return Mono.delay(Duration.ofMillis(50)).thenReturn(OptimizationResult.success(75, 1000));
                })
                .doFinally(signal -> running.decrementAndGet()));

        // when
        BatchSummary summary = scheduler.run(FIVE_URLS, 2).block(Duration.ofSeconds(5));

        // then
        assertThat(summary.getCompleted()).isEqualTo(5);
        assertThat(maxRunning.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("A job over its time budget fails with a timeout")
    void jobTimeout() {
        // given
        properties.getBulk().setJobTimeout(Duration.ofMillis(100));
        when(orchestrator.optimize(any(OptimizationRequest.class), any(RunOptions.class))).thenAnswer(invocation -> {
            OptimizationRequest request = invocation.getArgument(0);
            return request.getUrl().endsWith("/a")
                ? Mono.never()
                : Mono.just(OptimizationResult.success(70, 2000));
        });

        // when
        BatchSummary summary = scheduler.run(List.of("https://example.com/a", "https://example.com/b"), 2)
            .block(Duration.ofSeconds(5));

        // then
        assertThat(summary.getCompleted()).isEqualTo(1);
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.getJobs().get(0).getError()).isEqualTo("Job timeout");
    }

    @Test
    @DisplayName("Abort stops the batch before the next wave")
    void abortBeforeNextWave() {
        // given
        when(orchestrator.optimize(any(OptimizationRequest.class), any(RunOptions.class))).thenAnswer(invocation -> {
            scheduler.abort();
            return Mono.just(OptimizationResult.success(85, 3000));
        });

        // when
        BatchSummary summary = scheduler.run(List.of(
                "https://example.com/a", "https://example.com/b", "https://example.com/c"), 1)
            .block(Duration.ofSeconds(5));

        // then
        assertThat(summary.isAborted()).isTrue();
        assertThat(summary.isRunning()).isFalse();
        assertThat(summary.getCompleted()).isEqualTo(1);
        assertThat(summary.getJobs()).extracting(BulkJob::getStatus)
            .containsExactly(BulkJobStatus.COMPLETED, BulkJobStatus.QUEUED, BulkJobStatus.QUEUED);
        verify(orchestrator, times(1)).optimize(any(OptimizationRequest.class), any(RunOptions.class));
    }

    @Test
    @DisplayName("Only one batch runs at a time")
    void singleBatch() {
        // given
        scheduler.prepare(FIVE_URLS, 2);

        // when / then
        assertThat(scheduler.isRunning()).isTrue();
        assertThatThrownBy(() -> scheduler.prepare(FIVE_URLS, 2))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("A bulk optimization is already running");
    }

    @Test
    @DisplayName("Invalid input is rejected before a batch starts")
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> scheduler.prepare(FIVE_URLS, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Concurrency must be at least 1");
        assertThatThrownBy(() -> scheduler.prepare(List.of("not a url", "ftp://example.com/file"), 2))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("No valid URLs supplied");

        properties.getAi().getKeys().clear();
        assertThatThrownBy(() -> scheduler.prepare(FIVE_URLS, 2))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("No AI API key configured");
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Raw URL input is split, trimmed, validated and deduplicated in order")
    void normalizeUrls() {
        List<String> urls = BulkScheduler.normalizeUrls(List.of(
            "https://example.com/b, https://example.com/a",
            "  https://example.com/b  ",
            "https://example.com/c\nhttps://example.com/a",
            "example.com/no-scheme"));

        assertThat(urls).containsExactly("https://example.com/b", "https://example.com/a", "https://example.com/c");
    }

    @Test
    @DisplayName("Duplicate URLs produce a single slot")
    void duplicateUrlsShareSlot() {
        // given
        when(orchestrator.optimize(any(OptimizationRequest.class), any(RunOptions.class)))
            .thenReturn(Mono.just(OptimizationResult.success(60, 1500)));

        // when
        BatchSummary summary = scheduler.run(List.of("https://example.com/a", "https://example.com/a"), 2)
            .block(Duration.ofSeconds(5));

        // then
        assertThat(summary.getTotal()).isEqualTo(1);
        assertThat(summary.getCompleted()).isEqualTo(1);
    }

    private static OptimizerProperties configuredProperties() {
        OptimizerProperties properties = new OptimizerProperties();
        properties.getAi().getKeys().put("gemini", "ai-key");
        properties.getBulk().setWaveCooldown(Duration.ZERO);
        return properties;
    }
}
