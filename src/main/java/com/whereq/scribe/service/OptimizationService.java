package com.whereq.scribe.service;

import com.whereq.scribe.client.ContentStore;
import com.whereq.scribe.config.OptimizerProperties;
import com.whereq.scribe.crawler.SitemapCrawler;
import com.whereq.scribe.dto.OptimizationRequest;
import com.whereq.scribe.dto.SitemapResponse;
import com.whereq.scribe.exception.ConfigurationException;
import com.whereq.scribe.model.BatchSummary;
import com.whereq.scribe.model.BulkBatch;
import com.whereq.scribe.model.CancellationToken;
import com.whereq.scribe.model.Job;
import com.whereq.scribe.model.OptimizationResult;
import com.whereq.scribe.model.Page;
import com.whereq.scribe.model.RunOptions;
import com.whereq.scribe.model.SiteCredentials;
import com.whereq.scribe.progress.ProgressReporter;
import com.whereq.scribe.progress.ProgressSnapshot;
import com.whereq.scribe.state.ActivityLog;
import com.whereq.scribe.state.JobStateStore;
import com.whereq.scribe.state.OptimizationStats;
import com.whereq.scribe.state.PageCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for single and bulk optimizations, cancellation and progress
 */
@Slf4j
@Service
public class OptimizationService {

    @Autowired
    private PhaseOrchestrator orchestrator;

    @Autowired
    private BulkScheduler bulkScheduler;

    @Autowired
    private ProgressReporter progressReporter;

    @Autowired
    private JobStateStore jobStateStore;

    @Autowired
    private PageCatalog pageCatalog;

    @Autowired
    private ActivityLog activityLog;

    @Autowired
    private OptimizationStats optimizationStats;

    @Autowired
    private SitemapCrawler sitemapCrawler;

    @Autowired
    private ContentStore contentStore;

    @Autowired
    private OptimizerProperties properties;

    /**
     * Token of the interactive run in flight, null when none
     */
    private final AtomicReference<CancellationToken> activeToken = new AtomicReference<>();

    /**
     * Optimize one page.
     *
     * Interactive runs are single flight and cancellable through {@link #requestCancellation}; silent
     * runs report no progress and write no global activity.
     *
     * @param request target and keyword override
     * @param silent run without progress reporting or global log
     * @return terminal result
     */
    public Mono<OptimizationResult> runSingleJob(OptimizationRequest request, boolean silent) {
        if (silent) {
            return orchestrator.optimize(request, RunOptions.silent());
        }
        return Mono.defer(() -> {
            CancellationToken token = new CancellationToken();
            if (!activeToken.compareAndSet(null, token)) {
                return Mono.error(new IllegalStateException("An optimization is already running"));
            }
            return orchestrator.optimize(request, RunOptions.interactive(token))
                .doFinally(signal -> activeToken.compareAndSet(token, null));
        });
    }

    /**
     * Cancel the interactive run. The progress snapshot reports the run as stopped and failed
     * immediately; the pipeline itself is disposed as soon as the token fires.
     *
     * @return true if a running job received the request
     */
    public boolean requestCancellation(String reason) {
        CancellationToken token = activeToken.get();
        if (token == null || !token.cancel(reason)) {
            return false;
        }
        progressReporter.forceFailed();
        log.info("Cancellation requested: {}", token.getReason());
        activityLog.add("Cancellation requested: " + token.getReason());
        return true;
    }

    public boolean isRunning() {
        return activeToken.get() != null;
    }

    /**
     * Current progress snapshot followed by every change
     */
    public Flux<ProgressSnapshot> subscribeProgress() {
        return progressReporter.subscribe();
    }

    public ProgressSnapshot currentProgress() {
        return progressReporter.current();
    }

    /**
     * Run a bulk batch and wait for its summary
     */
    public Mono<BatchSummary> runBulkBatch(Collection<String> urls, int concurrency) {
        return bulkScheduler.run(urls, concurrency)
            .doOnNext(this::logBatchSummary);
    }

    /**
     * Start a bulk batch in the background
     *
     * @param concurrency jobs per wave, null for the configured default
     * @return the started batch
     */
    public BulkBatch startBulkBatch(Collection<String> urls, Integer concurrency) {
        int effective = concurrency != null ? concurrency : properties.getBulk().getDefaultConcurrency();
        BulkBatch batch = bulkScheduler.prepare(urls, effective);
        activityLog.add("Bulk optimization started: " + batch.getJobs().size() + " URLs, concurrency " + effective);

        bulkScheduler.execute(batch).subscribe(
            this::logBatchSummary,
            error -> log.error("Bulk batch {} terminated unexpectedly", batch.getId(), error));
        return batch;
    }

    public boolean abortBulkBatch() {
        boolean aborted = bulkScheduler.abort();
        if (aborted) {
            activityLog.add("Bulk optimization abort requested");
        }
        return aborted;
    }

    public Optional<BatchSummary> bulkStatus() {
        return bulkScheduler.currentSummary();
    }

    public Optional<Job> jobState(String url) {
        return jobStateStore.get(url);
    }

    public List<Page> pages() {
        return pageCatalog.all();
    }

    /**
     * Crawl a sitemap into the page catalogue
     */
    public Mono<SitemapResponse> crawlSitemap(String sitemapUrl) {
        return sitemapCrawler.discover(sitemapUrl)
            .map(discovered -> {
                int added = pageCatalog.addPages(discovered);
                activityLog.add("Sitemap crawl: " + discovered.size() + " pages found, " + added + " new");
                return SitemapResponse.builder()
                    .discovered(discovered.size())
                    .added(added)
                    .totalPages(pageCatalog.size())
                    .build();
            });
    }

    public List<ActivityLog.Entry> activity(int limit) {
        return activityLog.recent(limit);
    }

    public OptimizationStats.Snapshot stats() {
        return optimizationStats.snapshot();
    }

    /**
     * Check the configured WordPress credentials
     *
     * @return authenticated user name
     */
    public Mono<String> testWordPressConnection() {
        return Mono.defer(() -> {
            OptimizerProperties.WordPressConfig wordpress = properties.getWordpress();
            if (wordpress.getUrl() == null || wordpress.getUrl().isBlank()) {
                return Mono.error(new ConfigurationException("WordPress URL not configured"));
            }
            SiteCredentials site = wordpress.credentials();
            return contentStore.testConnection(site);
        });
    }

    private void logBatchSummary(BatchSummary summary) {
        activityLog.add("Bulk optimization " + (summary.isAborted() ? "aborted" : "finished") + ": "
            + summary.getCompleted() + " completed, " + summary.getFailed() + " failed, avg score "
            + summary.getAvgScore() + ", " + summary.getTotalWords() + " words");
    }
}
