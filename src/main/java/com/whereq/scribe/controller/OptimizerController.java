package com.whereq.scribe.controller;

import com.whereq.scribe.dto.BulkRequest;
import com.whereq.scribe.dto.BulkSubmitResponse;
import com.whereq.scribe.dto.CancellationResponse;
import com.whereq.scribe.dto.ConnectionTestResponse;
import com.whereq.scribe.dto.OptimizationRequest;
import com.whereq.scribe.dto.SitemapRequest;
import com.whereq.scribe.dto.SitemapResponse;
import com.whereq.scribe.exception.ConfigurationException;
import com.whereq.scribe.model.BatchSummary;
import com.whereq.scribe.model.Job;
import com.whereq.scribe.model.OptimizationResult;
import com.whereq.scribe.model.Page;
import com.whereq.scribe.progress.ProgressSnapshot;
import com.whereq.scribe.service.OptimizationService;
import com.whereq.scribe.state.ActivityLog;
import com.whereq.scribe.state.OptimizationStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Instant;
import java.util.List;

/**
 * Controller for page optimization, bulk batches and progress
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/optimizer")
@Tag(name = "Optimizer", description = "Optimize WordPress pages one at a time or in bulk")
public class OptimizerController {

    static final String BULK_PATH = "/api/v1/optimizer/bulk";

    @Autowired
    private OptimizationService optimizationService;

    /**
     * Optimize one page and wait for the result
     *
     * @param request target URL and keyword override, both optional
     * @return Mono with the terminal result
     */
    @PostMapping("/jobs")
    @Operation(summary = "Optimize a page",
        description = "Runs the full optimization pipeline; without a URL the page with the lowest health score is picked")
    public Mono<ResponseEntity<OptimizationResult>> optimize(@Valid @RequestBody OptimizationRequest request) {
        log.info("Received optimization request: url={}, keyword={}", request.getUrl(), request.getTargetKeyword());

        return optimizationService.runSingleJob(request, false)
            .map(ResponseEntity::ok)
            .onErrorResume(IllegalStateException.class, e -> {
                log.warn("Optimization rejected: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.CONFLICT)
                    .body(OptimizationResult.failure(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during optimization", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(OptimizationResult.failure("Internal server error: " + e.getMessage())));
            });
    }

    @DeleteMapping("/jobs/current")
    @Operation(summary = "Cancel the running optimization")
    public Mono<ResponseEntity<CancellationResponse>> cancel(
            @RequestParam(value = "reason", required = false) String reason) {

        return Mono.fromCallable(() -> optimizationService.requestCancellation(reason))
            .map(accepted -> {
                CancellationResponse response = CancellationResponse.builder()
                    .accepted(accepted)
                    .reason(reason)
                    .cancelledAt(accepted ? Instant.now() : null)
                    .message(accepted ? "Cancellation requested" : "No optimization is running")
                    .build();
                return accepted
                    ? ResponseEntity.ok(response)
                    : ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
            });
    }

    @GetMapping("/jobs")
    @Operation(summary = "Get the job state of a page")
    public Mono<ResponseEntity<Job>> getJob(@RequestParam("url") String url) {
        return Mono.justOrEmpty(optimizationService.jobState(url))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * Progress of the interactive optimization as server-sent events
     */
    @GetMapping(value = "/progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Stream optimization progress")
    public Flux<ServerSentEvent<ProgressSnapshot>> progress() {
        return optimizationService.subscribeProgress()
            .map(snapshot -> ServerSentEvent.<ProgressSnapshot>builder()
                .event("progress")
                .data(snapshot)
                .build());
    }

    /**
     * Start a bulk batch in the background
     *
     * @return Mono with 202 Accepted response
     */
    @PostMapping("/bulk")
    @Operation(summary = "Start a bulk optimization",
        description = "URLs are trimmed, validated and deduplicated; jobs run in waves of the given concurrency")
    public Mono<ResponseEntity<BulkSubmitResponse>> startBulk(@Valid @RequestBody BulkRequest request) {
        log.info("Received bulk request: {} entries, concurrency={}", request.getUrls().size(), request.getConcurrency());

        return Mono.fromCallable(() -> optimizationService.startBulkBatch(request.getUrls(), request.getConcurrency()))
            .map(batch -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create(BULK_PATH))
                .body(BulkSubmitResponse.builder()
                    .batchId(batch.getId())
                    .total(batch.getJobs().size())
                    .concurrency(batch.getConcurrency())
                    .submittedAt(Instant.now())
                    .build()))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(BulkSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(ConfigurationException.class, e -> {
                log.error("Configuration error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(BulkSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(IllegalStateException.class, e -> {
                log.warn("Bulk rejected: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.CONFLICT)
                    .body(BulkSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during bulk submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(BulkSubmitResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    @GetMapping("/bulk")
    @Operation(summary = "Get the running or last bulk batch")
    public Mono<ResponseEntity<BatchSummary>> bulkStatus() {
        return Mono.justOrEmpty(optimizationService.bulkStatus())
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/bulk")
    @Operation(summary = "Abort the running bulk batch", description = "Jobs already started run to completion")
    public Mono<ResponseEntity<CancellationResponse>> abortBulk() {
        return Mono.fromCallable(optimizationService::abortBulkBatch)
            .map(aborted -> {
                CancellationResponse response = CancellationResponse.builder()
                    .accepted(aborted)
                    .cancelledAt(aborted ? Instant.now() : null)
                    .message(aborted ? "Abort requested" : "No bulk optimization is running")
                    .build();
                return aborted
                    ? ResponseEntity.ok(response)
                    : ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
            });
    }

    @GetMapping("/pages")
    @Operation(summary = "List catalogue pages")
    public Mono<List<Page>> pages() {
        return Mono.fromCallable(optimizationService::pages);
    }

    @PostMapping("/pages/sitemap")
    @Operation(summary = "Crawl a sitemap into the page catalogue")
    public Mono<ResponseEntity<SitemapResponse>> crawlSitemap(@Valid @RequestBody SitemapRequest request) {
        return optimizationService.crawlSitemap(request.getSitemapUrl())
            .map(ResponseEntity::ok)
            .onErrorResume(Exception.class, e -> {
                log.error("Sitemap crawl of {} failed: {}", request.getSitemapUrl(), e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.BAD_GATEWAY)
                    .body(SitemapResponse.error("Crawl failed: " + e.getMessage())));
            });
    }

    @GetMapping("/activity")
    @Operation(summary = "Recent activity log entries")
    public Mono<List<ActivityLog.Entry>> activity(@RequestParam(value = "limit", defaultValue = "100") int limit) {
        return Mono.fromCallable(() -> optimizationService.activity(Math.max(0, limit)));
    }

    @GetMapping("/stats")
    @Operation(summary = "Aggregate optimization statistics")
    public Mono<OptimizationStats.Snapshot> stats() {
        return Mono.fromCallable(optimizationService::stats);
    }

    @PostMapping("/wordpress/test")
    @Operation(summary = "Test the configured WordPress credentials")
    public Mono<ResponseEntity<ConnectionTestResponse>> testWordPress() {
        return optimizationService.testWordPressConnection()
            .map(user -> ResponseEntity.ok(ConnectionTestResponse.builder()
                .connected(true)
                .user(user)
                .message("Connected")
                .build()))
            .onErrorResume(ConfigurationException.class, e -> Mono.just(ResponseEntity
                .badRequest()
                .body(ConnectionTestResponse.builder().connected(false).message(e.getMessage()).build())))
            .onErrorResume(Exception.class, e -> {
                log.warn("WordPress connection test failed: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.BAD_GATEWAY)
                    .body(ConnectionTestResponse.builder()
                        .connected(false)
                        .message("Connection failed: " + e.getMessage())
                        .build()));
            });
    }
}
