package com.whereq.scribe.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running state of one bulk batch. Owned by the scheduler for the lifetime of the batch.
 */
public class BulkBatch {

    private final String id;
    private final List<BulkJob> jobs;
    private final int concurrency;
    private final Instant startTime;

    private volatile boolean aborted;
    private boolean running = true;
    private int completed;
    private int failed;
    private long totalWords;
    private long totalScore;
    private long totalTime;

    public BulkBatch(String id, List<String> urls, int concurrency, Instant startTime) {
        this.id = id;
        this.concurrency = concurrency;
        this.startTime = startTime;
        List<BulkJob> slots = new ArrayList<>(urls.size());
        for (int i = 0; i < urls.size(); i++) {
            slots.add(BulkJob.builder().id(id + "-" + i).url(urls.get(i)).build());
        }
        this.jobs = Collections.unmodifiableList(slots);
    }

    public String getId() {
        return id;
    }

    public List<BulkJob> getJobs() {
        return jobs;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public boolean isAborted() {
        return aborted;
    }

    public void abort() {
        aborted = true;
    }

    /**
     * Consecutive waves of at most {@code concurrency} jobs
     */
    public List<List<BulkJob>> waves() {
        List<List<BulkJob>> waves = new ArrayList<>();
        for (int i = 0; i < jobs.size(); i += concurrency) {
            waves.add(jobs.subList(i, Math.min(i + concurrency, jobs.size())));
        }
        return waves;
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized void markRunning(BulkJob job, Instant now) {
        job.setStatus(BulkJobStatus.RUNNING);
        job.setStartTime(now);
    }

    public synchronized void recordSuccess(BulkJob job, OptimizationResult result, Instant now) {
        job.setStatus(BulkJobStatus.COMPLETED);
        job.setScore(result.getScore());
        job.setWordCount(result.getWordCount());
        job.setEndTime(now);
        completed++;
        totalWords += result.getWordCount();
        totalScore += result.getScore();
    }

    public synchronized void recordFailure(BulkJob job, String error, Instant now) {
        job.setStatus(BulkJobStatus.FAILED);
        job.setError(error);
        job.setEndTime(now);
        failed++;
    }

    public synchronized long runningCount() {
        return jobs.stream().filter(j -> j.getStatus() == BulkJobStatus.RUNNING).count();
    }

    public synchronized void finish(Instant now) {
        running = false;
        totalTime = Duration.between(startTime, now).toMillis();
    }

    public synchronized BatchSummary toSummary() {
        List<BulkJob> copies = new ArrayList<>(jobs.size());
        for (BulkJob job : jobs) {
            copies.add(job.toBuilder().build());
        }
        return BatchSummary.builder()
            .batchId(id)
            .running(running)
            .aborted(aborted)
            .concurrency(concurrency)
            .total(jobs.size())
            .completed(completed)
            .failed(failed)
            .totalWords(totalWords)
            .avgScore(completed > 0 ? (int) Math.round((double) totalScore / completed) : 0)
            .totalTime(running ? Duration.between(startTime, Instant.now()).toMillis() : totalTime)
            .jobs(Collections.unmodifiableList(copies))
            .build();
    }
}
