package com.whereq.scribe.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One optimization attempt for a target URL.
 *
 * Instances are immutable; every change produces a copy that the
 * {@link com.whereq.scribe.state.JobStateStore} commits atomically.
 */
@Value
@Builder(toBuilder = true)
public class Job {
    /**
     * Target URL, the stable key
     */
    String targetId;

    @Builder.Default
    JobStatus status = JobStatus.IDLE;

    @Builder.Default
    Phase phase = Phase.IDLE;

    /**
     * Incremented on every orchestrator invocation
     */
    int attempts;

    Instant startTime;

    /**
     * Elapsed milliseconds of the last terminal run
     */
    Long processingTime;

    String error;

    Integer score;

    Integer wordCount;

    /**
     * WordPress post id after publishing
     */
    Long postId;

    @Builder.Default
    List<String> warnings = List.of();

    @Builder.Default
    List<String> logs = List.of();

    public static Job idle(String targetId) {
        return Job.builder().targetId(targetId).build();
    }

    public boolean isRunning() {
        return status == JobStatus.RUNNING;
    }

    /**
     * Move to {@code next} if the phase order allows it, otherwise return this job unchanged
     */
    public Job advance(Phase next) {
        if (!phase.canTransitionTo(next)) {
            return this;
        }
        return toBuilder().phase(next).build();
    }

    public Job withWarning(SoftWarning kind, String message) {
        List<String> copy = new ArrayList<>(warnings);
        copy.add(kind.name() + ": " + message);
        return toBuilder().warnings(Collections.unmodifiableList(copy)).build();
    }

    /**
     * Append a log line, dropping the oldest lines beyond {@code capacity}
     */
    public Job withLog(String line, int capacity) {
        List<String> copy = new ArrayList<>(logs);
        copy.add(line);
        while (copy.size() > capacity) {
            copy.remove(0);
        }
        return toBuilder().logs(Collections.unmodifiableList(copy)).build();
    }
}
