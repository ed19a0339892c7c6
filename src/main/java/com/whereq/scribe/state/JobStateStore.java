package com.whereq.scribe.state;

import com.whereq.scribe.config.OptimizerProperties;
import com.whereq.scribe.model.Job;
import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.Phase;
import com.whereq.scribe.model.SoftWarning;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Track optimization job state per target URL.
 *
 * Jobs are immutable values; every write is a per-key atomic copy-then-commit through
 * {@link ConcurrentHashMap#compute}, so concurrent runs on distinct targets never interfere.
 * State lives for the process lifetime only.
 */
@Slf4j
@Component
public class JobStateStore {

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();
    private final int logCapacity;

    @Autowired
    public JobStateStore(OptimizerProperties properties) {
        this.logCapacity = properties.getLog().getJobLogCapacity();
    }

    /**
     * Get current job state
     *
     * @param targetId target URL
     * @return job state, empty if the target was never run
     */
    public Optional<Job> get(String targetId) {
        return Optional.ofNullable(jobs.get(targetId));
    }

    public List<Job> all() {
        return new ArrayList<>(jobs.values());
    }

    public boolean isRunning(String targetId) {
        Job job = jobs.get(targetId);
        return job != null && job.isRunning();
    }

    /**
     * Claim a target for a new run.
     *
     * @param targetId target URL
     * @param startTime run start
     * @return the initialised job
     * @throws IllegalStateException if another run already owns the target
     */
    public Job begin(String targetId, Instant startTime) {
        Job started = jobs.compute(targetId, (id, current) -> {
            Job base = current != null ? current : Job.idle(id);
            if (base.isRunning()) {
                throw new IllegalStateException("Optimization already running for " + id);
            }
            return base.toBuilder()
                .status(JobStatus.RUNNING)
                .phase(Phase.INITIALIZING)
                .error(null)
                .score(null)
                .wordCount(null)
                .processingTime(null)
                .warnings(List.of())
                .attempts(base.getAttempts() + 1)
                .startTime(startTime)
                .build();
        });
        log.info("Job {} started (attempt {})", targetId, started.getAttempts());
        return started;
    }

    /**
     * Move a job to the next phase. Transitions the phase order forbids are ignored.
     *
     * @return the job after the update
     */
    public Job advance(String targetId, Phase phase) {
        return update(targetId, job -> {
            Job next = job.advance(phase);
            if (next == job && job.getPhase() != phase) {
                log.debug("Job {} ignored transition {} → {}", targetId, job.getPhase(), phase);
            }
            return next;
        });
    }

    /**
     * Record a successful run. A job that already failed keeps its outcome.
     *
     * @return true if the job was moved to COMPLETED
     */
    public boolean complete(String targetId, int score, int wordCount, long processingTime, Long postId) {
        boolean[] completed = {false};
        update(targetId, job -> {
            if (!job.getPhase().canTransitionTo(Phase.COMPLETED)) {
                log.warn("Job {} cannot complete from phase {}", targetId, job.getPhase());
                return job;
            }
            completed[0] = true;
            return job.toBuilder()
                .phase(Phase.COMPLETED)
                .status(JobStatus.COMPLETED)
                .score(score)
                .wordCount(wordCount)
                .processingTime(processingTime)
                .postId(postId)
                .build();
        });
        if (completed[0]) {
            log.info("Job {} status updated: COMPLETED", targetId);
        }
        return completed[0];
    }

    /**
     * Record a failed run. Jobs already in a terminal phase keep their outcome.
     *
     * @return true if the job was moved to FAILED
     */
    public boolean fail(String targetId, String error, long processingTime) {
        boolean[] failed = {false};
        update(targetId, job -> {
            if (!job.getPhase().canTransitionTo(Phase.FAILED)) {
                return job;
            }
            failed[0] = true;
            return job.toBuilder()
                .phase(Phase.FAILED)
                .status(JobStatus.FAILED)
                .error(error)
                .processingTime(processingTime)
                .build();
        });
        if (failed[0]) {
            log.info("Job {} status updated: FAILED ({})", targetId, error);
        }
        return failed[0];
    }

    public void recordPostId(String targetId, Long postId) {
        update(targetId, job -> job.toBuilder().postId(postId).build());
    }

    public void addWarning(String targetId, SoftWarning kind, String message) {
        update(targetId, job -> job.withWarning(kind, message));
    }

    public void appendLog(String targetId, String line) {
        update(targetId, job -> job.withLog(line, logCapacity));
    }

    /**
     * Atomic copy-then-commit write for one target
     */
    public Job update(String targetId, UnaryOperator<Job> change) {
        return jobs.compute(targetId, (id, current) -> change.apply(current != null ? current : Job.idle(id)));
    }
}
