package com.whereq.scribe.progress;

import com.whereq.scribe.model.Phase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;

/**
 * Progress of the interactive optimization run.
 *
 * Every change is a partial update merged onto the previous snapshot; subscribers receive the
 * latest snapshot first and then every subsequent one. A finished snapshot is frozen until the next
 * run starts, so late updates from a cancelled pipeline cannot revive it.
 */
@Slf4j
@Component
public class ProgressReporter {

    private final Sinks.Many<ProgressSnapshot> sink = Sinks.many().replay().latest();

    private ProgressSnapshot current = ProgressSnapshot.idle();

    public ProgressReporter() {
        sink.tryEmitNext(current);
    }

    /**
     * Reset the snapshot for a new run
     */
    public synchronized ProgressSnapshot start(String currentUrl, Instant startTime) {
        return publish(ProgressSnapshot.started(currentUrl, startTime));
    }

    /**
     * Merge a partial update onto the current snapshot
     *
     * @return the resulting snapshot
     */
    public synchronized ProgressSnapshot update(ProgressUpdate update) {
        if (current.isFinished()) {
            log.debug("Ignoring progress update {} after run finished in {}", update, current.getPhase());
            return current;
        }
        return publish(current.merge(update));
    }

    /**
     * Immediately report the run as stopped and failed
     */
    public ProgressSnapshot forceFailed() {
        return update(ProgressUpdate.stopped(Phase.FAILED));
    }

    public synchronized ProgressSnapshot current() {
        return current;
    }

    /**
     * Latest snapshot followed by every later one
     */
    public Flux<ProgressSnapshot> subscribe() {
        return sink.asFlux();
    }

    private ProgressSnapshot publish(ProgressSnapshot snapshot) {
        current = snapshot;
        Sinks.EmitResult result = sink.tryEmitNext(snapshot);
        if (result.isFailure()) {
            log.warn("Failed to publish progress snapshot: {}", result);
        }
        return snapshot;
    }
}
