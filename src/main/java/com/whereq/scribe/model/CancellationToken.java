package com.whereq.scribe.model;

import com.whereq.scribe.exception.JobCancelledException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation request for one interactively triggered job.
 *
 * The orchestrator checks it at every phase boundary and also races its pipeline against
 * {@link #whenCancelled()}, so outstanding collaborator calls are disposed when it fires.
 */
public class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final Sinks.One<String> signal = Sinks.one();

    /**
     * Request cancellation. Only the first request is recorded.
     *
     * @param reason why the job is being cancelled
     * @return true if this call cancelled the token
     */
    public boolean cancel(String reason) {
        String recorded = reason == null || reason.isBlank() ? "User cancelled" : reason;
        if (this.reason.compareAndSet(null, recorded)) {
            signal.tryEmitValue(recorded);
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }

    /**
     * Emits the reason once cancellation is requested
     */
    public Mono<String> whenCancelled() {
        return signal.asMono();
    }

    public void throwIfCancelled() {
        String current = reason.get();
        if (current != null) {
            throw new JobCancelledException(current);
        }
    }
}
