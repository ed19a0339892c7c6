package com.whereq.scribe.progress;

import com.whereq.scribe.model.Phase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressReporterTest {

    private ProgressReporter reporter;

    @BeforeEach
    void setUp() {
        reporter = new ProgressReporter();
    }

    @Test
    @DisplayName("Subscribers receive the latest snapshot, then every change")
    void replaysLatest() {
        reporter.start("https://a.com/x", Instant.now());
        reporter.update(ProgressUpdate.phase(Phase.RESOLVING_POST));

        StepVerifier.create(reporter.subscribe().take(2))
            .assertNext(snapshot -> assertThat(snapshot.getPhase()).isEqualTo(Phase.RESOLVING_POST))
            .then(() -> reporter.update(ProgressUpdate.phase(Phase.ANALYZING_EXISTING)))
            .assertNext(snapshot -> assertThat(snapshot.getStep()).isEqualTo(Phase.ANALYZING_EXISTING.getStep()))
            .verifyComplete();
    }

    @Test
    @DisplayName("forceFailed stops the run immediately")
    void forceFailed() {
        reporter.start("https://a.com/x", Instant.now());
        reporter.update(ProgressUpdate.phase(Phase.SECTION_DRAFTS));

        ProgressSnapshot snapshot = reporter.forceFailed();

        assertThat(snapshot.isRunning()).isFalse();
        assertThat(snapshot.getPhase()).isEqualTo(Phase.FAILED);
    }

    @Test
    @DisplayName("A finished run ignores late updates until the next start")
    void finishedRunIsFrozen() {
        reporter.start("https://a.com/x", Instant.now());
        reporter.forceFailed();

        reporter.update(ProgressUpdate.phase(Phase.MERGE_CONTENT));
        assertThat(reporter.current().getPhase()).isEqualTo(Phase.FAILED);

        reporter.start("https://a.com/y", Instant.now());
        assertThat(reporter.current().getPhase()).isEqualTo(Phase.INITIALIZING);
        assertThat(reporter.current().isRunning()).isTrue();
        assertThat(reporter.current().getCurrentUrl()).isEqualTo("https://a.com/y");
    }
}
