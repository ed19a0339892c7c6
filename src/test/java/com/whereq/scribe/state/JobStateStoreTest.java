package com.whereq.scribe.state;

import com.whereq.scribe.config.OptimizerProperties;
import com.whereq.scribe.model.Job;
import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.Phase;
import com.whereq.scribe.model.SoftWarning;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStateStoreTest {

    private static final String URL = "https://example.com/post";

    private JobStateStore store;

    @BeforeEach
    void setUp() {
        OptimizerProperties properties = new OptimizerProperties();
        properties.getLog().setJobLogCapacity(3);
        store = new JobStateStore(properties);
    }

    @Test
    @DisplayName("begin claims the target and resets the previous outcome")
    void beginResetsState() {
        // given
        store.begin(URL, Instant.now());
        store.fail(URL, "Boom", 10);

        // when
        Job job = store.begin(URL, Instant.now());

        // then
        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.getPhase()).isEqualTo(Phase.INITIALIZING);
        assertThat(job.getAttempts()).isEqualTo(2);
        assertThat(job.getError()).isNull();
        assertThat(job.getProcessingTime()).isNull();
    }

    @Test
    @DisplayName("A running target cannot be claimed twice")
    void beginRejectsRunningTarget() {
        store.begin(URL, Instant.now());

        assertThatThrownBy(() -> store.begin(URL, Instant.now()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining(URL);
    }

    @Test
    @DisplayName("Backward transitions are ignored")
    void advanceIsForwardOnly() {
        store.begin(URL, Instant.now());
        store.advance(URL, Phase.QA_VALIDATION);

        Job job = store.advance(URL, Phase.SECTION_DRAFTS);

        assertThat(job.getPhase()).isEqualTo(Phase.QA_VALIDATION);
    }

    @Test
    @DisplayName("complete requires the publishing phase")
    void completeFromPublishing() {
        store.begin(URL, Instant.now());
        assertThat(store.complete(URL, 80, 4000, 100, 7L)).isFalse();
        assertThat(store.get(URL)).get().extracting(Job::getPhase).isEqualTo(Phase.INITIALIZING);

        store.advance(URL, Phase.PUBLISHING);
        assertThat(store.complete(URL, 80, 4000, 100, 7L)).isTrue();

        Job job = store.get(URL).orElseThrow();
        assertThat(job.getPhase()).isEqualTo(Phase.COMPLETED);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getScore()).isEqualTo(80);
        assertThat(job.getPostId()).isEqualTo(7L);
    }

    @Test
    @DisplayName("A terminal job keeps its outcome when failed again")
    void failKeepsTerminalOutcome() {
        store.begin(URL, Instant.now());
        store.advance(URL, Phase.PUBLISHING);
        store.complete(URL, 80, 4000, 100, 7L);

        boolean failed = store.fail(URL, "Late failure", 200);

        assertThat(failed).isFalse();
        assertThat(store.get(URL)).get().extracting(Job::getPhase).isEqualTo(Phase.COMPLETED);
    }

    @Test
    @DisplayName("A job failed during publishing cannot be completed afterwards")
    void completeAfterFailure() {
        store.begin(URL, Instant.now());
        store.advance(URL, Phase.PUBLISHING);
        store.fail(URL, "Cancelled: late", 150);

        boolean completed = store.complete(URL, 80, 4000, 200, 7L);

        assertThat(completed).isFalse();
        Job job = store.get(URL).orElseThrow();
        assertThat(job.getPhase()).isEqualTo(Phase.FAILED);
        assertThat(job.getScore()).isNull();
        assertThat(job.getError()).isEqualTo("Cancelled: late");
    }

    @Test
    @DisplayName("Warnings are prefixed with their kind and logs are bounded")
    void warningsAndLogs() {
        store.begin(URL, Instant.now());
        store.addWarning(URL, SoftWarning.ANALYSIS, "Search failed");
        for (int i = 1; i <= 5; i++) {
            store.appendLog(URL, "line " + i);
        }

        Job job = store.get(URL).orElseThrow();
        assertThat(job.getWarnings()).containsExactly("ANALYSIS: Search failed");
        assertThat(job.getLogs()).containsExactly("line 3", "line 4", "line 5");
    }

    @Test
    @DisplayName("Concurrent writers on distinct targets do not interfere")
    void concurrentDistinctTargets() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            String url = URL + "/" + i;
            futures.add(CompletableFuture.runAsync(() -> {
                store.begin(url, Instant.now());
                for (int line = 0; line < 20; line++) {
                    store.appendLog(url, "line " + line);
                }
                store.advance(url, Phase.PUBLISHING);
                store.complete(url, 90, 3000, 5, null);
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
        executor.shutdown();

        assertThat(store.all()).hasSize(50)
            .allSatisfy(job -> {
                assertThat(job.getPhase()).isEqualTo(Phase.COMPLETED);
                assertThat(job.getAttempts()).isEqualTo(1);
                assertThat(job.getLogs()).hasSize(3);
            });
    }
}
