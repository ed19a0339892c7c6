package com.whereq.scribe.progress;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.whereq.scribe.model.Phase;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable progress view of the interactive run
 */
@Value
@Builder(toBuilder = true)
public class ProgressSnapshot {
    public static final String UNKNOWN_ETA = "--:--";

    boolean running;

    @Builder.Default
    Phase phase = Phase.IDLE;

    /**
     * Display step, 0..{@link Phase#TOTAL_STEPS}
     */
    int step;

    Integer sectionsCompleted;

    Integer totalSections;

    Integer wordCount;

    Instant startTime;

    String currentUrl;

    public static ProgressSnapshot idle() {
        return ProgressSnapshot.builder().build();
    }

    /**
     * Fresh snapshot for a run that just started
     */
    public static ProgressSnapshot started(String currentUrl, Instant startTime) {
        return ProgressSnapshot.builder()
            .running(true)
            .phase(Phase.INITIALIZING)
            .step(Phase.INITIALIZING.getStep())
            .sectionsCompleted(0)
            .totalSections(0)
            .wordCount(0)
            .startTime(startTime)
            .currentUrl(currentUrl)
            .build();
    }

    /**
     * Apply a partial update. The step never decreases within a run, except that a failed run
     * reports step 0.
     */
    public ProgressSnapshot merge(ProgressUpdate update) {
        ProgressSnapshotBuilder next = toBuilder();
        if (update.getPhase() != null) {
            Phase phase = update.getPhase();
            next.phase(phase);
            next.step(phase == Phase.FAILED ? 0 : Math.max(step, phase.getStep()));
        }
        if (update.getRunning() != null) {
            next.running(update.getRunning());
        }
        if (update.getSectionsCompleted() != null) {
            next.sectionsCompleted(update.getSectionsCompleted());
        }
        if (update.getTotalSections() != null) {
            next.totalSections(update.getTotalSections());
        }
        if (update.getWordCount() != null) {
            next.wordCount(update.getWordCount());
        }
        if (update.getCurrentUrl() != null) {
            next.currentUrl(update.getCurrentUrl());
        }
        return next.build();
    }

    public int getPercentComplete() {
        return Math.floorDiv(100 * step, Phase.TOTAL_STEPS);
    }

    @JsonIgnore
    public boolean isFinished() {
        return !running && phase.isTerminal();
    }

    public Duration elapsed(Instant now) {
        if (startTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, now);
    }

    /**
     * Remaining time extrapolated from the average time per step, formatted m:ss
     */
    public String eta(Instant now) {
        long elapsedMs = elapsed(now).toMillis();
        if (step == 0 || elapsedMs <= 0) {
            return UNKNOWN_ETA;
        }
        long remaining = (elapsedMs / step) * (Phase.TOTAL_STEPS - step);
        return formatTime(remaining);
    }

    /**
     * ETA as of now
     */
    public String getEta() {
        return eta(Instant.now());
    }

    static String formatTime(long millis) {
        long seconds = millis / 1000;
        return String.format("%d:%02d", seconds / 60, seconds % 60);
    }
}
