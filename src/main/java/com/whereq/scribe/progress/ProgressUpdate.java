package com.whereq.scribe.progress;

import com.whereq.scribe.model.Phase;
import lombok.Builder;
import lombok.Value;

/**
 * Partial progress change. Null fields leave the current snapshot value untouched.
 */
@Value
@Builder
public class ProgressUpdate {
    Boolean running;

    Phase phase;

    Integer sectionsCompleted;

    Integer totalSections;

    Integer wordCount;

    String currentUrl;

    public static ProgressUpdate phase(Phase phase) {
        return ProgressUpdate.builder().phase(phase).build();
    }

    /**
     * Terminal update: the run stops in the given phase
     */
    public static ProgressUpdate stopped(Phase phase) {
        return ProgressUpdate.builder().phase(phase).running(false).build();
    }
}
