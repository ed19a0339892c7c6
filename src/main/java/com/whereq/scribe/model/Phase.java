package com.whereq.scribe.model;

/**
 * Optimization job phases, declared in execution order.
 *
 * Each phase carries the display step used for progress reporting (0..{@link #TOTAL_STEPS}).
 * Display steps are not ordered like the execution sequence: internal linking is prepared
 * before synthesis and reference discovery is reported by the synthesis engine after the video stage.
 *
 * Transitions:
 * IDLE → INITIALIZING → ... → PUBLISHING → COMPLETED
 * any non-terminal phase → FAILED
 */
public enum Phase {
    /**
     * Waiting to start
     */
    IDLE(0, "Ready"),

    /**
     * Setting up the optimization pipeline
     */
    INITIALIZING(1, "Initializing"),

    /**
     * Resolving the WordPress post for the target URL
     */
    RESOLVING_POST(2, "Finding Post"),

    /**
     * Analyzing the existing post body
     */
    ANALYZING_EXISTING(3, "Analyzing"),

    /**
     * Discovering content gaps and entities through search
     */
    ENTITY_GAP_ANALYSIS(4, "Entity Analysis"),

    /**
     * NeuronWriter NLP term analysis
     */
    NEURON_ANALYSIS(5, "NLP Analysis"),

    /**
     * Selecting internal link targets from the catalogue
     */
    INTERNAL_LINKING(11, "Links"),

    /**
     * Synthesis: content structure
     */
    OUTLINE_GENERATION(7, "Outline"),

    /**
     * Synthesis: section drafting
     */
    SECTION_DRAFTS(8, "Writing"),

    /**
     * Synthesis: video discovery
     */
    YOUTUBE_INTEGRATION(9, "Video"),

    /**
     * Synthesis: authoritative sources
     */
    REFERENCE_DISCOVERY(6, "References"),

    /**
     * Synthesis: assembling the final body
     */
    MERGE_CONTENT(10, "Merging"),

    /**
     * Synthesis: final optimizations
     */
    FINAL_POLISH(13, "Polishing"),

    /**
     * Quality scoring of the generated content
     */
    QA_VALIDATION(12, "QA Check"),

    /**
     * Pushing the content to WordPress
     */
    PUBLISHING(14, "Publishing"),

    /**
     * Optimization successful
     */
    COMPLETED(15, "Complete"),

    /**
     * Optimization failed
     */
    FAILED(0, "Failed");

    public static final int TOTAL_STEPS = 15;

    private final int step;
    private final String label;

    Phase(int step, String label) {
        this.step = step;
        this.label = label;
    }

    public int getStep() {
        return step;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Check if this is a terminal phase
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check whether a job in this phase may move to {@code next}.
     * Phases may be skipped but never revisited.
     */
    public boolean canTransitionTo(Phase next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        if (next == COMPLETED) {
            return this == PUBLISHING;
        }
        return next.ordinal() > this.ordinal();
    }
}
