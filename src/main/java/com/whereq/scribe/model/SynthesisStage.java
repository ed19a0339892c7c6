package com.whereq.scribe.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Sub-stages reported by the synthesis engine while it works
 */
public enum SynthesisStage {
    OUTLINE(Phase.OUTLINE_GENERATION),
    SECTIONS(Phase.SECTION_DRAFTS),
    YOUTUBE(Phase.YOUTUBE_INTEGRATION),
    REFERENCES(Phase.REFERENCE_DISCOVERY),
    MERGE(Phase.MERGE_CONTENT),
    POLISH(Phase.FINAL_POLISH);

    private final Phase phase;

    SynthesisStage(Phase phase) {
        this.phase = phase;
    }

    /**
     * Orchestrator phase this stage is reported as
     */
    public Phase getPhase() {
        return phase;
    }

    /**
     * Stage for an engine stage name
     *
     * @return the stage, null if the name is not known
     */
    @JsonCreator
    public static SynthesisStage fromValue(String value) {
        if (value == null) {
            return null;
        }
        String name = value.trim().toUpperCase(Locale.ROOT);
        for (SynthesisStage stage : values()) {
            if (stage.name().equals(name)) {
                return stage;
            }
        }
        return null;
    }
}
