package com.whereq.scribe.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class PhaseTest {

    @Test
    @DisplayName("Terminal phases never transition")
    void terminalPhasesAreFinal() {
        for (Phase next : Phase.values()) {
            assertThat(Phase.COMPLETED.canTransitionTo(next)).isFalse();
            assertThat(Phase.FAILED.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    @DisplayName("FAILED is reachable from every non-terminal phase")
    void failedReachableFromAnyActivePhase() {
        EnumSet.complementOf(EnumSet.of(Phase.COMPLETED, Phase.FAILED))
            .forEach(phase -> assertThat(phase.canTransitionTo(Phase.FAILED)).isTrue());
    }

    @Test
    @DisplayName("COMPLETED is reachable only from PUBLISHING")
    void completedOnlyFromPublishing() {
        for (Phase phase : Phase.values()) {
            assertThat(phase.canTransitionTo(Phase.COMPLETED)).isEqualTo(phase == Phase.PUBLISHING);
        }
    }

    @Test
    @DisplayName("Phases move forward, may skip, never go back")
    void forwardOnly() {
        assertThat(Phase.RESOLVING_POST.canTransitionTo(Phase.ANALYZING_EXISTING)).isTrue();
        assertThat(Phase.ANALYZING_EXISTING.canTransitionTo(Phase.INTERNAL_LINKING)).isTrue();
        assertThat(Phase.INTERNAL_LINKING.canTransitionTo(Phase.OUTLINE_GENERATION)).isTrue();
        assertThat(Phase.YOUTUBE_INTEGRATION.canTransitionTo(Phase.REFERENCE_DISCOVERY)).isTrue();
        assertThat(Phase.QA_VALIDATION.canTransitionTo(Phase.OUTLINE_GENERATION)).isFalse();
        assertThat(Phase.SECTION_DRAFTS.canTransitionTo(Phase.SECTION_DRAFTS)).isFalse();
    }

    @Test
    @DisplayName("Only COMPLETED maps to the last step")
    void lastStepIsCompletion() {
        for (Phase phase : Phase.values()) {
            assertThat(phase.getStep()).isBetween(0, Phase.TOTAL_STEPS);
            if (phase != Phase.COMPLETED) {
                assertThat(phase.getStep()).isLessThan(Phase.TOTAL_STEPS);
            }
        }
        assertThat(Phase.COMPLETED.getStep()).isEqualTo(Phase.TOTAL_STEPS);
        assertThat(Phase.FAILED.getStep()).isZero();
    }

    @Test
    @DisplayName("Synthesis stages map onto their phases")
    void synthesisStagesMapToPhases() {
        assertThat(SynthesisStage.fromValue("outline").getPhase()).isEqualTo(Phase.OUTLINE_GENERATION);
        assertThat(SynthesisStage.fromValue("SECTIONS").getPhase()).isEqualTo(Phase.SECTION_DRAFTS);
        assertThat(SynthesisStage.REFERENCES.getPhase()).isEqualTo(Phase.REFERENCE_DISCOVERY);
        assertThat(SynthesisStage.POLISH.getPhase()).isEqualTo(Phase.FINAL_POLISH);
    }

    @Test
    @DisplayName("Unknown synthesis stage names resolve to null")
    void unknownSynthesisStage() {
        assertThat(SynthesisStage.fromValue("fact_check")).isNull();
        assertThat(SynthesisStage.fromValue(null)).isNull();
    }
}
