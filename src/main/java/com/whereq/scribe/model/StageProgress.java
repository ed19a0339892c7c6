package com.whereq.scribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stage progress event from the synthesis engine
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageProgress {
    private SynthesisStage stage;

    private Integer sectionsCompleted;

    private Integer totalSections;
}
