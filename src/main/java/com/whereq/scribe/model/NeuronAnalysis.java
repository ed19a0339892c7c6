package com.whereq.scribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * NeuronWriter query result
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NeuronAnalysis {
    private String queryId;

    @Builder.Default
    private List<NlpTerm> terms = List.of();
}
