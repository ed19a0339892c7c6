package com.whereq.scribe.client;

import com.whereq.scribe.model.NeuronAnalysis;
import reactor.core.publisher.Mono;

public interface NlpTermAnalyzer {

    /**
     * Recommended terms for a topic
     */
    Mono<NeuronAnalysis> analyze(String topic);
}
