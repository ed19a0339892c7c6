package com.whereq.scribe.client;

import com.whereq.scribe.model.StageProgress;
import com.whereq.scribe.model.SynthesisRequest;
import com.whereq.scribe.model.SynthesizedContent;
import reactor.core.publisher.Mono;

/**
 * Engine that writes an article for a topic
 */
public interface ContentSynthesizer {

    /**
     * Write one article. The listener is called zero or more times while the engine works.
     */
    Mono<SynthesizedContent> synthesize(SynthesisRequest request, StageListener listener);

    @FunctionalInterface
    interface StageListener {
        void onStage(StageProgress progress);
    }
}
