package com.whereq.scribe.client;

import com.whereq.scribe.model.EntityGapData;
import reactor.core.publisher.Mono;

public interface EntityGapAnalyzer {

    /**
     * Compare what ranks for a topic with the existing content
     *
     * @param existingContent current post body, may be null
     * @param country search country code
     */
    Mono<EntityGapData> analyze(String topic, String existingContent, String country);
}
