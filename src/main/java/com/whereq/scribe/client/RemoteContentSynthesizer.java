package com.whereq.scribe.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.scribe.config.OptimizerProperties;
import com.whereq.scribe.exception.GenerationException;
import com.whereq.scribe.model.StageProgress;
import com.whereq.scribe.model.SynthesisRequest;
import com.whereq.scribe.model.SynthesizedContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * {@link ContentSynthesizer} calling a synthesis engine over HTTP.
 *
 * The engine answers with a server-sent-event stream: any number of {@code stage} events carrying a
 * {@link StageProgress}, then exactly one {@code result} event with the article, or an
 * {@code error} event.
 */
@Slf4j
@Service
public class RemoteContentSynthesizer implements ContentSynthesizer {

    static final String STAGE_EVENT = "stage";
    static final String RESULT_EVENT = "result";
    static final String ERROR_EVENT = "error";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> EVENT_TYPE =
        new ParameterizedTypeReference<>() {};

    @Autowired
    private WebClient.Builder webClientBuilder;

    @Autowired
    private OptimizerProperties properties;

    @Autowired
    private ObjectMapper objectMapper;

    @Override
    public Mono<SynthesizedContent> synthesize(SynthesisRequest request, StageListener listener) {
        OptimizerProperties.SynthesisConfig config = properties.getSynthesis();

        return webClientBuilder.build()
            .post()
            .uri(config.getEndpoint())
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue(request)
            .retrieve()
            .bodyToFlux(EVENT_TYPE)
            .concatMap(event -> handle(event, listener))
            .next()
            .switchIfEmpty(Mono.error(new GenerationException("Synthesis engine returned no result")))
            .timeout(config.getTimeout())
            .doOnSubscribe(s -> log.info("Synthesizing \"{}\" with {} / {}",
                request.getTopic(), request.getProvider(), request.getModel()));
    }

    /**
     * Dispatch one event; only a result event produces a value
     */
    Mono<SynthesizedContent> handle(ServerSentEvent<String> event, StageListener listener) {
        String type = event.event() != null ? event.event() : "";
        try {
            switch (type) {
                case STAGE_EVENT -> {
                    StageProgress progress = objectMapper.readValue(event.data(), StageProgress.class);
                    if (progress.getStage() == null) {
                        log.debug("Skipping unknown synthesis stage {}", event.data());
                    } else {
                        listener.onStage(progress);
                    }
                    return Mono.empty();
                }
                case RESULT_EVENT -> {
                    return Mono.just(objectMapper.readValue(event.data(), SynthesizedContent.class));
                }
                case ERROR_EVENT -> {
                    JsonNode error = objectMapper.readTree(event.data());
                    return Mono.error(new GenerationException(error.path("message").asText(event.data())));
                }
                default -> {
                    log.debug("Ignoring synthesis event {}", type);
                    return Mono.empty();
                }
            }
        } catch (JsonProcessingException e) {
            return Mono.error(new GenerationException("Malformed " + type + " event from synthesis engine", e));
        }
    }
}
