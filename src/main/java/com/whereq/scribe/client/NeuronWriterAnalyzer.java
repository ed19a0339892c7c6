package com.whereq.scribe.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.scribe.config.OptimizerProperties;
import com.whereq.scribe.model.NeuronAnalysis;
import com.whereq.scribe.model.NlpTerm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link NlpTermAnalyzer} over the NeuronWriter API.
 *
 * A query is created with {@code new-query}; NeuronWriter prepares it asynchronously, so
 * {@code get-query} is polled until the status is {@code ready}.
 */
@Slf4j
@Service
public class NeuronWriterAnalyzer implements NlpTermAnalyzer {

    private static final String READY = "ready";

    @Autowired
    private WebClient.Builder webClientBuilder;

    @Autowired
    private OptimizerProperties properties;

    @Override
    public Mono<NeuronAnalysis> analyze(String topic) {
        OptimizerProperties.NeuronConfig config = properties.getNeuron();
        WebClient client = webClientBuilder.clone()
            .baseUrl(config.getEndpoint())
            .defaultHeader("X-API-KEY", config.getApiKey())
            .build();

        Map<String, Object> newQuery = Map.of(
            "project", config.getProjectId(),
            "keyword", topic,
            "engine", config.getEngine(),
            "language", properties.getGeo().getLanguage());

        return call(client, "/new-query", newQuery)
            .map(created -> created.path("query").asText())
            .doOnNext(queryId -> log.info("NeuronWriter query {} created for \"{}\"", queryId, topic))
            .flatMap(queryId -> call(client, "/get-query", Map.of("query", queryId))
                .filter(query -> READY.equals(query.path("status").asText()))
                .repeatWhenEmpty(config.getMaxPolls(), polls -> polls.delayElements(config.getPollInterval()))
                .onErrorMap(IllegalStateException.class, e -> new IllegalStateException(
                    "NeuronWriter query " + queryId + " not ready after " + (config.getMaxPolls() + 1) + " polls", e))
                .map(query -> toAnalysis(queryId, query)));
    }

    private Mono<JsonNode> call(WebClient client, String path, Map<String, Object> body) {
        return client.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class);
    }

    NeuronAnalysis toAnalysis(String queryId, JsonNode query) {
        List<NlpTerm> terms = new ArrayList<>();
        for (JsonNode term : query.path("terms").path("content_basic")) {
            terms.add(NlpTerm.builder()
                .term(term.path("t").asText())
                .usagePercent(term.path("usage_pc").asInt())
                .build());
        }
        return NeuronAnalysis.builder()
            .queryId(queryId)
            .terms(terms)
            .build();
    }
}
