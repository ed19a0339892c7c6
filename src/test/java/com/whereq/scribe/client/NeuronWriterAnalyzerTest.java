package com.whereq.scribe.client;

import com.whereq.scribe.config.OptimizerProperties;
import com.whereq.scribe.model.NlpTerm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class NeuronWriterAnalyzerTest {

    private final OptimizerProperties properties = new OptimizerProperties();
    private final List<ClientRequest> requests = new ArrayList<>();
    private final AtomicInteger polls = new AtomicInteger();
    private final NeuronWriterAnalyzer analyzer = new NeuronWriterAnalyzer();

    @BeforeEach
    void setUp() {
        properties.getNeuron().setEnabled(true);
        properties.getNeuron().setApiKey("neuron-key");
        properties.getNeuron().setProjectId("project-1");
        properties.getNeuron().setPollInterval(Duration.ofMillis(10));
        properties.getNeuron().setMaxPolls(3);

        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            String path = request.url().getPath();
            if (path.endsWith("/new-query")) {
                return json("{\"query\": \"q-42\"}");
            }
            if (polls.incrementAndGet() < 3) {
                return json("{\"status\": \"waiting\"}");
            }
            return json("""
                {"status": "ready", "terms": {"content_basic": [
                  {"t": "burr grinder", "usage_pc": 90},
                  {"t": "grind size", "usage_pc": 75}
                ]}}
                """);
        });
        ReflectionTestUtils.setField(analyzer, "webClientBuilder", builder);
        ReflectionTestUtils.setField(analyzer, "properties", properties);
    }

    @Test
    @DisplayName("The query is polled until NeuronWriter reports it ready")
    void pollsUntilReady() {
        StepVerifier.create(analyzer.analyze("coffee grinders"))
            .assertNext(analysis -> {
                assertThat(analysis.getQueryId()).isEqualTo("q-42");
                assertThat(analysis.getTerms()).extracting(NlpTerm::getTerm)
                    .containsExactly("burr grinder", "grind size");
                assertThat(analysis.getTerms().get(0).getUsagePercent()).isEqualTo(90);
            })
            .verifyComplete();

        assertThat(polls.get()).isEqualTo(3);
        assertThat(requests.get(0).headers().getFirst("X-API-KEY")).isEqualTo("neuron-key");
        assertThat(requests.get(0).url().toString()).startsWith(properties.getNeuron().getEndpoint());
    }

    @Test
    @DisplayName("A query that never becomes ready fails after the last poll")
    void givesUpAfterMaxPolls() {
        properties.getNeuron().setMaxPolls(1);

        StepVerifier.create(analyzer.analyze("coffee grinders"))
            .expectErrorMessage("NeuronWriter query q-42 not ready after 2 polls")
            .verify();
        assertThat(polls.get()).isEqualTo(2);
    }

    private static Mono<ClientResponse> json(String body) {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }
}
