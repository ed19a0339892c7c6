package com.whereq.scribe.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.scribe.config.OptimizerProperties;
import com.whereq.scribe.exception.GenerationException;
import com.whereq.scribe.model.StageProgress;
import com.whereq.scribe.model.SynthesisRequest;
import com.whereq.scribe.model.SynthesisStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteContentSynthesizerTest {

    private final RemoteContentSynthesizer synthesizer = new RemoteContentSynthesizer();
    private final List<StageProgress> stages = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(synthesizer, "objectMapper", new ObjectMapper());
        ReflectionTestUtils.setField(synthesizer, "properties", new OptimizerProperties());
    }

    @Test
    @DisplayName("Stage events reach the listener and the result event completes the call")
    void streamsStagesThenResult() {
        respondWith("""
            event:stage
            data:{"stage":"outline"}

            event:stage
            data:{"stage":"SECTIONS","sectionsCompleted":2,"totalSections":6}

            event:heartbeat
            data:{}

            event:result
            data:{"title":"Coffee Grinders","htmlContent":"<h2>Intro</h2>","slug":"coffee-grinders","referenceCount":4}

            """);

        StepVerifier.create(synthesizer.synthesize(request(), stages::add))
            .assertNext(content -> {
                assertThat(content.getTitle()).isEqualTo("Coffee Grinders");
                assertThat(content.getSlug()).isEqualTo("coffee-grinders");
                assertThat(content.getReferenceCount()).isEqualTo(4);
            })
            .verifyComplete();

        assertThat(stages).extracting(StageProgress::getStage)
            .containsExactly(SynthesisStage.OUTLINE, SynthesisStage.SECTIONS);
        assertThat(stages.get(1).getTotalSections()).isEqualTo(6);
    }

    @Test
    @DisplayName("Stage events with an unknown stage are skipped")
    void unknownStageIsSkipped() {
        respondWith("""
            event:stage
            data:{"stage":"fact_check"}

            event:stage
            data:{"stage":"merge"}

            event:result
            data:{"title":"Coffee Grinders","htmlContent":"<h2>Intro</h2>"}

            """);

        StepVerifier.create(synthesizer.synthesize(request(), stages::add))
            .assertNext(content -> assertThat(content.getTitle()).isEqualTo("Coffee Grinders"))
            .verifyComplete();

        assertThat(stages).extracting(StageProgress::getStage).containsExactly(SynthesisStage.MERGE);
    }

    @Test
    @DisplayName("An error event fails the call with the engine's message")
    void errorEvent() {
        respondWith("""
            event:stage
            data:{"stage":"outline"}

            event:error
            data:{"message":"Provider rate limit reached"}

            """);

        StepVerifier.create(synthesizer.synthesize(request(), stages::add))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(GenerationException.class)
                .hasMessage("Provider rate limit reached"))
            .verify();
    }

    @Test
    @DisplayName("A stream without a result event fails")
    void streamWithoutResult() {
        respondWith("""
            event:stage
            data:{"stage":"polish"}

            """);

        StepVerifier.create(synthesizer.synthesize(request(), stages::add))
            .expectErrorMessage("Synthesis engine returned no result")
            .verify();
    }

    @Test
    @DisplayName("Malformed event data is reported as a generation failure")
    void malformedEvent() {
        ServerSentEvent<String> event = ServerSentEvent.<String>builder()
            .event("result")
            .data("not json")
            .build();

        StepVerifier.create(synthesizer.handle(event, stages::add))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(GenerationException.class)
                .hasMessage("Malformed result event from synthesis engine"))
            .verify();
    }

    private void respondWith(String eventStream) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request ->
            Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                .body(eventStream)
                .build()));
        ReflectionTestUtils.setField(synthesizer, "webClientBuilder", builder);
    }

    private static SynthesisRequest request() {
        return SynthesisRequest.builder()
            .topic("coffee grinders")
            .provider("gemini")
            .model("gemini-2.5-flash")
            .targetWords(4000)
            .build();
    }
}
