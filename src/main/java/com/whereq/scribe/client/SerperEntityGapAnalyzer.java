package com.whereq.scribe.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.scribe.config.OptimizerProperties;
import com.whereq.scribe.model.EntityGapData;
import com.whereq.scribe.util.HtmlText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@link EntityGapAnalyzer} over the Serper.dev Google search API
 */
@Slf4j
@Service
public class SerperEntityGapAnalyzer implements EntityGapAnalyzer {

    private static final int RESULT_COUNT = 10;
    private static final int MAX_REFERENCES = 8;
    private static final Set<String> SKIPPED_REFERENCE_HOSTS = Set.of(
        "youtube.com", "www.youtube.com", "facebook.com", "www.facebook.com",
        "twitter.com", "x.com", "www.pinterest.com", "www.reddit.com", "www.quora.com");

    @Autowired
    private WebClient.Builder webClientBuilder;

    @Autowired
    private OptimizerProperties properties;

    @Override
    public Mono<EntityGapData> analyze(String topic, String existingContent, String country) {
        OptimizerProperties.SearchConfig config = properties.getSearch();
        Map<String, Object> query = Map.of(
            "q", topic,
            "gl", country != null ? country.toLowerCase(Locale.ROOT) : "us",
            "num", RESULT_COUNT);

        return webClientBuilder.build()
            .post()
            .uri(config.getEndpoint())
            .contentType(MediaType.APPLICATION_JSON)
            .header("X-API-KEY", config.getSerperApiKey())
            .bodyValue(query)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(config.getTimeout())
            .map(body -> toGapData(body, existingContent))
            .doOnNext(gap -> log.info("Entity gap for \"{}\": {} missing entities, {} questions, {} competitors",
                topic, gap.getMissingEntities().size(), gap.getPaaQuestions().size(),
                gap.getCompetitorUrls().size()));
    }

    EntityGapData toGapData(JsonNode body, String existingContent) {
        String existing = HtmlText.plainText(existingContent).toLowerCase(Locale.ROOT);

        List<String> competitors = new ArrayList<>();
        List<String> references = new ArrayList<>();
        for (JsonNode result : body.path("organic")) {
            String link = result.path("link").asText("");
            if (link.isEmpty()) {
                continue;
            }
            competitors.add(link);
            if (references.size() < MAX_REFERENCES && isReferenceCandidate(link)) {
                references.add(link);
            }
        }

        Set<String> missing = new LinkedHashSet<>();
        for (JsonNode related : body.path("relatedSearches")) {
            String entity = related.path("query").asText("").trim();
            if (!entity.isEmpty() && !existing.contains(entity.toLowerCase(Locale.ROOT))) {
                missing.add(entity);
            }
        }

        List<String> questions = new ArrayList<>();
        for (JsonNode paa : body.path("peopleAlsoAsk")) {
            String question = paa.path("question").asText("").trim();
            if (!question.isEmpty()) {
                questions.add(question);
            }
        }

        return EntityGapData.builder()
            .missingEntities(List.copyOf(missing))
            .paaQuestions(questions)
            .competitorUrls(competitors)
            .validatedReferences(references)
            .build();
    }

    private static boolean isReferenceCandidate(String link) {
        try {
            URI uri = new URI(link);
            return "https".equals(uri.getScheme())
                && uri.getHost() != null
                && !SKIPPED_REFERENCE_HOSTS.contains(uri.getHost().toLowerCase(Locale.ROOT));
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
