package com.whereq.scribe.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.scribe.model.PostPayload;
import com.whereq.scribe.model.PreservationFlags;
import com.whereq.scribe.model.PublishedPost;
import com.whereq.scribe.model.RemotePost;
import com.whereq.scribe.model.SeoMeta;
import com.whereq.scribe.model.SiteCredentials;
import com.whereq.scribe.util.HtmlText;
import com.whereq.scribe.util.Slugs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ContentStore} backed by the WordPress REST API with application-password basic auth
 */
@Slf4j
@Service
public class WordPressContentStore implements ContentStore {

    private static final String POSTS_PATH = "/wp-json/wp/v2/posts";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    @Autowired
    private WebClient.Builder webClientBuilder;

    @Override
    public Mono<Long> resolvePostId(SiteCredentials site, String url) {
        String slug = Slugs.extractSlugFromUrl(url);
        if (slug.isEmpty()) {
            return Mono.empty();
        }

        return client(site)
            .get()
            .uri(uri -> uri.path(POSTS_PATH)
                .queryParam("slug", slug)
                .queryParam("status", "publish,draft,pending,private")
                .queryParam("_fields", "id")
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(REQUEST_TIMEOUT)
            .flatMap(body -> body.isArray() && body.size() > 0
                ? Mono.just(body.get(0).path("id").asLong())
                : Mono.empty())
            .doOnNext(id -> log.debug("Resolved {} to post {}", url, id));
    }

    @Override
    public Mono<RemotePost> fetchPost(SiteCredentials site, long postId) {
        return client(site)
            .get()
            .uri(uri -> uri.path(POSTS_PATH + "/{id}").queryParam("context", "edit").build(postId))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(REQUEST_TIMEOUT)
            .map(this::toRemotePost);
    }

    @Override
    public Mono<PublishedPost> createPost(SiteCredentials site, PostPayload payload) {
        return client(site)
            .post()
            .uri(POSTS_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(REQUEST_TIMEOUT)
            .map(this::toPublishedPost)
            .doOnNext(post -> log.info("Created post {} at {}", post.getId(), post.getLink()));
    }

    @Override
    public Mono<PublishedPost> updatePost(SiteCredentials site, long postId, PostPayload payload,
                                          PreservationFlags flags) {
        PostPayload.PostPayloadBuilder body = payload.toBuilder();
        if (flags.isPreserveSlug()) {
            body.slug(null);
        }
        if (!flags.isPreserveCategories()) {
            body.categories(null);
        }
        if (!flags.isPreserveTags()) {
            body.tags(null);
        }
        if (!flags.isPreserveFeaturedImage()) {
            body.featuredMedia(null);
        }

        return client(site)
            .post()
            .uri(POSTS_PATH + "/{id}", postId)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body.build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(REQUEST_TIMEOUT)
            .map(this::toPublishedPost)
            .doOnNext(post -> log.info("Updated post {} at {}", post.getId(), post.getLink()));
    }

    @Override
    public Mono<Void> updatePostMeta(SiteCredentials site, long postId, SeoMeta meta) {
        Map<String, String> fields = new LinkedHashMap<>();
        putIfPresent(fields, "_yoast_wpseo_title", meta.getTitle());
        putIfPresent(fields, "_yoast_wpseo_metadesc", meta.getDescription());
        putIfPresent(fields, "_yoast_wpseo_focuskw", meta.getFocusKeyword());
        putIfPresent(fields, "rank_math_title", meta.getTitle());
        putIfPresent(fields, "rank_math_description", meta.getDescription());
        putIfPresent(fields, "rank_math_focus_keyword", meta.getFocusKeyword());
        if (fields.isEmpty()) {
            return Mono.empty();
        }

        return client(site)
            .post()
            .uri(POSTS_PATH + "/{id}", postId)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("meta", fields))
            .retrieve()
            .toBodilessEntity()
            .timeout(REQUEST_TIMEOUT)
            .then();
    }

    @Override
    public Mono<String> testConnection(SiteCredentials site) {
        return client(site)
            .get()
            .uri("/wp-json/wp/v2/users/me")
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(REQUEST_TIMEOUT)
            .map(user -> user.path("name").asText(site.getUsername()))
            .doOnNext(name -> log.info("WordPress connection to {} verified as {}", site.baseUrl(), name));
    }

    private WebClient client(SiteCredentials site) {
        return webClientBuilder.clone()
            .baseUrl(site.baseUrl())
            .defaultHeaders(headers -> headers.setBasicAuth(site.getUsername(), site.getPassword()))
            .build();
    }

    private RemotePost toRemotePost(JsonNode node) {
        long media = node.path("featured_media").asLong(0);
        return RemotePost.builder()
            .id(node.path("id").asLong())
            .title(HtmlText.plainText(rendered(node.path("title"))))
            .content(rendered(node.path("content")))
            .slug(node.path("slug").asText(null))
            .link(node.path("link").asText(null))
            .categories(ids(node.path("categories")))
            .tags(ids(node.path("tags")))
            .featuredMediaId(media > 0 ? media : null)
            .build();
    }

    private PublishedPost toPublishedPost(JsonNode node) {
        return PublishedPost.builder()
            .id(node.path("id").asLong())
            .link(node.path("link").asText(null))
            .build();
    }

    /**
     * Raw field when available (edit context), rendered otherwise
     */
    private static String rendered(JsonNode field) {
        if (field.isTextual()) {
            return field.asText();
        }
        JsonNode raw = field.path("raw");
        return raw.isTextual() && !raw.asText().isEmpty() ? raw.asText() : field.path("rendered").asText("");
    }

    private static List<Long> ids(JsonNode array) {
        List<Long> ids = new ArrayList<>();
        array.forEach(id -> ids.add(id.asLong()));
        return ids;
    }

    private static void putIfPresent(Map<String, String> fields, String key, String value) {
        if (value != null && !value.isBlank()) {
            fields.put(key, value);
        }
    }
}
