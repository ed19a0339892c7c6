package com.whereq.scribe.client;

import com.whereq.scribe.model.PostPayload;
import com.whereq.scribe.model.PreservationFlags;
import com.whereq.scribe.model.PublishedPost;
import com.whereq.scribe.model.RemotePost;
import com.whereq.scribe.model.SeoMeta;
import com.whereq.scribe.model.SiteCredentials;
import reactor.core.publisher.Mono;

/**
 * Remote content management system the optimized articles are published to
 */
public interface ContentStore {

    /**
     * Find the post behind a public URL
     *
     * @param site site and credentials
     * @param url public page URL
     * @return post id, empty if no post matches
     */
    Mono<Long> resolvePostId(SiteCredentials site, String url);

    /**
     * Fetch a post with the assets that are preserved on update
     */
    Mono<RemotePost> fetchPost(SiteCredentials site, long postId);

    Mono<PublishedPost> createPost(SiteCredentials site, PostPayload payload);

    /**
     * Update an existing post. Fields the flags preserve are never overwritten.
     */
    Mono<PublishedPost> updatePost(SiteCredentials site, long postId, PostPayload payload, PreservationFlags flags);

    /**
     * Write SEO plugin metadata
     */
    Mono<Void> updatePostMeta(SiteCredentials site, long postId, SeoMeta meta);

    /**
     * Check the credentials
     *
     * @return display name of the authenticated user
     */
    Mono<String> testConnection(SiteCredentials site);
}
