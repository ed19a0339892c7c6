package com.whereq.scribe.crawler;

import com.whereq.scribe.model.Page;
import com.whereq.scribe.state.PageCatalog;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Discover pages from an XML sitemap
 */
@Slf4j
@Service
public class SitemapCrawler {

    static final int MAX_PAGES = 300;

    private static final Duration FETCH_TIMEOUT = Duration.ofSeconds(30);
    private static final List<String> EXCLUDED_PARTS = List.of(
        "?", ".xml", "/wp-admin", "/wp-content", "/wp-json", "/feed/", ".pdf", ".jpg", ".png");

    @Autowired
    private WebClient.Builder webClientBuilder;

    /**
     * Fetch a sitemap and turn its page URLs into catalogue entries
     *
     * @param sitemapUrl sitemap address
     * @return discovered pages, at most {@value #MAX_PAGES}
     */
    public Mono<List<Page>> discover(String sitemapUrl) {
        log.info("Crawling sitemap {}", sitemapUrl);

        return webClientBuilder.build()
            .get()
            .uri(sitemapUrl)
            .accept(MediaType.APPLICATION_XML, MediaType.TEXT_XML, MediaType.ALL)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(FETCH_TIMEOUT)
            .map(xml -> extractUrls(xml).stream()
                .map(url -> PageCatalog.fromUrl(url, "Page"))
                .toList())
            .doOnNext(pages -> log.info("Found {} valid URLs in {}", pages.size(), sitemapUrl));
    }

    /**
     * Page URLs listed in a sitemap, without admin, feed, media and query URLs
     */
    public static List<String> extractUrls(String xml) {
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        Set<String> urls = new LinkedHashSet<>();
        for (Element loc : doc.select("loc")) {
            String url = loc.text().trim();
            if (isPageUrl(url)) {
                urls.add(url);
            }
        }
        return urls.stream().limit(MAX_PAGES).toList();
    }

    private static boolean isPageUrl(String url) {
        if (!url.startsWith("http")) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        return EXCLUDED_PARTS.stream().noneMatch(lower::contains);
    }
}
