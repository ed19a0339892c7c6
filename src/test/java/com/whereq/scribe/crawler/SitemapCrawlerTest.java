package com.whereq.scribe.crawler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SitemapCrawlerTest {

    @Test
    @DisplayName("Page URLs are extracted in order without duplicates")
    void extractsPageUrls() {
        String xml = """
            <?xml version="1.0" encoding="UTF-8"?>
            <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
              <url><loc>https://example.com/espresso-basics/</loc></url>
              <url><loc> https://example.com/milk-frothing/ </loc></url>
              <url><loc>https://example.com/espresso-basics/</loc></url>
              <url><loc>https://example.com/?p=123</loc></url>
              <url><loc>https://example.com/post-sitemap.xml</loc></url>
              <url><loc>https://example.com/wp-content/uploads/menu.pdf</loc></url>
              <url><loc>https://example.com/wp-admin/options.php</loc></url>
              <url><loc>https://example.com/category/news/feed/</loc></url>
              <url><loc>https://example.com/images/beans.JPG</loc></url>
              <url><loc>/relative/path</loc></url>
            </urlset>
            """;

        assertThat(SitemapCrawler.extractUrls(xml))
            .containsExactly("https://example.com/espresso-basics/", "https://example.com/milk-frothing/");
    }

    @Test
    @DisplayName("At most 300 pages are returned")
    void capsPageCount() {
        StringBuilder xml = new StringBuilder("<urlset>");
        for (int i = 0; i < 350; i++) {
            xml.append("<url><loc>https://example.com/page-").append(i).append("</loc></url>");
        }
        xml.append("</urlset>");

        List<String> urls = SitemapCrawler.extractUrls(xml.toString());

        assertThat(urls).hasSize(SitemapCrawler.MAX_PAGES);
        assertThat(urls.get(0)).isEqualTo("https://example.com/page-0");
    }

    @Test
    @DisplayName("A document without locations yields nothing")
    void emptySitemap() {
        assertThat(SitemapCrawler.extractUrls("<html><body>Not a sitemap</body></html>")).isEmpty();
    }
}
