package com.whereq.scribe.util;

import com.whereq.scribe.model.ExistingContentAnalysis;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * HTML helpers for article bodies
 */
public final class HtmlText {

    private HtmlText() {
    }

    /**
     * Visible text of an HTML fragment
     */
    public static String plainText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parseBodyFragment(html).text();
    }

    public static int countWords(String html) {
        String text = plainText(html).trim();
        if (text.isEmpty()) {
            return 0;
        }
        return text.split("\\s+").length;
    }

    /**
     * Drop every {@code <h1>}; WordPress renders the post title as the page heading.
     */
    public static String removeH1Tags(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        Document doc = Jsoup.parseBodyFragment(html);
        doc.outputSettings().prettyPrint(false);
        doc.select("h1").remove();
        return doc.body().html();
    }

    /**
     * Structure of an existing post body
     */
    public static ExistingContentAnalysis analyze(String html) {
        if (html == null || html.isBlank()) {
            return ExistingContentAnalysis.builder().build();
        }
        Document doc = Jsoup.parseBodyFragment(html);
        List<String> headings = doc.select("h2, h3").stream()
            .map(Element::text)
            .filter(t -> !t.isBlank())
            .toList();
        return ExistingContentAnalysis.builder()
            .wordCount(countWords(html))
            .headings(headings)
            .linkCount(doc.select("a[href]").size())
            .imageCount(doc.select("img").size())
            .build();
    }
}
