package com.whereq.scribe.client;

import com.whereq.scribe.model.EntityGapData;
import com.whereq.scribe.model.NlpTerm;
import com.whereq.scribe.model.QaResult;
import com.whereq.scribe.model.QualitySignals;
import com.whereq.scribe.model.SeoMetrics;
import com.whereq.scribe.util.HtmlText;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based {@link ContentScorer} over the parsed article HTML
 */
@Component
public class HeuristicContentScorer implements ContentScorer {

    static final int MIN_WORDS = 1500;
    static final int MIN_H2 = 4;
    static final int MIN_LINKS = 3;
    static final int META_MIN = 120;
    static final int META_MAX = 160;
    static final int DEPTH_WORDS_FOR_FULL_SCORE = 4000;

    @Override
    public QaResult score(String html, QualitySignals signals) {
        Document doc = Jsoup.parseBodyFragment(html != null ? html : "");
        String text = doc.text().toLowerCase(Locale.ROOT);
        int words = HtmlText.countWords(html);
        String keyword = lower(signals.getTargetKeyword());

        List<QaResult.Check> checks = new ArrayList<>();
        checks.add(check("word-count", 15, words >= MIN_WORDS, words + " words"));
        checks.add(check("heading-structure", 10, doc.select("h2").size() >= MIN_H2,
            doc.select("h2").size() + " H2 headings"));
        checks.add(check("faq", 10, hasFaq(doc), "FAQ section or question headings"));
        checks.add(check("meta-description", 10, metaDescriptionFits(signals.getMetaDescription()),
            "meta description " + META_MIN + "-" + META_MAX + " characters"));
        checks.add(check("keyword-intro", 10, keyword.isEmpty() || firstParagraph(doc).contains(keyword),
            "keyword in the first paragraph"));
        checks.add(check("keyword-heading", 10, keyword.isEmpty() || headingsContain(doc, keyword),
            "keyword in an H2"));
        checks.add(check("lists", 5, !doc.select("ul, ol").isEmpty(), "bulleted or numbered list"));
        checks.add(check("tables", 5, !doc.select("table").isEmpty(), "comparison table"));
        checks.add(check("links", 10, doc.select("a[href]").size() >= MIN_LINKS,
            doc.select("a[href]").size() + " links"));
        checks.add(check("entity-coverage", 10, entityCoverage(text, signals.getEntityGap()) >= 0.6,
            "covers missing entities"));
        checks.add(check("nlp-terms", 5, termCoverage(text, signals.getNlpTerms()) >= 0.5,
            "uses recommended terms"));

        int total = checks.stream().mapToInt(QaResult.Check::getWeight).sum();
        int passed = checks.stream().filter(QaResult.Check::isPassed).mapToInt(QaResult.Check::getWeight).sum();

        return QaResult.builder()
            .score((int) Math.round(100.0 * passed / total))
            .checks(checks)
            .build();
    }

    @Override
    public SeoMetrics measure(String html, String title, String slug) {
        Document doc = Jsoup.parseBodyFragment(html != null ? html : "");
        int words = HtmlText.countWords(html);
        return SeoMetrics.builder()
            .wordCount(words)
            .aeoScore(aeoScore(doc))
            .contentDepth(Math.min(100, (int) Math.round(100.0 * words / DEPTH_WORDS_FOR_FULL_SCORE)))
            .headingStructure(headingStructure(doc))
            .build();
    }

    /**
     * Answer-engine readiness: question headings, FAQ, lists and tables
     */
    int aeoScore(Document doc) {
        long questionHeadings = doc.select("h2, h3").stream()
            .filter(h -> h.text().trim().endsWith("?"))
            .count();
        int score = (int) Math.min(40, questionHeadings * 10);
        if (hasFaq(doc)) {
            score += 20;
        }
        if (!doc.select("ul, ol").isEmpty()) {
            score += 20;
        }
        if (!doc.select("table").isEmpty()) {
            score += 20;
        }
        return Math.min(100, score);
    }

    int headingStructure(Document doc) {
        Elements headings = doc.select("h2, h3, h4");
        if (headings.isEmpty()) {
            return 0;
        }
        int score = 0;
        if (doc.select("h2").size() >= 3) {
            score += 40;
        }
        if (!doc.select("h3").isEmpty()) {
            score += 30;
        }
        if (!skipsLevels(headings)) {
            score += 30;
        }
        return score;
    }

    private static boolean skipsLevels(Elements headings) {
        int previous = 1;
        for (Element heading : headings) {
            int level = heading.tagName().charAt(1) - '0';
            if (level > previous + 1) {
                return true;
            }
            previous = level;
        }
        return false;
    }

    private static boolean hasFaq(Document doc) {
        return doc.select("h2, h3").stream().anyMatch(h -> {
            String text = h.text().toLowerCase(Locale.ROOT);
            return text.contains("faq") || text.contains("frequently asked");
        });
    }

    private static boolean metaDescriptionFits(String description) {
        return description != null && description.length() >= META_MIN && description.length() <= META_MAX;
    }

    private static String firstParagraph(Document doc) {
        Element first = doc.selectFirst("p");
        return first != null ? first.text().toLowerCase(Locale.ROOT) : "";
    }

    private static boolean headingsContain(Document doc, String keyword) {
        return doc.select("h2").stream().anyMatch(h -> h.text().toLowerCase(Locale.ROOT).contains(keyword));
    }

    private static double entityCoverage(String text, EntityGapData gap) {
        if (gap == null || gap.getMissingEntities().isEmpty()) {
            return 1.0;
        }
        long covered = gap.getMissingEntities().stream()
            .filter(e -> text.contains(e.toLowerCase(Locale.ROOT)))
            .count();
        return (double) covered / gap.getMissingEntities().size();
    }

    private static double termCoverage(String text, List<NlpTerm> terms) {
        if (terms == null || terms.isEmpty()) {
            return 1.0;
        }
        long used = terms.stream()
            .filter(t -> text.contains(t.getTerm().toLowerCase(Locale.ROOT)))
            .count();
        return (double) used / terms.size();
    }

    private static QaResult.Check check(String name, int weight, boolean passed, String detail) {
        return QaResult.Check.builder()
            .name(name)
            .weight(weight)
            .passed(passed)
            .detail(detail)
            .build();
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
