package com.whereq.scribe.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * URL, slug and title helpers for catalogue entries
 */
public final class Slugs {

    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9-]+");
    private static final Pattern DASHES = Pattern.compile("-{2,}");
    private static final Pattern WORD_START = Pattern.compile("\\b(\\w)");

    private Slugs() {
    }

    /**
     * Non-empty path segments of an absolute URL, empty when the URL cannot be parsed
     */
    public static List<String> pathSegments(String url) {
        try {
            String path = URI.create(url.trim()).getPath();
            if (path == null) {
                return List.of();
            }
            return Arrays.stream(path.split("/"))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        } catch (IllegalArgumentException e) {
            return List.of();
        }
    }

    public static String extractSlugFromUrl(String url) {
        List<String> segments = pathSegments(url);
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    /**
     * Lowercase ASCII slug with single dashes and no leading or trailing dash
     */
    public static String sanitizeSlug(String raw) {
        if (raw == null) {
            return "";
        }
        String ascii = Normalizer.normalize(raw, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        String slug = NON_SLUG.matcher(ascii.toLowerCase(Locale.ROOT).trim()).replaceAll("-");
        slug = DASHES.matcher(slug).replaceAll("-");
        while (slug.startsWith("-")) {
            slug = slug.substring(1);
        }
        while (slug.endsWith("-")) {
            slug = slug.substring(0, slug.length() - 1);
        }
        return slug;
    }

    /**
     * Title from the last path segment: dashes become spaces, words are capitalised.
     *
     * @return the title, or an empty string when the URL has no path
     */
    public static String titleFromUrl(String url) {
        String segment = extractSlugFromUrl(url);
        if (segment.isEmpty()) {
            return "";
        }
        Matcher matcher = WORD_START.matcher(segment.replace('-', ' '));
        StringBuilder title = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(title, matcher.group(1).toUpperCase(Locale.ROOT));
        }
        matcher.appendTail(title);
        return title.toString();
    }

    /**
     * Check for a syntactically valid absolute http(s) URL with a host
     */
    public static boolean isAbsoluteHttpUrl(String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return false;
        }
        try {
            URI uri = new URI(candidate);
            String scheme = uri.getScheme();
            return uri.isAbsolute()
                && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
