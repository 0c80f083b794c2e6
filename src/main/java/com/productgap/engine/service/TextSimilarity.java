package com.productgap.engine.service;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalization and set-overlap helpers shared by extraction and clustering.
 */
public final class TextSimilarity {

    private static final Pattern WORD = Pattern.compile("[a-z]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_TOKEN_LENGTH = 3;

    private static final Set<String> STOP_WORDS = ImmutableSet.of(
            "the", "and", "for", "are", "but", "not", "you", "your", "with", "this", "that", "they", "them",
            "there", "their", "have", "has", "had", "was", "were", "been", "from", "what", "when", "where",
            "which", "who", "why", "how", "can", "cant", "could", "would", "should", "will", "just", "than",
            "then", "into", "out", "about", "any", "all", "some", "more", "most", "very", "too", "our", "its",
            "also", "does", "doesn", "don", "did", "get", "gets", "got", "one", "like", "need", "needs", "none");

    private TextSimilarity() {
    }

    /**
     * Trims, lower-cases and collapses inner whitespace; blank entries are dropped.
     */
    public static SortedSet<String> normalizeKeywords(Collection<String> keywords) {
        SortedSet<String> normalized = new TreeSet<>();
        if (keywords == null) {
            return normalized;
        }
        for (String keyword : keywords) {
            if (keyword == null) {
                continue;
            }
            String cleaned = WHITESPACE.matcher(keyword.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
            if (!cleaned.isEmpty()) {
                normalized.add(cleaned);
            }
        }
        return normalized;
    }

    /**
     * Lower-cased alphabetic words of at least three letters, stop words removed.
     */
    public static Set<String> summaryTokens(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptySet();
        }
        Set<String> tokens = new TreeSet<>();
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() >= MIN_TOKEN_LENGTH && !STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * |a ∩ b| / |a ∪ b|, and 0 when either side is empty.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int intersection = Sets.intersection(a, b).size();
        int union = Sets.union(a, b).size();
        return (double) intersection / union;
    }

    public static boolean sameCategory(String a, String b) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) {
            return false;
        }
        return a.trim().equalsIgnoreCase(b.trim());
    }
}
