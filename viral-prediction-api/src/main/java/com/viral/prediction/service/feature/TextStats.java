package com.viral.prediction.service.feature;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizing and counting helpers shared by the feature heuristics.
 */
final class TextStats {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern VOWEL_GROUP = Pattern.compile("[aeiouy]+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

    private TextStats() {
    }

    static List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE.split(text.trim()))
                .filter(w -> !w.isEmpty())
                .toList();
    }

    /**
     * Lower-cased words with leading and trailing punctuation removed.
     */
    static List<String> normalizedWords(String text) {
        return words(text).stream()
                .map(w -> EDGE_PUNCTUATION.matcher(w.toLowerCase(Locale.ROOT)).replaceAll(""))
                .filter(w -> !w.isEmpty())
                .toList();
    }

    static List<String> sentences(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(SENTENCE_END.split(text))
                .filter(s -> !s.trim().isEmpty())
                .toList();
    }

    static double avgSyllablesPerWord(List<String> words) {
        if (words.isEmpty()) {
            return 1.0;
        }
        int total = 0;
        for (String word : words) {
            Matcher m = VOWEL_GROUP.matcher(word.toLowerCase(Locale.ROOT));
            int groups = 0;
            while (m.find()) {
                groups++;
            }
            total += Math.max(1, groups);
        }
        return (double) total / words.size();
    }

    /**
     * Number of distinct phrases from {@code phrases} that occur as whole words in {@code text}.
     */
    static int phraseHits(String text, List<String> phrases) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int hits = 0;
        for (String phrase : phrases) {
            if (containsPhrase(text, phrase)) {
                hits++;
            }
        }
        return hits;
    }

    /**
     * Case-insensitive whole-word match: the phrase may not be preceded or followed by a letter or digit,
     * so "ai" matches "#AI" and "AI," but not "said".
     */
    static boolean containsPhrase(String text, String phrase) {
        if (text == null || text.isEmpty() || phrase == null || phrase.isBlank()) {
            return false;
        }
        Pattern pattern = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(phrase.toLowerCase(Locale.ROOT))
                + "(?![\\p{L}\\p{N}])");
        return pattern.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    static int count(Pattern pattern, String text) {
        if (text == null) {
            return 0;
        }
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }
}
