package com.example.interviewcoach.analyzer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lexical helpers shared by the detectors and scorers.
 * Matching is plain substring containment on lowercased text.
 */
public final class TextMetrics {

    // Unicode-aware: no-break and ideographic spaces separate words, and any decimal digit counts.
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DIGIT = Pattern.compile("\\p{Nd}");
    private static final String[] NO_WORDS = new String[0];

    private TextMetrics() {
        // utility class
    }

    public static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /** Whitespace-separated tokens; empty or blank text has none. */
    public static String[] words(String text) {
        if (text == null || text.isEmpty()) return NO_WORDS;
        return Arrays.stream(WHITESPACE.split(text))
                .filter(word -> !word.isEmpty())
                .toArray(String[]::new);
    }

    public static int wordCount(String text) {
        return words(text).length;
    }

    /** True if the text contains at least one decimal digit. */
    public static boolean hasNumbers(String text) {
        return text != null && DIGIT.matcher(text).find();
    }

    /** Non-overlapping occurrences of {@code needle} in {@code text}. */
    public static int countOccurrences(String text, String needle) {
        if (text == null || needle.isEmpty()) return 0;
        int count = 0;
        int from = 0;
        int idx;
        while ((idx = text.indexOf(needle, from)) >= 0) {
            count++;
            from = idx + needle.length();
        }
        return count;
    }

    public static boolean containsAny(String lowerText, List<String> phrases) {
        return firstMatch(lowerText, phrases).isPresent();
    }

    /** Number of distinct phrases of the list contained in the text. */
    public static int countMatches(String lowerText, List<String> phrases) {
        int count = 0;
        for (String phrase : phrases) {
            if (lowerText.contains(phrase)) count++;
        }
        return count;
    }

    /** First phrase, in list order, contained in the text. */
    public static Optional<String> firstMatch(String lowerText, List<String> phrases) {
        for (String phrase : phrases) {
            if (lowerText.contains(phrase)) return Optional.of(phrase);
        }
        return Optional.empty();
    }
}
