package com.example.interviewcoach.ingestion;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Whitespace cleanup for extracted document text.
 */
public final class TextNormalizer {

    private static final Pattern SPACE_RUN = Pattern.compile(" +");
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\n{3,}");

    private TextNormalizer() {
        // utility class
    }

    /**
     * Collapses runs of spaces to one, runs of three or more newlines to two,
     * and strips every line as well as the whole text.
     *
     * @param text raw extracted text, may be null
     * @return normalized text, empty for null input
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";
        String collapsed = SPACE_RUN.matcher(text).replaceAll(" ");
        collapsed = BLANK_LINE_RUN.matcher(collapsed).replaceAll("\n\n");
        return Arrays.stream(collapsed.split("\n", -1))
                .map(String::strip)
                .collect(Collectors.joining("\n"))
                .strip();
    }
}
