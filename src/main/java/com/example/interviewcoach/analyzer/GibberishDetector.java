package com.example.interviewcoach.analyzer;

import com.example.interviewcoach.lexicon.Lexicon;
import com.example.interviewcoach.model.GibberishSeverity;
import com.example.interviewcoach.model.GibberishVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects random, spam or placeholder answers before any scoring happens.
 * <p>
 * Rules:
 * <ul>
 *   <li>Degenerate patterns from the lexicon (keyboard mashing, repeated characters,
 *       placeholder text, one-word replies, admissions of not knowing): severe, first match only</li>
 *   <li>Very low character diversity: severe</li>
 *   <li>Excessive punctuation, digits without a metric context, repeated words,
 *       implausible average word length: moderate</li>
 * </ul>
 * The verdict severity is the maximum over the triggered rules.
 */
@Service
public class GibberishDetector {

    private static final Logger log = LoggerFactory.getLogger(GibberishDetector.class);

    private static final String PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    private static final int MIN_LENGTH_FOR_DIVERSITY = 20;
    private static final int MIN_DISTINCT_CHARACTERS = 8;
    private static final int MIN_LENGTH_FOR_PUNCTUATION = 10;
    private static final double MAX_PUNCTUATION_RATIO = 0.3;
    private static final double MAX_DIGIT_RATIO = 0.3;
    private static final int MAX_WORD_REPETITION = 5;
    private static final int REPETITION_WORD_LIMIT = 50;
    private static final double MIN_AVG_WORD_LENGTH = 2;
    private static final double MAX_AVG_WORD_LENGTH = 12;

    private final List<Pattern> degeneratePatterns;

    public GibberishDetector(Lexicon lexicon) {
        this.degeneratePatterns = lexicon.gibberishPatterns().stream()
                .map(p -> Pattern.compile(p,
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS | Pattern.UNIX_LINES))
                .toList();
    }

    /**
     * Scans the raw answer.
     *
     * @param text raw answer, may be null or empty
     * @return verdict with severity and reasons
     */
    public GibberishVerdict detect(String text) {
        String raw = text == null ? "" : text;
        String lower = TextMetrics.lower(raw);
        List<String> issues = new ArrayList<>();
        GibberishSeverity severity = GibberishSeverity.NONE;

        for (Pattern pattern : degeneratePatterns) {
            if (pattern.matcher(lower).find()) {
                issues.add("Contains random or placeholder text");
                severity = severity.max(GibberishSeverity.SEVERE);
                break;
            }
        }

        String compact = lower.replace(" ", "");
        long distinctChars = compact.codePoints().distinct().count();
        if (codePointLength(compact) > MIN_LENGTH_FOR_DIVERSITY && distinctChars < MIN_DISTINCT_CHARACTERS) {
            issues.add("Very low character diversity - appears random");
            severity = severity.max(GibberishSeverity.SEVERE);
        }

        int length = codePointLength(raw);
        long punctuation = raw.codePoints().filter(c -> PUNCTUATION.indexOf(c) >= 0).count();
        if (length > MIN_LENGTH_FOR_PUNCTUATION && (double) punctuation / length > MAX_PUNCTUATION_RATIO) {
            issues.add("Excessive punctuation");
            severity = severity.max(GibberishSeverity.MODERATE);
        }

        long digits = raw.codePoints().filter(Character::isDigit).count();
        double digitRatio = (double) digits / Math.max(length, 1);
        if (digitRatio > MAX_DIGIT_RATIO && !raw.contains("%") && !raw.contains("$")) {
            issues.add("Excessive numbers without context");
            severity = severity.max(GibberishSeverity.MODERATE);
        }

        String[] words = TextMetrics.words(lower);
        if (words.length > 0) {
            // Tokens are compared verbatim: "word," and "word" are different words.
            Map<String, Integer> counts = new HashMap<>();
            for (String word : words) {
                if (word.length() > 2) {
                    counts.merge(word, 1, Integer::sum);
                }
            }
            int maxRepetition = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
            if (maxRepetition > MAX_WORD_REPETITION && words.length < REPETITION_WORD_LIMIT) {
                issues.add("Excessive word repetition");
                severity = severity.max(GibberishSeverity.MODERATE);
            }

            double avgWordLength = 0;
            for (String word : words) {
                avgWordLength += codePointLength(word);
            }
            avgWordLength /= words.length;
            if (avgWordLength > MAX_AVG_WORD_LENGTH || avgWordLength < MIN_AVG_WORD_LENGTH) {
                issues.add("Unusual word patterns");
                severity = severity.max(GibberishSeverity.MODERATE);
            }
        }

        GibberishVerdict verdict = new GibberishVerdict(severity, issues);
        log.debug("Gibberish scan: severity={}, issues={}", severity, issues);
        return verdict;
    }

    private static int codePointLength(String s) {
        return s.codePointCount(0, s.length());
    }
}
