package com.example.interviewcoach.analyzer;

import com.example.interviewcoach.lexicon.Lexicon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects language that would concern a real interviewer.
 * Checks are independent; flags are emitted in a fixed order.
 */
@Service
public class RedFlagDetector {

    private static final Logger log = LoggerFactory.getLogger(RedFlagDetector.class);

    public static final String BLAME =
            "Blames others instead of taking accountability - major red flag in big tech interviews";
    public static final String NEGATIVITY =
            "Displays negative attitude about previous employers - interviewers note this";
    public static final String WE_OVERUSE =
            "Uses 'we' excessively without clarifying your individual contribution";
    public static final String NO_OUTCOME =
            "Long answer with no clear outcome or result mentioned";
    public static final String NO_METRICS =
            "Claims results but provides no quantifiable metrics (%, $, time saved, etc.)";
    public static final String TOO_BRIEF =
            "Response is too brief for a behavioral question - shows lack of depth or preparation";
    public static final String HEDGING =
            "Excessive hedging language undermines confidence";
    public static final String VAGUENESS =
            "Uses vague phrases without concrete details - interviewers want specifics";

    private static final int MAX_WE_COUNT = 5;
    private static final int MIN_I_COUNT = 2;
    private static final int LONG_ANSWER_WORDS = 50;
    private static final int METRICS_EXPECTED_WORDS = 30;
    private static final int BRIEF_ANSWER_WORDS = 30;
    private static final int MAX_HEDGING_TERMS = 3;
    private static final int MAX_VAGUE_PHRASES = 2;

    private final Lexicon lexicon;

    public RedFlagDetector(Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    /**
     * @param answer raw answer text
     * @return distinct red-flag descriptions in detection order
     */
    public List<String> detect(String answer) {
        String lower = TextMetrics.lower(answer);
        List<String> flags = new ArrayList<>();

        if (TextMetrics.containsAny(lower, lexicon.blamePhrases())) {
            flags.add(BLAME);
        }
        if (TextMetrics.containsAny(lower, lexicon.negativePhrases())) {
            flags.add(NEGATIVITY);
        }

        int weCount = TextMetrics.countOccurrences(lower, " we ");
        int iCount = TextMetrics.countOccurrences(lower, " i ");
        if (weCount > MAX_WE_COUNT && iCount < MIN_I_COUNT) {
            flags.add(WE_OVERUSE);
        }

        boolean claimsResult = TextMetrics.containsAny(lower, lexicon.starIndicators().result());
        boolean hasNumbers = TextMetrics.hasNumbers(answer);
        int wordCount = TextMetrics.wordCount(answer);

        if (wordCount > LONG_ANSWER_WORDS && !claimsResult) {
            flags.add(NO_OUTCOME);
        }
        if (claimsResult && !hasNumbers && wordCount > METRICS_EXPECTED_WORDS) {
            flags.add(NO_METRICS);
        }
        if (wordCount < BRIEF_ANSWER_WORDS) {
            flags.add(TOO_BRIEF);
        }
        if (TextMetrics.countMatches(lower, lexicon.hedgingWords()) >= MAX_HEDGING_TERMS) {
            flags.add(HEDGING);
        }
        if (TextMetrics.countMatches(lower, lexicon.vaguePhrases()) >= MAX_VAGUE_PHRASES) {
            flags.add(VAGUENESS);
        }

        log.debug("Red flags: {} (we={}, i={}, words={})", flags.size(), weCount, iCount, wordCount);
        return flags;
    }
}
