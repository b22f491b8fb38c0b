package com.example.interviewcoach.analyzer;

import com.example.interviewcoach.lexicon.Lexicon;
import org.springframework.stereotype.Service;

/**
 * Scores confidence (1-10) from achievement and leadership vocabulary,
 * first-person ownership and hedging.
 */
@Service
public class ConfidenceScorer {

    private static final int BASE_SCORE = 2;

    private final Lexicon lexicon;

    public ConfidenceScorer(Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    /**
     * @param answer raw answer text
     * @return confidence score in [1, 10]
     */
    public int score(String answer) {
        String lower = TextMetrics.lower(answer);
        int wordCount = TextMetrics.wordCount(lower);
        if (wordCount < 10) return 2;
        if (wordCount < 20) return 3;

        int score = BASE_SCORE;

        int keywords = countConfidenceKeywords(lower) + countLeadershipKeywords(lower);
        if (keywords >= 8) {
            score += 5;
        } else if (keywords >= 5) {
            score += 4;
        } else if (keywords >= 3) {
            score += 3;
        } else if (keywords >= 2) {
            score += 2;
        } else if (keywords >= 1) {
            score += 1;
        }

        int ownership = TextMetrics.countMatches(lower, lexicon.ownershipPhrases());
        if (ownership >= 3) {
            score += 2;
        } else if (ownership >= 1) {
            score += 1;
        }

        int hedges = TextMetrics.countMatches(lower, lexicon.confidenceHedgingWords());
        if (hedges >= 3) {
            score -= 3;
        } else if (hedges >= 1) {
            score -= 1;
        }

        return ClarityScorer.clamp(score);
    }

    /** Distinct confidence keywords contained in the answer; repeats count once. */
    public int countConfidenceKeywords(String answer) {
        return TextMetrics.countMatches(TextMetrics.lower(answer), lexicon.confidenceKeywords());
    }

    /** Distinct leadership keywords contained in the answer; repeats count once. */
    public int countLeadershipKeywords(String answer) {
        return TextMetrics.countMatches(TextMetrics.lower(answer), lexicon.leadershipKeywords());
    }
}
