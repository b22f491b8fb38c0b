package com.example.interviewcoach.analyzer;

import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Scores clarity (1-10) from sentence structure: average sentence length,
 * absence of run-on sentences and variation in sentence length.
 */
@Service
public class ClarityScorer {

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]");

    private static final int BASE_SCORE = 3;
    private static final int RUN_ON_WORDS = 40;

    /**
     * @param answer raw answer text
     * @return clarity score in [1, 10]
     */
    public int score(String answer) {
        int wordCount = TextMetrics.wordCount(answer);
        if (wordCount < 5) return 1;
        if (wordCount < 10) return 2;
        if (wordCount < 20) return 3;

        int[] sentenceLengths = Arrays.stream(SENTENCE_END.split(answer))
                .mapToInt(TextMetrics::wordCount)
                .filter(words -> words > 0)
                .toArray();

        if (sentenceLengths.length == 0) return 1;
        if (sentenceLengths.length < 2) return 2;

        int score = BASE_SCORE;
        double avgWordsPerSentence = (double) Arrays.stream(sentenceLengths).sum() / sentenceLengths.length;

        // Bands overlap; only the first matching one applies.
        if (avgWordsPerSentence >= 10 && avgWordsPerSentence <= 25) {
            score += 4;
        } else if (avgWordsPerSentence >= 8 && avgWordsPerSentence <= 30) {
            score += 2;
        } else if (avgWordsPerSentence > 40) {
            score -= 1;
        } else if (avgWordsPerSentence < 5) {
            score -= 1;
        }

        long runOnSentences = Arrays.stream(sentenceLengths).filter(n -> n > RUN_ON_WORDS).count();
        if (runOnSentences == 0 && sentenceLengths.length >= 3) {
            score += 2;
        }

        if (sentenceLengths.length >= 4) {
            int variation = Arrays.stream(sentenceLengths).max().getAsInt()
                    - Arrays.stream(sentenceLengths).min().getAsInt();
            if (variation > 5) {
                score += 1;
            }
        }

        return clamp(score);
    }

    static int clamp(int score) {
        return Math.max(1, Math.min(10, score));
    }
}
