package com.example.interviewcoach.analyzer;

import com.example.interviewcoach.model.StarComponents;
import org.springframework.stereotype.Service;

/**
 * Scores STAR structure (1-10) from the number of components present,
 * with a bonus when the answer is bookended by a situation and a result.
 */
@Service
public class StructureScorer {

    private static final int[] SCORE_BY_COMPONENT_COUNT = {1, 2, 4, 7, 10};

    private final StarComponentDetector starDetector;

    public StructureScorer(StarComponentDetector starDetector) {
        this.starDetector = starDetector;
    }

    public int score(String answer) {
        int wordCount = TextMetrics.wordCount(answer);
        if (wordCount < 10) return 1;
        if (wordCount < 20) return 2;

        StarComponents components = starDetector.detect(answer);
        int score = SCORE_BY_COMPONENT_COUNT[components.count()];
        if (components.situation() && components.result()) {
            score = Math.min(10, score + 1);
        }
        return score;
    }
}
