package com.example.interviewcoach.analyzer;

import com.example.interviewcoach.lexicon.Lexicon;
import com.example.interviewcoach.lexicon.StarIndicators;
import com.example.interviewcoach.model.StarComponents;
import org.springframework.stereotype.Component;

/**
 * Finds which STAR components an answer contains: a component is present if any of
 * its indicator phrases occurs in the lowercased text.
 */
@Component
public class StarComponentDetector {

    private final StarIndicators indicators;

    public StarComponentDetector(Lexicon lexicon) {
        this.indicators = lexicon.starIndicators();
    }

    public StarComponents detect(String answer) {
        String lower = TextMetrics.lower(answer);
        return new StarComponents(
                TextMetrics.containsAny(lower, indicators.situation()),
                TextMetrics.containsAny(lower, indicators.task()),
                TextMetrics.containsAny(lower, indicators.action()),
                TextMetrics.containsAny(lower, indicators.result()));
    }
}
