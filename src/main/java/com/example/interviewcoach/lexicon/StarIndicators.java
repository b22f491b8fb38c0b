package com.example.interviewcoach.lexicon;

import java.util.List;

/**
 * Indicator phrases for each STAR component.
 */
public record StarIndicators(
        List<String> situation,
        List<String> task,
        List<String> action,
        List<String> result
) {
    public StarIndicators {
        situation = List.copyOf(situation);
        task = List.copyOf(task);
        action = List.copyOf(action);
        result = List.copyOf(result);
    }
}
