package com.example.interviewcoach.model;

import java.util.List;
import java.util.Map;

/**
 * Intermediate findings reported alongside the scores.
 *
 * @param starComponentsFound    presence of each STAR component (always four keys)
 * @param confidenceKeywordCount distinct confidence keywords found
 * @param leadershipKeywordCount distinct leadership keywords found
 * @param redFlags               red flags in detection order (gibberish issues on a rejected answer)
 * @param relevanceIssues        relevance issues, empty when no question was supplied
 */
public record AnalysisDetails(
        Map<String, Boolean> starComponentsFound,
        int confidenceKeywordCount,
        int leadershipKeywordCount,
        List<String> redFlags,
        List<String> relevanceIssues
) {
    public AnalysisDetails {
        redFlags = List.copyOf(redFlags);
        relevanceIssues = List.copyOf(relevanceIssues);
    }
}
