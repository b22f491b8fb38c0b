package com.example.interviewcoach.model;

import java.util.List;

/**
 * Final assessment of one interview answer.
 *
 * @param clarity         clarity score in [1, 10]
 * @param confidence      confidence score in [1, 10]
 * @param structure       STAR structure score in [1, 10]
 * @param totalScore      integer mean of the three scores
 * @param feedback        multi-section narrative feedback
 * @param valid           false only when the answer was rejected as gibberish
 * @param rejectionReason reason for rejection, null for a valid answer
 * @param details         intermediate findings
 */
public record AnalysisResult(
        int clarity,
        int confidence,
        int structure,
        int totalScore,
        String feedback,
        boolean valid,
        String rejectionReason,
        AnalysisDetails details
) {
    public static final String REJECTION_REASON = "Invalid response detected";

    /**
     * Terminal result for an answer that failed the gibberish gate: every score is 1.
     */
    public static AnalysisResult rejected(String feedback, List<String> gibberishIssues) {
        AnalysisDetails details = new AnalysisDetails(
                StarComponents.NONE.asMap(), 0, 0, gibberishIssues, List.of());
        return new AnalysisResult(1, 1, 1, 1, feedback, false, REJECTION_REASON, details);
    }
}
