package com.example.interviewcoach.model;

import java.util.List;

/**
 * Whether an answer addresses the topic inferred from its question.
 *
 * @param relevanceScore score clamped to [0, 10], baseline 5
 * @param questionType   first matching topic of the question, {@link QuestionType#NONE} if none matched
 * @param issues         relevance problems, in detection order
 */
public record RelevanceVerdict(
        int relevanceScore,
        QuestionType questionType,
        List<String> issues
) {
    public static final int RELEVANCE_THRESHOLD = 4;

    public RelevanceVerdict {
        issues = List.copyOf(issues);
    }

    public boolean isRelevant() {
        return relevanceScore >= RELEVANCE_THRESHOLD;
    }
}
