package com.example.interviewcoach.model;

import java.util.List;

/**
 * Outcome of the spam/placeholder scan over a raw answer.
 *
 * @param severity highest severity among the triggered rules
 * @param issues   human-readable reasons, in the order the rules fired
 */
public record GibberishVerdict(
        GibberishSeverity severity,
        List<String> issues
) {
    public GibberishVerdict {
        issues = List.copyOf(issues);
    }

    /** Moderate and severe verdicts both close the gibberish gate. */
    public boolean isGibberish() {
        return severity.isAtLeast(GibberishSeverity.MODERATE);
    }
}
