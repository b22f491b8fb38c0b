package com.example.interviewcoach.model;

import java.util.List;

/**
 * Overall verdict bands on the mean of clarity, confidence and structure.
 * Bands are checked from the top; the first one whose floor is reached wins.
 */
public enum VerdictTier {
    STRONG(8, List.of(
            "• STRONG RESPONSE - Would likely receive a 'Strong Hire' signal for behavioral fit.",
            "• This demonstrates the depth and structure expected at top tech companies.")),
    ACCEPTABLE(6, List.of(
            "• ACCEPTABLE RESPONSE - 'Inclined' but not exceptional.",
            "• In a competitive loop, this might not be enough. Aim higher.")),
    WEAK(4, List.of(
            "• WEAK RESPONSE - Would likely receive a 'Not Inclined' rating.",
            "• At companies like Amazon (Bar Raiser interviews), this would be concerning.",
            "• You need significant improvement in structure and specificity.")),
    POOR(2, List.of(
            "• POOR RESPONSE - Would result in 'Strong No Hire' feedback.",
            "• This answer shows lack of preparation for behavioral interviews.",
            "• Recommend: Study STAR method, prepare 6-8 stories with specific metrics.")),
    UNACCEPTABLE(Double.NEGATIVE_INFINITY, List.of(
            "• UNACCEPTABLE RESPONSE - Interview would likely be stopped early.",
            "• This type of answer suggests either unprepared candidate or poor fit.",
            "• Action required: Complete preparation overhaul before real interviews."));

    private final double floor;
    private final List<String> lines;

    VerdictTier(double floor, List<String> lines) {
        this.floor = floor;
        this.lines = lines;
    }

    public List<String> lines() {
        return lines;
    }

    public static VerdictTier of(double meanScore) {
        for (VerdictTier tier : values()) {
            if (meanScore >= tier.floor) {
                return tier;
            }
        }
        return UNACCEPTABLE;
    }
}
