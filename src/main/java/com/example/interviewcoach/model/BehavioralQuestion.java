package com.example.interviewcoach.model;

import java.util.List;

/**
 * Canned behavioral question with the competencies it probes.
 */
public record BehavioralQuestion(
        String question,
        List<String> focus
) {
    public BehavioralQuestion {
        focus = focus != null ? List.copyOf(focus) : List.of();
    }
}
