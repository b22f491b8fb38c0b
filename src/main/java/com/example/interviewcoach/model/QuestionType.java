package com.example.interviewcoach.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Topic a behavioral question is classified into.
 * The label is the form used in the lexicon file and in relevance issue messages.
 */
public enum QuestionType {
    CHALLENGE("challenge"),
    DIFFICULT_TEAM_MEMBER("difficult team member"),
    LEADERSHIP("leadership"),
    FAILED("failed"),
    DEADLINE("deadline"),
    ABOVE_AND_BEYOND("above and beyond"),
    PERSUADE("persuade"),
    FEEDBACK("feedback"),
    NONE("none");

    private final String label;

    QuestionType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
