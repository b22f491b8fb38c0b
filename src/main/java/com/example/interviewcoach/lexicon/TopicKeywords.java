package com.example.interviewcoach.lexicon;

import com.example.interviewcoach.model.QuestionType;

import java.util.List;

/**
 * Keywords that identify a question topic and that a relevant answer is expected to echo.
 */
public record TopicKeywords(
        QuestionType type,
        List<String> keywords
) {
    public TopicKeywords {
        keywords = List.copyOf(keywords);
    }
}
