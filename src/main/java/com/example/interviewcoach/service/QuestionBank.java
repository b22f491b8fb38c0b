package com.example.interviewcoach.service;

import com.example.interviewcoach.model.BehavioralQuestion;

import java.util.List;

/**
 * Catalog of canned behavioral questions, in a fixed order.
 * Informational only: the scoring pipeline never reads it.
 */
public class QuestionBank {

    private final List<BehavioralQuestion> questions;

    public QuestionBank(List<BehavioralQuestion> questions) {
        this.questions = List.copyOf(questions);
    }

    public List<BehavioralQuestion> questions() {
        return questions;
    }
}
