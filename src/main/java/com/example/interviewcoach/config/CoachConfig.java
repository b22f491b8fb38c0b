package com.example.interviewcoach.config;

import com.example.interviewcoach.lexicon.Lexicon;
import com.example.interviewcoach.lexicon.ReferenceDataLoader;
import com.example.interviewcoach.service.QuestionBank;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wiring of the shared, read-only reference data and of the extraction worker pool.
 */
@Configuration
public class CoachConfig {

    /**
     * Lexicon shared by all detectors. Loaded once; a broken file aborts startup.
     */
    @Bean
    public Lexicon lexicon(ReferenceDataLoader loader, CoachProperties properties) {
        return loader.loadLexicon(properties.lexicon().location());
    }

    @Bean
    public QuestionBank questionBank(ReferenceDataLoader loader, CoachProperties properties) {
        return new QuestionBank(loader.loadQuestions(properties.lexicon().questionBankLocation()));
    }

    /**
     * Bounded pool for blocking document extraction (PDF parsing and OCR).
     */
    @Bean
    public ExecutorService extractionExecutor(CoachProperties properties) {
        int threads = Math.max(1, properties.extraction().workerThreads());
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("extraction-"));
    }

    /**
     * ObjectMapper used to print analysis results.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
