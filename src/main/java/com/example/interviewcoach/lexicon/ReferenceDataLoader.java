package com.example.interviewcoach.lexicon;

import com.example.interviewcoach.model.BehavioralQuestion;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the static reference data (lexicon and question bank) from JSON resources.
 * <p>
 * Locations are Spring resource strings, so both {@code classpath:} and {@code file:}
 * work. Files may carry comments and trailing commas to keep them hand-editable.
 */
@Component
public class ReferenceDataLoader {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataLoader.class);

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ResourceLoader resourceLoader;

    public ReferenceDataLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * Reads the lexicon file.
     *
     * @param location resource location, e.g. {@code classpath:lexicon/hr-lexicon.json}
     * @return immutable lexicon
     * @throws IllegalStateException if the file is missing or malformed
     */
    public Lexicon loadLexicon(String location) {
        Lexicon lexicon = read(location, new TypeReference<Lexicon>() {});
        log.info("Lexicon v{} loaded from {}: {} confidence, {} leadership keywords, {} question topics",
                lexicon.version(), location, lexicon.confidenceKeywords().size(),
                lexicon.leadershipKeywords().size(), lexicon.questionTopics().size());
        return lexicon;
    }

    /**
     * Reads the question bank file, keeping the declared order.
     */
    public List<BehavioralQuestion> loadQuestions(String location) {
        List<BehavioralQuestion> questions = List.copyOf(
                read(location, new TypeReference<List<BehavioralQuestion>>() {}));
        log.info("Question bank loaded from {}: {} questions", location, questions.size());
        return questions;
    }

    private <T> T read(String location, TypeReference<T> type) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Reference data not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            T value = LENIENT_MAPPER.readValue(in, type);
            if (value == null) {
                throw new IllegalStateException("Reference data is empty: " + location);
            }
            return value;
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Unable to read reference data from %s: %s".formatted(location, e.getMessage()), e);
        }
    }
}
