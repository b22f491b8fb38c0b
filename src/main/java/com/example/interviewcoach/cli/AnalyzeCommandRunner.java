package com.example.interviewcoach.cli;

import com.example.interviewcoach.ingestion.ExtractionException;
import com.example.interviewcoach.model.AnalysisResult;
import com.example.interviewcoach.model.BehavioralQuestion;
import com.example.interviewcoach.service.InterviewAssessmentService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Command-line entry point.
 *
 * <p>Options:
 * <ul>
 *   <li>{@code --answer=<text>} analyze an inline answer</li>
 *   <li>{@code --answer-file=<path>} analyze a UTF-8 text file</li>
 *   <li>{@code --document=<path>} extract and analyze a PDF</li>
 *   <li>{@code --question=<text>} question that was asked (enables the relevance check)</li>
 *   <li>{@code --list-questions} print the question bank</li>
 * </ul>
 * Results are printed to standard output as JSON.
 */
@Component
public class AnalyzeCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommandRunner.class);

    private final InterviewAssessmentService assessmentService;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private int exitCode;

    @Autowired
    public AnalyzeCommandRunner(InterviewAssessmentService assessmentService, ObjectMapper objectMapper) {
        this(assessmentService, objectMapper, System.out);
    }

    AnalyzeCommandRunner(InterviewAssessmentService assessmentService, ObjectMapper objectMapper, PrintStream out) {
        this.assessmentService = assessmentService;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption("list-questions")) {
            List<BehavioralQuestion> questions = assessmentService.questions();
            print(questions);
            return;
        }

        String question = option(args, "question");
        try {
            if (args.containsOption("document")) {
                Path document = pathOption(args, "document");
                log.info("Analyzing document answer '{}'", document);
                AnalysisResult result = assessmentService
                        .assessDocument(Files.readAllBytes(document), question)
                        .join();
                print(result);
            } else if (args.containsOption("answer-file")) {
                Path file = pathOption(args, "answer-file");
                String answer = Files.readString(file, StandardCharsets.UTF_8);
                print(assessmentService.assessText(answer, question));
            } else if (args.containsOption("answer")) {
                print(assessmentService.assessText(option(args, "answer"), question));
            } else {
                log.info("Nothing to analyze. Use --answer=<text>, --answer-file=<path>, "
                        + "--document=<path.pdf> [--question=<text>] or --list-questions");
            }
        } catch (IOException e) {
            log.error("Unable to read input: {}", e.getMessage());
            exitCode = 2;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ExtractionException) {
                log.error("Document extraction failed: {}", cause.getMessage());
                exitCode = 3;
            } else {
                throw e;
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void print(Object value) {
        try {
            out.println(objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize output: " + e.getMessage(), e);
        }
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static Path pathOption(ApplicationArguments args, String name) throws IOException {
        String value = option(args, name);
        if (value == null || value.isBlank()) {
            throw new IOException("--%s requires a path".formatted(name));
        }
        return Path.of(value);
    }
}
