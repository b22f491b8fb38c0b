package com.example.interviewcoach.cli;

import com.example.interviewcoach.ingestion.ExtractionException;
import com.example.interviewcoach.model.AnalysisResult;
import com.example.interviewcoach.model.BehavioralQuestion;
import com.example.interviewcoach.service.InterviewAssessmentService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AnalyzeCommandRunnerTest {

    private final InterviewAssessmentService assessmentService = mock(InterviewAssessmentService.class);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private AnalyzeCommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new AnalyzeCommandRunner(assessmentService, objectMapper,
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should print the question bank as JSON")
    void listQuestions() throws IOException {
        when(assessmentService.questions())
                .thenReturn(List.of(new BehavioralQuestion("Tell me about a conflict.", List.of("teamwork"))));

        runner.run(new DefaultApplicationArguments("--list-questions"));

        JsonNode output = objectMapper.readTree(output());
        assertThat(output.get(0).get("question").asText()).isEqualTo("Tell me about a conflict.");
        assertThat(output.get(0).get("focus").get(0).asText()).isEqualTo("teamwork");
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("should analyze an inline answer with its question")
    void inlineAnswer() throws IOException {
        when(assessmentService.assessText("My answer", "The question"))
                .thenReturn(AnalysisResult.rejected("feedback", List.of("issue")));

        runner.run(new DefaultApplicationArguments("--answer=My answer", "--question=The question"));

        JsonNode output = objectMapper.readTree(output());
        assertThat(output.get("valid").asBoolean()).isFalse();
        assertThat(output.get("totalScore").asInt()).isEqualTo(1);
        assertThat(output.get("details").get("redFlags").get(0).asText()).isEqualTo("issue");
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("should read the answer from a UTF-8 file")
    void answerFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("answer.txt");
        Files.writeString(file, "Answer from file", StandardCharsets.UTF_8);
        when(assessmentService.assessText("Answer from file", null))
                .thenReturn(AnalysisResult.rejected("feedback", List.of()));

        runner.run(new DefaultApplicationArguments("--answer-file=" + file));

        verify(assessmentService).assessText("Answer from file", null);
        assertThat(output()).isNotBlank();
    }

    @Test
    @DisplayName("should exit with 2 when the document cannot be read")
    void missingDocument(@TempDir Path dir) {
        runner.run(new DefaultApplicationArguments("--document=" + dir.resolve("absent.pdf")));

        assertThat(runner.getExitCode()).isEqualTo(2);
        verify(assessmentService, never()).assessDocument(any(), any());
        assertThat(output()).isEmpty();
    }

    @Test
    @DisplayName("should exit with 2 when a path option has no value")
    void pathOptionWithoutValue() {
        runner.run(new DefaultApplicationArguments("--answer-file"));

        assertThat(runner.getExitCode()).isEqualTo(2);
    }

    @Test
    @DisplayName("should exit with 3 when the document yields no text")
    void extractionFailure(@TempDir Path dir) throws IOException {
        Path document = dir.resolve("scan.pdf");
        Files.write(document, new byte[]{1, 2, 3});
        when(assessmentService.assessDocument(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new ExtractionException("no text")));

        runner.run(new DefaultApplicationArguments("--document=" + document));

        assertThat(runner.getExitCode()).isEqualTo(3);
        assertThat(output()).isEmpty();
    }

    @Test
    @DisplayName("should do nothing without an input option")
    void noInput() {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(assessmentService);
        assertThat(runner.getExitCode()).isZero();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
