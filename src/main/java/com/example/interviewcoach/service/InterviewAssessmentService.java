package com.example.interviewcoach.service;

import com.example.interviewcoach.ingestion.DocumentTextExtractionService;
import com.example.interviewcoach.model.AnalysisResult;
import com.example.interviewcoach.model.BehavioralQuestion;
import com.example.interviewcoach.orchestrator.AnswerAnalysisOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Facade used by callers: assesses answers given as text or as an uploaded document.
 * <p>
 * Document extraction may block on PDF parsing and OCR, so it runs on the
 * extraction pool; the analysis itself is pure and runs on the completing thread.
 */
@Service
public class InterviewAssessmentService {

    private static final Logger log = LoggerFactory.getLogger(InterviewAssessmentService.class);

    private final DocumentTextExtractionService extractionService;
    private final AnswerAnalysisOrchestrator orchestrator;
    private final QuestionBank questionBank;
    private final ExecutorService extractionExecutor;

    public InterviewAssessmentService(DocumentTextExtractionService extractionService,
                                      AnswerAnalysisOrchestrator orchestrator,
                                      QuestionBank questionBank,
                                      @Qualifier("extractionExecutor") ExecutorService extractionExecutor) {
        this.extractionService = extractionService;
        this.orchestrator = orchestrator;
        this.questionBank = questionBank;
        this.extractionExecutor = extractionExecutor;
    }

    /**
     * Extracts the answer from a document off the caller's thread, then analyzes it.
     *
     * @param document raw PDF bytes
     * @param question question that was asked, may be null
     * @return future completing with the result, or exceptionally with an
     *         {@link com.example.interviewcoach.ingestion.ExtractionException}
     */
    public CompletableFuture<AnalysisResult> assessDocument(byte[] document, String question) {
        return CompletableFuture
                .supplyAsync(() -> extractionService.extractText(document), extractionExecutor)
                .thenApply(text -> {
                    log.info("Document answer extracted ({} characters), starting analysis", text.length());
                    return orchestrator.analyze(text, question);
                });
    }

    public AnalysisResult assessText(String answer, String question) {
        return orchestrator.analyze(answer, question);
    }

    public List<BehavioralQuestion> questions() {
        return questionBank.questions();
    }
}
