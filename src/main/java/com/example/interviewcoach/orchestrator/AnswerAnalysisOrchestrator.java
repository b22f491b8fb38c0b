package com.example.interviewcoach.orchestrator;

import com.example.interviewcoach.analyzer.*;
import com.example.interviewcoach.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Single entry point of the answer analysis pipeline.
 * Pipeline:
 * 1. Gibberish gate (terminal rejection on a moderate or severe verdict)
 * 2. Relevance check (only when a question is supplied)
 * 3. Red-flag detection
 * 4. Clarity, confidence and STAR structure scoring
 * 5. Penalties: red flags hit clarity and confidence, irrelevance hits structure
 * 6. Feedback generation
 * <p>
 * Stateless and free of I/O; safe to call concurrently.
 */
@Service
public class AnswerAnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnswerAnalysisOrchestrator.class);

    /** Penalty points per red flag, before halving. */
    private static final double PENALTY_PER_RED_FLAG = 1.5;
    private static final double MAX_RED_FLAG_PENALTY = 5;
    private static final int IRRELEVANCE_PENALTY = 3;

    private final GibberishDetector gibberishDetector;
    private final RelevanceChecker relevanceChecker;
    private final RedFlagDetector redFlagDetector;
    private final ClarityScorer clarityScorer;
    private final ConfidenceScorer confidenceScorer;
    private final StructureScorer structureScorer;
    private final StarComponentDetector starDetector;
    private final FeedbackGenerator feedbackGenerator;

    public AnswerAnalysisOrchestrator(GibberishDetector gibberishDetector,
                                      RelevanceChecker relevanceChecker,
                                      RedFlagDetector redFlagDetector,
                                      ClarityScorer clarityScorer,
                                      ConfidenceScorer confidenceScorer,
                                      StructureScorer structureScorer,
                                      StarComponentDetector starDetector,
                                      FeedbackGenerator feedbackGenerator) {
        this.gibberishDetector = gibberishDetector;
        this.relevanceChecker = relevanceChecker;
        this.redFlagDetector = redFlagDetector;
        this.clarityScorer = clarityScorer;
        this.confidenceScorer = confidenceScorer;
        this.structureScorer = structureScorer;
        this.starDetector = starDetector;
        this.feedbackGenerator = feedbackGenerator;
    }

    /**
     * Analyzes one answer.
     *
     * @param answer   candidate's answer, may be null or empty
     * @param question question that was asked; null or empty skips the relevance check
     * @return the assessment, never null
     */
    public AnalysisResult analyze(String answer, String question) {
        String text = answer == null ? "" : answer;
        log.debug("Analyzing answer ({} words): \"{}\"", TextMetrics.wordCount(text), preview(text));

        // ── Step 1: Gibberish gate ──
        GibberishVerdict gibberish = gibberishDetector.detect(text);
        if (gibberish.isGibberish()) {
            log.info("Answer rejected by gibberish gate (severity {}): {}",
                    gibberish.severity(), gibberish.issues());
            return AnalysisResult.rejected(feedbackGenerator.rejection(gibberish.issues()), gibberish.issues());
        }

        // ── Step 2: Relevance ──
        RelevanceVerdict relevance = null;
        if (question != null && !question.isEmpty()) {
            relevance = relevanceChecker.check(question, text);
        }

        // ── Step 3: Red flags ──
        List<String> redFlags = redFlagDetector.detect(text);

        // ── Step 4: Scoring ──
        int clarity = clarityScorer.score(text);
        int confidence = confidenceScorer.score(text);
        int structure = structureScorer.score(text);

        // ── Step 5: Penalties ──
        double redFlagPenalty = Math.min(redFlags.size() * PENALTY_PER_RED_FLAG, MAX_RED_FLAG_PENALTY);
        int halfPenalty = (int) (redFlagPenalty / 2);
        int relevancePenalty = relevance != null && !relevance.isRelevant() ? IRRELEVANCE_PENALTY : 0;

        clarity = Math.max(1, clarity - halfPenalty);
        confidence = Math.max(1, confidence - halfPenalty);
        structure = Math.max(1, structure - relevancePenalty);
        int totalScore = (clarity + confidence + structure) / 3;

        // ── Step 6: Feedback ──
        String feedback = feedbackGenerator.generate(clarity, confidence, structure, text, redFlags, relevance);

        AnalysisDetails details = new AnalysisDetails(
                starDetector.detect(text).asMap(),
                confidenceScorer.countConfidenceKeywords(text),
                confidenceScorer.countLeadershipKeywords(text),
                redFlags,
                relevance != null ? relevance.issues() : List.of());

        log.info("Answer analyzed: clarity={}, confidence={}, structure={}, total={}, red flags={}",
                clarity, confidence, structure, totalScore, redFlags.size());
        return new AnalysisResult(clarity, confidence, structure, totalScore, feedback, true, null, details);
    }

    private String preview(String text) {
        String flat = text.replaceAll("\\s+", " ").strip();
        return flat.length() <= 60 ? flat : flat.substring(0, 57) + "...";
    }
}
