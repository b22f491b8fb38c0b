package com.example.interviewcoach.analyzer;

import com.example.interviewcoach.model.RelevanceVerdict;
import com.example.interviewcoach.model.StarComponents;
import com.example.interviewcoach.model.VerdictTier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Composes the narrative feedback shown to the candidate.
 * <p>
 * Sections, in fixed order: critical issues (red flags), relevance concerns, structure,
 * ownership and confidence, clarity, missing metrics, overall assessment. Sections
 * without content are omitted entirely.
 */
@Service
public class FeedbackGenerator {

    private static final int MAX_RED_FLAGS_SHOWN = 3;
    private static final int MAX_RELEVANCE_ISSUES_SHOWN = 2;
    private static final double METRICS_ADVICE_BELOW = 8;

    private final StarComponentDetector starDetector;

    public FeedbackGenerator(StarComponentDetector starDetector) {
        this.starDetector = starDetector;
    }

    /**
     * Builds the feedback for a valid answer.
     *
     * @param clarity    final clarity score
     * @param confidence final confidence score
     * @param structure  final structure score
     * @param answer     raw answer text
     * @param redFlags   red flags in detection order
     * @param relevance  relevance verdict, null when no question was supplied
     * @return newline-separated feedback text
     */
    public String generate(int clarity, int confidence, int structure, String answer,
                           List<String> redFlags, RelevanceVerdict relevance) {
        String lower = TextMetrics.lower(answer);
        double avgScore = (clarity + confidence + structure) / 3.0;
        List<String> parts = new ArrayList<>();

        if (redFlags != null && !redFlags.isEmpty()) {
            parts.add("🚨 CRITICAL ISSUES DETECTED:");
            redFlags.stream().limit(MAX_RED_FLAGS_SHOWN).forEach(flag -> parts.add("• " + flag));
            parts.add("");
        }

        if (relevance != null && !relevance.issues().isEmpty()) {
            parts.add("⚠️ RELEVANCE CONCERNS:");
            relevance.issues().stream().limit(MAX_RELEVANCE_ISSUES_SHOWN).forEach(issue -> parts.add("• " + issue));
            parts.add("");
        }

        appendStructure(parts, structure, starDetector.detect(lower));
        appendOwnership(parts, confidence, lower);
        appendClarity(parts, clarity);

        if (!TextMetrics.hasNumbers(lower) && avgScore < METRICS_ADVICE_BELOW) {
            parts.add("📊 MISSING METRICS:");
            parts.add("• No quantifiable results mentioned. Big tech LOVES numbers.");
            parts.add("• Add metrics like: '20% improvement', 'reduced from 2 weeks to 3 days', '$50K saved'.");
            parts.add("");
        }

        parts.add("📝 OVERALL ASSESSMENT:");
        parts.addAll(VerdictTier.of(avgScore).lines());

        return String.join("\n", parts);
    }

    /**
     * Builds the feedback for an answer rejected by the gibberish gate.
     */
    public String rejection(List<String> issues) {
        return "This response cannot be evaluated. "
                + String.join(" ", issues) + " "
                + "In a real interview at companies like Google, Amazon, or Microsoft, "
                + "this type of response would immediately disqualify you. "
                + "Please provide a genuine, thoughtful answer that describes a specific situation "
                + "from your experience.";
    }

    private void appendStructure(List<String> parts, int structure, StarComponents components) {
        List<String> present = components.present();
        List<String> missing = components.missing();

        parts.add("📋 STRUCTURE ANALYSIS:");
        if (structure >= 8) {
            parts.add("• Strong STAR method execution. All components clearly present.");
        } else if (structure >= 5) {
            parts.add("• Partial STAR structure detected. Found: %s."
                    .formatted(present.isEmpty() ? "None" : String.join(", ", present)));
            if (!missing.isEmpty()) {
                parts.add("• Missing: %s. At Google/Amazon, incomplete STAR = incomplete answer."
                        .formatted(String.join(", ", missing)));
            }
        } else if (structure >= 3) {
            parts.add("• Weak structure. Your answer rambles without clear organization.");
            parts.add("• Missing STAR components: %s.".formatted(String.join(", ", missing)));
            parts.add("• Big tech interviewers are trained to detect missing structure - this would hurt your scorecard.");
        } else {
            parts.add("• No discernible STAR structure. This is a fundamental requirement for behavioral interviews.");
            parts.add("• At companies like Meta, Microsoft, or Amazon, this answer would receive a 'Not Inclined' rating.");
        }
        parts.add("");
    }

    private void appendOwnership(List<String> parts, int confidence, String lower) {
        parts.add("💪 OWNERSHIP & CONFIDENCE:");
        if (confidence >= 8) {
            parts.add("• Good use of first-person ownership. You clearly articulated your individual contributions.");
        } else if (confidence >= 5) {
            int weCount = TextMetrics.countOccurrences(lower, " we ");
            int iCount = TextMetrics.countOccurrences(lower, " i ");
            if (weCount > iCount) {
                parts.add("• Too much 'we' and not enough 'I'. Interviewers want to know what YOU did, not your team.");
                parts.add("• Hiring managers will ask: 'But what was YOUR specific contribution?'");
            } else {
                parts.add("• Moderate confidence shown. Add more action verbs (led, drove, delivered, achieved).");
            }
        } else if (confidence >= 3) {
            parts.add("• Weak ownership demonstrated. You sound unsure of your own contributions.");
            parts.add("• Hedging words like 'maybe', 'I think', 'sort of' undermine your credibility.");
        } else {
            parts.add("• Poor confidence projection. In a real interview, this would raise doubts about your capabilities.");
            parts.add("• Senior interviewers specifically look for candidates who can clearly articulate their impact.");
        }
        parts.add("");
    }

    private void appendClarity(List<String> parts, int clarity) {
        parts.add("🎯 CLARITY & COMMUNICATION:");
        if (clarity >= 8) {
            parts.add("• Clear, well-structured sentences. Easy to follow your narrative.");
        } else if (clarity >= 5) {
            parts.add("• Acceptable clarity but could be sharper. Aim for concise, punchy sentences.");
            parts.add("• Remember: interviewers are evaluating 5-8 candidates. Make your points memorable.");
        } else if (clarity >= 3) {
            parts.add("• Unclear communication. Sentences are either too long or too choppy.");
            parts.add("• Practice the 'headline + details' approach: state your point, then elaborate.");
        } else {
            parts.add("• Very poor clarity. Hard to understand your main points.");
            parts.add("• This would be flagged as a communication concern in interviewer feedback.");
        }
        parts.add("");
    }
}
