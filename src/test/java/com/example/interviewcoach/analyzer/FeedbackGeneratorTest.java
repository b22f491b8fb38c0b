package com.example.interviewcoach.analyzer;

import com.example.interviewcoach.SampleAnswers;
import com.example.interviewcoach.TestLexicons;
import com.example.interviewcoach.model.QuestionType;
import com.example.interviewcoach.model.RelevanceVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FeedbackGeneratorTest {

    private final FeedbackGenerator generator =
            new FeedbackGenerator(new StarComponentDetector(TestLexicons.standard()));

    @Test
    @DisplayName("should render only the core sections for a strong answer")
    void strongAnswer() {
        String feedback = generator.generate(10, 8, 10, SampleAnswers.STRONG, List.of(), null);

        assertThat(feedback).isEqualTo(String.join("\n",
                "📋 STRUCTURE ANALYSIS:",
                "• Strong STAR method execution. All components clearly present.",
                "",
                "💪 OWNERSHIP & CONFIDENCE:",
                "• Good use of first-person ownership. You clearly articulated your individual contributions.",
                "",
                "🎯 CLARITY & COMMUNICATION:",
                "• Clear, well-structured sentences. Easy to follow your narrative.",
                "",
                "📝 OVERALL ASSESSMENT:",
                "• STRONG RESPONSE - Would likely receive a 'Strong Hire' signal for behavioral fit.",
                "• This demonstrates the depth and structure expected at top tech companies."));
    }

    @Test
    @DisplayName("should keep the fixed section order")
    void sectionOrder() {
        RelevanceVerdict relevance = new RelevanceVerdict(2, QuestionType.PERSUADE,
                List.of("first issue", "second issue", "third issue"));

        String feedback = generator.generate(3, 3, 3, SampleAnswers.BRIEF,
                List.of("flag one", "flag two", "flag three", "flag four"), relevance);

        assertThat(feedback).containsSubsequence(
                "🚨 CRITICAL ISSUES DETECTED:",
                "⚠️ RELEVANCE CONCERNS:",
                "📋 STRUCTURE ANALYSIS:",
                "💪 OWNERSHIP & CONFIDENCE:",
                "🎯 CLARITY & COMMUNICATION:",
                "📊 MISSING METRICS:",
                "📝 OVERALL ASSESSMENT:");
        assertThat(feedback).contains("• flag three").doesNotContain("flag four");
        assertThat(feedback).contains("• second issue").doesNotContain("third issue");
        assertThat(feedback).doesNotEndWith("\n");
    }

    @Nested
    @DisplayName("Tiered sections")
    class Tiers {

        @Test
        @DisplayName("should list found and missing components for a partial structure")
        void partialStructure() {
            String answer = "There was a challenge with the build pipeline and in the end the release was a "
                    + "success for the whole company";

            String feedback = generator.generate(5, 5, 5, answer, List.of(), null);

            assertThat(feedback)
                    .contains("• Partial STAR structure detected. Found: SITUATION, RESULT.")
                    .contains("• Missing: TASK, ACTION. At Google/Amazon, incomplete STAR = incomplete answer.");
        }

        @Test
        @DisplayName("should call out 'we' over 'I' in the mid confidence tier")
        void pronounBalance() {
            String feedback = generator.generate(6, 6, 6, SampleAnswers.WE_HEAVY, List.of(), null);

            assertThat(feedback)
                    .contains("• Too much 'we' and not enough 'I'. Interviewers want to know what YOU did, not your team.")
                    .contains("• ACCEPTABLE RESPONSE - 'Inclined' but not exceptional.");
        }

        @Test
        @DisplayName("should suggest action verbs when 'I' dominates in the mid confidence tier")
        void moderateConfidence() {
            String feedback = generator.generate(6, 6, 6, "So I did it and I shipped it", List.of(), null);

            assertThat(feedback).contains("• Moderate confidence shown. Add more action verbs (led, drove, delivered, achieved).");
        }

        @Test
        @DisplayName("should choose the verdict from the mean of the three scores")
        void verdictTiers() {
            assertThat(generator.generate(4, 4, 5, "", List.of(), null)).contains("• WEAK RESPONSE");
            assertThat(generator.generate(2, 2, 2, "", List.of(), null)).contains("• POOR RESPONSE");
            assertThat(generator.generate(1, 1, 2, "", List.of(), null)).contains("• UNACCEPTABLE RESPONSE");
        }

        @Test
        @DisplayName("should skip the metrics advice when numbers are present or the mean is high")
        void metricsAdvice() {
            assertThat(generator.generate(5, 5, 5, "We cut costs by 20%", List.of(), null))
                    .doesNotContain("MISSING METRICS");
            assertThat(generator.generate(8, 8, 8, "no numbers here", List.of(), null))
                    .doesNotContain("MISSING METRICS");
            assertThat(generator.generate(7, 8, 8, "no numbers here", List.of(), null))
                    .contains("MISSING METRICS");
        }
    }

    @Test
    @DisplayName("should explain a rejection with the gibberish issues")
    void rejection() {
        String feedback = generator.rejection(List.of("Contains random or placeholder text"));

        assertThat(feedback)
                .startsWith("This response cannot be evaluated. Contains random or placeholder text In a real interview")
                .endsWith("describes a specific situation from your experience.");
    }
}
