package com.example.interviewcoach.lexicon;

import java.util.List;

/**
 * Read-only vocabulary shared by every detector and scorer.
 * <p>
 * Loaded once at startup by {@link ReferenceDataLoader}; all lists are immutable copies,
 * so a single instance is safely shared across concurrent analyses.
 * List order matters wherever a component reports only the first match.
 *
 * @param version                version tag of the lexicon file
 * @param confidenceKeywords     action/achievement verbs that project confidence
 * @param leadershipKeywords     collaboration and leadership vocabulary
 * @param starIndicators         indicator phrases per STAR component
 * @param questionTopics         ordered topic classification table (first match wins)
 * @param gibberishPatterns      regular expressions for degenerate input (first match wins)
 * @param blamePhrases           blame-shifting language
 * @param negativePhrases        negativity about former employers
 * @param vaguePhrases           generic phrases without concrete detail
 * @param hedgingWords           hedging terms counted by the red-flag detector
 * @param confidenceHedgingWords hedging terms penalized by the confidence scorer
 * @param ownershipPhrases       first-person ownership phrases
 * @param offTopicPhrases        signals that the answer drifted away from the question
 * @param storyIndicators        words suggesting a concrete example is being told
 * @param genericOpeners         stock non-answers
 */
public record Lexicon(
        String version,
        List<String> confidenceKeywords,
        List<String> leadershipKeywords,
        StarIndicators starIndicators,
        List<TopicKeywords> questionTopics,
        List<String> gibberishPatterns,
        List<String> blamePhrases,
        List<String> negativePhrases,
        List<String> vaguePhrases,
        List<String> hedgingWords,
        List<String> confidenceHedgingWords,
        List<String> ownershipPhrases,
        List<String> offTopicPhrases,
        List<String> storyIndicators,
        List<String> genericOpeners
) {
    public Lexicon {
        if (starIndicators == null) {
            throw new IllegalStateException("Lexicon is missing 'starIndicators'");
        }
        confidenceKeywords = required(confidenceKeywords, "confidenceKeywords");
        leadershipKeywords = required(leadershipKeywords, "leadershipKeywords");
        questionTopics = required(questionTopics, "questionTopics");
        gibberishPatterns = required(gibberishPatterns, "gibberishPatterns");
        blamePhrases = required(blamePhrases, "blamePhrases");
        negativePhrases = required(negativePhrases, "negativePhrases");
        vaguePhrases = required(vaguePhrases, "vaguePhrases");
        hedgingWords = required(hedgingWords, "hedgingWords");
        confidenceHedgingWords = required(confidenceHedgingWords, "confidenceHedgingWords");
        ownershipPhrases = required(ownershipPhrases, "ownershipPhrases");
        offTopicPhrases = required(offTopicPhrases, "offTopicPhrases");
        storyIndicators = required(storyIndicators, "storyIndicators");
        genericOpeners = required(genericOpeners, "genericOpeners");
    }

    private static <T> List<T> required(List<T> values, String name) {
        if (values == null) {
            throw new IllegalStateException("Lexicon is missing '%s'".formatted(name));
        }
        return List.copyOf(values);
    }
}
