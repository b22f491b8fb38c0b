package com.example.interviewcoach.analyzer;

import com.example.interviewcoach.lexicon.Lexicon;
import com.example.interviewcoach.lexicon.TopicKeywords;
import com.example.interviewcoach.model.QuestionType;
import com.example.interviewcoach.model.RelevanceVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks whether an answer addresses the topic of its question.
 * <p>
 * The question is classified into the first lexicon topic whose keywords it contains.
 * Starting from a neutral score of 5, the answer is rewarded for echoing the topic
 * keywords and penalized for off-topic signals, missing examples and stock openers.
 */
@Service
public class RelevanceChecker {

    private static final Logger log = LoggerFactory.getLogger(RelevanceChecker.class);

    private static final int BASELINE_SCORE = 5;
    private static final int NO_TOPIC_MATCH_PENALTY = 3;
    private static final int TOPIC_MATCH_BONUS = 2;
    private static final int MIN_TOPIC_MATCHES_FOR_BONUS = 2;
    private static final int OFF_TOPIC_PENALTY = 2;
    private static final int NO_STORY_PENALTY = 2;
    private static final int NO_STORY_MIN_WORDS = 20;
    private static final int GENERIC_OPENER_PENALTY = 2;

    private final Lexicon lexicon;

    public RelevanceChecker(Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    /**
     * Scores the relevance of {@code answer} to {@code question}.
     *
     * @param question question text
     * @param answer   answer text
     * @return verdict with a score clamped to [0, 10]
     */
    public RelevanceVerdict check(String question, String answer) {
        String questionLower = TextMetrics.lower(question);
        String answerLower = TextMetrics.lower(answer);
        List<String> issues = new ArrayList<>();
        int score = BASELINE_SCORE;

        TopicKeywords topic = classify(questionLower);
        QuestionType questionType = topic != null ? topic.type() : QuestionType.NONE;

        if (topic != null) {
            int matches = TextMetrics.countMatches(answerLower, topic.keywords());
            if (matches == 0) {
                issues.add("Answer doesn't address the '%s' aspect of the question".formatted(questionType.label()));
                score -= NO_TOPIC_MATCH_PENALTY;
            } else if (matches >= MIN_TOPIC_MATCHES_FOR_BONUS) {
                score += TOPIC_MATCH_BONUS;
            }
        }

        if (TextMetrics.containsAny(answerLower, lexicon.offTopicPhrases())) {
            issues.add("Contains off-topic indicators");
            score -= OFF_TOPIC_PENALTY;
        }

        boolean tellsStory = TextMetrics.containsAny(answerLower, lexicon.storyIndicators());
        if (!tellsStory && TextMetrics.wordCount(answer) > NO_STORY_MIN_WORDS) {
            issues.add("Doesn't provide a specific example or story");
            score -= NO_STORY_PENALTY;
        }

        for (String opener : lexicon.genericOpeners()) {
            if (answerLower.startsWith(opener) || answerLower.contains(". " + opener)) {
                issues.add("Uses generic statements instead of specific examples");
                score -= GENERIC_OPENER_PENALTY;
                break;
            }
        }

        RelevanceVerdict verdict = new RelevanceVerdict(Math.max(0, Math.min(10, score)), questionType, issues);
        log.debug("Relevance check: type={}, score={}, issues={}", questionType, verdict.relevanceScore(), issues);
        return verdict;
    }

    /** First topic, in lexicon order, with a keyword in the question; null if none. */
    TopicKeywords classify(String questionLower) {
        for (TopicKeywords topic : lexicon.questionTopics()) {
            if (TextMetrics.containsAny(questionLower, topic.keywords())) {
                return topic;
            }
        }
        return null;
    }
}
