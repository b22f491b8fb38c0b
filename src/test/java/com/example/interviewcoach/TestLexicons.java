package com.example.interviewcoach;

import com.example.interviewcoach.lexicon.Lexicon;
import com.example.interviewcoach.lexicon.ReferenceDataLoader;
import org.springframework.core.io.DefaultResourceLoader;

/**
 * Loads the bundled lexicon once for plain unit tests.
 */
public final class TestLexicons {

    public static final String LEXICON_LOCATION = "classpath:lexicon/hr-lexicon.json";
    public static final String QUESTION_BANK_LOCATION = "classpath:questions/hr-question-bank.json";

    private static Lexicon standard;

    private TestLexicons() {
    }

    public static synchronized Lexicon standard() {
        if (standard == null) {
            standard = loader().loadLexicon(LEXICON_LOCATION);
        }
        return standard;
    }

    public static ReferenceDataLoader loader() {
        return new ReferenceDataLoader(new DefaultResourceLoader());
    }
}
