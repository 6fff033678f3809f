package com.agl.grammar.search;

import static org.junit.jupiter.api.Assertions.*;

import com.agl.grammar.core.GrammarKind;
import com.agl.grammar.pattern.PatternGrammar;
import com.agl.grammar.regular.RegularGrammar;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.Test;

final class GrammarSearchTest {

    @Test
    void defaultSearchFindsARegularGrammar() {
        GrammarSearch.Config config = new GrammarSearch.Config();
        config.random = new Random(7);
        Optional<GrammarSearch.Result> found = new GrammarSearch(config).run();
        assertTrue(found.isPresent());
        GrammarSearch.Result result = found.get();
        assertInstanceOf(RegularGrammar.class, result.grammar());
        assertEquals(config.requiredGrammatical(), result.grammaticalStrings().size());
        for (String string : result.grammaticalStrings()) {
            assertTrue(result.grammar().recognize(string));
        }
    }

    @Test
    void recursionCanBeExcluded() {
        GrammarSearch.Config config = new GrammarSearch.Config();
        config.recursion = false;
        config.trainingStrings = 3;
        config.testStringsGrammatical = 1;
        config.random = new Random(11);
        Optional<GrammarSearch.Result> found = new GrammarSearch(config).run();
        assertTrue(found.isPresent());
        assertFalse(found.get().grammar().hasCycle());
    }

    @Test
    void patternGrammarsCanBeSearched() {
        GrammarSearch.Config config = new GrammarSearch.Config();
        config.kind = GrammarKind.PATTERN;
        config.random = new Random(13);
        Optional<GrammarSearch.Result> found = new GrammarSearch(config).run();
        assertTrue(found.isPresent());
        assertInstanceOf(PatternGrammar.class, found.get().grammar());
        assertEquals(0, found.get().oversize());
    }

    @Test
    void impossibleSettingsRunDry() {
        GrammarSearch.Config config = new GrammarSearch.Config();
        // only 25 distinct strings of length 2 exist over five tokens
        config.trainingStrings = 1000;
        config.minLength = 2;
        config.maxLength = 2;
        config.maxAttempts = 200;
        config.maxGrammarAttempts = 2;
        config.maxOversizeAttempts = 1;
        config.random = new Random(0);
        assertTrue(new GrammarSearch(config).run().isEmpty());
    }

    @Test
    void invalidLengthsAreRejectedUpFront() {
        GrammarSearch.Config config = new GrammarSearch.Config();
        config.minLength = 6;
        config.maxLength = 3;
        assertThrows(IllegalArgumentException.class, () -> new GrammarSearch(config));
    }
}
