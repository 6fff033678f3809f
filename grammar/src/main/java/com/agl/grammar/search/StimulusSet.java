package com.agl.grammar.search;

import com.agl.grammar.core.Grammar;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Training strings plus a shuffled test list mixing grammatical and ungrammatical items, as shown
 * to a participant in one session.
 */
public final class StimulusSet {

    public record TestItem(String string, boolean grammatical) {}

    private final List<String> training;
    private final List<TestItem> test;

    public StimulusSet(List<String> training, List<TestItem> test) {
        this.training = List.copyOf(training);
        this.test = List.copyOf(test);
    }

    public List<String> training() {
        return training;
    }

    public List<TestItem> test() {
        return test;
    }

    /** Draws fresh grammatical strings from the grammar before splitting them. */
    public static Optional<StimulusSet> prepare(Grammar grammar, GrammarSearch.Config config) {
        Set<String> grammatical =
                grammar.produceGrammatical(
                        config.requiredGrammatical(), config.minLength, config.maxLength, config.maxAttempts);
        return prepare(grammar, List.copyOf(grammatical), config);
    }

    /**
     * Splits {@code grammatical} into training and test strings and adds ungrammatical test items.
     * Empty when the grammar cannot supply the numbers the config asks for.
     */
    public static Optional<StimulusSet> prepare(
            Grammar grammar, List<String> grammatical, GrammarSearch.Config config) {
        Objects.requireNonNull(grammar, "grammar");
        if (grammatical.size() < config.requiredGrammatical()) {
            return Optional.empty();
        }
        Set<String> ungrammatical =
                grammar.produceUngrammatical(
                        config.testStringsUngrammatical,
                        config.minLength,
                        config.maxLength,
                        config.maxAttempts);
        if (ungrammatical.size() < config.testStringsUngrammatical) {
            return Optional.empty();
        }
        List<String> pool = new ArrayList<>(grammatical.subList(0, config.requiredGrammatical()));
        Collections.shuffle(pool, config.random);
        List<String> training = pool.subList(0, config.trainingStrings);
        List<TestItem> test = new ArrayList<>();
        for (String string : pool.subList(config.trainingStrings, pool.size())) {
            test.add(new TestItem(string, true));
        }
        for (String string : ungrammatical) {
            test.add(new TestItem(string, false));
        }
        Collections.shuffle(test, config.random);
        return Optional.of(new StimulusSet(training, test));
    }
}
