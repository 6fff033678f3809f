package com.agl.grammar;

import com.agl.grammar.core.Alphabet;
import com.agl.grammar.core.Grammar;
import com.agl.grammar.core.GrammarDecodeException;
import com.agl.grammar.core.GrammarKind;
import com.agl.grammar.search.GrammarSearch;
import com.agl.grammar.search.Grammars;
import com.agl.grammar.search.StimulusSet;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Command-line front end. Without {@code --grammar} it searches for a fresh grammar and prints
 * its obfuscated form together with a set of stimuli; with {@code --grammar=<obfuscated>} it
 * restores that grammar and judges every {@code --check=<string>}.
 */
public final class AglGrammars {

    private AglGrammars() {
        // Utility class
    }

    private static final class Options {
        final GrammarSearch.Config config = new GrammarSearch.Config();
        String grammar;
        boolean tokensGiven;
        boolean reveal;
        boolean debug;
        final List<String> checks = new ArrayList<>();
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options options = parse(args, err);
        GrammarSearch.setDebug(options.debug);
        if (options.grammar != null) {
            return judge(options, out, err);
        }
        return generate(options, out, err);
    }

    private static int generate(Options options, PrintStream out, PrintStream err) {
        GrammarSearch.Config config = options.config;
        GrammarSearch search;
        try {
            search = new GrammarSearch(config);
        } catch (IllegalArgumentException e) {
            err.println("Invalid settings: " + e.getMessage());
            return 2;
        }
        out.println("Looking for a suitable random grammar...");
        Optional<GrammarSearch.Result> found = search.run();
        if (found.isEmpty()) {
            err.println("No grammar found that satisfies the current settings. Try relaxing some of them.");
            return 1;
        }
        Grammar grammar = found.get().grammar();
        Optional<StimulusSet> stimuli =
                StimulusSet.prepare(grammar, found.get().grammaticalStrings(), config);
        if (stimuli.isEmpty()) {
            err.println("The grammar cannot produce enough distinct ungrammatical strings.");
            return 1;
        }
        out.println("grammar (" + config.kind + "): " + grammar.obfuscatedRepr());
        if (options.reveal) {
            out.println(grammar);
        }
        out.println("training:");
        for (String string : stimuli.get().training()) {
            out.println("  " + string);
        }
        out.println("test:");
        for (StimulusSet.TestItem item : stimuli.get().test()) {
            out.println("  " + item.string() + (item.grammatical() ? "  y" : "  n"));
        }
        return 0;
    }

    private static int judge(Options options, PrintStream out, PrintStream err) {
        GrammarSearch.Config config = options.config;
        Grammar grammar;
        try {
            Alphabet tokens = options.tokensGiven ? new Alphabet(config.tokens) : null;
            grammar = Grammars.fromObfuscatedRepr(config.kind, options.grammar, tokens, config.random);
        } catch (GrammarDecodeException e) {
            err.println("Loading grammar failed: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Cannot apply tokens to the grammar: " + e.getMessage());
            return 1;
        }
        if (options.reveal) {
            out.println(grammar);
        }
        for (String check : options.checks) {
            out.println(check + "  " + (grammar.recognize(check) ? "grammatical" : "ungrammatical"));
        }
        return 0;
    }

    private static Options parse(String[] args, PrintStream err) {
        Options options = new Options();
        GrammarSearch.Config config = options.config;
        if (args == null) {
            return options;
        }
        for (String arg : args) {
            if (arg == null) {
                continue;
            }
            String value = arg.contains("=") ? arg.substring(arg.indexOf('=') + 1) : "";
            try {
                if (arg.startsWith("--kind=")) {
                    config.kind = GrammarKind.parse(value);
                } else if (arg.startsWith("--tokens=")) {
                    config.tokens = Alphabet.parse(value).tokens();
                    options.tokensGiven = true;
                } else if (arg.startsWith("--training=")) {
                    config.trainingStrings = Integer.parseInt(value);
                } else if (arg.startsWith("--test-grammatical=")) {
                    config.testStringsGrammatical = Integer.parseInt(value);
                } else if (arg.startsWith("--test-ungrammatical=")) {
                    config.testStringsUngrammatical = Integer.parseInt(value);
                } else if (arg.startsWith("--min-length=")) {
                    config.minLength = Integer.parseInt(value);
                } else if (arg.startsWith("--max-length=")) {
                    config.maxLength = Integer.parseInt(value);
                } else if (arg.startsWith("--recursion=")) {
                    config.recursion = Boolean.parseBoolean(value);
                } else if (arg.startsWith("--seed=")) {
                    config.random = new Random(Long.parseLong(value));
                } else if (arg.startsWith("--grammar=")) {
                    options.grammar = value;
                } else if (arg.startsWith("--check=")) {
                    options.checks.add(value);
                } else if (arg.equals("--reveal")) {
                    options.reveal = true;
                } else if (arg.equals("--debug")) {
                    options.debug = true;
                } else {
                    err.println("Ignoring unknown option: " + arg);
                }
            } catch (IllegalArgumentException e) {
                err.println("Invalid value for " + arg + ": " + e.getMessage());
            }
        }
        return options;
    }
}
