package FAConvert.Simulation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;

import FAConvert.EpsilonClosure;
import FAConvert.Model.Automaton;
import net.automatalib.word.Word;

/**
 * Membership queries on arbitrary automata (epsilon transitions, several initial states, nondeterminism).
 * The active set starts as the epsilon closure of the initial states; each symbol is a move followed by a closure.
 * Words containing a symbol outside the alphabet are rejected.
 */
public class WordSimulator {
    private final Automaton automaton;
    private final EpsilonClosure closure;

    public WordSimulator(Automaton automaton) {
        this.automaton = automaton;
        this.closure = new EpsilonClosure(automaton);
    }

    public static boolean accepts(Automaton automaton, Word<String> word) {
        return new WordSimulator(automaton).accepts(word);
    }

    /**
     * @param input - each code point is one symbol
     */
    public static boolean accepts(Automaton automaton, String input) {
        return new WordSimulator(automaton).accepts(toWord(input));
    }

    public boolean accepts(String input) {
        return accepts(toWord(input));
    }

    public boolean accepts(Word<String> word) {
        for (String sym : word) {
            if (!automaton.getAlphabet().contains(sym)) {
                return false;
            }
        }

        SortedSet<String> active = closure.closure(automaton.getInitialStates());
        for (String sym : word) {
            if (active.isEmpty()) {
                return false;
            }
            active = closure.closure(closure.move(active, sym));
        }
        for (String s : active) {
            if (automaton.isFinal(s)) {
                return true;
            }
        }
        return false;
    }

    /**
     * For callers that validate before simulating.
     * @return symbols of {@code word} that are not in the alphabet, in order of first occurrence
     */
    public static List<String> unknownSymbols(Automaton automaton, Word<String> word) {
        Set<String> unknown = new LinkedHashSet<>();
        for (String sym : word) {
            if (!automaton.getAlphabet().contains(sym)) {
                unknown.add(sym);
            }
        }
        return new ArrayList<>(unknown);
    }

    public static List<String> unknownSymbols(Automaton automaton, String input) {
        return unknownSymbols(automaton, toWord(input));
    }

    /**
     * Splits a string into one symbol per code point.
     */
    public static Word<String> toWord(String input) {
        List<String> symbols = new ArrayList<>(input.length());
        input.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return Word.fromList(symbols);
    }
}
