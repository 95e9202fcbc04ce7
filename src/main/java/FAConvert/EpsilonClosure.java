package FAConvert;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import FAConvert.Model.Automaton;

/**
 * Epsilon closures over one automaton. Single-state closures are cached for the lifetime of the instance.
 */
public class EpsilonClosure {
    private final Automaton automaton;
    private final Map<String, SortedSet<String>> cache = new HashMap<>();

    public EpsilonClosure(Automaton automaton) {
        this.automaton = automaton;
    }

    /**
     * @param state a state of the automaton
     * @return states reachable from {@code state} via zero or more epsilon transitions
     */
    public SortedSet<String> closure(String state) {
        SortedSet<String> result = cache.get(state);
        if (result == null) {
            result = Collections.unmodifiableSortedSet(compute(Collections.singleton(state)));
            cache.put(state, result);
        }
        return result;
    }

    /**
     * @param seed states to start from
     * @return the smallest superset of {@code seed} closed under epsilon transitions
     */
    public SortedSet<String> closure(Collection<String> seed) {
        if (seed.size() == 1) {
            return closure(seed.iterator().next());
        }
        return compute(seed);
    }

    private TreeSet<String> compute(Collection<String> seed) {
        TreeSet<String> result = new TreeSet<>(seed);
        Deque<String> stack = new ArrayDeque<>(seed);
        while (!stack.isEmpty()) {
            String curr = stack.pop();
            for (String succ : automaton.getTransitions(curr, Automaton.EPSILON)) {
                if (result.add(succ)) {
                    stack.push(succ);
                }
            }
        }
        return result;
    }

    /**
     * States reachable from {@code states} by exactly one {@code symbol}-transition (epsilon not followed).
     */
    public SortedSet<String> move(Collection<String> states, String symbol) {
        TreeSet<String> result = new TreeSet<>();
        for (String s : states) {
            result.addAll(automaton.getTransitions(s, symbol));
        }
        return result;
    }
}
