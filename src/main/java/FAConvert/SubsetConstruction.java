package FAConvert;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import FAConvert.Model.Automaton;
import FAConvert.Model.DeterministicAutomaton;
import FAConvert.Model.PreconditionException;
import FAConvert.Model.StateLimitExceededException;
import FAConvert.Model.SubsetKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction: converts an epsilon-free NFA (possibly with several initial states) into a complete DFA.
 * Each DFA state is a set of NFA states, named by {@link SubsetKey}. Empty successor sets are routed to
 * the sink {@link #SINK}, which loops on every symbol.
 */
public class SubsetConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(SubsetConstruction.class);

    public static final String SINK = SubsetKey.EMPTY_NAME;
    public static final int NO_LIMIT = Integer.MAX_VALUE;

    private final int maxStates;

    public SubsetConstruction() {
        this(NO_LIMIT);
    }

    /**
     * @param maxStates - upper bound on the number of DFA states, sink included
     */
    public SubsetConstruction(int maxStates) {
        if (maxStates < 1) {
            throw new IllegalArgumentException("maxStates must be positive: " + maxStates);
        }
        this.maxStates = maxStates;
    }

    public static DeterministicAutomaton determinize(Automaton nfa) {
        return new SubsetConstruction().run(nfa);
    }

    /**
     * @param nfa - epsilon-free automaton
     * @return DFA with states sorted by name
     * @throws PreconditionException if {@code nfa} has epsilon transitions
     * @throws StateLimitExceededException if the DFA would have more than the configured number of states
     */
    public DeterministicAutomaton run(Automaton nfa) {
        if (nfa.hasEpsilonTransitions()) {
            throw new PreconditionException(
                "Automaton has epsilon transitions; eliminate them before determinizing");
        }

        final TreeSet<String> alphabet = new TreeSet<>(nfa.getAlphabet());
        final SubsetKey init = SubsetKey.of(nfa.getInitialStates());

        SortedMap<String, SortedMap<String, String>> table = new TreeMap<>();
        TreeSet<String> finals = new TreeSet<>();
        Set<SubsetKey> visited = new HashSet<>();
        Deque<SubsetKey> queue = new ArrayDeque<>();
        boolean sinkUsed = init.isEmpty();

        visited.add(init);
        queue.add(init);

        while (!queue.isEmpty()) {
            SubsetKey curr = queue.poll();
            SortedMap<String, String> row = new TreeMap<>();
            table.put(curr.getName(), row);
            if (isAccepting(nfa, curr)) {
                finals.add(curr.getName());
            }

            for (String sym : alphabet) {
                TreeSet<String> succStates = new TreeSet<>();
                for (String s : curr.getMembers()) {
                    succStates.addAll(nfa.getTransitions(s, sym));
                }
                if (succStates.isEmpty()) {
                    row.put(sym, SINK);
                    sinkUsed = true;
                    continue;
                }
                SubsetKey succ = SubsetKey.of(succStates);
                row.put(sym, succ.getName());
                if (visited.add(succ)) {
                    checkLimit(visited.size() + (sinkUsed ? 1 : 0));
                    queue.add(succ);
                }
            }
        }

        if (sinkUsed) {
            checkLimit(table.containsKey(SINK) ? table.size() : table.size() + 1);
            SortedMap<String, String> sinkRow = new TreeMap<>();
            for (String sym : alphabet) {
                sinkRow.put(sym, SINK);
            }
            table.put(SINK, sinkRow);
        }

        LOG.debug("Subset construction: {} NFA states -> {} DFA states{}",
            nfa.size(), table.size(), sinkUsed ? " (with sink)" : "");
        return new DeterministicAutomaton(alphabet, table.keySet(), init.getName(), finals, table);
    }

    private void checkLimit(int states) {
        if (states > maxStates) {
            throw new StateLimitExceededException(maxStates);
        }
    }

    private static boolean isAccepting(Automaton nfa, SubsetKey subset) {
        for (String s : subset.getMembers()) {
            if (nfa.isFinal(s)) {
                return true;
            }
        }
        return false;
    }
}
