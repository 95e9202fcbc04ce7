package FAConvert;

import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import FAConvert.Model.Automaton;
import FAConvert.Model.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites an automaton with epsilon transitions into an equivalent epsilon-free NFA.
 * Multiple initial states are absorbed into the union of their closures; no state is added.
 */
public class EpsilonEliminator {
    private static final Logger LOG = LoggerFactory.getLogger(EpsilonEliminator.class);

    private EpsilonEliminator() {}

    /**
     * @param automaton - automaton, possibly with epsilon transitions
     * @return epsilon-free automaton with the same states and language;
     *     {@code automaton} itself if it has no epsilon transitions
     * @throws SchemaException if a transition refers to an undeclared state or symbol
     */
    public static Automaton eliminate(Automaton automaton) {
        recheckSchema(automaton);
        if (!automaton.hasEpsilonTransitions()) {
            LOG.debug("No epsilon transitions, nothing to eliminate");
            return automaton;
        }

        final EpsilonClosure closure = new EpsilonClosure(automaton);
        Automaton.Builder out = Automaton.builder()
            .addStates(automaton.getStates())
            .addSymbols(automaton.getAlphabet());

        for (String s : automaton.getStates()) {
            SortedSet<String> sClosure = closure.closure(s);
            for (String a : automaton.getAlphabet()) {
                TreeSet<String> dest = new TreeSet<>();
                for (String e : sClosure) {
                    for (String d : automaton.getTransitions(e, a)) {
                        dest.addAll(closure.closure(d));
                    }
                }
                out.addTransitions(s, a, dest);
            }
            if (intersects(sClosure, automaton.getFinalStates())) {
                out.addFinal(s);
            }
        }
        for (String i : automaton.getInitialStates()) {
            out.addInitialStates(closure.closure(i));
        }

        Automaton result = out.build();
        LOG.debug("Eliminated epsilon transitions: {} -> {} transitions, {} initial states",
            automaton.transitionCount(), result.transitionCount(), result.getInitialStates().size());
        return result;
    }

    static boolean intersects(SortedSet<String> a, SortedSet<String> b) {
        SortedSet<String> smaller = a.size() <= b.size() ? a : b;
        SortedSet<String> larger = smaller == a ? b : a;
        for (String s : smaller) {
            if (larger.contains(s)) {
                return true;
            }
        }
        return false;
    }

    private static void recheckSchema(Automaton automaton) {
        for (String origin : automaton.getStates()) {
            for (Map.Entry<String, SortedSet<String>> e : automaton.getTransitions(origin).entrySet()) {
                if (!Automaton.EPSILON.equals(e.getKey()) && !automaton.getAlphabet().contains(e.getKey())) {
                    throw new SchemaException("Transition symbol is not in the alphabet: " + e.getKey());
                }
                for (String d : e.getValue()) {
                    if (!automaton.getStates().contains(d)) {
                        throw new SchemaException("Transition destination is not a declared state: " + d);
                    }
                }
            }
        }
    }
}
