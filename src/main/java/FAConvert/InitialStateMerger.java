package FAConvert;

import FAConvert.Model.Automaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces several initial states by one fresh initial state with epsilon transitions to each of them.
 */
public class InitialStateMerger {
    private static final Logger LOG = LoggerFactory.getLogger(InitialStateMerger.class);

    public static final String NEW_INITIAL = "Q_novo_inicial";

    private InitialStateMerger() {}

    /**
     * @return an automaton with at most one initial state; {@code automaton} itself if it already has at most one
     */
    public static Automaton merge(Automaton automaton) {
        if (automaton.getInitialStates().size() <= 1) {
            return automaton;
        }
        String fresh = freshName(automaton);
        Automaton.Builder result = Automaton.builder()
            .addStates(automaton.getStates())
            .addState(fresh)
            .addSymbols(automaton.getAlphabet())
            .addFinalStates(automaton.getFinalStates())
            .addInitial(fresh)
            .addTransitions(fresh, Automaton.EPSILON, automaton.getInitialStates());
        for (String s : automaton.getStates()) {
            automaton.getTransitions(s).forEach((sym, dest) -> result.addTransitions(s, sym, dest));
        }
        LOG.debug("Merged {} initial states into {}", automaton.getInitialStates().size(), fresh);
        return result.build();
    }

    /**
     * @return {@link #NEW_INITIAL}, or the first of {@code Q0_novo, Q1_novo, ...} that is not a state yet
     */
    static String freshName(Automaton automaton) {
        String name = NEW_INITIAL;
        for (int i = 0; automaton.getStates().contains(name); i++) {
            name = "Q" + i + "_novo";
        }
        return name;
    }
}
