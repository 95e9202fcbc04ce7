package FAConvert;

import FAConvert.Minimize.PartitionMinimizer;
import FAConvert.Model.Automaton;
import FAConvert.Model.DeterministicAutomaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chains the transformations according to what the input automaton already is:
 * epsilon-NFA -> eliminate then determinize; NFA -> determinize; deterministic -> used as is.
 */
public class Pipeline {
    private static final Logger LOG = LoggerFactory.getLogger(Pipeline.class);

    private final SubsetConstruction subsetConstruction;
    private final PartitionMinimizer minimizer;

    public Pipeline() {
        this(new SubsetConstruction(), new PartitionMinimizer());
    }

    public Pipeline(SubsetConstruction subsetConstruction, PartitionMinimizer minimizer) {
        this.subsetConstruction = subsetConstruction;
        this.minimizer = minimizer;
    }

    public DeterministicAutomaton toDFA(Automaton automaton) {
        if (automaton.hasEpsilonTransitions()) {
            LOG.debug("Epsilon transitions found; converting epsilon-NFA -> NFA -> DFA");
            return subsetConstruction.run(EpsilonEliminator.eliminate(automaton));
        }
        if (!automaton.isDeterministic() || automaton.getInitialStates().isEmpty()) {
            LOG.debug("Nondeterministic automaton; converting NFA -> DFA");
            return subsetConstruction.run(automaton);
        }
        return DeterministicAutomaton.fromAutomaton(automaton);
    }

    public Report toMinimalDFA(Automaton automaton) {
        DeterministicAutomaton dfa = toDFA(automaton);
        DeterministicAutomaton minimal = minimizer.minimize(dfa);
        LOG.debug("Minimized DFA: {} -> {} states", dfa.size(), minimal.size());
        return new Report(dfa, minimal);
    }

    /**
     * @param dfa - DFA that was minimized
     * @param minimal - minimization result
     */
    public record Report(DeterministicAutomaton dfa, DeterministicAutomaton minimal) {
        public int statesBefore() {
            return dfa.size();
        }

        public int statesAfter() {
            return minimal.size();
        }

        public int reduction() {
            return statesBefore() - statesAfter();
        }
    }
}
