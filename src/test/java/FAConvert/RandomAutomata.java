package FAConvert;

import java.util.List;
import java.util.Random;

import FAConvert.Model.Automaton;
import net.automatalib.common.util.random.RandomUtil;

/**
 * Random automata in the style of Tabakov and Vardi,
 * <a href="https://doi.org/10.1007/11591191_28">Experimental Evaluation of Classical Automata Constructions</a>,
 * extended with epsilon transitions and additional initial states.
 */
public class RandomAutomata {
    public static final List<String> ALPHABET = List.of("a", "b");

    /**
     * @param r
     *      random instance
     * @param size
     *      number of states, named q0 .. q(size-1)
     * @param edgeNum
     *      number of edges per letter
     * @param epsilonNum
     *      number of epsilon edges
     * @param acceptNum
     *      number of accepting states (at least one)
     * @param initialNum
     *      number of initial states (at least one)
     * @return
     *      a random automaton, not necessarily connected
     */
    public static Automaton generate(Random r, int size, int edgeNum, int epsilonNum, int acceptNum, int initialNum) {
        assert acceptNum > 0 && acceptNum <= size;
        assert initialNum > 0 && initialNum <= size;

        Automaton.Builder b = Automaton.builder().addSymbols(ALPHABET);
        for (int i = 0; i < size; i++) {
            b.addState(name(i));
        }
        // per the paper, the first state is always initial and accepting
        b.addInitial(name(0)).addFinal(name(0));
        for (int f : RandomUtil.distinctIntegers(r, acceptNum - 1, 1, size)) {
            b.addFinal(name(f));
        }
        for (int i : RandomUtil.distinctIntegers(r, initialNum - 1, 1, size)) {
            b.addInitial(name(i));
        }
        for (String a : ALPHABET) {
            for (int edgeIndex : RandomUtil.distinctIntegers(r, edgeNum, size * size)) {
                b.addTransition(name(edgeIndex / size), a, name(edgeIndex % size));
            }
        }
        for (int edgeIndex : RandomUtil.distinctIntegers(r, epsilonNum, size * size)) {
            b.addTransition(name(edgeIndex / size), Automaton.EPSILON, name(edgeIndex % size));
        }
        return b.build();
    }

    public static Automaton epsilonNFA(int randomSeed, int size) {
        final Random random = new Random(randomSeed);
        return generate(random, size, Math.round(1.25f * size), Math.round(0.5f * size),
            Math.max(1, Math.round(0.5f * size)), 1 + random.nextInt(2));
    }

    public static Automaton nfa(int randomSeed, int size) {
        final Random random = new Random(randomSeed);
        return generate(random, size, Math.round(1.25f * size), 0,
            Math.max(1, Math.round(0.5f * size)), 1 + random.nextInt(2));
    }

    static String name(int i) {
        return "q" + i;
    }
}
