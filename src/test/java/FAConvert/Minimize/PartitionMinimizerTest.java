package FAConvert.Minimize;

import FAConvert.AutomataLibBridge;
import FAConvert.RandomAutomata;
import FAConvert.Scenarios;
import FAConvert.SubsetConstruction;
import FAConvert.Model.DeterministicAutomaton;
import FAConvert.Model.PreconditionException;
import FAConvert.Model.SchemaException;
import FAConvert.Simulation.WordSimulator;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

public class PartitionMinimizerTest {
  private static final List<String> WORDS = List.of("", "0", "1", "01", "10", "11", "011", "0110", "1111");

  @Test
  void testAlreadyMinimal() {
    DeterministicAutomaton dfa = Scenarios.endsWithOne();
    DeterministicAutomaton min = PartitionMinimizer.minimizeDFA(dfa);
    Assertions.assertEquals(2, min.size());
    Assertions.assertEquals(List.of("S0", "S1"), min.getStates());
    Assertions.assertEquals("S0", min.getInitialState());
    Assertions.assertEquals(List.of("S1"), min.getFinalStates());
    Assertions.assertEquals("S1", min.getSuccessor("S0", "1"));
    Assertions.assertEquals("S0", min.getSuccessor("S1", "0"));
    assertSameAnswers(dfa, min);
  }

  @Test
  void testEquivalentStatesMerged() {
    DeterministicAutomaton dfa = Scenarios.lengthAtLeastTwo();
    DeterministicAutomaton min = PartitionMinimizer.minimizeDFA(dfa);
    Assertions.assertEquals(3, min.size());
    // S0 = {A}, S1 = {B, C}, S2 = {D}
    Assertions.assertEquals("S0", min.getInitialState());
    Assertions.assertEquals("S1", min.getSuccessor("S0", "0"));
    Assertions.assertEquals("S1", min.getSuccessor("S0", "1"));
    Assertions.assertEquals("S2", min.getSuccessor("S1", "1"));
    Assertions.assertEquals(List.of("S2"), min.getFinalStates());
    assertSameAnswers(dfa, min);
  }

  @Test
  void testInitialBlockIsS0() {
    // initial state "z" sorts last but its block is still named S0
    DeterministicAutomaton dfa = new DeterministicAutomaton(List.of("a"), List.of("a1", "z"), "z", List.of("a1"),
        Map.of("z", Map.of("a", "a1"), "a1", Map.of("a", "a1")));
    DeterministicAutomaton min = PartitionMinimizer.minimizeDFA(dfa);
    Assertions.assertEquals("S0", min.getInitialState());
    Assertions.assertEquals(List.of("S1"), min.getFinalStates());
  }

  @Test
  void testPartialDFA() {
    // p -a-> q -a-> r, r final; missing transitions reject
    DeterministicAutomaton dfa = new DeterministicAutomaton(List.of("a", "b"), List.of("p", "q", "r"), "p",
        List.of("r"), Map.of("p", Map.of("a", "q"), "q", Map.of("a", "r")));
    DeterministicAutomaton min = PartitionMinimizer.minimizeDFA(dfa);
    Assertions.assertEquals(3, min.size());
    Assertions.assertFalse(min.isComplete());
    Assertions.assertNull(min.getSuccessor("S0", "b"));
    Assertions.assertTrue(WordSimulator.accepts(min.toAutomaton(), "aa"));
    Assertions.assertFalse(WordSimulator.accepts(min.toAutomaton(), "a"));
    Assertions.assertFalse(WordSimulator.accepts(min.toAutomaton(), "ab"));
  }

  @Test
  void testDeadStatesKept() {
    // d never reaches a final state but is still mapped to its own block
    DeterministicAutomaton dfa = new DeterministicAutomaton(List.of("a", "b"), List.of("d", "f", "p"), "p",
        List.of("f"), Map.of("p", Map.of("a", "f", "b", "d"), "d", Map.of("a", "d")));
    DeterministicAutomaton min = PartitionMinimizer.minimizeDFA(dfa);
    Assertions.assertEquals(List.of("S0", "S1", "S2"), min.getStates());
    Assertions.assertEquals("S2", min.getSuccessor("S0", "a"));
    Assertions.assertEquals("S1", min.getSuccessor("S0", "b"));
    Assertions.assertEquals("S1", min.getSuccessor("S1", "a"));
    Assertions.assertNull(min.getSuccessor("S1", "b"));
    Assertions.assertEquals(List.of("S2"), min.getFinalStates());
  }

  @Test
  void testUndefinedTransitionInNoPreimage() {
    // p -a-> d with d non-final and without transitions: {p} and {d} stay apart
    DeterministicAutomaton dfa = new DeterministicAutomaton(List.of("a"), List.of("d", "p"), "p", List.of("p"),
        Map.of("p", Map.of("a", "d")));
    DeterministicAutomaton min = PartitionMinimizer.minimizeDFA(dfa);
    Assertions.assertEquals(2, min.size());
    Assertions.assertEquals("S0", min.getInitialState());
    Assertions.assertEquals(List.of("S0"), min.getFinalStates());
    Assertions.assertEquals("S1", min.getSuccessor("S0", "a"));
    Assertions.assertNull(min.getSuccessor("S1", "a"));
  }

  @Test
  void testTrimOption() {
    // u is unreachable and not equivalent to any reachable state
    DeterministicAutomaton dfa = new DeterministicAutomaton(List.of("a"), List.of("p", "u"), "p", List.of("u"),
        Map.of("p", Map.of("a", "p"), "u", Map.of("a", "p")));
    Assertions.assertEquals(2, new PartitionMinimizer().minimize(dfa).size());
    Assertions.assertEquals(1, new PartitionMinimizer(true).minimize(dfa).size());
  }

  @Test
  void testPreconditions() {
    DeterministicAutomaton empty = new DeterministicAutomaton(List.of("a"), List.of(), null, List.of(), Map.of());
    Assertions.assertThrows(PreconditionException.class, () -> PartitionMinimizer.minimizeDFA(empty));

    DeterministicAutomaton badInitial = new DeterministicAutomaton(List.of("a"), List.of("p"), "x", List.of(),
        Map.of());
    Assertions.assertThrows(PreconditionException.class, () -> PartitionMinimizer.minimizeDFA(badInitial));

    DeterministicAutomaton badTarget = new DeterministicAutomaton(List.of("a"), List.of("p"), "p", List.of(),
        Map.of("p", Map.of("a", "x")));
    Assertions.assertThrows(SchemaException.class, () -> PartitionMinimizer.minimizeDFA(badTarget));

    DeterministicAutomaton badSymbol = new DeterministicAutomaton(List.of("a"), List.of("p"), "p", List.of(),
        Map.of("p", Map.of("b", "p")));
    Assertions.assertThrows(SchemaException.class, () -> PartitionMinimizer.minimizeDFA(badSymbol));

    DeterministicAutomaton badFinal = new DeterministicAutomaton(List.of("a"), List.of("p"), "p", List.of("x"),
        Map.of());
    Assertions.assertThrows(SchemaException.class, () -> PartitionMinimizer.minimizeDFA(badFinal));
  }

  @Test
  void testIdempotent() {
    DeterministicAutomaton once = PartitionMinimizer.minimizeDFA(Scenarios.lengthAtLeastTwo());
    Assertions.assertEquals(once, PartitionMinimizer.minimizeDFA(once));
  }

  @Tag("IntegTest")
  @Test
  void testAgainstHopcroft() {
    PartitionMinimizer minimizer = new PartitionMinimizer(true);
    for (int size = 2; size < 10; size++) {
      for (int seed = 0; seed < 100; seed++) {
        String debug = seed + "; " + size;
        DeterministicAutomaton dfa = SubsetConstruction.determinize(RandomAutomata.nfa(seed, size));
        DeterministicAutomaton min = minimizer.minimize(dfa);

        CompactDFA<String> compactDFA = AutomataLibBridge.toDFA(dfa);
        CompactDFA<String> compactMin = AutomataLibBridge.toDFA(min);
        Alphabet<String> alphabet = compactDFA.getInputAlphabet();
        Assertions.assertTrue(Automata.testEquivalence(compactDFA, compactMin, alphabet), debug);

        CompactDFA<String> hopcroft = HopcroftMinimizer.minimizeDFA(compactDFA, alphabet);
        Assertions.assertEquals(hopcroft.size(), min.size(), debug);
        Assertions.assertEquals(min.size(), minimizer.minimize(min).size(), debug);
      }
    }
  }

  private static void assertSameAnswers(DeterministicAutomaton before, DeterministicAutomaton after) {
    for (String w : WORDS) {
      Assertions.assertEquals(WordSimulator.accepts(before.toAutomaton(), w),
          WordSimulator.accepts(after.toAutomaton(), w), w);
    }
  }
}
