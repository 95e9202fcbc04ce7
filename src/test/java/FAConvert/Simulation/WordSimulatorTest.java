package FAConvert.Simulation;

import FAConvert.AutomataLibBridge;
import FAConvert.EpsilonClosure;
import FAConvert.EpsilonEliminator;
import FAConvert.Languages;
import FAConvert.RandomAutomata;
import FAConvert.Scenarios;
import FAConvert.Model.Automaton;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.word.Word;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

public class WordSimulatorTest {
  @Test
  void testEpsilonToA() {
    WordSimulator simulator = new WordSimulator(Scenarios.epsilonToA());
    Assertions.assertTrue(simulator.accepts("a"));
    Assertions.assertFalse(simulator.accepts(""));
    Assertions.assertFalse(simulator.accepts("b"));
    Assertions.assertFalse(simulator.accepts("aa"));
    Assertions.assertTrue(simulator.accepts(Word.fromLetter("a")));
  }

  @Test
  void testEmptyWordMatchesInitialClosure() {
    for (int seed = 0; seed < 200; seed++) {
      Automaton automaton = RandomAutomata.epsilonNFA(seed, 5);
      boolean expected = !Collections.disjoint(
          new EpsilonClosure(automaton).closure(automaton.getInitialStates()), automaton.getFinalStates());
      Assertions.assertEquals(expected, WordSimulator.accepts(automaton, ""), "seed " + seed);
      Assertions.assertEquals(expected, WordSimulator.accepts(automaton, Word.epsilon()), "seed " + seed);
    }
  }

  @Test
  void testEpsilonAfterSymbol() {
    // p -a-> q -ε-> r, r final
    Automaton automaton = Automaton.builder()
        .addSymbols(List.of("a"))
        .addStates(List.of("p", "q", "r"))
        .addInitial("p")
        .addFinal("r")
        .addTransition("p", "a", "q")
        .addTransition("q", Automaton.EPSILON, "r")
        .build();
    Assertions.assertTrue(WordSimulator.accepts(automaton, "a"));
    Assertions.assertFalse(WordSimulator.accepts(automaton, "aa"));
  }

  @Test
  void testUnknownSymbolsRejected() {
    Automaton automaton = Scenarios.epsilonToA();
    Assertions.assertDoesNotThrow(() -> WordSimulator.accepts(automaton, "ac"));
    Assertions.assertFalse(WordSimulator.accepts(automaton, "ac"));
    Assertions.assertFalse(WordSimulator.accepts(automaton, "c"));
    Assertions.assertEquals(List.of("c", "x"), WordSimulator.unknownSymbols(automaton, "acxca"));
    Assertions.assertTrue(WordSimulator.unknownSymbols(automaton, "abab").isEmpty());
  }

  @Test
  void testMultipleInitialStates() {
    Automaton automaton = Automaton.builder()
        .addSymbols(List.of("a", "b"))
        .addStates(List.of("i1", "i2", "f"))
        .addInitialStates(List.of("i1", "i2"))
        .addFinal("f")
        .addTransition("i1", "a", "f")
        .addTransition("i2", "b", "f")
        .build();
    Assertions.assertTrue(WordSimulator.accepts(automaton, "a"));
    Assertions.assertTrue(WordSimulator.accepts(automaton, "b"));
    Assertions.assertFalse(WordSimulator.accepts(automaton, "ab"));
  }

  @Test
  void testToWord() {
    Assertions.assertEquals(Word.fromSymbols("a", "b", "c"), WordSimulator.toWord("abc"));
    Assertions.assertEquals(Word.epsilon(), WordSimulator.toWord(""));
    Assertions.assertEquals(1, WordSimulator.toWord("𝔄").length()); // one supplementary code point
  }

  @Tag("IntegTest")
  @Test
  void testAgainstAutomataLib() {
    for (int size = 2; size < 10; size++) {
      for (int seed = 0; seed < 100; seed++) {
        Automaton nfa = EpsilonEliminator.eliminate(RandomAutomata.epsilonNFA(seed, size));
        CompactNFA<String> compact = AutomataLibBridge.toNFA(nfa);
        WordSimulator simulator = new WordSimulator(nfa);
        for (Word<String> w : Languages.allWords(nfa.getAlphabet(), 5)) {
          Assertions.assertEquals(compact.accepts(w), simulator.accepts(w), seed + "; " + size + "; " + w);
        }
      }
    }
  }
}
