package FAConvert.Model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class AutomatonTest {
  private static Automaton.Builder scenario() {
    return Automaton.builder()
        .addSymbols(List.of("a", "b"))
        .addStates(List.of("q0", "q1", "q2"))
        .addInitial("q0")
        .addFinal("q2")
        .addTransition("q0", Automaton.EPSILON, "q1")
        .addTransition("q1", "a", "q2");
  }

  @Test
  void testBuild() {
    Automaton automaton = scenario().build();
    Assertions.assertEquals(3, automaton.size());
    Assertions.assertEquals(List.of("a", "b"), List.copyOf(automaton.getAlphabet()));
    Assertions.assertEquals(Set.of("q0"), automaton.getInitialStates());
    Assertions.assertTrue(automaton.isFinal("q2"));
    Assertions.assertFalse(automaton.isFinal("q0"));
    Assertions.assertEquals(Set.of("q1"), automaton.getTransitions("q0", Automaton.EPSILON));
    Assertions.assertEquals(2, automaton.transitionCount());
    Assertions.assertTrue(automaton.hasEpsilonTransitions());
    Assertions.assertFalse(automaton.isDeterministic());
    Assertions.assertEquals(2, automaton.getInputAlphabet().size());
  }

  @Test
  void testInputAlphabet() {
    Automaton automaton = scenario().build();
    Assertions.assertSame(automaton.getInputAlphabet(), automaton.getInputAlphabet());
    Assertions.assertEquals(List.of("a", "b"), List.copyOf(automaton.getInputAlphabet()));
    Assertions.assertEquals(1, automaton.getInputAlphabet().getSymbolIndex("b"));
  }

  @Test
  void testMissingTransitionsAreEmpty() {
    Automaton automaton = scenario().build();
    Assertions.assertTrue(automaton.getTransitions("q2", "a").isEmpty());
    Assertions.assertTrue(automaton.getTransitions("q2").isEmpty());
    Assertions.assertTrue(automaton.getTransitions("unknown", "a").isEmpty());
  }

  @Test
  void testImmutable() {
    Automaton automaton = scenario().build();
    Assertions.assertThrows(UnsupportedOperationException.class, () -> automaton.getStates().add("q3"));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> automaton.getFinalStates().clear());
    Assertions.assertThrows(UnsupportedOperationException.class,
        () -> automaton.getTransitions("q1", "a").add("q0"));
  }

  @Test
  void testSchemaErrors() {
    Assertions.assertThrows(SchemaException.class, () -> scenario().addInitial("x").build());
    Assertions.assertThrows(SchemaException.class, () -> scenario().addFinal("x").build());
    Assertions.assertThrows(SchemaException.class, () -> scenario().addTransition("x", "a", "q0").build());
    Assertions.assertThrows(SchemaException.class, () -> scenario().addTransition("q0", "a", "x").build());
    Assertions.assertThrows(SchemaException.class, () -> scenario().addTransition("q0", "c", "q1").build());
    Assertions.assertThrows(SchemaException.class, () -> scenario().addSymbol(Automaton.EPSILON).build());
  }

  @Test
  void testDeterminism() {
    Automaton.Builder b = Automaton.builder()
        .addSymbols(List.of("a"))
        .addStates(List.of("p", "q"))
        .addInitial("p")
        .addTransition("p", "a", "q");
    Assertions.assertTrue(b.build().isDeterministic());
    Assertions.assertFalse(b.addTransition("p", "a", "p").build().isDeterministic());

    Automaton twoInitials = Automaton.builder()
        .addSymbols(List.of("a"))
        .addStates(List.of("p", "q"))
        .addInitialStates(List.of("p", "q"))
        .build();
    Assertions.assertFalse(twoInitials.isDeterministic());
  }

  @Test
  void testEqualityAndToBuilder() {
    Automaton automaton = scenario().build();
    Assertions.assertEquals(automaton, scenario().build());
    Assertions.assertEquals(automaton.hashCode(), scenario().build().hashCode());
    Assertions.assertEquals(automaton, automaton.toBuilder().build());

    Automaton extended = automaton.toBuilder().addTransition("q2", "b", "q0").build();
    Assertions.assertNotEquals(automaton, extended);
    Assertions.assertTrue(automaton.getTransitions("q2", "b").isEmpty()); // original untouched
  }
}
