package FAConvert.Format;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import FAConvert.AutomataLibBridge;
import FAConvert.Model.Automaton;
import FAConvert.Model.DeterministicAutomaton;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

/**
 * BA transition-list format (https://languageinclusion.org/doku.php?id=tools), read and written with AutomataLib.
 * States are named by their AutomataLib ids, so original BA state labels are not preserved.
 */
public class BAFormat {

    private BAFormat() {}

    public static Automaton read(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> nfa = BAParsers.nfa().readModel(is).model;
        return AutomataLibBridge.fromNFA(nfa, nfa.getInputAlphabet());
    }

    public static void write(OutputStream os, DeterministicAutomaton dfa) throws IOException {
        final CompactDFA<String> compact = AutomataLibBridge.toDFA(dfa);
        BAWriter<String> baWriter = new BAWriter<>();
        baWriter.writeModel(os, compact, compact.getInputAlphabet());
    }
}
