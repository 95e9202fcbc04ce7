package FAConvert.Format;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import FAConvert.Model.Automaton;
import net.automatalib.exception.FormatException;

/**
 * Line-based form, as typed at a terminal:
 * <pre>
 * a,b            alphabet
 * q0,q1,q2       states
 * q0             initial states
 * q2             final states
 * q0,ε,q1        origin,symbol,destination (one per line)
 * q1,a,q2
 * fim
 * </pre>
 * Names cannot contain commas, so subset-named DFA states should be written as JSON instead.
 * Lines starting with {@code #} are comments. The transition list ends at EOF or at a line {@code fim} / {@code end}.
 */
public class TextFormat {
    private static final int HEADER_LINES = 4;

    private TextFormat() {}

    public static Automaton read(Reader reader) throws IOException, FormatException {
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        List<List<String>> header = new ArrayList<>(HEADER_LINES);
        Automaton.Builder builder = Automaton.builder();

        int lineNo = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNo++;
            String trimmed = line.strip();
            if (trimmed.startsWith("#")) {
                continue;
            }
            if (header.size() < HEADER_LINES) {
                header.add(JSONFormat.splitList(trimmed));
                continue;
            }
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.equalsIgnoreCase("fim") || trimmed.equalsIgnoreCase("end")) {
                break;
            }
            String[] parts = trimmed.split(",", -1);
            if (parts.length != 3) {
                throw new FormatException("Line " + lineNo + ": expected origin,symbol,destination but got '" + trimmed + "'");
            }
            builder.addTransition(parts[0].strip(), parts[1].strip(), parts[2].strip());
        }

        if (header.size() < HEADER_LINES) {
            throw new FormatException("Expected alphabet, states, initial states and final states lines; got "
                + header.size() + " line(s)");
        }
        return builder.addSymbols(header.get(0))
            .addStates(header.get(1))
            .addInitialStates(header.get(2))
            .addFinalStates(header.get(3))
            .build();
    }

    public static void write(Writer writer, Automaton automaton) throws IOException {
        writer.write(String.join(",", automaton.getAlphabet()) + "\n");
        writer.write(String.join(",", automaton.getStates()) + "\n");
        writer.write(String.join(",", automaton.getInitialStates()) + "\n");
        writer.write(String.join(",", automaton.getFinalStates()) + "\n");
        for (String origin : automaton.getStates()) {
            for (Map.Entry<String, SortedSet<String>> e : automaton.getTransitions(origin).entrySet()) {
                for (String destination : e.getValue()) {
                    writer.write(origin + "," + e.getKey() + "," + destination + "\n");
                }
            }
        }
        writer.write("fim\n");
        writer.flush();
    }
}
