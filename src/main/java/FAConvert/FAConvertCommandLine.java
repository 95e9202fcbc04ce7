package FAConvert;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import FAConvert.Format.AutomatonRenderer;
import FAConvert.Format.BAFormat;
import FAConvert.Format.JSONFormat;
import FAConvert.Format.TextFormat;
import FAConvert.Minimize.PartitionMinimizer;
import FAConvert.Model.Automaton;
import FAConvert.Model.AutomatonException;
import FAConvert.Model.DeterministicAutomaton;
import FAConvert.Simulation.WordSimulator;
import net.automatalib.exception.FormatException;

public class FAConvertCommandLine {
  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 2;
  static final int EXIT_INPUT_ERROR = 1;

  private static final List<String> OPERATIONS =
      List.of("merge-initial", "eliminate", "determinize", "minimize", "accepts");

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    Options options = new Options();
    List<String> positional = new ArrayList<>(3);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
      } else if ("--trim".equalsIgnoreCase(arg)) {
        options.trim = true;
      } else if ("--json".equalsIgnoreCase(arg) || "--writeBA".equalsIgnoreCase(arg)
          || "--maxStates".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
          err.println("Missing value for " + arg);
          return printUsage(out);
        }
        String value = args[++i];
        if ("--json".equalsIgnoreCase(arg)) {
          options.jsonOut = value;
        } else if ("--writeBA".equalsIgnoreCase(arg)) {
          options.baOut = value;
        } else {
          try {
            options.maxStates = Integer.parseInt(value);
          } catch (NumberFormatException e) {
            err.println("Not a number: " + value);
            return printUsage(out);
          }
          if (options.maxStates < 1) {
            err.println("--maxStates must be positive");
            return printUsage(out);
          }
        }
      } else if (arg.startsWith("--")) {
        // Unknown flag
        return printUsage(out);
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2 || positional.size() > 3 || !OPERATIONS.contains(positional.get(0))
        || (positional.size() == 3 && !"accepts".equals(positional.get(0)))) {
      return printUsage(out);
    }

    String operation = positional.get(0);
    String inputPath = positional.get(1);
    try {
      Automaton automaton = readAutomaton(inputPath);
      out.println("Input automaton: " + automaton.size() + " states, alphabet size " + automaton.getAlphabet().size());
      if ("accepts".equals(operation)) {
        String words = positional.size() == 3 ? positional.get(2) : "-";
        testWords(automaton, words, out);
      } else {
        runOperation(operation, automaton, options, out);
      }
      return EXIT_OK;
    } catch (AutomatonException | FormatException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_INPUT_ERROR;
    } catch (IOException e) {
      err.println("I/O error: " + e.getMessage());
      return EXIT_INPUT_ERROR;
    }
  }

  private static int printUsage(PrintStream out) {
    out.println(
        "FAConvert [--debug] [--trim] [--maxStates <n>] [--json <output file>] [--writeBA <output file>]"
            + " <operation> <input file> [words file]");
    out.println("[--debug] : Additional debug/progress output");
    out.println("[--trim] : Discard states unreachable from the initial states before converting or minimizing");
    out.println("[--maxStates <n>] : Fail if subset construction exceeds n states");
    out.println("[--json <output file>] : Write the result as JSON");
    out.println("[--writeBA <output file>] : Write the resulting DFA in BA format (determinize, minimize)");
    out.println();
    out.println("<operation> : one of the choices below:");
    out.println("  merge-initial: Replace several initial states by one, using epsilon transitions.");
    out.println("  eliminate: epsilon-NFA -> NFA.");
    out.println("  determinize: NFA -> DFA (subset construction). The NFA must be epsilon-free.");
    out.println("  minimize: any automaton -> minimal DFA, converting to a DFA first if needed.");
    out.println("  accepts: Test the words of [words file] (one per line, 'ε' for the empty word; stdin if absent).");
    out.println();
    out.println("<input file> : automaton as JSON (.json), BA (.ba), or the line-based text format (anything else).");
    return EXIT_USAGE;
  }

  static Automaton readAutomaton(String filePath) throws IOException, FormatException {
    String lower = filePath.toLowerCase(Locale.ROOT);
    try (InputStream is = new FileInputStream(filePath)) {
      if (lower.endsWith(".json")) {
        return JSONFormat.read(is);
      } else if (lower.endsWith(".ba")) {
        return BAFormat.read(is);
      }
      return TextFormat.read(new InputStreamReader(is, StandardCharsets.UTF_8));
    }
  }

  private static void runOperation(String operation, Automaton automaton, Options options, PrintStream out)
      throws IOException {
    SubsetConstruction subsetConstruction = new SubsetConstruction(options.maxStates);
    if (options.trim) {
      Automaton trimmed = AutomatonTrim.trim(automaton);
      if (trimmed != automaton) {
        out.println("Discarded " + (automaton.size() - trimmed.size()) + " unreachable state(s)");
        automaton = trimmed;
      }
    }
    switch (operation) {
      case "merge-initial" -> {
        Automaton merged = InitialStateMerger.merge(automaton);
        if (merged == automaton) {
          out.println("The automaton has at most one initial state. Nothing to convert.");
        }
        out.print(AutomatonRenderer.render("Epsilon-NFA with one initial state", merged));
        writeResult(options, merged, null, out);
      }
      case "eliminate" -> {
        Automaton nfa = EpsilonEliminator.eliminate(automaton);
        if (nfa == automaton) {
          out.println("The automaton has no epsilon transitions. Nothing to convert.");
        }
        out.print(AutomatonRenderer.render("NFA without epsilon transitions", nfa));
        writeResult(options, nfa, null, out);
      }
      case "determinize" -> {
        DeterministicAutomaton dfa = subsetConstruction.run(automaton);
        out.print(AutomatonRenderer.render("DFA (subset construction)", dfa));
        writeResult(options, null, dfa, out);
      }
      case "minimize" -> {
        Pipeline pipeline = new Pipeline(subsetConstruction, new PartitionMinimizer(options.trim));
        Pipeline.Report report = pipeline.toMinimalDFA(automaton);
        out.print(AutomatonRenderer.render("Minimized DFA", report.minimal()));
        out.println("States before: " + report.statesBefore());
        out.println("States after: " + report.statesAfter());
        out.println("Reduction: " + report.reduction() + " state(s)");
        writeResult(options, null, report.minimal(), out);
      }
      default -> throw new IllegalStateException("Unexpected operation: " + operation);
    }
  }

  private static void writeResult(Options options, Automaton automaton, DeterministicAutomaton dfa, PrintStream out)
      throws IOException {
    if (options.jsonOut != null) {
      out.println("Writing JSON to file: " + options.jsonOut);
      try (OutputStream os = new FileOutputStream(options.jsonOut)) {
        if (dfa != null) {
          JSONFormat.write(os, dfa);
        } else {
          JSONFormat.write(os, automaton);
        }
      }
    }
    if (options.baOut != null) {
      if (dfa == null) {
        out.println("BA output is only written for DFA results; skipping " + options.baOut);
        return;
      }
      out.println("Writing BA to file: " + options.baOut);
      try (OutputStream os = new FileOutputStream(options.baOut)) {
        BAFormat.write(os, dfa);
      }
    }
  }

  private static void testWords(Automaton automaton, String wordsPath, PrintStream out) throws IOException {
    final WordSimulator simulator = new WordSimulator(automaton);
    Reader reader = "-".equals(wordsPath)
        ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
        : Files.newBufferedReader(Paths.get(wordsPath), StandardCharsets.UTF_8);
    try (BufferedReader in = new BufferedReader(reader)) {
      int idx = 0;
      String line;
      while ((line = in.readLine()) != null) {
        idx++;
        String word = line.strip();
        if (word.isEmpty()) {
          continue;
        }
        if (Automaton.EPSILON.equals(word)) {
          word = "";
        }
        List<String> unknown = WordSimulator.unknownSymbols(automaton, word);
        if (!unknown.isEmpty()) {
          out.println(idx + ": '" + word + "' -> ERROR: symbols outside the alphabet: " + String.join(", ", unknown));
          continue;
        }
        out.println(idx + ": '" + word + "' -> " + (simulator.accepts(word) ? "ACCEPT" : "REJECT"));
      }
    }
  }

  private static final class Options {
    boolean trim;
    int maxStates = SubsetConstruction.NO_LIMIT;
    String jsonOut;
    String baOut;
  }
}
