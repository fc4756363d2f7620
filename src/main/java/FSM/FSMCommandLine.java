package FSM;

import FSM.Errors.AutomatonException;
import FSM.Model.Dfa;
import FSM.Model.MealyMachine;
import FSM.Model.MooreMachine;
import FSM.Model.Nfa;
import FSM.Regex.RegexCompiler;
import FSM.Table.GrammarParser;
import FSM.Table.TableFormat;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public class FSMCommandLine {
  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1;
  static final int EXIT_USAGE = 2;

  public static void main(String[] args) {
    int status = run(args);
    if (status != EXIT_OK) {
      System.exit(status);
    }
  }

  /**
   * Parses the arguments and runs one command.
   * @param args - command-line arguments
   * @return - process exit status
   */
  static int run(String[] args) {
    String baFilename = null;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        SubsetConstruction.DEBUG = true;
        AutomatonMinimizer.DEBUG = true;
      } else if ("--writeBA".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --writeBA");
          return printUsage();
        }
        baFilename = args[++i]; // consume the value
      } else if (arg.startsWith("--")) {
        // Unknown flag
        return printUsage();
      } else {
        positional.add(arg);
      }
    }

    if (positional.isEmpty()) {
      return printUsage();
    }

    String command = positional.get(0);
    List<String> operands = positional.subList(1, positional.size());
    if (operands.size() != arity(command)) {
      return printUsage();
    }

    try {
      long before = System.currentTimeMillis();
      Optional<Dfa> dfa = runCommand(command, operands);
      long after = System.currentTimeMillis();
      System.out.println(command + " duration: " + ((after - before) / 1000f) + "s");

      if (baFilename != null) {
        if (dfa.isEmpty()) {
          System.err.println("--writeBA only applies to commands producing a DFA");
          return EXIT_USAGE;
        }
        writeBAFile(baFilename, dfa.get());
      }
      return EXIT_OK;
    } catch (AutomatonException | UncheckedIOException e) {
      System.err.println("Error: " + e.getMessage());
      return EXIT_ERROR;
    }
  }

  private static int printUsage() {
    System.out.println(
        "FSM [--debug] [--writeBA <BA output file>] <command> <arguments>");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--writeBA <BA output file>] : Also write the resulting DFA in BA format");
    System.out.println();
    System.out.println("<command> : one of the choices below:");
    System.out.println("  regex <expression> <nfa.csv>: Thompson construction.");
    System.out.println("  regex-dfa <expression> <dfa.csv>: Thompson construction, subset construction, minimization.");
    System.out.println("  determinize <nfa.csv|nfa.ba> <dfa.csv>: Subset construction.");
    System.out.println("  minimize <mealy|moore|dfa> <in.csv> <out.csv>: Partition refinement.");
    System.out.println("  mealy-to-moore <mealy.csv> <moore.csv>");
    System.out.println("  moore-to-mealy <moore.csv> <mealy.csv>");
    System.out.println("  equivalent <moore1.csv> <moore2.csv>: Equivalence up to state renaming.");
    System.out.println("  grammar <grammar.txt> <nfa.csv>: Regular grammar to NFA.");
    System.out.println("  accepts <dfa.csv> <word>: Run a DFA on a word (space-separated symbols, or one symbol per character).");
    System.out.println();
    System.out.println("Tables are ';'-separated, one column per state and one row per input symbol.");
    System.out.println("  BA format described here: https://languageinclusion.org/doku.php?id=tools");
    return EXIT_USAGE;
  }

  private static int arity(String command) {
    return switch (command) {
      case "regex", "regex-dfa", "determinize", "mealy-to-moore", "moore-to-mealy", "equivalent", "grammar", "accepts" -> 2;
      case "minimize" -> 3;
      default -> -1;
    };
  }

  /**
   * Choose command to run.
   * @param command - command name passed in from command-line
   * @param operands - the remaining positional arguments
   * @return - the DFA the command produced, if any
   */
  static Optional<Dfa> runCommand(String command, List<String> operands) {
    System.out.println("Invoking command: " + command);
    return switch (command) {
      case "regex" -> {
        Nfa nfa = RegexCompiler.compile(operands.get(0));
        System.out.println("NFA size: " + nfa.size());
        TableFormat.writeLines(path(operands.get(1)), TableFormat.write(nfa));
        yield Optional.empty();
      }
      case "regex-dfa" -> {
        Dfa dfa = regexToMinimalDfa(operands.get(0));
        TableFormat.writeLines(path(operands.get(1)), TableFormat.write(dfa));
        yield Optional.of(dfa);
      }
      case "determinize" -> {
        Nfa nfa = readNfa(operands.get(0));
        System.out.println("Original NFA size: " + nfa.size());
        System.out.println("Alphabet size: " + nfa.getInputAlphabet().size());
        Dfa dfa = SubsetConstruction.determinize(nfa);
        System.out.println("DFA size: " + dfa.size());
        TableFormat.writeLines(path(operands.get(1)), TableFormat.write(dfa));
        yield Optional.of(dfa);
      }
      case "minimize" -> minimize(operands.get(0), path(operands.get(1)), path(operands.get(2)));
      case "mealy-to-moore" -> {
        MealyMachine mealy = TableFormat.readMealy(path(operands.get(0)));
        MooreMachine moore = MealyMooreConverter.toMoore(mealy);
        System.out.println("Mealy size: " + mealy.size() + ", Moore size: " + moore.size());
        TableFormat.writeLines(path(operands.get(1)), TableFormat.write(moore));
        yield Optional.empty();
      }
      case "moore-to-mealy" -> {
        MooreMachine moore = TableFormat.readMoore(path(operands.get(0)));
        MealyMachine mealy = MealyMooreConverter.toMealy(moore);
        System.out.println("Moore size: " + moore.size() + ", Mealy size: " + mealy.size());
        TableFormat.writeLines(path(operands.get(1)), TableFormat.write(mealy));
        yield Optional.empty();
      }
      case "equivalent" -> {
        MooreMachine first = TableFormat.readMoore(path(operands.get(0)));
        MooreMachine second = TableFormat.readMoore(path(operands.get(1)));
        Optional<String> difference = EquivalenceChecker.findDifference(first, second);
        if (difference.isPresent()) {
          System.out.println("Not equivalent: " + difference.get());
        } else {
          System.out.println("Equivalent");
        }
        yield Optional.empty();
      }
      case "grammar" -> {
        Nfa nfa = GrammarParser.parse(path(operands.get(0)));
        System.out.println("NFA size: " + nfa.size());
        TableFormat.writeLines(path(operands.get(1)), TableFormat.write(nfa));
        yield Optional.empty();
      }
      case "accepts" -> {
        Dfa dfa = TableFormat.readDfa(path(operands.get(0)));
        boolean accepted = dfa.accepts(splitWord(operands.get(1)));
        System.out.println(accepted ? "Accepted" : "Rejected");
        yield Optional.of(dfa);
      }
      default -> throw new IllegalStateException("Unexpected command choice: " + command);
    };
  }

  static Dfa regexToMinimalDfa(String regex) {
    Nfa nfa = RegexCompiler.compile(regex);
    System.out.println("NFA size: " + nfa.size());
    Dfa dfa = SubsetConstruction.determinize(nfa);
    System.out.println("Unminimized DFA size: " + dfa.size());
    dfa = AutomatonMinimizer.minimize(dfa);
    System.out.println("Minimized DFA size: " + dfa.size());
    return dfa;
  }

  private static Optional<Dfa> minimize(String kind, Path in, Path out) {
    switch (kind.toLowerCase()) {
      case "mealy": {
        MealyMachine mealy = TableFormat.readMealy(in);
        MealyMachine minimized = AutomatonMinimizer.minimize(mealy);
        System.out.println("Mealy size: " + mealy.size() + " -> " + minimized.size());
        TableFormat.writeLines(out, TableFormat.write(minimized));
        return Optional.empty();
      }
      case "moore": {
        MooreMachine moore = TableFormat.readMoore(in);
        MooreMachine minimized = AutomatonMinimizer.minimize(moore);
        System.out.println("Moore size: " + moore.size() + " -> " + minimized.size());
        TableFormat.writeLines(out, TableFormat.write(minimized));
        return Optional.empty();
      }
      case "dfa": {
        Dfa dfa = TableFormat.readDfa(in);
        Dfa minimized = AutomatonMinimizer.minimize(dfa);
        System.out.println("DFA size: " + dfa.size() + " -> " + minimized.size());
        TableFormat.writeLines(out, TableFormat.write(minimized));
        return Optional.of(minimized);
      }
      default:
        throw new AutomatonException("Unknown machine kind '" + kind + "', expected mealy, moore or dfa");
    }
  }

  private static Nfa readNfa(String filename) {
    if (filename.toLowerCase().endsWith(".ba")) {
      return BAFormat.readNfa(filename);
    }
    return TableFormat.readNfa(path(filename));
  }

  /**
   * Symbols are separated by whitespace if the word contains any, otherwise each character is a symbol.
   */
  static List<String> splitWord(String word) {
    String trimmed = word.trim();
    if (trimmed.isEmpty()) {
      return List.of();
    }
    if (trimmed.chars().anyMatch(Character::isWhitespace)) {
      return Arrays.asList(trimmed.split("\\s+"));
    }
    List<String> symbols = new ArrayList<>();
    trimmed.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
    return symbols;
  }

  private static Path path(String filename) {
    return Paths.get(filename);
  }

  private static void writeBAFile(String filename, Dfa dfa) {
    System.out.println("Writing to file: " + filename);
    BAFormat.writeDfa(filename, dfa);
  }
}
