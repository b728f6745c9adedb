package ca.gc.cra.spectra.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into the help/verbose flags and everything else.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] args;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] args, boolean help, boolean verbose) {
    this.args = args;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation; blank and {@code null} entries are dropped
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], false, false);
    }
    List<String> rest = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else {
        rest.add(arg);
      }
    }
    return new CliInput(rest.toArray(String[]::new), help, verbose);
  }

  /**
   * Returns the arguments left after removing flags: a command name and {@code key=value} pairs.
   *
   * @return copy of the remaining arguments
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(args, args.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }
}
