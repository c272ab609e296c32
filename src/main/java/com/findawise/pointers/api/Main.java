package com.findawise.pointers.api;

import com.findawise.pointers.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for the content pointer engine.
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: pointers <validate|report|worker> [options]";
  private static final String HELP_TEXT = """
      Content pointer engine

      Usage:
        pointers <command> [options]

      Commands:
        validate    Run one validation cycle over stored pointers (validate --help for details)
        report      Print pointer analytics, broken pointers and duplicates
        worker      Validate continuously on the configured interval

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches to a command without terminating the JVM. Flags after the command name are passed
   * through to it.
   *
   * @param args dispatcher arguments; the first non-flag token names the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    String command = null;
    List<String> delegate = new ArrayList<>();
    List<String> globalFlags = new ArrayList<>();
    if (args != null) {
      for (String arg : args) {
        if (arg == null || arg.isBlank()) {
          continue;
        }
        if (command == null && !arg.startsWith("-") && !arg.contains("=") && !arg.equalsIgnoreCase("help")) {
          command = arg.trim().toLowerCase(Locale.ROOT);
        } else if (command == null) {
          globalFlags.add(arg);
        } else {
          delegate.add(arg);
        }
      }
    }

    CliInput global = CliInput.parse(globalFlags.toArray(String[]::new));
    if (command == null) {
      if (global.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (global.help()) {
      delegate.add("--help");
    }
    if (global.keyValueArgs().length > 0) {
      delegate.addAll(0, List.of(global.keyValueArgs()));
    }
    String[] delegateArgs = delegate.toArray(String[]::new);

    return switch (command) {
      case "validate" -> ValidateCli.run(delegateArgs);
      case "report" -> ReportCli.run(delegateArgs);
      case "worker" -> WorkerCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
