package com.findawise.pointers.api;

import com.findawise.pointers.application.ContentPointerService;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.ValidationStatus;
import com.findawise.pointers.domain.validation.ValidationCycleReport;
import com.findawise.pointers.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a single validation cycle over the persisted pointers and prints the outcome.
 */
public final class ValidateCli {
  private static final Logger log = LoggerFactory.getLogger(ValidateCli.class);
  private static final String SUMMARY_USAGE =
      "usage: validate [config=PATH] [store.directory=PATH] [content.nodesFile=PATH] "
          + "[content.fileRoot=PATH] [validation.batchSize=N] [validation.timeoutMillis=MS] "
          + "[format=text|json] [failOnBroken=true|false] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      Content pointer validation

      Usage:
        validate store.directory=./pointer-store content.nodesFile=./nodes.yaml [options]

      Options:
        config=PATH                YAML file; the common and validate sections apply
        store.type=file|memory     Pointer store backend (default file)
        store.directory=PATH       Directory of persisted pointers
        content.nodesFile=PATH     YAML content catalog used by slug and id pointers
        content.fileRoot=PATH      Root directory for file pointers
        validation.batchSize=N     Pointers validated concurrently (default 10)
        validation.timeoutMillis=MS  Per-pointer validator timeout (default 10000)
        format=text|json           Output rendering (default text)
        failOnBroken=true|false    Exit with code 1 when any pointer is broken
        metricsExporter=otlp|none  Metrics exporter (default none)
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ValidateCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for validate CLI");
    }

    CommandSupport.Prepared prepared;
    ConfigCliUtils.OutputFormat format;
    boolean failOnBroken;
    try {
      prepared = CommandSupport.prepare("validate", input, SUMMARY_USAGE, log);
      format = ConfigCliUtils.parseFormat(prepared.settings());
      failOnBroken = ConfigCliUtils.parseBoolean(prepared.settings(), "failOnBroken");
    } catch (CommandSupport.CommandFailure failure) {
      return failure.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid validate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (ContentPointerService service = CommandSupport.buildService(prepared)) {
      int restored = service.restore();
      log.info("Restored {} pointers for validation", restored);
      ValidationCycleReport report = service.runValidationCycle();
      List<ContentPointer> broken = service.getBrokenPointers();
      if (format == ConfigCliUtils.OutputFormat.JSON) {
        CliPrinter.println(ReportRenderer.cycleJson(report, broken));
      } else {
        CliPrinter.printLines(ReportRenderer.cycleLines(report, broken));
      }
      if (failOnBroken && report.count(ValidationStatus.BROKEN) > 0) {
        return ExitCode.BROKEN_POINTERS;
      }
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Validation configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Validation I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during validation", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
