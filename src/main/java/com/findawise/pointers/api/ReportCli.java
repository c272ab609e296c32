package com.findawise.pointers.api;

import com.findawise.pointers.application.ContentPointerService;
import com.findawise.pointers.domain.analytics.DuplicateGroup;
import com.findawise.pointers.domain.analytics.PointerAnalyticsReport;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints pointer analytics, broken pointers and duplicate targets without validating anything.
 */
public final class ReportCli {
  private static final Logger log = LoggerFactory.getLogger(ReportCli.class);
  private static final String SUMMARY_USAGE =
      "usage: report [config=PATH] [store.directory=PATH] [format=text|json] "
          + "[security.allowDomains=a,b] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      Content pointer analytics

      Usage:
        report store.directory=./pointer-store [options]

      Options:
        config=PATH                YAML file; the common and report sections apply
        store.directory=PATH       Directory of persisted pointers
        security.allowDomains=a,b  Domains counted as trusted
        format=text|json           Output rendering (default text)
        metricsExporter=otlp|none  Metrics exporter (default none)
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ReportCli() {}

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
    }

    CommandSupport.Prepared prepared;
    ConfigCliUtils.OutputFormat format;
    try {
      prepared = CommandSupport.prepare("report", input, SUMMARY_USAGE, log);
      format = ConfigCliUtils.parseFormat(prepared.settings());
    } catch (CommandSupport.CommandFailure failure) {
      return failure.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid report arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (ContentPointerService service = CommandSupport.buildService(prepared)) {
      service.restore();
      PointerAnalyticsReport report = service.getPointerAnalytics();
      List<ContentPointer> broken = service.getBrokenPointers();
      List<DuplicateGroup> duplicates = service.getDuplicatePointers();
      if (format == ConfigCliUtils.OutputFormat.JSON) {
        CliPrinter.println(ReportRenderer.analyticsJson(report, broken, duplicates));
      } else {
        CliPrinter.printLines(ReportRenderer.analyticsLines(report, broken, duplicates));
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Report I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while reporting", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
