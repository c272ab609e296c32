package com.findawise.pointers.api;

import com.findawise.pointers.application.ContentPointerService;
import com.findawise.pointers.logging.LoggingConfigurator;
import com.findawise.pointers.validation.Numbers;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-running validation worker: restores pointers, then validates on the configured interval
 * until the JVM shuts down or {@code runFor} elapses.
 */
public final class WorkerCli {
  private static final Logger log = LoggerFactory.getLogger(WorkerCli.class);
  private static final String SUMMARY_USAGE =
      "usage: worker [config=PATH] [validation.intervalSeconds=N] [runFor=SECONDS] "
          + "[audit.sink=log|kafka] [audit.kafkaBootstrap=HOST:PORT] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      Content pointer validation worker

      Usage:
        worker config=./pointer-engine.yaml [options]

      Options:
        config=PATH                    YAML file; the common and worker sections apply
        validation.intervalSeconds=N   Delay between cycles (default 300)
        validation.batchSize=N         Pointers validated concurrently (default 10)
        runFor=SECONDS                 Stop after this many seconds instead of waiting for shutdown
        audit.sink=log|kafka           Audit destination (default log)
        audit.kafkaBootstrap=HOST:PORT Required when audit.sink=kafka
        audit.kafkaTopic=TOPIC         Audit topic (default pointer.audit.v1)
        metricsExporter=otlp|none      Metrics exporter (default otlp)
        otelEndpoint=URL               OTLP metrics endpoint
        otelResourceAttributes=K=V     Comma-separated OTel resource attributes
        --verbose                      Enable DEBUG logging
        --help                         Show this message
      """;

  private WorkerCli() {}

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
      log.debug("Verbose logging enabled for worker CLI");
    }

    CommandSupport.Prepared prepared;
    long runForSeconds;
    try {
      prepared = CommandSupport.prepare("worker", input, SUMMARY_USAGE, log);
      runForSeconds = runFor(prepared.settings().get("runFor"));
    } catch (CommandSupport.CommandFailure failure) {
      return failure.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid worker arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CountDownLatch stopped = new CountDownLatch(1);
    try (ContentPointerService service = CommandSupport.buildService(prepared)) {
      // The hook closes the service itself; the JVM does not wait for this thread on shutdown.
      Thread hook = new Thread(() -> {
        service.close();
        stopped.countDown();
      }, "pointer-worker-shutdown");
      service.start();
      Runtime.getRuntime().addShutdownHook(hook);
      log.info("Validation worker running (interval={}s, batchSize={})",
          prepared.config().validationInterval().toSeconds(), prepared.config().validationBatchSize());
      if (runForSeconds > 0) {
        stopped.await(runForSeconds, TimeUnit.SECONDS);
        removeHook(hook);
      } else {
        stopped.await();
      }
      log.info("Validation worker stopping");
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Worker I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Worker interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in validation worker", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static long runFor(String raw) {
    if (raw == null || raw.isBlank()) {
      return 0L;
    }
    long seconds;
    try {
      seconds = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("runFor must be an integer (was " + raw + ")", ex);
    }
    return Numbers.requireRange("runFor", seconds, 1, 86_400L * 365);
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; keeping shutdown hook");
    }
  }
}
