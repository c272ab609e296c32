package com.findawise.pointers.api;

import com.findawise.pointers.application.ContentPointerService;
import com.findawise.pointers.application.port.MetricsPort;
import com.findawise.pointers.config.CompositionRoot;
import com.findawise.pointers.config.ConfigMerger;
import com.findawise.pointers.config.DefaultsForMode;
import com.findawise.pointers.config.EngineConfig;
import com.findawise.pointers.config.YamlConfigLoader;
import com.findawise.pointers.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Configuration pipeline shared by the commands: CLI arguments, optional YAML file, embedded
 * defaults, telemetry and finally {@link EngineConfig}.
 */
final class CommandSupport {

  private CommandSupport() {}

  /**
   * Resolves the effective configuration for {@code mode}.
   *
   * @param mode command name used to pick the YAML section and defaults
   * @param input parsed CLI input
   * @param usage one-line usage printed on argument errors
   * @param log logger of the calling command
   * @return prepared configuration together with the metrics adapter to use
   * @throws CommandFailure carrying the exit code when preparation fails
   */
  static Prepared prepare(String mode, CliInput input, String usage, Logger log) throws CommandFailure {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      throw invalid(usage);
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        throw invalid(usage);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        throw invalid(usage);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        throw new CommandFailure(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    EngineConfig config;
    MetricsPort metrics;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      config = EngineConfig.fromMap(effective);
      metrics = TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      throw invalid(usage);
    }
    return new Prepared(config, metrics, effective);
  }

  /**
   * Wires the engine from prepared settings.
   *
   * @param prepared resolved configuration
   * @return service owning the metrics adapter
   * @throws IOException when a configured file cannot be read
   */
  static ContentPointerService buildService(Prepared prepared) throws IOException {
    try {
      return new CompositionRoot(prepared.config(), prepared.metrics(), new SystemClockAdapter()).build();
    } catch (IOException | RuntimeException ex) {
      if (prepared.metrics() instanceof AutoCloseable closeable) {
        try {
          closeable.close();
        } catch (Exception closeEx) {
          ex.addSuppressed(closeEx);
        }
      }
      throw ex;
    }
  }

  private static CommandFailure invalid(String usage) {
    CliPrinter.println(usage);
    return new CommandFailure(ExitCode.INVALID_ARGS);
  }

  /**
   * Configuration ready for wiring.
   *
   * @param config bound engine settings
   * @param metrics metrics adapter chosen from {@code metricsExporter}
   * @param settings merged flat settings, including command-specific keys
   */
  record Prepared(EngineConfig config, MetricsPort metrics, Map<String, String> settings) {}

  /** Signals that a command must stop with {@link #exitCode()}. */
  static final class CommandFailure extends Exception {
    private static final long serialVersionUID = 1L;
    private final ExitCode exitCode;

    CommandFailure(ExitCode exitCode) {
      super(exitCode.name(), null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
