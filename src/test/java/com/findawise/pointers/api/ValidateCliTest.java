package com.findawise.pointers.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.ValidationStatus;
import com.findawise.pointers.infrastructure.persistence.JsonFilePointerStore;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ValidateCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ValidateCli.class);
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    CliPrinter.clearTestWriter();
  }

  @Test
  void cycleValidatesPendingPointersAndPersistsStatuses() throws Exception {
    Path catalog = CliFixtures.writeCatalog(tempDir);
    Path storeDir = CliFixtures.writeStore(tempDir);

    ExitCode code = ValidateCli.run(CliFixtures.args(storeDir, catalog));

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.startsWith("Validation cycle: attempted=6 batches=1 applied=6 errors=0 staleDiscards=0"),
        output);
    assertTrue(output.contains("  valid=3"));
    assertTrue(output.contains("  broken=1"));
    assertTrue(output.contains("  expired=1"));
    assertTrue(output.contains("  redirected=1"));
    assertTrue(output.contains("Broken pointers: 1"));
    assertTrue(output.contains("  p-missing page -> nowhere (slug, not_found)"));

    Map<String, ContentPointer> stored = new JsonFilePointerStore(storeDir, null).loadAll().stream()
        .collect(Collectors.toMap(ContentPointer::id, Function.identity()));
    assertEquals(ValidationStatus.VALID, stored.get("p-valid").validationStatus());
    assertEquals(ValidationStatus.BROKEN, stored.get("p-missing").validationStatus());
    assertEquals(ValidationStatus.REDIRECTED, stored.get("p-redirect").validationStatus());
    assertTrue(stored.get("p-valid").lastValidated() != null);
  }

  @Test
  void jsonFormatAndFailOnBroken() throws Exception {
    Path catalog = CliFixtures.writeCatalog(tempDir);
    Path storeDir = CliFixtures.writeStore(tempDir);

    ExitCode code = ValidateCli.run(CliFixtures.args(storeDir, catalog, "format=json", "failOnBroken=true"));

    assertEquals(ExitCode.BROKEN_POINTERS, code);
    String output = buffer.toString().trim();
    assertTrue(output.startsWith("{\"attempted\":6,"), output);
    assertTrue(output.contains("\"broken\":[{\"id\":\"p-missing\",\"sourceId\":\"page\",\"targetId\":\"nowhere\","
        + "\"pointerType\":\"slug\",\"outcome\":\"not_found\"}]"));
  }

  @Test
  void secondRunHasNothingPending() throws Exception {
    Path catalog = CliFixtures.writeCatalog(tempDir);
    Path storeDir = CliFixtures.writeStore(tempDir);
    assertEquals(ExitCode.SUCCESS, ValidateCli.run(CliFixtures.args(storeDir, catalog)));
    buffer.getBuffer().setLength(0);

    ExitCode code = ValidateCli.run(CliFixtures.args(storeDir, catalog, "failOnBroken=true"));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().startsWith("Validation cycle: attempted=0 batches=0"));
    assertTrue(buffer.toString().contains("Broken pointers: 1"));
  }

  @Test
  void invalidSettingsPrintUsage() {
    ExitCode code = ValidateCli.run(new String[] {
        "store.directory=" + tempDir.resolve("store"), "metricsExporter=none", "validation.batchSize=0"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: validate"));
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("validation.batchSize"));
    assertTrue(logged);
  }

  @Test
  void unknownFormatAndMissingConfigAreRejected() {
    String store = "store.directory=" + tempDir.resolve("store");

    assertEquals(ExitCode.INVALID_ARGS,
        ValidateCli.run(new String[] {store, "metricsExporter=none", "format=xml"}));
    assertEquals(ExitCode.INVALID_ARGS,
        ValidateCli.run(new String[] {store, "config=" + tempDir.resolve("absent.yaml")}));
    assertEquals(ExitCode.INVALID_ARGS, ValidateCli.run(new String[] {"not-a-setting"}));
  }

  @Test
  void yamlConfigSuppliesSettings() throws Exception {
    Path catalog = CliFixtures.writeCatalog(tempDir);
    Path storeDir = CliFixtures.writeStore(tempDir);
    Path yaml = tempDir.resolve("engine.yaml");
    Files.writeString(yaml, String.join("\n",
        "common:",
        "  metricsExporter: none",
        "  store:",
        "    directory: " + storeDir,
        "  content:",
        "    nodesFile: " + catalog,
        "validate:",
        "  format: json",
        ""));

    ExitCode code = ValidateCli.run(new String[] {"config=" + yaml});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().trim().startsWith("{\"attempted\":6,"));
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, ValidateCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("failOnBroken=true|false"));
  }
}
