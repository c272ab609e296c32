package com.findawise.pointers.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.ValidationStatus;
import com.findawise.pointers.infrastructure.persistence.JsonFilePointerStore;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkerCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void boundedRunValidatesOnScheduleAndStops() throws Exception {
    Path catalog = CliFixtures.writeCatalog(tempDir);
    Path storeDir = CliFixtures.writeStore(tempDir);

    ExitCode code = WorkerCli.run(CliFixtures.args(storeDir, catalog, "validation.intervalSeconds=1", "runFor=3"));

    assertEquals(ExitCode.SUCCESS, code);
    List<ContentPointer> stored = new JsonFilePointerStore(storeDir, null).loadAll();
    assertTrue(stored.stream().noneMatch(p -> p.validationStatus() == ValidationStatus.PENDING));
  }

  @Test
  void runForIsBounded() {
    assertEquals(0L, WorkerCli.runFor(null));
    assertEquals(0L, WorkerCli.runFor(" "));
    assertEquals(90L, WorkerCli.runFor("90"));
    assertThrows(IllegalArgumentException.class, () -> WorkerCli.runFor("0"));
    assertThrows(IllegalArgumentException.class, () -> WorkerCli.runFor("forever"));
  }

  @Test
  void invalidRunForPrintsUsage() {
    ExitCode code = WorkerCli.run(new String[] {
        "store.directory=" + tempDir.resolve("store"), "metricsExporter=none", "runFor=-5"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: worker"));
  }

  @Test
  void invalidOtlpEndpointIsRejected() {
    ExitCode code = WorkerCli.run(new String[] {
        "store.directory=" + tempDir.resolve("store"), "otelEndpoint=ftp://collector"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }
}
