package com.findawise.pointers.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
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
  void helpWithoutCommandListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("validate    Run one validation cycle"));
  }

  @Test
  void missingOrUnknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"export"}));
    assertTrue(buffer.toString().contains("usage: pointers <validate|report|worker>"));
  }

  @Test
  void globalHelpIsForwardedToCommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"-h", "report"}));
    assertTrue(buffer.toString().contains("Content pointer analytics"));
  }

  @Test
  void dispatchesWithGlobalAndCommandSettings() throws Exception {
    Path catalog = CliFixtures.writeCatalog(tempDir);
    Path storeDir = CliFixtures.writeStore(tempDir);

    ExitCode code = Main.run(new String[] {
        "metricsExporter=none", "Validate", "store.directory=" + storeDir, "content.nodesFile=" + catalog});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().startsWith("Validation cycle: attempted=6"));
  }
}
