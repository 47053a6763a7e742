package org.atrack.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.atrack.application.pipeline.MasterCatalogBuilder;
import org.atrack.domain.Catalog;
import org.atrack.infrastructure.persistence.MasterCatalogWriter;
import org.atrack.testutil.Fixtures;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CandidatesCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void writesOneCandidateFilePerImage() throws IOException {
    List<Catalog> sequence = Fixtures.movingObjectSequence(10);
    Path catalogs = Fixtures.writeCatalogDirectory(tempDir.resolve("night"), sequence);
    MasterCatalogWriter.write(MasterCatalogBuilder.union(sequence), catalogs.resolve("master.cat"));
    Path output = tempDir.resolve("out");

    ExitCode code = CandidatesCli.run(new String[] {"catalogs=" + catalogs, "out=" + output});

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = Files.readAllLines(output.resolve("candidates").resolve("img-002.cnd"));
    assertEquals(2, lines.size());
    assertTrue(lines.get(1).startsWith("0,302.0,300.0,"));
    assertFalse(Files.exists(output.resolve("master.cat")), "supplied master must not be rewritten");
    assertFalse(Files.exists(output.resolve("tracks.ndjson")));
  }

  @Test
  void dryRunNamesCandidateDirectory() throws IOException {
    Path catalogs = Fixtures.writeCatalogDirectory(tempDir.resolve("night"), Fixtures.movingObjectSequence(10));
    Path output = tempDir.resolve("out");

    ExitCode code = CandidatesCli.run(new String[] {"catalogs=" + catalogs, "out=" + output, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Candidates dry-run"));
    assertTrue(text.contains(output.resolve("candidates").toString()));
    assertFalse(Files.exists(output));
  }

  @Test
  void missingManifestIsInvalid() throws IOException {
    Path catalogs = Fixtures.writeCatalogDirectory(tempDir.resolve("night"), Fixtures.movingObjectSequence(10));
    Files.delete(catalogs.resolve("frames.yaml"));

    ExitCode code = CandidatesCli.run(new String[] {"catalogs=" + catalogs, "out=" + tempDir.resolve("out")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: atrack candidates"));
  }

  @Test
  void malformedCatalogIsAnIoError() throws IOException {
    Path catalogs = Fixtures.writeCatalogDirectory(tempDir.resolve("night"), Fixtures.movingObjectSequence(10));
    Files.writeString(catalogs.resolve("img-001.cat"), "0 1 2\n");

    ExitCode code = CandidatesCli.run(new String[] {"catalogs=" + catalogs, "out=" + tempDir.resolve("out")});

    assertEquals(ExitCode.IO_ERROR, code);
  }
}
