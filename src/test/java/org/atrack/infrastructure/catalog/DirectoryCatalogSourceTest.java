package org.atrack.infrastructure.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.atrack.domain.Catalog;
import org.atrack.domain.MasterCatalog;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryCatalogSourceTest {
  private static final String ROW = "0 500 500 150.0 0.0 1000 10 10 15 0.01 2.0 1.1\n";

  @TempDir Path tempDir;
  private Path manifest;

  @BeforeEach
  void setUp() throws IOException {
    manifest = Files.writeString(tempDir.resolve("frames.yaml"), """
        frames:
          b:
            date-obs: 2021-03-04
            time-obs: 01:10:00
            exptime: 60
          a:
            date-obs: 2021-03-04
            time-obs: 01:00:00
            exptime: 60
          c.pysexcat:
            date-obs: 2021-03-04
            time-obs: 01:20:00
            exptime: 60
        """);
  }

  @Test
  void loadsCatalogsInFileNameOrderAndSkipsMaster() throws IOException {
    Files.writeString(tempDir.resolve("c.pysexcat"), ROW);
    Files.writeString(tempDir.resolve("a.cat"), ROW + ROW);
    Files.writeString(tempDir.resolve("b.txt"), ROW);
    Files.writeString(tempDir.resolve("master.cat"), ROW);
    Files.writeString(tempDir.resolve("notes.md"), "not a catalog");

    List<Catalog> catalogs = new DirectoryCatalogSource(tempDir, manifest, Optional.empty()).loadCatalogs();

    assertEquals(List.of("a", "b", "c"), catalogs.stream().map(Catalog::name).toList());
    assertEquals(List.of(0, 1, 2), catalogs.stream().map(Catalog::imageIndex).toList());
    assertEquals(2, catalogs.get(0).records().size());
    assertTrue(catalogs.get(1).metadata().timestamp().isAfter(catalogs.get(0).metadata().timestamp()));
  }

  @Test
  void catalogWithoutManifestEntryFails() throws IOException {
    Files.writeString(tempDir.resolve("a.cat"), ROW);
    Files.writeString(tempDir.resolve("z.cat"), ROW);

    CatalogFormatException ex = assertThrows(CatalogFormatException.class,
        () -> new DirectoryCatalogSource(tempDir, manifest, Optional.empty()).loadCatalogs());

    assertTrue(ex.getMessage().contains("z.cat"));
  }

  @Test
  void emptyDirectoryYieldsNoCatalogsWithoutReadingManifest() throws IOException {
    Path empty = Files.createDirectory(tempDir.resolve("empty"));

    List<Catalog> catalogs =
        new DirectoryCatalogSource(empty, empty.resolve("frames.yaml"), Optional.empty()).loadCatalogs();

    assertTrue(catalogs.isEmpty());
  }

  @Test
  void masterResolvesFromDirectoryOrExplicitPath() throws IOException {
    DirectoryCatalogSource implicit = new DirectoryCatalogSource(tempDir, manifest, Optional.empty());
    assertTrue(implicit.loadMaster().isEmpty());

    Files.writeString(tempDir.resolve("master.cat"), ROW + ROW + ROW);
    assertEquals(3, implicit.loadMaster().map(MasterCatalog::records).orElseThrow().size());

    Path stack = Files.writeString(tempDir.resolve("stack.txt"), ROW);
    DirectoryCatalogSource explicit = new DirectoryCatalogSource(tempDir, manifest, Optional.of(stack));
    assertEquals(1, explicit.loadMaster().orElseThrow().records().size());
  }

  @Test
  void missingExplicitMasterFails() {
    DirectoryCatalogSource source =
        new DirectoryCatalogSource(tempDir, manifest, Optional.of(tempDir.resolve("gone.cat")));

    assertThrows(CatalogFormatException.class, source::loadMaster);
  }
}
