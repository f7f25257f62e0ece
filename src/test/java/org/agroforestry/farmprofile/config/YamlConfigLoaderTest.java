package org.agroforestry.farmprofile.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void sectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("farm-profile.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          maxWorkers: 2
        profiling:
          maxWorkers: 8
          defaultYear: 2023
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "profiling");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("8", map.get("maxWorkers"));
    assertEquals("2023", map.get("defaultYear"));
  }

  @Test
  void flattensNestedMapsAndNulls() {
    Map<String, String> map = YamlConfigLoader.load(new StringReader("""
        Profiling:
          query:
            timeout: 30
          datasets:
        """), "profiling", "inline");

    assertEquals("30", map.get("query.timeout"));
    assertEquals("", map.get("datasets"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "profiling").isPresent());
  }

  @Test
  void emptyDocumentYieldsNoSettings() {
    assertTrue(YamlConfigLoader.load(new StringReader(""), "profiling", "inline").isEmpty());
  }

  @Test
  void invalidStructuresThrow() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(new StringReader("""
        - profiling:
            maxWorkers: 2
        """), "profiling", "inline"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(new StringReader("""
        profiling:
          datasets: [a, b]
        """), "profiling", "inline"));
    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(new StringReader("profiling: [unclosed"), "profiling", "inline"));
  }
}
