package org.agroforestry.farmprofile.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProfilingConfigTest {

  @TempDir Path tempDir;

  @Test
  void defaultsMatchTheEmbeddedTable() {
    ProfilingConfig config = ProfilingConfig.defaults();

    assertEquals(ProfilingDefaults.DEFAULT_YEAR, config.defaultYear());
    assertEquals(ProfilingDefaults.MAX_WORKERS, config.maxWorkers());
    assertEquals(ProfilingDefaults.QUERY_TIMEOUT_SECONDS, config.queryTimeoutSeconds());
    assertEquals(ProfilingDefaults.ERROR_MESSAGE_MAX_BYTES, config.errorMessageMaxBytes());
    assertEquals(Optional.empty(), config.datasets());
    assertEquals("", config.metricsExporter());
    assertFalse(config.verbose());
  }

  @Test
  void loadsYamlOverDefaults() throws IOException {
    Path yaml = tempDir.resolve("farm-profile.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: NONE
        profiling:
          defaultYear: 2025
          maxWorkers: 16
          queryTimeoutSeconds: 0
          datasets: /etc/farm/datasets.yaml
          verbose: true
        """);

    ProfilingConfig config = ProfilingConfig.load(yaml);

    assertEquals(2025, config.defaultYear());
    assertEquals(16, config.maxWorkers());
    assertEquals(0, config.queryTimeoutSeconds());
    assertEquals(Optional.of(Path.of("/etc/farm/datasets.yaml")), config.datasets());
    assertEquals("none", config.metricsExporter());
    assertTrue(config.verbose());
    assertEquals(ProfilingDefaults.ERROR_MESSAGE_MAX_BYTES, config.errorMessageMaxBytes());
  }

  @Test
  void missingFileGivesDefaults() throws IOException {
    assertEquals(ProfilingConfig.defaults(), ProfilingConfig.load(tempDir.resolve("absent.yaml")));
  }

  @Test
  void rejectsOutOfRangeAndMalformedValues() {
    assertThrows(IllegalArgumentException.class, () -> ProfilingConfig.fromMap(Map.of("maxWorkers", "0")));
    assertThrows(IllegalArgumentException.class, () -> ProfilingConfig.fromMap(Map.of("maxWorkers", "257")));
    assertThrows(IllegalArgumentException.class, () -> ProfilingConfig.fromMap(Map.of("defaultYear", "20x4")));
    assertThrows(IllegalArgumentException.class,
        () -> ProfilingConfig.fromMap(Map.of("queryTimeoutSeconds", "-5")));
    assertThrows(IllegalArgumentException.class,
        () -> ProfilingConfig.fromMap(Map.of("errorMessageMaxBytes", "8")));
    assertThrows(IllegalArgumentException.class,
        () -> ProfilingConfig.fromMap(Map.of("metricsExporter", "prometheus")));
    assertThrows(IllegalArgumentException.class, () -> ProfilingConfig.fromMap(Map.of("verbose", "yes")));
  }

  @Test
  void ignoresUnknownKeys() {
    assertEquals(ProfilingConfig.defaults(), ProfilingConfig.fromMap(Map.of("iface", "en0")));
  }
}
