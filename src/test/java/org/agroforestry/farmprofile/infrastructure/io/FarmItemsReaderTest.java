package org.agroforestry.farmprofile.infrastructure.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.agroforestry.farmprofile.domain.geometry.GeometryParser;
import org.agroforestry.farmprofile.domain.geometry.Polygon;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FarmItemsReaderTest {

  @TempDir Path tempDir;

  private final FarmItemsReader reader = new FarmItemsReader();

  @Test
  void readsItemsWithNestedGeometry() throws IOException {
    Path file = tempDir.resolve("farms.json");
    Files.writeString(file, """
        [
          {"farm_id": 101, "geometry": [18.0, -76.5], "owner": "J. Brown", "organic": true},
          {"farm_id": "F-2", "geometry": [[[18.0, -76.5], [18.0, -76.4], [18.1, -76.4]]], "notes": null}
        ]
        """);

    List<Map<String, Object>> items = reader.read(file);

    assertEquals(2, items.size());
    assertEquals(101, items.get(0).get("farm_id"));
    assertEquals(List.of(18.0, -76.5), items.get(0).get("geometry"));
    assertEquals(Boolean.TRUE, items.get(0).get("organic"));
    assertEquals(List.of("farm_id", "geometry", "owner", "organic"), List.copyOf(items.get(0).keySet()));
    assertTrue(items.get(1).containsKey("notes"));
    assertNull(items.get(1).get("notes"));
    assertTrue(GeometryParser.parse(items.get(1).get("geometry")) instanceof Polygon);
  }

  @Test
  void emptyDocumentHasNoItems() throws IOException {
    assertTrue(reader.read(new StringReader("")).isEmpty());
    assertTrue(reader.read(new StringReader("[]")).isEmpty());
  }

  @Test
  void rejectsNonArrayDocuments() {
    assertThrows(IllegalArgumentException.class, () -> reader.read(new StringReader("{\"farm_id\": 1}")));
    assertThrows(IllegalArgumentException.class, () -> reader.read(new StringReader("[1, 2]")));
    assertThrows(IllegalArgumentException.class, () -> reader.read(new StringReader("[] []")));
  }

  @Test
  void leavesCallerReaderOpen() throws IOException {
    TrackingReader source = new TrackingReader("[{\"farm_id\": 1, \"geometry\": [18.0, -76.5]}]");

    assertEquals(1, reader.read(source).size());
    assertFalse(source.closed);

    TrackingReader invalid = new TrackingReader("{}");
    assertThrows(IllegalArgumentException.class, () -> reader.read(invalid));
    assertFalse(invalid.closed);
  }

  private static final class TrackingReader extends StringReader {
    private boolean closed;

    TrackingReader(String text) {
      super(text);
    }

    @Override
    public void close() {
      closed = true;
      super.close();
    }
  }
}
