package org.agroforestry.farmprofile.infrastructure.io;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads bulk farm items from a JSON array of objects.
 *
 * <p>Each object becomes one insertion-ordered map; nested coordinate arrays become {@link List}s of numbers that
 * the geometry parser accepts directly.</p>
 *
 * @since 0.1.0
 */
public final class FarmItemsReader {
  private final JsonFactory factory = JsonFactory.builder()
      .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
      .build();

  /**
   * Reads items from a file.
   *
   * @param path JSON document
   * @return items in document order
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the document is not an array of objects
   */
  public List<Map<String, Object>> read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (InputStream in = Files.newInputStream(path)) {
      return read(new InputStreamReader(in, StandardCharsets.UTF_8));
    }
  }

  /**
   * Reads items from a character stream; the stream is not closed.
   *
   * @param source JSON document
   * @return items in document order
   * @throws IOException if the stream cannot be read
   * @throws IllegalArgumentException if the document is not an array of objects
   */
  public List<Map<String, Object>> read(Reader source) throws IOException {
    Objects.requireNonNull(source, "source");
    try (JsonParser parser = factory.createParser(source)) {
      return readItems(parser);
    }
  }

  private List<Map<String, Object>> readItems(JsonParser parser) throws IOException {
    JsonToken token = parser.nextToken();
    if (token == null) {
      return List.of();
    }
    if (token != JsonToken.START_ARRAY) {
      throw new IllegalArgumentException("Farm items must be a JSON array (found " + token + ")");
    }
    List<Map<String, Object>> items = new ArrayList<>();
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("Farm item " + items.size() + " must be a JSON object (found " + token + ")");
      }
      items.add(readObject(parser));
    }
    if (parser.nextToken() != null) {
      throw new IllegalArgumentException("Farm items document contains trailing content");
    }
    return items;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("Unexpected end of farm items document");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String name = parser.getCurrentName();
      map.put(name, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }
}
