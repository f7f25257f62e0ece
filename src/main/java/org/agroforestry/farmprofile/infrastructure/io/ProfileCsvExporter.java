package org.agroforestry.farmprofile.infrastructure.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.agroforestry.farmprofile.domain.profile.FarmProfile;
import org.agroforestry.farmprofile.domain.profile.ProfileField;

/**
 * Writes farm profiles as CSV, one row per profile.
 *
 * <p>Columns: {@code id}, {@code year}, the schema fields in data-dictionary order, the pass-through attributes in
 * order of first appearance, then {@code status} and {@code error}. Absent values are written as empty cells.</p>
 *
 * @since 0.1.0
 */
public final class ProfileCsvExporter {
  private final CsvMapper mapper = new CsvMapper();

  /**
   * Writes profiles to a file, replacing it if present.
   *
   * @param profiles profiles in output order
   * @param target destination file
   * @throws IOException if the file cannot be written
   */
  public void write(Collection<FarmProfile> profiles, Path target) throws IOException {
    Objects.requireNonNull(target, "target");
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      write(profiles, writer);
    }
  }

  /**
   * Writes profiles to a character stream; the stream is flushed but not closed.
   *
   * @param profiles profiles in output order
   * @param out destination stream
   * @throws IOException if writing fails
   */
  public void write(Collection<FarmProfile> profiles, Writer out) throws IOException {
    Objects.requireNonNull(profiles, "profiles");
    Objects.requireNonNull(out, "out");
    CsvSchema schema = schemaFor(profiles);
    SequenceWriter writer = mapper.writer(schema).writeValues(out);
    for (FarmProfile profile : profiles) {
      writer.write(cells(profile));
    }
    writer.flush();
  }

  /**
   * Computes the column layout for a profile collection.
   *
   * @param profiles profiles to be written
   * @return CSV schema with header
   */
  CsvSchema schemaFor(Collection<FarmProfile> profiles) {
    Set<String> passThrough = new LinkedHashSet<>();
    for (FarmProfile profile : profiles) {
      passThrough.addAll(profile.attributes().keySet());
    }
    CsvSchema.Builder builder = CsvSchema.builder().addColumn("id").addColumn("year");
    for (ProfileField field : ProfileField.values()) {
      builder.addColumn(field.key());
    }
    passThrough.forEach(builder::addColumn);
    return builder.addColumn("status").addColumn("error").setUseHeader(true).build();
  }

  private static Map<String, String> cells(FarmProfile profile) {
    Map<String, String> cells = new LinkedHashMap<>();
    profile.toRow().forEach((column, value) -> cells.put(column, value == null ? "" : String.valueOf(value)));
    return cells;
  }
}
