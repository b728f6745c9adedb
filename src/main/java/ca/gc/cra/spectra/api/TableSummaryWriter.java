package ca.gc.cra.spectra.api;

import ca.gc.cra.spectra.application.port.ReaderModule;
import ca.gc.cra.spectra.config.OutputFormat;
import ca.gc.cra.spectra.domain.table.ColumnSpec;
import ca.gc.cra.spectra.domain.table.MetaValue;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * <strong>What:</strong> Renders command results as aligned text or a JSON document.
 * <p><strong>Why:</strong> Operators read the text form; scripts consume the JSON form. Only the table's shape and
 * a bounded preview are emitted, never the whole table.</p>
 * <p><strong>Role:</strong> Presentation helper of the CLI adapters.</p>
 * <p><strong>Thread-safety:</strong> Instances are stateless apart from the reusable {@link JsonFactory}.</p>
 *
 * @since 0.1.0
 */
final class TableSummaryWriter {
  static final int TEXT_VALUES_PER_ROW = 8;
  private static final Comparator<String> SUFFIX_ORDER =
      Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

  private final JsonFactory jsonFactory = new JsonFactory();
  private final OutputFormat format;

  TableSummaryWriter(OutputFormat format) {
    this.format = Objects.requireNonNull(format, "format");
  }

  /**
   * Summarizes a table read from a file.
   *
   * @param file source file
   * @param readerId id of the module that read it
   * @param sheet sheet requested on the command line, if any
   * @param table table read
   * @param previewRows maximum number of rows to print
   * @return rendered summary
   * @throws IOException if JSON generation fails
   */
  String table(Path file, String readerId, Optional<String> sheet, SpectralTable table, int previewRows)
      throws IOException {
    int preview = Math.min(previewRows, table.rowCount());
    List<ColumnSpec> attributes = table.domain().attributes();
    List<ColumnSpec> metas = table.domain().metas();
    if (format == OutputFormat.TEXT) {
      List<String> lines = new ArrayList<>();
      lines.add("file       : " + file);
      lines.add("reader     : " + readerId);
      lines.add("sheet      : " + sheet.orElse("<first>"));
      lines.add("rows       : " + table.rowCount());
      lines.add("attributes : " + attributes.size() + axisRange(attributes));
      lines.add("metas      : " + describeColumns(metas));
      for (int row = 0; row < preview; row++) {
        lines.add("row " + row + " : " + previewValues(table, row) + metaPairs(table, row));
      }
      return String.join(System.lineSeparator(), lines);
    }

    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("file", file.toString());
      gen.writeStringField("reader", readerId);
      if (sheet.isPresent()) {
        gen.writeStringField("sheet", sheet.get());
      } else {
        gen.writeNullField("sheet");
      }
      gen.writeNumberField("rows", table.rowCount());
      gen.writeArrayFieldStart("attributes");
      for (ColumnSpec attribute : attributes) {
        gen.writeString(attribute.name());
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("metas");
      for (ColumnSpec meta : metas) {
        gen.writeStartObject();
        gen.writeStringField("name", meta.name());
        gen.writeStringField("kind", meta.kind().name());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("preview");
      for (int row = 0; row < preview; row++) {
        writeRow(gen, table, row);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    return out.toString();
  }

  /**
   * Lists the sheets of a file.
   *
   * @param file source file
   * @param sheets sheet names in reader order
   * @return rendered list
   * @throws IOException if JSON generation fails
   */
  String sheets(Path file, List<String> sheets) throws IOException {
    if (format == OutputFormat.TEXT) {
      if (sheets.isEmpty()) {
        return file + ": single table (no sheets)";
      }
      return String.join(System.lineSeparator(), sheets);
    }
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("file", file.toString());
      gen.writeArrayFieldStart("sheets");
      for (String sheet : sheets) {
        gen.writeString(sheet);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    return out.toString();
  }

  /**
   * Lists registered reader modules.
   *
   * @param modules modules in registration order
   * @return rendered list
   * @throws IOException if JSON generation fails
   */
  String formats(List<ReaderModule> modules) throws IOException {
    if (format == OutputFormat.TEXT) {
      List<String> lines = new ArrayList<>();
      for (ReaderModule module : modules) {
        lines.add(String.format("%-6s %s [%s]", module.id(), module.description(),
            String.join(" ", sortedSuffixes(module))));
      }
      return String.join(System.lineSeparator(), lines);
    }
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartArray();
      for (ReaderModule module : modules) {
        gen.writeStartObject();
        gen.writeStringField("id", module.id());
        gen.writeStringField("description", module.description());
        gen.writeArrayFieldStart("extensions");
        for (String suffix : sortedSuffixes(module)) {
          gen.writeString(suffix);
        }
        gen.writeEndArray();
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    return out.toString();
  }

  private static List<String> sortedSuffixes(ReaderModule module) {
    List<String> suffixes = new ArrayList<>(module.extensions());
    suffixes.sort(SUFFIX_ORDER);
    return suffixes;
  }

  private static String axisRange(List<ColumnSpec> attributes) {
    if (attributes.isEmpty()) {
      return "";
    }
    return " (" + attributes.get(0).name() + " .. " + attributes.get(attributes.size() - 1).name() + ")";
  }

  private static String describeColumns(List<ColumnSpec> columns) {
    if (columns.isEmpty()) {
      return "<none>";
    }
    StringJoiner joined = new StringJoiner(", ");
    for (ColumnSpec column : columns) {
      joined.add(column.name() + " (" + column.kind() + ")");
    }
    return joined.toString();
  }

  private static String previewValues(SpectralTable table, int row) {
    int width = table.domain().attributes().size();
    StringJoiner joined = new StringJoiner(", ", "[", "]");
    for (int a = 0; a < Math.min(width, TEXT_VALUES_PER_ROW); a++) {
      joined.add(Double.toString(table.value(row, a)));
    }
    if (width > TEXT_VALUES_PER_ROW) {
      joined.add("... " + (width - TEXT_VALUES_PER_ROW) + " more");
    }
    return joined.toString();
  }

  private static String metaPairs(SpectralTable table, int row) {
    List<ColumnSpec> metas = table.domain().metas();
    if (metas.isEmpty()) {
      return "";
    }
    StringJoiner joined = new StringJoiner(", ", " {", "}");
    for (int m = 0; m < metas.size(); m++) {
      MetaValue value = table.meta(row, m);
      joined.add(metas.get(m).name() + "=" + (value == null ? "?" : value.toString()));
    }
    return joined.toString();
  }

  private static void writeRow(JsonGenerator gen, SpectralTable table, int row) throws IOException {
    gen.writeStartObject();
    gen.writeArrayFieldStart("values");
    for (double value : table.row(row)) {
      gen.writeNumber(value);
    }
    gen.writeEndArray();
    gen.writeObjectFieldStart("metas");
    List<ColumnSpec> metas = table.domain().metas();
    for (int m = 0; m < metas.size(); m++) {
      gen.writeFieldName(metas.get(m).name());
      MetaValue value = table.meta(row, m);
      if (value == null) {
        gen.writeNull();
      } else if (value instanceof MetaValue.Numeric numeric) {
        gen.writeNumber(numeric.value());
      } else {
        gen.writeString(value.toString());
      }
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }
}
