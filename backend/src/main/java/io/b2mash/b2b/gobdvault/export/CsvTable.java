package io.b2mash.b2b.gobdvault.export;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Builds RFC 4180 CSV with formula-injection defusing. */
public class CsvTable {

  private final List<String> header;
  private final List<List<String>> rows = new ArrayList<>();

  public CsvTable(List<String> header) {
    this.header = List.copyOf(header);
  }

  public CsvTable addRow(List<?> values) {
    if (values.size() != header.size()) {
      throw new IllegalArgumentException(
          "Expected " + header.size() + " values but got " + values.size());
    }
    var row = new ArrayList<String>(values.size());
    for (Object value : values) {
      row.add(value == null ? null : value.toString());
    }
    rows.add(row);
    return this;
  }

  public int rowCount() {
    return rows.size();
  }

  public String render() {
    var out = new StringBuilder();
    appendLine(out, header);
    for (List<String> row : rows) {
      appendLine(out, row);
    }
    return out.toString();
  }

  public byte[] toBytes() {
    return render().getBytes(StandardCharsets.UTF_8);
  }

  private static void appendLine(StringBuilder out, List<String> values) {
    out.append(values.stream().map(CsvTable::escapeCsv).collect(Collectors.joining(",")));
    out.append("\r\n");
  }

  static String escapeCsv(String value) {
    if (value == null) {
      return "";
    }
    // Defuse CSV formula injection (OWASP recommendation)
    if (!value.isEmpty() && "=+-@\t\r".indexOf(value.charAt(0)) >= 0) {
      value = "'" + value;
    }
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
