package io.github.themoah.kfcli.cli;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Plain ASCII table with a header row, columns sized to their widest cell.
 */
public class TablePrinter {

  private final List<String> headers;
  private final List<List<String>> rows = new ArrayList<>();

  public TablePrinter(String... headers) {
    if (headers.length == 0) {
      throw new IllegalArgumentException("table needs at least one column");
    }
    this.headers = List.of(headers);
  }

  public TablePrinter addRow(Object... cells) {
    if (cells.length != headers.size()) {
      throw new IllegalArgumentException(
        "expected " + headers.size() + " cells, got " + cells.length);
    }
    rows.add(Arrays.stream(cells).map(String::valueOf).toList());
    return this;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public void print(PrintWriter out) {
    out.print(render());
    out.flush();
  }

  String render() {
    int[] widths = new int[headers.size()];
    for (int i = 0; i < widths.length; i++) {
      widths[i] = headers.get(i).length();
    }
    for (List<String> row : rows) {
      for (int i = 0; i < widths.length; i++) {
        widths[i] = Math.max(widths[i], row.get(i).length());
      }
    }

    String separator = separator(widths);
    StringBuilder sb = new StringBuilder();
    sb.append(separator);
    appendRow(sb, headers, widths);
    sb.append(separator);
    for (List<String> row : rows) {
      appendRow(sb, row, widths);
    }
    if (!rows.isEmpty()) {
      sb.append(separator);
    }
    return sb.toString();
  }

  private static String separator(int[] widths) {
    StringBuilder sb = new StringBuilder("+");
    for (int width : widths) {
      sb.append("-".repeat(width + 2)).append('+');
    }
    return sb.append(System.lineSeparator()).toString();
  }

  private static void appendRow(StringBuilder sb, List<String> cells, int[] widths) {
    sb.append('|');
    for (int i = 0; i < widths.length; i++) {
      String cell = cells.get(i);
      sb.append(' ').append(cell).append(" ".repeat(widths[i] - cell.length())).append(" |");
    }
    sb.append(System.lineSeparator());
  }
}
