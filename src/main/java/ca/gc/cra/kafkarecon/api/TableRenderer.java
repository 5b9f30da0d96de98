package ca.gc.cra.kafkarecon.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders aligned text tables.
 *
 * <p>Layout: three-space indent, two-space column gap, a dash underline as long as each header, and columns
 * padded to their widest cell. A cell holding a {@link List} spans one line per element; sibling cells on the
 * extra lines show {@code " ..."}.</p>
 */
final class TableRenderer {
  static final String INDENT = "   ";
  static final String GAP = "  ";
  static final String CONTINUATION = " ...";
  static final String ABSENT = "-";

  private TableRenderer() {
    // Utility
  }

  static List<String> render(List<String> headers, List<List<Object>> rows) {
    if (headers == null || headers.isEmpty()) {
      return List.of();
    }
    List<List<String>> lines = new ArrayList<>();
    lines.add(List.copyOf(headers));
    List<String> underline = new ArrayList<>();
    for (String header : headers) {
      underline.add("-".repeat(header.length()));
    }
    lines.add(underline);
    for (List<Object> row : rows) {
      lines.addAll(expand(row, headers.size()));
    }

    int[] widths = new int[headers.size()];
    for (List<String> line : lines) {
      for (int i = 0; i < widths.length; i++) {
        widths[i] = Math.max(widths[i], line.get(i).length());
      }
    }

    List<String> rendered = new ArrayList<>(lines.size());
    for (List<String> line : lines) {
      StringBuilder sb = new StringBuilder(INDENT);
      for (int i = 0; i < widths.length; i++) {
        if (i > 0) {
          sb.append(GAP);
        }
        String cell = line.get(i);
        sb.append(cell).append(" ".repeat(widths[i] - cell.length()));
      }
      rendered.add(sb.toString().stripTrailing());
    }
    return rendered;
  }

  private static List<List<String>> expand(List<Object> row, int columns) {
    List<List<String>> cells = new ArrayList<>(columns);
    int height = 0;
    for (int i = 0; i < columns; i++) {
      Object cell = i < row.size() ? row.get(i) : null;
      List<String> values = new ArrayList<>();
      if (cell instanceof List<?> list) {
        for (Object element : list) {
          values.add(text(element));
        }
      } else {
        values.add(text(cell));
      }
      cells.add(values);
      height = Math.max(height, values.size());
    }
    if (height == 0) {
      return Collections.emptyList();
    }
    List<List<String>> lines = new ArrayList<>(height);
    for (int line = 0; line < height; line++) {
      List<String> values = new ArrayList<>(columns);
      for (List<String> column : cells) {
        values.add(line < column.size() ? column.get(line) : CONTINUATION);
      }
      lines.add(values);
    }
    return lines;
  }

  private static String text(Object value) {
    return value == null ? ABSENT : String.valueOf(value);
  }
}
