package star.engine.cli;

import java.io.PrintStream;
import java.util.List;

import star.engine.catalog.ColumnSchema;
import star.engine.exec.Row;

/**
 * Simple ASCII table printer for catalog rows.
 * Headers come from the catalog schema of the first row; nulls print as empty cells.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(List<Row> rows, PrintStream out) {
        if (rows == null || rows.isEmpty()) {
            out.println("(0 row(s))");
            return;
        }
        List<ColumnSchema> schema = rows.get(0).schema().columns();
        int colCount = schema.size();
        String[] headers = new String[colCount];
        for (int i = 0; i < colCount; i++) headers[i] = schema.get(i).name();
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers[i].length();
        for (Row r : rows) {
            for (int i = 0; i < colCount; i++) {
                String s = cell(r.value(i));
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildLine(headers, widths));
        out.println(divLine);
        for (Row r : rows) {
            String[] cells = new String[colCount];
            for (int i = 0; i < colCount; i++) cells[i] = cell(r.value(i));
            out.println(buildLine(cells, widths));
        }
        out.println(divLine);
        out.println("(" + rows.size() + " row(s))");
    }

    private static String cell(Object v) {
        return v == null ? "" : String.valueOf(v);
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            divider.append("-".repeat(w + 2));
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(String[] cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(pad(cells[i], widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
