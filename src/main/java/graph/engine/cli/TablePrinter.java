package graph.engine.cli;

import java.util.List;

import graph.engine.table.ResultTable;

/**
 * Simple ASCII table printer for query results. Nulls render as "null".
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(ResultTable table) {
        System.out.println(render(table));
    }

    public static String render(ResultTable table) {
        List<String> headers = table.columnNames();
        int colCount = headers.size();
        int rowCount = table.rowCount();
        if (colCount == 0) return "(" + rowCount + " row(s))";
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers.get(i).length();
        for (int r = 0; r < rowCount; r++) {
            List<Object> vals = table.row(r);
            for (int i = 0; i < colCount; i++) {
                String s = String.valueOf(vals.get(i));
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String divLine = buildDivider(widths);
        StringBuilder out = new StringBuilder();
        out.append(divLine).append('\n');
        out.append(buildRow(headers, widths)).append('\n');
        out.append(divLine).append('\n');
        for (int r = 0; r < rowCount; r++) {
            out.append(buildRow(table.row(r), widths)).append('\n');
        }
        out.append(divLine).append('\n');
        out.append("(").append(rowCount).append(" row(s))");
        return out.toString();
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

    private static String buildRow(List<?> vals, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            String s = String.valueOf(vals.get(i));
            sb.append(' ').append(pad(s, widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
