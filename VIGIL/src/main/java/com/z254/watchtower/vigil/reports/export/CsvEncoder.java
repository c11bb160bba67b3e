package com.z254.watchtower.vigil.reports.export;

import java.util.List;

/**
 * Minimal RFC 4180 writer. Lines are separated by {@code \n}. Cells holding a quote, comma,
 * CR or LF are quoted with inner quotes doubled. Null cells are empty.
 */
public final class CsvEncoder {

    private CsvEncoder() {}

    public static String encode(List<String> header, List<List<String>> rows) {
        StringBuilder out = new StringBuilder();
        appendLine(out, header);
        for (List<String> row : rows) {
            out.append('\n');
            appendLine(out, row);
        }
        return out.toString();
    }

    public static String escape(String cell) {
        if (cell == null) {
            return "";
        }
        boolean needsQuotes = cell.indexOf('"') >= 0 || cell.indexOf(',') >= 0
                || cell.indexOf('\n') >= 0 || cell.indexOf('\r') >= 0;
        if (!needsQuotes) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }

    private static void appendLine(StringBuilder out, List<String> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(escape(cells.get(i)));
        }
    }
}
