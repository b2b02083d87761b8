package com.marketdesk.jobs.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Left-aligned plain-text table for terminal output.
 */
class TableWriter {

    private static final int MAX_CELL_WIDTH = 60;

    private final List<String> headers;
    private final List<List<String>> rows = new ArrayList<>();

    TableWriter(String... headers) {
        this.headers = Arrays.asList(headers);
    }

    TableWriter row(Object... cells) {
        List<String> row = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            Object cell = i < cells.length ? cells[i] : null;
            row.add(truncate(cell == null ? "" : cell.toString()));
        }
        rows.add(row);
        return this;
    }

    void print(PrintStream out) {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = headers.get(i).length();
            for (List<String> row : rows) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }

        out.println(format(headers, widths));
        StringBuilder rule = new StringBuilder();
        for (int i = 0; i < widths.length; i++) {
            rule.append("-".repeat(widths[i]));
            if (i < widths.length - 1) {
                rule.append("  ");
            }
        }
        out.println(rule);
        for (List<String> row : rows) {
            out.println(format(row, widths));
        }
    }

    private static String format(List<String> cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            String cell = cells.get(i);
            line.append(cell);
            if (i < cells.size() - 1) {
                line.append(" ".repeat(widths[i] - cell.length() + 2));
            }
        }
        return line.toString();
    }

    private static String truncate(String value) {
        return value.length() <= MAX_CELL_WIDTH ? value : value.substring(0, MAX_CELL_WIDTH - 3) + "...";
    }
}
