package com.graphdoc.core.export.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes pipe tables with columns padded to their widest cell.
 *
 * <p>Width is measured on the displayed text, so a link counts with its label only.
 */
class OrgTableWriter {

    private static final Pattern LINK = Pattern.compile("\\[\\[([^\\]]*)](?:\\[([^\\]]*)])?]");

    List<String> write(List<String> header, List<List<String>> rows) {
        List<List<String>> allRows = new ArrayList<>();
        if (header != null) {
            allRows.add(escapeRow(header));
        }
        rows.forEach(row -> allRows.add(escapeRow(row)));
        if (allRows.isEmpty()) {
            return List.of();
        }

        int columns = allRows.stream().mapToInt(List::size).max().orElse(0);
        int[] widths = new int[columns];
        for (List<String> row : allRows) {
            for (int column = 0; column < row.size(); column++) {
                widths[column] = Math.max(widths[column], displayLength(row.get(column)));
            }
        }

        List<String> lines = new ArrayList<>();
        for (int index = 0; index < allRows.size(); index++) {
            lines.add(formatRow(allRows.get(index), widths));
            if (index == 0 && header != null) {
                lines.add(separator(widths));
            }
        }
        return lines;
    }

    static int displayLength(String cell) {
        Matcher matcher = LINK.matcher(cell);
        StringBuilder displayed = new StringBuilder();
        while (matcher.find()) {
            String label = matcher.group(2) != null ? matcher.group(2) : matcher.group(1);
            matcher.appendReplacement(displayed, Matcher.quoteReplacement(label));
        }
        matcher.appendTail(displayed);
        return displayed.length();
    }

    private static List<String> escapeRow(List<String> row) {
        List<String> cells = new ArrayList<>(row.size());
        for (String cell : row) {
            cells.add(escapeCell(cell));
        }
        return cells;
    }

    private static String escapeCell(String cell) {
        if (cell == null) {
            return "";
        }
        return cell.replace("|", "\\vert{}")
            .replaceAll("\\s*\\R\\s*", " ")
            .trim();
    }

    private static String formatRow(List<String> row, int[] widths) {
        StringBuilder line = new StringBuilder("|");
        for (int column = 0; column < widths.length; column++) {
            String cell = column < row.size() ? row.get(column) : "";
            line.append(' ')
                .append(cell)
                .append(" ".repeat(widths[column] - displayLength(cell)))
                .append(" |");
        }
        return line.toString();
    }

    private static String separator(int[] widths) {
        StringBuilder line = new StringBuilder("|");
        for (int column = 0; column < widths.length; column++) {
            if (column > 0) {
                line.append('+');
            }
            line.append("-".repeat(widths[column] + 2));
        }
        return line.append('|').toString();
    }
}
