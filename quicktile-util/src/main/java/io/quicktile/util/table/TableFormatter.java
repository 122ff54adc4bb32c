package io.quicktile.util.table;

/*
 * Copyright (c) quicktile
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Formats rows of text cells as an aligned plain-text table, optionally grouped by
 * one of the columns.
 *
 * <p>The output starts with the header line and a divider, followed by the data rows.
 * Columns are as wide as their widest header or cell. A row with fewer cells than
 * there are headers only renders its own cells; it is neither padded nor rejected.
 *
 * <h2>Grouping</h2>
 *
 * <p>When a group column is given, that column is removed from the headers and from
 * every row, and rows are bucketed by its value. Groups are emitted in ascending
 * string order, each preceded by a blank line and its label, with rows kept in their
 * original relative order. The divider is widened when needed so that it is never
 * narrower than the longest group label.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * String table = new TableFormatter().format(
 *     TableRows.of(List.of(List.of("left", "0"), List.of("right", "1"))),
 *     List.of("Name", "Index"));
 * }</pre>
 *
 * <p>Instances are stateless apart from their {@link TableStyle} and may be reused.
 */
public final class TableFormatter {

    private static final Logger logger = LogManager.getLogger(TableFormatter.class);

    private static final String NO_GROUP = "";

    private final TableStyle style;

    /**
     * Creates a formatter using {@link TableStyle#DEFAULT}.
     */
    public TableFormatter() {
        this(TableStyle.DEFAULT);
    }

    /**
     * Creates a formatter with the given rendering style.
     *
     * @param style pad, divider and indent settings
     */
    public TableFormatter(TableStyle style) {
        this.style = Objects.requireNonNull(style, "style");
    }

    public TableStyle getStyle() {
        return style;
    }

    /**
     * Formats rows with the default style and no grouping.
     *
     * @param rows    rows of cells
     * @param headers column labels
     * @return formatted table string
     */
    public static String formatTable(List<? extends List<String>> rows, List<String> headers) {
        return new TableFormatter().format(TableRows.of(rows), headers, OptionalInt.empty());
    }

    /**
     * Formats rows with the default style, grouped by the given column.
     *
     * @param rows    rows of cells
     * @param headers column labels, including the group column
     * @param groupBy index of the column to group by
     * @return formatted table string
     */
    public static String formatTable(List<? extends List<String>> rows, List<String> headers, int groupBy) {
        return new TableFormatter().format(TableRows.of(rows), headers, OptionalInt.of(groupBy));
    }

    /**
     * Formats a mapping as a two-column table sorted by key, with the default style.
     *
     * @param entries mapping with mutually comparable keys
     * @param headers column labels
     * @return formatted table string
     */
    public static String formatTable(Map<?, ?> entries, List<String> headers) {
        return new TableFormatter().format(TableRows.of(entries), headers, OptionalInt.empty());
    }

    /**
     * Formats rows without grouping.
     *
     * @param rows    row source
     * @param headers column labels
     * @return formatted table string
     */
    public String format(TableRows rows, List<String> headers) {
        return format(rows, headers, OptionalInt.empty());
    }

    /**
     * Formats rows grouped by the given column.
     *
     * @param rows    row source
     * @param headers column labels, including the group column
     * @param groupBy index of the column to group by
     * @return formatted table string
     */
    public String format(TableRows rows, List<String> headers, int groupBy) {
        return format(rows, headers, OptionalInt.of(groupBy));
    }

    /**
     * Formats the table as an aligned string.
     *
     * @param rows    row source
     * @param headers column labels, including the group column if one is given
     * @param groupBy index of the column to group by, or empty for a single ungrouped block
     * @return formatted table string, one newline-terminated line per table line
     * @throws IndexOutOfBoundsException if the group column does not exist in the headers or in some row
     * @throws IllegalArgumentException  if a row, header or cell is null
     */
    public String format(TableRows rows, List<String> headers, OptionalInt groupBy) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(groupBy, "groupBy");

        List<String> columns = new ArrayList<>(headers);
        List<List<String>> body = rows.toRows();
        for (int c = 0; c < columns.size(); c++) {
            if (columns.get(c) == null) {
                throw new IllegalArgumentException("Header at position " + c + " is null");
            }
        }
        requireNoNullCells(body);

        SortedMap<String, List<List<String>>> groups = groupRows(columns, body, groupBy);

        int[] colWidths = computeColumnWidths(columns, body);
        int groupWidth = groups.keySet().stream().mapToInt(String::length).max().orElse(0);
        logger.trace("column widths {}, group label width {}", () -> Arrays.toString(colWidths), () -> groupWidth);

        StringBuilder sb = new StringBuilder();
        appendRow(sb, colWidths, columns, style.padChar(), 0, 0);
        appendRow(sb, colWidths, Collections.nCopies(columns.size(), ""), style.dividerChar(), 0, groupWidth + 1);
        appendGroups(sb, colWidths, groups);

        logger.debug("formatted {} rows in {} groups over {} columns", body.size(), groups.size(), columns.size());
        return sb.toString();
    }

    /**
     * Buckets rows by group key, removing the group column from the headers and rows
     * in place when one is given.
     */
    private static SortedMap<String, List<List<String>>> groupRows(
        List<String> columns, List<List<String>> body, OptionalInt groupBy) {

        SortedMap<String, List<List<String>>> groups = new TreeMap<>();
        if (groupBy.isEmpty()) {
            groups.put(NO_GROUP, body);
            return groups;
        }

        int groupColumn = groupBy.getAsInt();
        if (groupColumn < 0 || groupColumn >= columns.size()) {
            throw new IndexOutOfBoundsException(
                "Group column " + groupColumn + " out of range for " + columns.size() + " headers");
        }
        columns.remove(groupColumn);

        for (int r = 0; r < body.size(); r++) {
            List<String> row = body.get(r);
            if (groupColumn >= row.size()) {
                throw new IndexOutOfBoundsException(
                    "Group column " + groupColumn + " out of range for row " + r + " with " + row.size() + " cells");
            }
            String group = row.remove(groupColumn);
            groups.computeIfAbsent(group, k -> new ArrayList<>()).add(row);
        }
        return groups;
    }

    /**
     * Computes the width of each column as the longest of its header and of the cells
     * in that position. Rows too short to reach a column do not contribute to it.
     *
     * @param headers column labels
     * @param rows    rows of cells
     * @return one width per header
     */
    static int[] computeColumnWidths(List<String> headers, List<List<String>> rows) {
        int[] widths = new int[headers.size()];
        for (int pos = 0; pos < widths.length; pos++) {
            int width = headers.get(pos).length();
            for (List<String> row : rows) {
                if (row.size() > pos) {
                    width = Math.max(width, row.get(pos).length());
                }
            }
            widths[pos] = width;
        }
        return widths;
    }

    private void appendGroups(StringBuilder sb, int[] colWidths, SortedMap<String, List<List<String>>> groups) {
        for (Map.Entry<String, List<List<String>>> group : groups.entrySet()) {
            if (!group.getKey().isEmpty()) {
                sb.append('\n').append(group.getKey()).append('\n');
            }
            for (List<String> row : group.getValue()) {
                appendRow(sb, colWidths, row, style.padChar(), style.dataIndent(), 0);
            }
        }
    }

    /**
     * Appends one table line. Each cell is written as the indent, the cell left-justified
     * to its column width with {@code pad}, and a separator space. Only as many cells as
     * both the row and the column list provide are written.
     *
     * <p>If the line comes out narrower than {@code minWidth}, the trailing separator is
     * replaced by pad characters so the line is exactly {@code minWidth} wide.
     */
    static void appendRow(StringBuilder sb, int[] colWidths, List<String> cells, char pad, int indent, int minWidth) {
        int start = sb.length();
        int count = Math.min(colWidths.length, cells.size());
        for (int i = 0; i < count; i++) {
            String cell = cells.get(i);
            repeat(sb, ' ', indent);
            sb.append(cell);
            repeat(sb, pad, colWidths[i] - cell.length());
            sb.append(' ');
        }

        int rendered = sb.length() - start;
        if (rendered < minWidth) {
            if (count > 0) {
                sb.setLength(sb.length() - 1);
                repeat(sb, pad, minWidth - rendered + 1);
            } else {
                repeat(sb, pad, minWidth);
            }
        }
        sb.append('\n');
    }

    private static void repeat(StringBuilder sb, char c, int times) {
        for (int i = 0; i < times; i++) {
            sb.append(c);
        }
    }

    private static void requireNoNullCells(List<List<String>> rows) {
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            for (int c = 0; c < row.size(); c++) {
                if (row.get(c) == null) {
                    throw new IllegalArgumentException("Row " + r + " has a null cell at position " + c);
                }
            }
        }
    }
}
