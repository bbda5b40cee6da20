package com.tyron.nanovim.api.editor;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A zero-based (row, column) coordinate in a line oriented document.
 * Ordering is lexicographic: row first, then column.
 */
public record Position(int row, int column) implements Comparable<Position> {

    public static final Position ORIGIN = new Position(0, 0);

    public Position {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("negative position: (" + row + ", " + column + ")");
        }
    }

    public Position withColumn(int column) {
        return new Position(row, column);
    }

    public boolean isBefore(Position other) {
        return compareTo(other) < 0;
    }

    /**
     * Clamps the row to {@code [0, lines.size() - 1]} and the column to {@code [0, lineLength]}.
     */
    public Position clamp(@NotNull List<String> lines) {
        if (lines.isEmpty()) {
            return ORIGIN;
        }
        int r = Math.min(row, lines.size() - 1);
        int c = Math.min(column, lines.get(r).length());
        return r == row && c == column ? this : new Position(r, c);
    }

    @Override
    public int compareTo(@NotNull Position o) {
        if (row != o.row) {
            return Integer.compare(row, o.row);
        }
        return Integer.compare(column, o.column);
    }

    public static Position min(Position a, Position b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static Position max(Position a, Position b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
