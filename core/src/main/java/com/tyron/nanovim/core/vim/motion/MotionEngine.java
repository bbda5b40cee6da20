package com.tyron.nanovim.core.vim.motion;

import com.tyron.nanovim.api.editor.Position;
import org.jetbrains.annotations.NotNull;

import java.util.List;

import static com.tyron.nanovim.core.vim.text.WordClassifier.firstNonBlank;
import static com.tyron.nanovim.core.vim.text.WordClassifier.isWordBoundary;

/**
 * Pure cursor motion functions over a list of lines.
 *
 * Results may have a column equal to the line length (one past the last character), which operators need as
 * an exclusive end. Use {@link #clampNormal(List, Position)} before placing a Normal-mode cursor.
 */
public final class MotionEngine {

    private MotionEngine() {
    }

    /**
     * @param count         repeat count, at least 1
     * @param explicitCount true if the user typed a count; {@code G} and {@code gg} then treat it as a line number
     */
    public static Position move(@NotNull List<String> lines, @NotNull Position from, @NotNull Motion motion,
                                int count, boolean explicitCount) {
        Position pos = from.clamp(lines);
        int n = Math.max(1, count);
        switch (motion) {
            case FIRST_LINE:
                return goToLine(lines, explicitCount ? n : 1);
            case LAST_LINE:
                return goToLine(lines, explicitCount ? n : lines.size());
            case LINE_START:
                return pos.withColumn(0);
            case LINE_END:
                return lineEnd(lines, pos);
            case FIRST_NON_BLANK:
                return pos.withColumn(firstNonBlank(lines.get(pos.row())));
            case UP:
                return verticalMove(lines, pos, -n);
            case DOWN:
                return verticalMove(lines, pos, n);
            default:
                break;
        }

        for (int i = 0; i < n; i++) {
            Position next = step(lines, pos, motion);
            if (next.equals(pos)) {
                break;
            }
            pos = next;
        }
        return pos;
    }

    private static Position step(List<String> lines, Position pos, Motion motion) {
        return switch (motion) {
            case LEFT -> left(pos);
            case RIGHT -> right(lines, pos);
            case WORD_FORWARD -> wordForward(lines, pos);
            case WORD_BACKWARD -> wordBackward(lines, pos);
            case WORD_END -> wordEnd(lines, pos);
            default -> throw new IllegalArgumentException("not a repeatable motion: " + motion);
        };
    }

    public static Position left(Position pos) {
        return pos.column() > 0 ? pos.withColumn(pos.column() - 1) : pos;
    }

    public static Position right(List<String> lines, Position pos) {
        int max = maxNormalColumn(lines.get(pos.row()));
        return pos.column() < max ? pos.withColumn(pos.column() + 1) : pos;
    }

    /**
     * Moves {@code rows} lines up (negative) or down, stopping at the first and last line. The column is kept
     * and clamped once on the target line.
     */
    public static Position verticalMove(List<String> lines, Position pos, int rows) {
        int row = (int) Math.max(0, Math.min(lines.size() - 1, (long) pos.row() + rows));
        if (row == pos.row()) {
            return pos;
        }
        return clampNormal(lines, new Position(row, pos.column()));
    }

    /**
     * Skips the rest of the current word, then the boundary characters after it. At the end of a line continues
     * at the start of the next line; on the last line stops one past the last character.
     */
    public static Position wordForward(List<String> lines, Position pos) {
        String line = lines.get(pos.row());
        int col = pos.column();

        while (col < line.length() && !isWordBoundary(line.charAt(col))) {
            col++;
        }
        while (col < line.length() && isWordBoundary(line.charAt(col))) {
            col++;
        }

        if (col < line.length()) {
            return pos.withColumn(col);
        }
        if (pos.row() < lines.size() - 1) {
            return new Position(pos.row() + 1, 0);
        }
        return pos.withColumn(line.length());
    }

    /**
     * Moves to the start of the previous word. At column 0 moves to the end of the previous line.
     */
    public static Position wordBackward(List<String> lines, Position pos) {
        if (pos.column() > 0) {
            String line = lines.get(pos.row());
            int col = Math.min(pos.column(), line.length()) - 1;

            while (col > 0 && isWordBoundary(line.charAt(col))) {
                col--;
            }
            while (col > 0 && !isWordBoundary(line.charAt(col - 1))) {
                col--;
            }
            return pos.withColumn(Math.max(col, 0));
        }
        if (pos.row() > 0) {
            int row = pos.row() - 1;
            return new Position(row, maxNormalColumn(lines.get(row)));
        }
        return pos;
    }

    /**
     * Moves to the last character of the current or next word, continuing onto following lines.
     */
    public static Position wordEnd(List<String> lines, Position pos) {
        int row = pos.row();
        int col = pos.column() + 1;

        while (true) {
            String line = lines.get(row);
            while (col < line.length() && isWordBoundary(line.charAt(col))) {
                col++;
            }
            if (col < line.length()) {
                while (col < line.length() && !isWordBoundary(line.charAt(col))) {
                    col++;
                }
                return new Position(row, col - 1);
            }
            if (row >= lines.size() - 1) {
                return pos;
            }
            row++;
            col = 0;
        }
    }

    public static Position lineEnd(List<String> lines, Position pos) {
        return pos.withColumn(maxNormalColumn(lines.get(pos.row())));
    }

    /**
     * @param lineNumber 1-based, clamped to {@code [1, lines.size()]}
     */
    public static Position goToLine(List<String> lines, int lineNumber) {
        int row = Math.max(1, Math.min(lineNumber, lines.size())) - 1;
        return new Position(row, 0);
    }

    /**
     * Clamps to the document and keeps the column on a character: {@code [0, max(0, length - 1)]}.
     */
    public static Position clampNormal(List<String> lines, Position pos) {
        Position clamped = pos.clamp(lines);
        int max = maxNormalColumn(lines.get(clamped.row()));
        return clamped.column() > max ? clamped.withColumn(max) : clamped;
    }

    private static int maxNormalColumn(String line) {
        return Math.max(0, line.length() - 1);
    }
}
