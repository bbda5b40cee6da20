package com.tyron.nanovim.core.vim.edit;

import com.tyron.nanovim.api.editor.Editor;
import com.tyron.nanovim.api.editor.Position;
import com.tyron.nanovim.api.editor.Range;
import com.tyron.nanovim.core.vim.Keys;
import com.tyron.nanovim.core.vim.register.RegisterStore;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.tyron.nanovim.core.vim.register.RegisterStore.LINE_TERMINATOR;

/**
 * Mutating operations on the editor's document.
 *
 * Every removal or yank is captured into the selected register before the document changes. The caret is left
 * where the operation ends; callers staying in Normal mode clamp it onto a character.
 */
public final class EditEngine {

    private final Editor editor;
    private final RegisterStore registers;

    public EditEngine(@NotNull Editor editor, @NotNull RegisterStore registers) {
        this.editor = Objects.requireNonNull(editor, "editor");
        this.registers = Objects.requireNonNull(registers, "registers");
    }

    // x
    public void deleteChars(int count) {
        List<String> lines = lines();
        Position pos = caret(lines);
        String line = lines.get(pos.row());
        if (pos.column() >= line.length()) {
            return;
        }
        int end = Math.min(line.length(), pos.column() + Math.max(1, count));
        registers.capture(line.substring(pos.column(), end));
        lines.set(pos.row(), line.substring(0, pos.column()) + line.substring(end));
        commit(lines, pos);
    }

    // X
    public void deleteCharsBefore(int count) {
        List<String> lines = lines();
        Position pos = caret(lines);
        if (pos.column() == 0) {
            return;
        }
        String line = lines.get(pos.row());
        int start = Math.max(0, pos.column() - Math.max(1, count));
        registers.capture(line.substring(start, pos.column()));
        lines.set(pos.row(), line.substring(0, start) + line.substring(pos.column()));
        commit(lines, pos.withColumn(start));
    }

    /**
     * Deletes {@code count} lines starting at {@code row}. Deleting every line leaves one empty line.
     */
    public void deleteLines(int row, int count) {
        List<String> lines = lines();
        int n = lineSpan(lines, row, count);
        registers.captureLines(joinLines(lines, row, n));
        lines.subList(row, row + n).clear();
        if (lines.isEmpty()) {
            lines.add("");
        }
        commit(lines, new Position(Math.min(row, lines.size() - 1), 0));
    }

    public void yankLines(int row, int count) {
        List<String> lines = lines();
        registers.captureLines(joinLines(lines, row, lineSpan(lines, row, count)));
    }

    /**
     * Replaces {@code count} lines with a single empty line and places the caret on it.
     */
    public void changeLines(int row, int count) {
        List<String> lines = lines();
        int n = lineSpan(lines, row, count);
        registers.captureLines(joinLines(lines, row, n));
        lines.subList(row, row + n).clear();
        lines.add(row, "");
        commit(lines, new Position(row, 0));
    }

    // D and C
    public void deleteToLineEnd() {
        List<String> lines = lines();
        Position pos = caret(lines);
        String line = lines.get(pos.row());
        if (pos.column() >= line.length()) {
            return;
        }
        registers.capture(line.substring(pos.column()));
        lines.set(pos.row(), line.substring(0, pos.column()));
        commit(lines, pos);
    }

    /**
     * Deletes the characters in {@code range} (end exclusive) and moves the caret to its start.
     */
    public void deleteRange(@NotNull Range range) {
        List<String> lines = lines();
        Range r = clamp(lines, range);
        if (r.isEmpty()) {
            return;
        }
        registers.capture(textIn(lines, r.start(), r.end()));
        deleteSpan(lines, r.start(), r.end());
        commit(lines, r.start());
    }

    public void yankRange(@NotNull Range range) {
        List<String> lines = lines();
        Range r = clamp(lines, range);
        if (r.isEmpty()) {
            return;
        }
        registers.capture(textIn(lines, r.start(), r.end()));
        editor.getCaretModel().moveTo(r.start());
    }

    /**
     * Deletes the rectangle of rows {@code [top, bottom]} and columns {@code [left, right]}.
     * The captured rows are joined with line terminators but carry no trailing one.
     */
    public void deleteBlock(int top, int bottom, int left, int right) {
        List<String> lines = lines();
        registers.capture(blockText(lines, top, bottom, left, right));
        for (int row = top; row <= Math.min(bottom, lines.size() - 1); row++) {
            String line = lines.get(row);
            int from = Math.min(left, line.length());
            int to = Math.min(right + 1, line.length());
            lines.set(row, line.substring(0, from) + line.substring(to));
        }
        commit(lines, new Position(top, left));
    }

    public void yankBlock(int top, int bottom, int left, int right) {
        List<String> lines = lines();
        registers.capture(blockText(lines, top, bottom, left, right));
        editor.getCaretModel().moveTo(new Position(top, left).clamp(lines));
    }

    // p
    public void pasteAfter() {
        String text = registers.get();
        if (text.isEmpty()) {
            return;
        }
        List<String> lines = lines();
        Position pos = caret(lines);

        if (registers.isLinewise()) {
            List<String> pasted = splitLinewise(text);
            lines.addAll(pos.row() + 1, pasted);
            commit(lines, new Position(pos.row() + 1, 0));
            return;
        }

        String line = lines.get(pos.row());
        int at = line.isEmpty() ? 0 : Math.min(pos.column() + 1, line.length());
        insertInline(lines, new Position(pos.row(), at), text);
    }

    // P
    public void pasteBefore() {
        String text = registers.get();
        if (text.isEmpty()) {
            return;
        }
        List<String> lines = lines();
        Position pos = caret(lines);

        if (registers.isLinewise()) {
            lines.addAll(pos.row(), splitLinewise(text));
            commit(lines, new Position(pos.row(), 0));
            return;
        }
        insertInline(lines, pos, text);
    }

    // o
    public void openLineBelow() {
        List<String> lines = lines();
        Position pos = caret(lines);
        lines.add(pos.row() + 1, "");
        commit(lines, new Position(pos.row() + 1, 0));
    }

    // O
    public void openLineAbove() {
        List<String> lines = lines();
        Position pos = caret(lines);
        lines.add(pos.row(), "");
        commit(lines, new Position(pos.row(), 0));
    }

    /**
     * Replaces {@code count} characters starting at the caret with {@code ch}. Does nothing if the line is too
     * short.
     */
    public void replaceChars(char ch, int count) {
        List<String> lines = lines();
        Position pos = caret(lines);
        String line = lines.get(pos.row());
        int n = Math.max(1, count);
        if (pos.column() + n > line.length()) {
            return;
        }
        lines.set(pos.row(), line.substring(0, pos.column()) + String.valueOf(ch).repeat(n)
                + line.substring(pos.column() + n));
        commit(lines, pos.withColumn(pos.column() + n - 1));
    }

    /**
     * Replace mode: overwrites the character under the caret (or appends at the line end) and advances.
     */
    public void overwriteChar(char ch) {
        List<String> lines = lines();
        Position pos = caret(lines);
        String line = lines.get(pos.row());
        String rest = pos.column() < line.length() ? line.substring(pos.column() + 1) : "";
        lines.set(pos.row(), line.substring(0, pos.column()) + ch + rest);
        commit(lines, pos.withColumn(pos.column() + 1));
    }

    /**
     * Applies an Insert-mode key to the document as a text widget would.
     *
     * @return false if the key does not edit text
     */
    public boolean typeKey(@NotNull String key) {
        List<String> lines = lines();
        Position pos = caret(lines);
        String line = lines.get(pos.row());

        if (Keys.isEnter(key)) {
            lines.set(pos.row(), line.substring(0, pos.column()));
            lines.add(pos.row() + 1, line.substring(pos.column()));
            commit(lines, new Position(pos.row() + 1, 0));
            return true;
        }
        if (Keys.BACKSPACE.equals(key)) {
            if (pos.column() > 0) {
                lines.set(pos.row(), line.substring(0, pos.column() - 1) + line.substring(pos.column()));
                commit(lines, pos.withColumn(pos.column() - 1));
            } else if (pos.row() > 0) {
                String previous = lines.get(pos.row() - 1);
                lines.set(pos.row() - 1, previous + line);
                lines.remove(pos.row());
                commit(lines, new Position(pos.row() - 1, previous.length()));
            }
            return true;
        }

        char ch = Keys.toChar(key);
        if (ch == Keys.NONE) {
            return false;
        }
        lines.set(pos.row(), line.substring(0, pos.column()) + ch + line.substring(pos.column()));
        commit(lines, pos.withColumn(pos.column() + 1));
        return true;
    }

    private void insertInline(List<String> lines, Position at, String text) {
        String line = lines.get(at.row());
        String before = line.substring(0, at.column());
        String after = line.substring(at.column());
        String[] parts = text.split(LINE_TERMINATOR, -1);

        if (parts.length == 1) {
            lines.set(at.row(), before + text + after);
            commit(lines, at.withColumn(at.column() + text.length() - 1));
            return;
        }

        lines.set(at.row(), before + parts[0]);
        for (int i = 1; i < parts.length; i++) {
            String part = i == parts.length - 1 ? parts[i] + after : parts[i];
            lines.add(at.row() + i, part);
        }
        commit(lines, at);
    }

    /**
     * @return The text between {@code start} and {@code end} (exclusive), rows joined with line terminators.
     */
    public static String textIn(List<String> lines, Position start, Position end) {
        if (start.row() == end.row()) {
            return lines.get(start.row()).substring(start.column(), end.column());
        }
        StringBuilder sb = new StringBuilder();
        sb.append(lines.get(start.row()).substring(start.column())).append(LINE_TERMINATOR);
        for (int row = start.row() + 1; row < end.row(); row++) {
            sb.append(lines.get(row)).append(LINE_TERMINATOR);
        }
        sb.append(lines.get(end.row()), 0, end.column());
        return sb.toString();
    }

    private static void deleteSpan(List<String> lines, Position start, Position end) {
        String head = lines.get(start.row()).substring(0, start.column());
        String tail = lines.get(end.row()).substring(end.column());
        lines.subList(start.row() + 1, end.row() + 1).clear();
        lines.set(start.row(), head + tail);
    }

    private static String blockText(List<String> lines, int top, int bottom, int left, int right) {
        StringBuilder sb = new StringBuilder();
        for (int row = top; row <= Math.min(bottom, lines.size() - 1); row++) {
            String line = lines.get(row);
            if (row > top) {
                sb.append(LINE_TERMINATOR);
            }
            sb.append(line, Math.min(left, line.length()), Math.min(right + 1, line.length()));
        }
        return sb.toString();
    }

    private static String joinLines(List<String> lines, int row, int count) {
        return String.join(LINE_TERMINATOR, lines.subList(row, row + count)) + LINE_TERMINATOR;
    }

    private static List<String> splitLinewise(String text) {
        String body = text.substring(0, text.length() - LINE_TERMINATOR.length());
        return List.of(body.split(LINE_TERMINATOR, -1));
    }

    private static int lineSpan(List<String> lines, int row, int count) {
        return Math.max(1, Math.min(count, lines.size() - row));
    }

    private static Range clamp(List<String> lines, Range range) {
        Range r = range.normalized();
        return new Range(r.start().clamp(lines), r.end().clamp(lines));
    }

    private List<String> lines() {
        return new ArrayList<>(editor.getDocument().getLines());
    }

    private Position caret(List<String> lines) {
        return editor.getCaretModel().getPosition().clamp(lines);
    }

    private void commit(List<String> lines, Position caret) {
        editor.getDocument().setText(String.join(LINE_TERMINATOR, lines));
        editor.getCaretModel().moveTo(caret.clamp(lines));
    }
}
