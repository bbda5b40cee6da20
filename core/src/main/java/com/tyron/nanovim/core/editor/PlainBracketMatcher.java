package com.tyron.nanovim.core.editor;

import com.tyron.nanovim.api.editor.BracketMatcher;
import com.tyron.nanovim.api.editor.Document;
import com.tyron.nanovim.api.editor.Position;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Text-only {@link BracketMatcher} for {@code ()}, {@code []} and {@code {}}.
 *
 * Starts from the first bracket at or after the position on the same line and counts nesting across lines.
 * Brackets inside strings or comments are not special.
 */
public final class PlainBracketMatcher implements BracketMatcher {

    private static final String OPEN = "([{";
    private static final String CLOSE = ")]}";

    @Nullable
    @Override
    public Position findMatch(@NotNull Document document, @NotNull Position position) {
        List<String> lines = document.getLines();
        Position pos = position.clamp(lines);
        String line = lines.get(pos.row());

        int col = pos.column();
        while (col < line.length() && OPEN.indexOf(line.charAt(col)) < 0 && CLOSE.indexOf(line.charAt(col)) < 0) {
            col++;
        }
        if (col >= line.length()) {
            return null;
        }

        char bracket = line.charAt(col);
        int open = OPEN.indexOf(bracket);
        if (open >= 0) {
            return scanForward(lines, pos.row(), col, bracket, CLOSE.charAt(open));
        }
        int close = CLOSE.indexOf(bracket);
        return scanBackward(lines, pos.row(), col, bracket, OPEN.charAt(close));
    }

    private static Position scanForward(List<String> lines, int row, int col, char self, char match) {
        int depth = 0;
        for (int r = row; r < lines.size(); r++) {
            String line = lines.get(r);
            for (int c = r == row ? col : 0; c < line.length(); c++) {
                char ch = line.charAt(c);
                if (ch == self) {
                    depth++;
                } else if (ch == match && --depth == 0) {
                    return new Position(r, c);
                }
            }
        }
        return null;
    }

    private static Position scanBackward(List<String> lines, int row, int col, char self, char match) {
        int depth = 0;
        for (int r = row; r >= 0; r--) {
            String line = lines.get(r);
            for (int c = r == row ? col : line.length() - 1; c >= 0; c--) {
                char ch = line.charAt(c);
                if (ch == self) {
                    depth++;
                } else if (ch == match && --depth == 0) {
                    return new Position(r, c);
                }
            }
        }
        return null;
    }
}
