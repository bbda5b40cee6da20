package com.tyron.nanovim.core.vim.search;

import com.tyron.nanovim.api.editor.Editor;
import com.tyron.nanovim.api.editor.Position;
import com.tyron.nanovim.core.vim.mark.JumpList;
import com.tyron.nanovim.core.vim.options.EditorOption;
import com.tyron.nanovim.core.vim.options.VimOptions;
import com.tyron.nanovim.core.vim.search.SearchState.Direction;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.tyron.nanovim.core.vim.text.WordClassifier.isWordBoundary;

/**
 * Plain substring search with wraparound.
 *
 * A successful search records the starting position in the jump list and moves the caret to the match.
 * A missing pattern or no match leaves everything unchanged.
 */
public final class SearchEngine {

    private static final Logger LOG = Logger.getLogger(SearchEngine.class.getName());

    private final Editor editor;
    private final JumpList jumpList;
    private final VimOptions options;
    private final SearchState state;

    public SearchEngine(@NotNull Editor editor, @NotNull JumpList jumpList, @NotNull VimOptions options,
                        @NotNull SearchState state) {
        this.editor = Objects.requireNonNull(editor, "editor");
        this.jumpList = Objects.requireNonNull(jumpList, "jumpList");
        this.options = Objects.requireNonNull(options, "options");
        this.state = Objects.requireNonNull(state, "state");
    }

    public SearchState getState() {
        return state;
    }

    /**
     * Starts a new search ({@code /} or {@code ?}).
     */
    public boolean search(@NotNull String pattern, @NotNull Direction direction) {
        state.setDirection(direction);
        if (!pattern.isEmpty()) {
            state.setPattern(pattern);
        }
        return find(direction);
    }

    // n
    public boolean searchNext() {
        return find(state.getDirection());
    }

    // N
    public boolean searchPrevious() {
        return find(state.getDirection().reverse());
    }

    /**
     * {@code *} and {@code #}: searches for the word containing or following the caret.
     */
    public boolean searchWordUnderCursor(@NotNull Direction direction) {
        List<String> lines = editor.getDocument().getLines();
        Position caret = editor.getCaretModel().getPosition().clamp(lines);
        String word = wordAt(lines.get(caret.row()), caret.column());
        if (word == null) {
            return false;
        }
        state.setPattern(word);
        state.setDirection(direction);
        return find(direction);
    }

    private boolean find(Direction direction) {
        if (!state.hasPattern()) {
            return false;
        }
        List<String> lines = editor.getDocument().getLines();
        Position caret = editor.getCaretModel().getPosition().clamp(lines);
        boolean ignoreCase = options.isEnabled(EditorOption.IGNORE_CASE);
        boolean wrap = options.isEnabled(EditorOption.WRAP_SCAN);

        Position match = direction == Direction.FORWARD
                ? findForward(lines, caret, state.getPattern(), ignoreCase, wrap)
                : findBackward(lines, caret, state.getPattern(), ignoreCase, wrap);
        if (match == null) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Pattern not found: " + state.getPattern());
            }
            return false;
        }

        jumpList.push(caret);
        editor.getCaretModel().moveTo(match);
        editor.scrollToCaret();
        return true;
    }

    /**
     * Scans from {@code column + 1} of the start row to the end of the document, then (when {@code wrap})
     * from row 0 through the start row.
     */
    @Nullable
    public static Position findForward(List<String> lines, Position from, String pattern, boolean ignoreCase,
                                       boolean wrap) {
        for (int row = from.row(); row < lines.size(); row++) {
            String line = lines.get(row);
            int start = row == from.row() ? Math.min(from.column() + 1, line.length()) : 0;
            int idx = indexOf(line, pattern, start, ignoreCase);
            if (idx >= 0) {
                return new Position(row, idx);
            }
        }
        if (!wrap) {
            return null;
        }
        for (int row = 0; row <= from.row(); row++) {
            int idx = indexOf(lines.get(row), pattern, 0, ignoreCase);
            if (idx >= 0) {
                return new Position(row, idx);
            }
        }
        return null;
    }

    /**
     * Mirror of {@link #findForward}: matches must start before {@code column} on the start row, then earlier
     * rows, then (when {@code wrap}) from the last row back to the start row.
     */
    @Nullable
    public static Position findBackward(List<String> lines, Position from, String pattern, boolean ignoreCase,
                                        boolean wrap) {
        for (int row = from.row(); row >= 0; row--) {
            String line = lines.get(row);
            int limit = row == from.row() ? from.column() - 1 : line.length();
            int idx = lastIndexOf(line, pattern, limit, ignoreCase);
            if (idx >= 0) {
                return new Position(row, idx);
            }
        }
        if (!wrap) {
            return null;
        }
        for (int row = lines.size() - 1; row >= from.row(); row--) {
            String line = lines.get(row);
            int idx = lastIndexOf(line, pattern, line.length(), ignoreCase);
            if (idx >= 0) {
                return new Position(row, idx);
            }
        }
        return null;
    }

    /**
     * @return The maximal run of word characters containing or following {@code column}, or null.
     */
    @Nullable
    public static String wordAt(String line, int column) {
        int col = column;
        while (col < line.length() && isWordBoundary(line.charAt(col))) {
            col++;
        }
        if (col >= line.length()) {
            return null;
        }
        int start = col;
        while (start > 0 && !isWordBoundary(line.charAt(start - 1))) {
            start--;
        }
        int end = col;
        while (end < line.length() && !isWordBoundary(line.charAt(end))) {
            end++;
        }
        return line.substring(start, end);
    }

    private static int indexOf(String line, String pattern, int from, boolean ignoreCase) {
        if (!ignoreCase) {
            return line.indexOf(pattern, from);
        }
        for (int i = from; i + pattern.length() <= line.length(); i++) {
            if (line.regionMatches(true, i, pattern, 0, pattern.length())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @param maxStart the largest start index allowed; negative means none
     */
    private static int lastIndexOf(String line, String pattern, int maxStart, boolean ignoreCase) {
        if (maxStart < 0) {
            return -1;
        }
        if (!ignoreCase) {
            return line.lastIndexOf(pattern, maxStart);
        }
        for (int i = Math.min(maxStart, line.length() - pattern.length()); i >= 0; i--) {
            if (line.regionMatches(true, i, pattern, 0, pattern.length())) {
                return i;
            }
        }
        return -1;
    }
}
