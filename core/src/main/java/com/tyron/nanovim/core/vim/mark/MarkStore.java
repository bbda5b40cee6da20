package com.tyron.nanovim.core.vim.mark;

import com.tyron.nanovim.api.editor.Position;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named cursor bookmarks.
 */
public final class MarkStore {

    private final Map<Character, Position> marks = new HashMap<>();

    public void setMark(char name, @NotNull Position position) {
        marks.put(name, Objects.requireNonNull(position, "position"));
    }

    /**
     * @return The saved position, or null if the mark was never set.
     */
    @Nullable
    public Position getMark(char name) {
        return marks.get(name);
    }
}
