package com.tyron.nanovim.core.vim.mark;

import com.tyron.nanovim.api.editor.Position;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * History of positions the cursor jumped away from.
 *
 * The index is in {@code [0, size]}; {@code size} means "at the newest end". {@link #push(Position)} appends
 * without deduplication and moves the index to the end. When the capacity is exceeded the oldest entry is
 * dropped.
 */
public final class JumpList {

    private final List<Position> entries = new ArrayList<>();
    private final int capacity;
    private int index;

    public JumpList(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity <= 0: " + capacity);
        }
        this.capacity = capacity;
    }

    public void push(@NotNull Position position) {
        entries.add(Objects.requireNonNull(position, "position"));
        while (entries.size() > capacity) {
            entries.remove(0);
        }
        index = entries.size();
    }

    /**
     * Moves one entry back. When leaving the newest end, {@code current} is recorded so that
     * {@link #forward()} can return to it; with a capacity of 1 there is no room for it.
     *
     * @return The older position, or null if there is none.
     */
    @Nullable
    public Position back(@NotNull Position current) {
        if (index == 0) {
            return null;
        }
        if (index == entries.size() && capacity > 1) {
            entries.add(Objects.requireNonNull(current, "current"));
            if (entries.size() > capacity) {
                entries.remove(0);
                index--;
            }
        }
        index--;
        return entries.get(index);
    }

    /**
     * @return The newer position, or null if already at the newest entry.
     */
    @Nullable
    public Position forward() {
        if (index >= entries.size() - 1) {
            return null;
        }
        index++;
        return entries.get(index);
    }

    /**
     * @return The most recently pushed position, or null if the list is empty.
     */
    @Nullable
    public Position last() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1);
    }

    public int getIndex() {
        return index;
    }

    public int size() {
        return entries.size();
    }

    public List<Position> getEntries() {
        return Collections.unmodifiableList(entries);
    }
}
