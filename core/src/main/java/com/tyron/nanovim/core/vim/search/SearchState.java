package com.tyron.nanovim.core.vim.search;

import org.jetbrains.annotations.NotNull;

/**
 * The last search pattern and direction. Shared with the substitution engine, which reads and updates the
 * pattern.
 */
public final class SearchState {

    public enum Direction {
        FORWARD, BACKWARD;

        public Direction reverse() {
            return this == FORWARD ? BACKWARD : FORWARD;
        }
    }

    private String pattern = "";
    private Direction direction = Direction.FORWARD;

    @NotNull
    public String getPattern() {
        return pattern;
    }

    public void setPattern(@NotNull String pattern) {
        this.pattern = pattern;
    }

    public boolean hasPattern() {
        return !pattern.isEmpty();
    }

    @NotNull
    public Direction getDirection() {
        return direction;
    }

    public void setDirection(@NotNull Direction direction) {
        this.direction = direction;
    }
}
