package com.tyron.nanovim.api.editor;

/**
 * A span between two {@link Position}s. The end is exclusive.
 *
 * Ranges built from user gestures (selections) may be reversed; call {@link #normalized()} before using one.
 */
public record Range(Position start, Position end) {

    public Range normalized() {
        return start.compareTo(end) <= 0 ? this : new Range(end, start);
    }

    public boolean isEmpty() {
        return start.equals(end);
    }
}
