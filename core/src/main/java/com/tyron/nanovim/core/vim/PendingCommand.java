package com.tyron.nanovim.core.vim;

import java.util.ArrayList;
import java.util.List;

/**
 * Keys typed towards a Normal-mode command that has not been dispatched yet, plus its counts.
 *
 * A count typed before the keys and one typed after an operator ({@code 2d3w}) multiply. Counts saturate at
 * {@link #MAX_COUNT}.
 */
public final class PendingCommand {

    public static final int MAX_COUNT = 99_999_999;

    private final List<String> keys = new ArrayList<>();
    private int count;
    private int motionCount;

    public void append(String key) {
        keys.add(key);
    }

    /**
     * Adds a digit to the count before the keys, or to the motion count once keys have been typed.
     */
    public void appendDigit(char digit) {
        if (keys.isEmpty()) {
            count = addDigit(count, digit);
        } else {
            motionCount = addDigit(motionCount, digit);
        }
    }

    private static int addDigit(int value, char digit) {
        return (int) Math.min(MAX_COUNT, value * 10L + (digit - '0'));
    }

    public List<String> getKeys() {
        return List.copyOf(keys);
    }

    public boolean isEmpty() {
        return keys.isEmpty() && count == 0;
    }

    /**
     * @return The effective count, 0 if none was typed.
     */
    public int getCount() {
        if (count == 0 || motionCount == 0) {
            return Math.max(count, motionCount);
        }
        return (int) Math.min(MAX_COUNT, (long) count * motionCount);
    }

    public boolean hasCount() {
        return count > 0 || motionCount > 0;
    }

    /**
     * @return true if a count is being typed at the current position, i.e. before any key or after an operator.
     */
    public boolean isCountStarted() {
        return keys.isEmpty() ? count > 0 : motionCount > 0;
    }

    public void clearKeys() {
        keys.clear();
        motionCount = 0;
    }

    public void clear() {
        keys.clear();
        count = 0;
        motionCount = 0;
    }

    @Override
    public String toString() {
        return (count > 0 ? String.valueOf(count) : "") + String.join("", keys)
                + (motionCount > 0 ? String.valueOf(motionCount) : "");
    }
}
