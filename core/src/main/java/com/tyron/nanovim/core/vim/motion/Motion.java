package com.tyron.nanovim.core.vim.motion;

import org.jetbrains.annotations.Nullable;

/**
 * Cursor motions and the flags operators need to turn them into ranges.
 */
public enum Motion {
    LEFT("h", false, false, false),
    DOWN("j", true, false, false),
    UP("k", true, false, false),
    RIGHT("l", false, false, false),
    WORD_FORWARD("w", false, false, false),
    WORD_BACKWARD("b", false, false, false),
    WORD_END("e", false, true, false),
    LINE_START("0", false, false, false),
    LINE_END("$", false, true, false),
    FIRST_NON_BLANK("^", false, false, false),
    FIRST_LINE("gg", true, false, true),
    LAST_LINE("G", true, false, true);

    private final String keys;
    private final boolean linewise;
    private final boolean inclusive;
    private final boolean jump;

    Motion(String keys, boolean linewise, boolean inclusive, boolean jump) {
        this.keys = keys;
        this.linewise = linewise;
        this.inclusive = inclusive;
        this.jump = jump;
    }

    public String getKeys() {
        return keys;
    }

    /**
     * Operators over a linewise motion act on whole lines.
     */
    public boolean isLinewise() {
        return linewise;
    }

    /**
     * Operators over an inclusive motion include the character at the target.
     */
    public boolean isInclusive() {
        return inclusive;
    }

    /**
     * Jump motions record the starting position in the jump list.
     */
    public boolean isJump() {
        return jump;
    }

    /**
     * @return The motion bound to {@code keys}, or null.
     */
    @Nullable
    public static Motion forKeys(String keys) {
        for (Motion motion : values()) {
            if (motion.keys.equals(keys)) {
                return motion;
            }
        }
        return null;
    }
}
