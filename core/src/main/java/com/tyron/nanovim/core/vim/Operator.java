package com.tyron.nanovim.core.vim;

import org.jetbrains.annotations.Nullable;

/**
 * Commands that act on the span of a following motion.
 */
public enum Operator {
    DELETE('d'),
    CHANGE('c'),
    YANK('y');

    private final char key;

    Operator(char key) {
        this.key = key;
    }

    public char getKey() {
        return key;
    }

    @Nullable
    public static Operator forKey(String key) {
        for (Operator op : values()) {
            if (key.length() == 1 && key.charAt(0) == op.key) {
                return op;
            }
        }
        return null;
    }
}
