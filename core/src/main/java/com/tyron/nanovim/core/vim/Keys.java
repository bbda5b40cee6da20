package com.tyron.nanovim.core.vim;

/**
 * Symbolic key names understood by the interpreter.
 */
public final class Keys {

    public static final String ESCAPE = "Escape";
    public static final String ENTER = "Enter";
    public static final String RETURN = "Return";
    public static final String BACKSPACE = "Backspace";
    public static final String TAB = "Tab";
    public static final String SPACE = "Space";

    /** Returned by {@link #toChar(String)} for keys that do not produce a character. */
    public static final char NONE = '\0';

    private Keys() {
    }

    public static boolean isEnter(String key) {
        return ENTER.equals(key) || RETURN.equals(key);
    }

    /**
     * @return The character typed by {@code key}, or {@link #NONE} for named keys such as {@code Escape}.
     */
    public static char toChar(String key) {
        if (key.length() == 1) {
            return key.charAt(0);
        }
        if (SPACE.equals(key)) {
            return ' ';
        }
        if (TAB.equals(key)) {
            return '\t';
        }
        return NONE;
    }

    /**
     * @return true for {@code 1}-{@code 9}, and for {@code 0} when a count is already being typed.
     */
    public static boolean isCountDigit(String key, boolean countStarted) {
        if (key.length() != 1) {
            return false;
        }
        char ch = key.charAt(0);
        return (ch >= '1' && ch <= '9') || (ch == '0' && countStarted);
    }
}
