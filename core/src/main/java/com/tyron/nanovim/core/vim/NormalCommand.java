package com.tyron.nanovim.core.vim;

/**
 * Normal-mode commands after key resolution.
 */
public enum NormalCommand {
    MOTION,
    MATCH_BRACKET,
    SCROLL_HALF_PAGE_DOWN,
    SCROLL_HALF_PAGE_UP,
    SCROLL_PAGE_DOWN,
    SCROLL_PAGE_UP,

    INSERT,
    INSERT_AT_FIRST_NON_BLANK,
    APPEND,
    APPEND_AT_LINE_END,
    OPEN_LINE_BELOW,
    OPEN_LINE_ABOVE,
    VISUAL,
    VISUAL_LINE,
    VISUAL_BLOCK,
    REPLACE_MODE,
    COMMAND_LINE,

    DELETE_CHAR,
    DELETE_CHAR_BEFORE,
    DELETE_TO_LINE_END,
    CHANGE_TO_LINE_END,
    YANK_LINE,
    /** {@code dd}, {@code cc}, {@code yy}. */
    OPERATOR_LINES,
    /** An operator followed by a motion, e.g. {@code dw}. */
    OPERATOR_MOTION,
    PASTE_AFTER,
    PASTE_BEFORE,
    REPLACE_CHAR,
    UNDO,
    REDO,
    REPEAT,

    SEARCH_FORWARD,
    SEARCH_BACKWARD,
    SEARCH_NEXT,
    SEARCH_PREVIOUS,
    SEARCH_WORD_FORWARD,
    SEARCH_WORD_BACKWARD,

    SET_MARK,
    /** {@code `x}: exact position. */
    JUMP_TO_MARK,
    /** {@code 'x}: first non-blank of the marked line. */
    JUMP_TO_MARK_LINE,

    START_RECORDING,
    STOP_RECORDING,
    PLAY_MACRO,
    SELECT_REGISTER;

    /**
     * @return true if {@code .} repeats this command once it has been dispatched. Everything but {@code .}
     * itself and register selection is.
     */
    public boolean isRepeatable() {
        return this != REPEAT && this != SELECT_REGISTER;
    }
}
