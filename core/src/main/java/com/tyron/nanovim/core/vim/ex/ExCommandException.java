package com.tyron.nanovim.core.vim.ex;

/**
 * A command-line command that cannot be carried out. The message is meant for the user.
 */
public class ExCommandException extends Exception {

    public enum Kind {
        UNRECOGNIZED_EX_COMMAND,
        INVALID_SUBSTITUTION_SYNTAX,
        UNSAVED_CLOSE_BLOCKED,
        UNKNOWN_SET_OPTION
    }

    private final Kind kind;

    public ExCommandException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExCommandException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
