package com.tyron.nanovim.api.vim;

/**
 * The interpretation regime for incoming keys. Exactly one mode is active at a time.
 */
public enum Mode {
    NORMAL("NORMAL"),
    INSERT("INSERT"),
    VISUAL("VISUAL"),
    VISUAL_LINE("V-LINE"),
    VISUAL_BLOCK("V-BLOCK"),
    COMMAND_LINE("COMMAND"),
    REPLACE("REPLACE");

    private final String label;

    Mode(String label) {
        this.label = label;
    }

    /**
     * @return The text shown in a status line for this mode.
     */
    public String getLabel() {
        return label;
    }

    public boolean isVisual() {
        return this == VISUAL || this == VISUAL_LINE || this == VISUAL_BLOCK;
    }
}
