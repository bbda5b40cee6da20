package com.tyron.nanovim.core.vim.options;

import org.jetbrains.annotations.Nullable;

/**
 * Boolean options settable with {@code :set}.
 */
public enum EditorOption {
    NUMBER("number", "nu", false),
    WRAP("wrap", null, true),
    IGNORE_CASE("ignorecase", "ic", false),
    WRAP_SCAN("wrapscan", "ws", true);

    private final String name;
    private final String shortName;
    private final boolean defaultValue;

    EditorOption(String name, String shortName, boolean defaultValue) {
        this.name = name;
        this.shortName = shortName;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public boolean getDefaultValue() {
        return defaultValue;
    }

    @Nullable
    public static EditorOption forName(String name) {
        for (EditorOption option : values()) {
            if (option.name.equals(name) || name.equals(option.shortName)) {
                return option;
            }
        }
        return null;
    }
}
