package com.tyron.nanovim.testFramework;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses key sequences written in Vim notation into the symbolic keys accepted by
 * {@link com.tyron.nanovim.api.vim.ModalKeyHandler}.
 *
 * <pre>
 * "dd"            -> [d, d]
 * "ihi&lt;Esc&gt;"      -> [i, h, i, Escape]
 * ":q!&lt;CR&gt;"       -> [:, q, !, Enter]
 * "&lt;C-r&gt;"         -> [Ctrl+r]
 * </pre>
 *
 * A plain space becomes {@code Space}. Use {@code <lt>} for a literal {@code <}.
 */
public final class KeyNotation {

    private KeyNotation() {
    }

    @NotNull
    public static List<String> parse(@NotNull String notation) {
        List<String> keys = new ArrayList<>();
        int i = 0;
        while (i < notation.length()) {
            char ch = notation.charAt(i);
            if (ch == '<') {
                int close = notation.indexOf('>', i + 1);
                if (close > i + 1) {
                    keys.add(named(notation.substring(i + 1, close)));
                    i = close + 1;
                    continue;
                }
            }
            keys.add(ch == ' ' ? "Space" : String.valueOf(ch));
            i++;
        }
        return keys;
    }

    private static String named(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.startsWith("c-") && name.length() == 3) {
            return "Ctrl+" + name.charAt(2);
        }
        return switch (lower) {
            case "esc" -> "Escape";
            case "cr", "enter" -> "Enter";
            case "return" -> "Return";
            case "bs" -> "Backspace";
            case "tab" -> "Tab";
            case "space" -> "Space";
            case "lt" -> "<";
            default -> throw new IllegalArgumentException("Unknown key name: <" + name + ">");
        };
    }
}
