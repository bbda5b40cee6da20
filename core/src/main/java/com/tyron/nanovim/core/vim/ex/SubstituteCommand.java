package com.tyron.nanovim.core.vim.ex;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * The parts of {@code s/pattern/replacement/flags}.
 *
 * {@code \/} stands for a literal slash; every other backslash sequence is kept for the regex engine.
 * The replacement and flags may be omitted ({@code s/foo/} and {@code s/foo/bar} are valid).
 */
public record SubstituteCommand(String pattern, String replacement, boolean global, boolean ignoreCase) {

    public static SubstituteCommand parse(@NotNull String command) throws ExCommandException {
        if (!command.startsWith("s/")) {
            throw invalid("Invalid substitute command: " + command);
        }

        List<String> parts = new ArrayList<>(3);
        StringBuilder current = new StringBuilder();
        String body = command.substring(2);
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (ch == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                if (next != '/') {
                    current.append('\\');
                }
                current.append(next);
            } else if (ch == '/' && parts.size() < 2) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }

        if (parts.isEmpty()) {
            throw invalid("Invalid substitute command: missing '/' after pattern");
        }
        String flags = "";
        if (parts.size() == 1) {
            parts.add(current.toString());
        } else {
            flags = current.toString();
        }

        boolean global = false;
        boolean ignoreCase = false;
        for (char flag : flags.toCharArray()) {
            switch (flag) {
                case 'g' -> global = true;
                case 'i' -> ignoreCase = true;
                default -> throw invalid("Invalid substitute flag: " + flag);
            }
        }
        return new SubstituteCommand(parts.get(0), parts.get(1), global, ignoreCase);
    }

    private static ExCommandException invalid(String message) {
        return new ExCommandException(ExCommandException.Kind.INVALID_SUBSTITUTION_SYNTAX, message);
    }
}
