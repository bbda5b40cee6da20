package com.tyron.nanovim.core.vim.ex;

import org.jetbrains.annotations.NotNull;

/**
 * A parsed command line.
 *
 * @param argument the path for {@link Type#EDIT}, the option list for {@link Type#SET}, the {@code s/...}
 *                 text for substitutions, the 1-based line for {@link Type#GO_TO_LINE} (or {@code "$"}); empty
 *                 otherwise
 */
public record ExCommand(Type type, String argument) {

    public enum Type {
        WRITE, QUIT, WRITE_QUIT, FORCE_QUIT, EDIT, SET, SUBSTITUTE_LINE, SUBSTITUTE_ALL, GO_TO_LINE
    }

    public static ExCommand parse(@NotNull String commandLine) throws ExCommandException {
        String cmd = commandLine.trim();
        switch (cmd) {
            case "w", "write" -> {
                return new ExCommand(Type.WRITE, "");
            }
            case "q", "quit" -> {
                return new ExCommand(Type.QUIT, "");
            }
            case "wq", "x" -> {
                return new ExCommand(Type.WRITE_QUIT, "");
            }
            case "q!", "quit!" -> {
                return new ExCommand(Type.FORCE_QUIT, "");
            }
            case "$" -> {
                return new ExCommand(Type.GO_TO_LINE, "$");
            }
            default -> {
            }
        }

        if (cmd.startsWith("e ") || cmd.startsWith("edit ")) {
            String path = cmd.substring(cmd.indexOf(' ') + 1).trim();
            return new ExCommand(Type.EDIT, path);
        }
        if (cmd.startsWith("set ")) {
            return new ExCommand(Type.SET, cmd.substring(4).trim());
        }
        if (cmd.startsWith("s/")) {
            return new ExCommand(Type.SUBSTITUTE_LINE, cmd);
        }
        if (cmd.startsWith("%s/")) {
            return new ExCommand(Type.SUBSTITUTE_ALL, cmd.substring(1));
        }
        if (!cmd.isEmpty() && cmd.chars().allMatch(Character::isDigit)) {
            return new ExCommand(Type.GO_TO_LINE, cmd);
        }
        throw new ExCommandException(ExCommandException.Kind.UNRECOGNIZED_EX_COMMAND,
                "Not an editor command: " + cmd);
    }
}
