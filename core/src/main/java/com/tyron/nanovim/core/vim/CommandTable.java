package com.tyron.nanovim.core.vim;

import com.tyron.nanovim.core.vim.motion.Motion;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Resolves pending Normal-mode keys to a command.
 *
 * Resolution is prefix aware: keys such as {@code d} or {@code m} are valid but incomplete on their own and
 * wait for one more key.
 */
public final class CommandTable {

    public enum Status {
        COMPLETE, INCOMPLETE, UNKNOWN
    }

    /**
     * A resolved command.
     *
     * @param operator set for {@link NormalCommand#OPERATOR_LINES} and {@link NormalCommand#OPERATOR_MOTION}
     * @param motion   set for {@link NormalCommand#MOTION} and {@link NormalCommand#OPERATOR_MOTION}
     * @param argument the character argument of {@code r}, {@code m}, {@code '}, {@code `}, {@code q},
     *                 {@code @} and {@code "}; {@link Keys#NONE} otherwise
     */
    public record ResolvedCommand(NormalCommand command, @Nullable Operator operator, @Nullable Motion motion,
                                  char argument) {

        static ResolvedCommand of(NormalCommand command) {
            return new ResolvedCommand(command, null, null, Keys.NONE);
        }

        static ResolvedCommand withArgument(NormalCommand command, char argument) {
            return new ResolvedCommand(command, null, null, argument);
        }
    }

    public record Resolution(Status status, @Nullable ResolvedCommand command) {

        static final Resolution INCOMPLETE = new Resolution(Status.INCOMPLETE, null);
        static final Resolution UNKNOWN = new Resolution(Status.UNKNOWN, null);

        static Resolution complete(ResolvedCommand command) {
            return new Resolution(Status.COMPLETE, command);
        }
    }

    private CommandTable() {
    }

    /**
     * @param recording true while a macro is being recorded; a lone {@code q} then stops the recording
     */
    @NotNull
    public static Resolution resolve(@NotNull List<String> keys, boolean recording) {
        return switch (keys.size()) {
            case 0 -> Resolution.INCOMPLETE;
            case 1 -> resolveSingle(keys.get(0), recording);
            case 2 -> resolvePair(keys.get(0), keys.get(1));
            case 3 -> resolveTriple(keys.get(0), keys.get(1), keys.get(2));
            default -> Resolution.UNKNOWN;
        };
    }

    private static Resolution resolveSingle(String key, boolean recording) {
        Motion motion = Motion.forKeys(key);
        if (motion != null) {
            return Resolution.complete(new ResolvedCommand(NormalCommand.MOTION, null, motion, Keys.NONE));
        }

        NormalCommand command = switch (key) {
            case "%" -> NormalCommand.MATCH_BRACKET;
            case "Ctrl+d" -> NormalCommand.SCROLL_HALF_PAGE_DOWN;
            case "Ctrl+u" -> NormalCommand.SCROLL_HALF_PAGE_UP;
            case "Ctrl+f" -> NormalCommand.SCROLL_PAGE_DOWN;
            case "Ctrl+b" -> NormalCommand.SCROLL_PAGE_UP;
            case "i" -> NormalCommand.INSERT;
            case "I" -> NormalCommand.INSERT_AT_FIRST_NON_BLANK;
            case "a" -> NormalCommand.APPEND;
            case "A" -> NormalCommand.APPEND_AT_LINE_END;
            case "o" -> NormalCommand.OPEN_LINE_BELOW;
            case "O" -> NormalCommand.OPEN_LINE_ABOVE;
            case "v" -> NormalCommand.VISUAL;
            case "V" -> NormalCommand.VISUAL_LINE;
            case "Ctrl+v" -> NormalCommand.VISUAL_BLOCK;
            case "R" -> NormalCommand.REPLACE_MODE;
            case ":" -> NormalCommand.COMMAND_LINE;
            case "x" -> NormalCommand.DELETE_CHAR;
            case "X" -> NormalCommand.DELETE_CHAR_BEFORE;
            case "D" -> NormalCommand.DELETE_TO_LINE_END;
            case "C" -> NormalCommand.CHANGE_TO_LINE_END;
            case "Y" -> NormalCommand.YANK_LINE;
            case "p" -> NormalCommand.PASTE_AFTER;
            case "P" -> NormalCommand.PASTE_BEFORE;
            case "u" -> NormalCommand.UNDO;
            case "Ctrl+r" -> NormalCommand.REDO;
            case "." -> NormalCommand.REPEAT;
            case "/" -> NormalCommand.SEARCH_FORWARD;
            case "?" -> NormalCommand.SEARCH_BACKWARD;
            case "n" -> NormalCommand.SEARCH_NEXT;
            case "N" -> NormalCommand.SEARCH_PREVIOUS;
            case "*" -> NormalCommand.SEARCH_WORD_FORWARD;
            case "#" -> NormalCommand.SEARCH_WORD_BACKWARD;
            case "q" -> recording ? NormalCommand.STOP_RECORDING : null;
            default -> null;
        };
        if (command != null) {
            return Resolution.complete(ResolvedCommand.of(command));
        }
        return isPrefix(key) ? Resolution.INCOMPLETE : Resolution.UNKNOWN;
    }

    private static boolean isPrefix(String key) {
        return switch (key) {
            case "d", "c", "y", "r", "m", "'", "`", "q", "@", "\"", "g" -> true;
            default -> false;
        };
    }

    private static Resolution resolvePair(String first, String second) {
        if ("g".equals(first)) {
            return "g".equals(second) ? motion(Motion.FIRST_LINE) : Resolution.UNKNOWN;
        }

        Operator operator = Operator.forKey(first);
        if (operator != null) {
            if (first.equals(second)) {
                return Resolution.complete(new ResolvedCommand(NormalCommand.OPERATOR_LINES, operator, null,
                        Keys.NONE));
            }
            if ("g".equals(second)) {
                return Resolution.INCOMPLETE;
            }
            Motion motion = Motion.forKeys(second);
            if (motion == null) {
                return Resolution.UNKNOWN;
            }
            return Resolution.complete(new ResolvedCommand(NormalCommand.OPERATOR_MOTION, operator, motion,
                    Keys.NONE));
        }

        NormalCommand command = switch (first) {
            case "r" -> NormalCommand.REPLACE_CHAR;
            case "m" -> NormalCommand.SET_MARK;
            case "`" -> NormalCommand.JUMP_TO_MARK;
            case "'" -> NormalCommand.JUMP_TO_MARK_LINE;
            case "q" -> NormalCommand.START_RECORDING;
            case "@" -> NormalCommand.PLAY_MACRO;
            case "\"" -> NormalCommand.SELECT_REGISTER;
            default -> null;
        };
        char argument = Keys.toChar(second);
        if (command == null || argument == Keys.NONE) {
            return Resolution.UNKNOWN;
        }
        return Resolution.complete(ResolvedCommand.withArgument(command, argument));
    }

    private static Resolution resolveTriple(String first, String second, String third) {
        Operator operator = Operator.forKey(first);
        if (operator != null && "g".equals(second) && "g".equals(third)) {
            return Resolution.complete(new ResolvedCommand(NormalCommand.OPERATOR_MOTION, operator,
                    Motion.FIRST_LINE, Keys.NONE));
        }
        return Resolution.UNKNOWN;
    }

    private static Resolution motion(Motion motion) {
        return Resolution.complete(new ResolvedCommand(NormalCommand.MOTION, null, motion, Keys.NONE));
    }
}
