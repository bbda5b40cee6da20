package com.tyron.nanovim.core.vim.register;

import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Map;

/**
 * Named text slots for yank, delete and paste.
 *
 * Each slot remembers whether its text was captured from whole lines. Linewise text ends with
 * {@link #LINE_TERMINATOR} and is pasted as new lines; everything else is pasted inline, even when it happens to
 * end with a line terminator.
 *
 * Uppercase names append to the matching lowercase register. Every capture into a named register is also
 * copied to the default register.
 */
public final class RegisterStore {

    public static final char DEFAULT_REGISTER = '"';
    public static final String LINE_TERMINATOR = "\n";

    private record Slot(String text, boolean linewise) {
        static final Slot EMPTY = new Slot("", false);
    }

    private final Map<Character, Slot> registers = new HashMap<>();
    private char selected = DEFAULT_REGISTER;

    /**
     * @param linewise true if {@code text} holds whole lines, each ending with {@link #LINE_TERMINATOR}
     */
    public void capture(char name, @NotNull String text, boolean linewise) {
        char slot = slotOf(name);
        Slot value = new Slot(text, linewise);
        if (Character.isUpperCase(name)) {
            Slot old = registers.getOrDefault(slot, Slot.EMPTY);
            // Appending lines to characters starts the lines on a new line.
            String separator = linewise && !old.linewise && !old.text.isEmpty() ? LINE_TERMINATOR : "";
            value = new Slot(old.text + separator + text, old.linewise || linewise);
        }
        registers.put(slot, value);
        if (slot != DEFAULT_REGISTER) {
            registers.put(DEFAULT_REGISTER, value);
        }
    }

    public void capture(char name, @NotNull String text) {
        capture(name, text, false);
    }

    /**
     * Captures characters into the register chosen with {@link #select(char)}.
     */
    public void capture(@NotNull String text) {
        capture(selected, text, false);
    }

    /**
     * Captures whole lines into the register chosen with {@link #select(char)}.
     */
    public void captureLines(@NotNull String text) {
        capture(selected, text, true);
    }

    /**
     * @return The stored text, or an empty string for registers that were never written.
     */
    @NotNull
    public String get(char name) {
        return registers.getOrDefault(slotOf(name), Slot.EMPTY).text;
    }

    @NotNull
    public String get() {
        return get(selected);
    }

    public boolean isLinewise(char name) {
        return registers.getOrDefault(slotOf(name), Slot.EMPTY).linewise;
    }

    public boolean isLinewise() {
        return isLinewise(selected);
    }

    /**
     * Chooses the register used by the next capturing or pasting command.
     */
    public void select(char name) {
        this.selected = name;
    }

    public char getSelected() {
        return selected;
    }

    public void resetSelection() {
        this.selected = DEFAULT_REGISTER;
    }

    private static char slotOf(char name) {
        return Character.isUpperCase(name) ? Character.toLowerCase(name) : name;
    }
}
