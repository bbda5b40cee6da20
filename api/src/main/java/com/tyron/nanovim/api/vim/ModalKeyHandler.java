package com.tyron.nanovim.api.vim;

import org.jetbrains.annotations.NotNull;

/**
 * Entry point for symbolic key events.
 *
 * Keys are either a single character ({@code "h"}, {@code ":"}) or a name:
 * {@code Escape}, {@code Enter}, {@code Return}, {@code Backspace}, {@code Tab}, {@code Space}
 * and {@code Ctrl+<c>} (for example {@code Ctrl+r}).
 */
public interface ModalKeyHandler {

    /**
     * Processes one key to completion.
     *
     * @return true if the key was consumed. Unconsumed keys in {@link Mode#INSERT} should be forwarded to the
     * text input widget.
     */
    boolean handleKey(@NotNull String key);

    @NotNull
    Mode getMode();
}
