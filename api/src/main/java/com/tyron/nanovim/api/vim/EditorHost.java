package com.tyron.nanovim.api.vim;

import org.jetbrains.annotations.NotNull;

/**
 * Host application services used by the modal interpreter.
 *
 * Requests are fire-and-forget: the host performs the actual I/O and UI work.
 * All callbacks must be delivered on the thread that dispatches key events.
 */
public interface EditorHost {

    void requestSave();

    void requestLoad(@NotNull String path);

    /**
     * @param force true to close even if the document has unsaved changes
     */
    void requestClose(boolean force);

    /**
     * @return true if the document has changes that were not saved.
     */
    boolean isModified();

    /**
     * Asks the user for one line of text (search patterns).
     */
    void requestInput(@NotNull String prompt, @NotNull InputCallback callback);

    void showError(@NotNull String message);

    /**
     * Called after a view option was changed with {@code :set}.
     */
    void optionChanged(@NotNull String name, boolean value);

    void undo();

    void redo();

    interface InputCallback {
        void confirmed(@NotNull String text);

        default void cancelled() {
        }
    }
}
