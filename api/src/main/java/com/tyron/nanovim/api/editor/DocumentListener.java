package com.tyron.nanovim.api.editor;

import org.jetbrains.annotations.NotNull;

/**
 * Receives {@link DocumentEvent}s from an {@link ObservableDocument}.
 */
@FunctionalInterface
public interface DocumentListener {

    /**
     * Called on the thread that changed the document, once the new lines are visible through
     * {@link Document#getLines()}. Must not change the document itself.
     */
    void documentChanged(@NotNull DocumentEvent event);
}
