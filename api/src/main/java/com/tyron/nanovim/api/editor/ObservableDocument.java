package com.tyron.nanovim.api.editor;

import org.jetbrains.annotations.NotNull;

/**
 * A {@link Document} that reports every {@link Document#setText(String)}.
 *
 * Interpreters attached to an editor listen so their caret and selection stay inside text the host replaced.
 */
public interface ObservableDocument extends Document {

    void addDocumentListener(@NotNull DocumentListener listener);

    void removeDocumentListener(@NotNull DocumentListener listener);

    /**
     * @return The number of changes so far, 0 for a new document.
     */
    long getModificationStamp();
}
