package com.tyron.nanovim.api.editor;

import java.util.List;

/**
 * Manages the lifecycle of {@link Editor} instances.
 *
 * An editor edits a {@link Document}. Multiple editors may exist for a single document.
 */
public interface EditorManager {

    /**
     * Creates an editor for an existing document.
     */
    Editor createEditor(Document document);

    /**
     * Releases an editor instance.
     */
    void releaseEditor(Editor editor);

    List<Editor> getEditors(Document document);

    List<Editor> getAllEditors();
}
