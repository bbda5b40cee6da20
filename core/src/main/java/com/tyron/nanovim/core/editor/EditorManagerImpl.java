package com.tyron.nanovim.core.editor;

import com.tyron.nanovim.api.editor.BracketMatcher;
import com.tyron.nanovim.api.editor.Document;
import com.tyron.nanovim.api.editor.Editor;
import com.tyron.nanovim.api.editor.EditorManager;
import com.tyron.nanovim.api.vim.EditorHost;
import com.tyron.nanovim.core.config.VimConfig;
import com.tyron.nanovim.core.vim.VimInterpreter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Core implementation of {@link EditorManager}.
 *
 * This is a non-UI editor registry. Each editor may have one {@link VimInterpreter} attached; the interpreter is
 * disposed when it is replaced or its editor is released.
 */
public final class EditorManagerImpl implements EditorManager {

    private final VimConfig config;
    private final BracketMatcher bracketMatcher;

    private final Object lock = new Object();
    private final Map<Document, List<Editor>> editorsByDocument = new IdentityHashMap<>();
    private final List<Editor> allEditors = new ArrayList<>();
    private final Map<Editor, VimInterpreter> interpreters = new IdentityHashMap<>();

    public EditorManagerImpl() {
        this(VimConfig.defaults(), new PlainBracketMatcher());
    }

    public EditorManagerImpl(@NotNull VimConfig config, @NotNull BracketMatcher bracketMatcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.bracketMatcher = Objects.requireNonNull(bracketMatcher, "bracketMatcher");
    }

    @Override
    public Editor createEditor(Document document) {
        Objects.requireNonNull(document, "document");
        Editor editor = new SimpleEditor(document);

        synchronized (lock) {
            allEditors.add(editor);
            editorsByDocument.computeIfAbsent(document, d -> new ArrayList<>()).add(editor);
        }

        return editor;
    }

    /**
     * Creates the interpreter for an editor managed by this registry, replacing any previous one.
     */
    public VimInterpreter attachInterpreter(@NotNull Editor editor, @NotNull EditorHost host) {
        Objects.requireNonNull(editor, "editor");
        Objects.requireNonNull(host, "host");

        synchronized (lock) {
            if (!allEditors.contains(editor)) {
                throw new IllegalArgumentException("Editor is not managed by this registry: " + editor);
            }
            VimInterpreter interpreter = new VimInterpreter(editor, host, config, bracketMatcher);
            VimInterpreter previous = interpreters.put(editor, interpreter);
            if (previous != null) {
                previous.dispose();
            }
            return interpreter;
        }
    }

    @Nullable
    public VimInterpreter getInterpreter(@NotNull Editor editor) {
        Objects.requireNonNull(editor, "editor");
        synchronized (lock) {
            return interpreters.get(editor);
        }
    }

    @Override
    public void releaseEditor(Editor editor) {
        Objects.requireNonNull(editor, "editor");

        synchronized (lock) {
            allEditors.remove(editor);
            VimInterpreter interpreter = interpreters.remove(editor);
            if (interpreter != null) {
                interpreter.dispose();
            }
            List<Editor> list = editorsByDocument.get(editor.getDocument());
            if (list != null) {
                list.remove(editor);
                if (list.isEmpty()) {
                    editorsByDocument.remove(editor.getDocument());
                }
            }
        }
    }

    @Override
    public List<Editor> getEditors(Document document) {
        Objects.requireNonNull(document, "document");
        synchronized (lock) {
            List<Editor> list = editorsByDocument.get(document);
            return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
        }
    }

    @Override
    public List<Editor> getAllEditors() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(allEditors));
        }
    }
}
