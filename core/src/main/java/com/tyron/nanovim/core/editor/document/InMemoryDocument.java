package com.tyron.nanovim.core.editor.document;

import com.tyron.nanovim.api.editor.DocumentEvent;
import com.tyron.nanovim.api.editor.DocumentListener;
import com.tyron.nanovim.api.editor.ObservableDocument;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Simple in-memory {@link ObservableDocument} implementation.
 *
 * Thread-safety: all text operations are synchronized on an internal lock. Listeners are notified
 * after the lock is released.
 */
public final class InMemoryDocument implements ObservableDocument {

    private final Object lock = new Object();
    private String text;
    private List<String> lines;
    private final CopyOnWriteArrayList<DocumentListener> listeners = new CopyOnWriteArrayList<>();

    private volatile long modificationStamp;

    public InMemoryDocument(String initialText) {
        this.text = initialText != null ? initialText : "";
        this.lines = splitLines(this.text);
        this.modificationStamp = 0L;
    }

    @Override
    public String getText() {
        synchronized (lock) {
            return text;
        }
    }

    @Override
    public int getTextLength() {
        synchronized (lock) {
            return text.length();
        }
    }

    @NotNull
    @Override
    public List<String> getLines() {
        synchronized (lock) {
            return lines;
        }
    }

    @Override
    public int getLineCount() {
        synchronized (lock) {
            return lines.size();
        }
    }

    @Override
    public String getLine(int row) {
        synchronized (lock) {
            if (row < 0 || row >= lines.size()) {
                throw new IndexOutOfBoundsException("row " + row + " is out of bounds for lineCount=" + lines.size());
            }
            return lines.get(row);
        }
    }

    @Override
    public void setText(@NotNull String newText) {
        Objects.requireNonNull(newText, "text");

        DocumentEvent event;
        synchronized (lock) {
            List<String> oldLines = lines;
            text = newText;
            lines = splitLines(newText);
            modificationStamp++;
            event = new DocumentEvent(this, oldLines, lines, modificationStamp);
        }

        for (DocumentListener listener : listeners) {
            listener.documentChanged(event);
        }
    }

    @Override
    public void addDocumentListener(@NotNull DocumentListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeDocumentListener(@NotNull DocumentListener listener) {
        listeners.remove(listener);
    }

    @Override
    public long getModificationStamp() {
        return modificationStamp;
    }

    /**
     * Splits on {@code '\n'}, keeping a trailing empty line. The result is immutable and never empty.
     */
    public static List<String> splitLines(String text) {
        return List.copyOf(Arrays.asList(text.split("\n", -1)));
    }
}
