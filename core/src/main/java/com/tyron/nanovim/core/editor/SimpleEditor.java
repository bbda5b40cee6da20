package com.tyron.nanovim.core.editor;

import com.tyron.nanovim.api.editor.Document;
import com.tyron.nanovim.api.editor.Editor;
import com.tyron.nanovim.api.editor.Position;
import com.tyron.nanovim.api.editor.Range;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Minimal {@link Editor} implementation.
 *
 * This does not render anything; it only provides caret and selection state and the document reference.
 */
public final class SimpleEditor implements Editor {

    public static final int DEFAULT_VISIBLE_LINES = 24;

    private final Document document;
    private final SimpleCarets carets = new SimpleCarets();
    private final SimpleSelectionModel selectionModel = new SimpleSelectionModel();
    private volatile int visibleLineCount = DEFAULT_VISIBLE_LINES;

    public SimpleEditor(Document document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    @Override
    public Document getDocument() {
        return document;
    }

    @Override
    public Carets getCaretModel() {
        return carets;
    }

    @Override
    public SelectionModel getSelectionModel() {
        return selectionModel;
    }

    @Override
    public int getVisibleLineCount() {
        return visibleLineCount;
    }

    public void setVisibleLineCount(int visibleLineCount) {
        if (visibleLineCount <= 0) {
            throw new IllegalArgumentException("visibleLineCount <= 0: " + visibleLineCount);
        }
        this.visibleLineCount = visibleLineCount;
    }

    @Override
    public void scrollToCaret() {
        // No-op (UI specific).
    }

    private static final class SimpleCarets implements Carets {
        private volatile Position position = Position.ORIGIN;

        @NotNull
        @Override
        public Position getPosition() {
            return position;
        }

        @Override
        public void moveTo(@NotNull Position position) {
            this.position = Objects.requireNonNull(position, "position");
        }
    }

    private static final class SimpleSelectionModel implements SelectionModel {
        private volatile Range selection;
        private volatile boolean block;

        @Nullable
        @Override
        public Range getSelection() {
            return selection;
        }

        @Override
        public boolean isBlockSelection() {
            return selection != null && block;
        }

        @Override
        public void setSelection(@NotNull Range range, boolean block) {
            this.selection = Objects.requireNonNull(range, "range");
            this.block = block;
        }

        @Override
        public void removeSelection() {
            this.selection = null;
            this.block = false;
        }
    }
}
