package com.tyron.nanovim.api.editor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Abstract view of the Code Editor component.
 */
public interface Editor {
    Document getDocument();

    Carets getCaretModel();

    SelectionModel getSelectionModel();

    /**
     * @return Number of lines the view can show at once. Used for page scrolling.
     */
    int getVisibleLineCount();

    /**
     * Scroll the view so the caret is visible.
     */
    void scrollToCaret();

    interface Carets {
        @NotNull
        Position getPosition();

        void moveTo(@NotNull Position position);

        default int getRow() {
            return getPosition().row();
        }

        default int getColumn() {
            return getPosition().column();
        }
    }

    interface SelectionModel {
        /**
         * @return The current selection or null if nothing is selected.
         */
        @Nullable
        Range getSelection();

        /**
         * @return true if the selection is a rectangle spanning the columns of its start and end.
         */
        boolean isBlockSelection();

        void setSelection(@NotNull Range range, boolean block);

        void removeSelection();
    }
}
