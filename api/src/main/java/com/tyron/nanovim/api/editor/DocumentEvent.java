package com.tyron.nanovim.api.editor;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * A content replacement in an {@link ObservableDocument}, as line snapshots taken before and after it.
 *
 * @param stamp the modification stamp of the document after the change
 */
public record DocumentEvent(@NotNull Document document, @NotNull List<String> oldLines,
                            @NotNull List<String> newLines, long stamp) {

    public DocumentEvent {
        Objects.requireNonNull(document, "document");
        oldLines = List.copyOf(oldLines);
        newLines = List.copyOf(newLines);
    }

    /**
     * @return Lines added by the change, negative if lines were removed.
     */
    public int getLineDelta() {
        return newLines.size() - oldLines.size();
    }
}
