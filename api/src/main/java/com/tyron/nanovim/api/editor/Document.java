package com.tyron.nanovim.api.editor;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Abstract view of the text content.
 *
 * The text is line oriented: lines are separated by {@code '\n'} and a document always has at least one
 * (possibly empty) line.
 */
public interface Document {
    String getText();
    int getTextLength();

    /**
     * @return The lines of the document, without terminators. Never empty.
     */
    @NotNull
    List<String> getLines();

    int getLineCount();

    /**
     * @throws IndexOutOfBoundsException if {@code row} is not in {@code [0, getLineCount())}
     */
    String getLine(int row);

    /**
     * Replaces the whole content.
     */
    void setText(@NotNull String text);
}
