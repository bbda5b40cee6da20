package com.tyron.nanovim.core.vim.mark;

import com.tyron.nanovim.api.editor.Position;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MarkStoreTest {

    @Test
    public void marksAreOverwrittenAndUnsetMarksAreNull() {
        MarkStore marks = new MarkStore();
        assertNull(marks.getMark('a'));

        marks.setMark('a', new Position(1, 2));
        marks.setMark('a', new Position(3, 4));
        marks.setMark('b', Position.ORIGIN);

        assertEquals(new Position(3, 4), marks.getMark('a'));
        assertEquals(Position.ORIGIN, marks.getMark('b'));
    }
}
