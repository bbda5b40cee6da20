package com.tyron.nanovim.core.vim.mark;

import com.google.common.truth.Truth;
import com.tyron.nanovim.api.editor.Position;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JumpListTest {

    @Test
    public void backRecordsCurrentAndForwardReturnsToIt() {
        JumpList list = new JumpList(10);
        list.push(new Position(0, 0));
        list.push(new Position(5, 0));

        Position current = new Position(9, 2);
        assertEquals(new Position(5, 0), list.back(current));
        assertEquals(new Position(0, 0), list.back(current));
        assertNull(list.back(current));

        assertEquals(new Position(5, 0), list.forward());
        assertEquals(current, list.forward());
        assertNull(list.forward());
    }

    @Test
    public void pushMovesIndexToEndWithoutDeduplication() {
        JumpList list = new JumpList(10);
        list.push(new Position(1, 0));
        list.push(new Position(1, 0));

        assertEquals(2, list.size());
        assertEquals(2, list.getIndex());
        assertEquals(new Position(1, 0), list.last());
    }

    @Test
    public void oldestEntriesDroppedAtCapacity() {
        JumpList list = new JumpList(2);
        list.push(new Position(0, 0));
        list.push(new Position(1, 0));
        list.push(new Position(2, 0));

        Truth.assertThat(list.getEntries()).containsExactly(new Position(1, 0), new Position(2, 0)).inOrder();
    }

    @Test
    public void backStaysWithinCapacity() {
        JumpList list = new JumpList(3);
        list.push(new Position(0, 0));
        list.push(new Position(1, 0));
        list.push(new Position(2, 0));

        Position current = new Position(7, 0);
        assertEquals(new Position(2, 0), list.back(current));
        Truth.assertThat(list.getEntries())
                .containsExactly(new Position(1, 0), new Position(2, 0), current).inOrder();
        assertEquals(1, list.getIndex());

        assertEquals(new Position(1, 0), list.back(current));
        assertNull(list.back(current));
        assertEquals(new Position(2, 0), list.forward());
        assertEquals(current, list.forward());
        assertEquals(3, list.size());
    }

    @Test
    public void singleEntryListGoesBackWithoutGrowing() {
        JumpList list = new JumpList(1);
        list.push(new Position(4, 0));

        assertEquals(new Position(4, 0), list.back(new Position(9, 0)));
        assertEquals(1, list.size());
        assertNull(list.forward());
    }

    @Test
    public void emptyListHasNoLastEntry() {
        JumpList list = new JumpList(1);
        assertNull(list.last());
        assertNull(list.back(Position.ORIGIN));
        assertThrows(IllegalArgumentException.class, () -> new JumpList(0));
    }
}
