package com.tyron.nanovim.core.vim;

import com.google.common.truth.Truth;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PendingCommandTest {

    private static void digits(PendingCommand pending, String digits) {
        for (char ch : digits.toCharArray()) {
            pending.appendDigit(ch);
        }
    }

    @Test
    public void countsBeforeAndAfterTheOperatorMultiply() {
        PendingCommand pending = new PendingCommand();
        digits(pending, "2");
        pending.append("d");
        assertFalse(pending.isCountStarted());
        digits(pending, "3");
        assertTrue(pending.isCountStarted());

        assertEquals(6, pending.getCount());
        assertEquals("2d3", pending.toString());
        Truth.assertThat(pending.getKeys()).containsExactly("d");
    }

    @Test
    public void countsSaturate() {
        PendingCommand pending = new PendingCommand();
        digits(pending, "4294967297");
        assertEquals(PendingCommand.MAX_COUNT, pending.getCount());

        pending.append("d");
        digits(pending, "99");
        assertEquals(PendingCommand.MAX_COUNT, pending.getCount());
    }

    @Test
    public void clearKeysKeepsTheLeadingCount() {
        PendingCommand pending = new PendingCommand();
        digits(pending, "4");
        pending.append("\"");
        pending.clearKeys();
        assertEquals(4, pending.getCount());
        assertTrue(pending.hasCount());

        pending.clear();
        assertTrue(pending.isEmpty());
        assertFalse(pending.hasCount());
        assertEquals("", pending.toString());
    }
}
