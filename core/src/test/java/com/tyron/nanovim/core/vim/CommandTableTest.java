package com.tyron.nanovim.core.vim;

import com.tyron.nanovim.core.vim.CommandTable.Resolution;
import com.tyron.nanovim.core.vim.CommandTable.ResolvedCommand;
import com.tyron.nanovim.core.vim.CommandTable.Status;
import com.tyron.nanovim.core.vim.motion.Motion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CommandTableTest {

    private static Resolution resolve(String... keys) {
        return CommandTable.resolve(List.of(keys), false);
    }

    private static ResolvedCommand complete(String... keys) {
        Resolution resolution = resolve(keys);
        assertEquals(Status.COMPLETE, resolution.status(), String.join("", keys));
        return resolution.command();
    }

    @Test
    public void prefixesAreIncomplete() {
        for (String prefix : new String[]{"d", "c", "y", "r", "m", "'", "`", "q", "@", "\"", "g"}) {
            assertEquals(Status.INCOMPLETE, resolve(prefix).status(), prefix);
        }
        assertEquals(Status.INCOMPLETE, resolve("d", "g").status());
    }

    @Test
    public void unknownSequences() {
        assertEquals(Status.UNKNOWN, resolve("Z").status());
        assertEquals(Status.UNKNOWN, resolve("d", "z").status());
        assertEquals(Status.UNKNOWN, resolve("g", "x").status());
        assertEquals(Status.UNKNOWN, resolve("d", "g", "x").status());
        assertEquals(Status.UNKNOWN, resolve("r", "Escape").status());
        assertEquals(Status.UNKNOWN, resolve("Escape").status());
    }

    @Test
    public void motionsAndOperators() {
        assertEquals(Motion.WORD_FORWARD, complete("w").motion());
        assertEquals(Motion.FIRST_LINE, complete("g", "g").motion());

        ResolvedCommand dd = complete("d", "d");
        assertEquals(NormalCommand.OPERATOR_LINES, dd.command());
        assertEquals(Operator.DELETE, dd.operator());

        ResolvedCommand cw = complete("c", "w");
        assertEquals(NormalCommand.OPERATOR_MOTION, cw.command());
        assertEquals(Operator.CHANGE, cw.operator());
        assertEquals(Motion.WORD_FORWARD, cw.motion());

        ResolvedCommand ygg = complete("y", "g", "g");
        assertEquals(Operator.YANK, ygg.operator());
        assertEquals(Motion.FIRST_LINE, ygg.motion());

        assertEquals(Motion.LINE_START, complete("d", "0").motion());
    }

    @Test
    public void argumentCommands() {
        assertEquals(new ResolvedCommand(NormalCommand.REPLACE_CHAR, null, null, ' '), complete("r", "Space"));
        assertEquals('a', complete("m", "a").argument());
        assertEquals(NormalCommand.JUMP_TO_MARK, complete("`", "`").command());
        assertEquals(NormalCommand.JUMP_TO_MARK_LINE, complete("'", "a").command());
        assertEquals(NormalCommand.PLAY_MACRO, complete("@", "@").command());
        assertEquals(NormalCommand.SELECT_REGISTER, complete("\"", "A").command());
    }

    @Test
    public void loneQStopsOnlyWhileRecording() {
        assertEquals(Status.INCOMPLETE, CommandTable.resolve(List.of("q"), false).status());

        Resolution stop = CommandTable.resolve(List.of("q"), true);
        assertEquals(Status.COMPLETE, stop.status());
        assertEquals(NormalCommand.STOP_RECORDING, stop.command().command());
    }

    @Test
    public void everythingButRepeatAndRegisterSelectionIsRepeatable() {
        assertTrue(NormalCommand.DELETE_CHAR.isRepeatable());
        assertTrue(NormalCommand.OPERATOR_MOTION.isRepeatable());
        assertTrue(NormalCommand.MOTION.isRepeatable());
        assertTrue(NormalCommand.PLAY_MACRO.isRepeatable());
        assertFalse(NormalCommand.REPEAT.isRepeatable());
        assertFalse(NormalCommand.SELECT_REGISTER.isRepeatable());
    }
}
