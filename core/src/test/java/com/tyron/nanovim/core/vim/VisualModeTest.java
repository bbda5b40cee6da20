package com.tyron.nanovim.core.vim;

import com.tyron.nanovim.api.editor.Position;
import com.tyron.nanovim.api.editor.Range;
import com.tyron.nanovim.api.vim.Mode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VisualModeTest extends BaseVimTest {

    private Range selection() {
        return editor.getSelectionModel().getSelection();
    }

    @Test
    public void charwiseSelectionIncludesTheCursor() {
        configure("abcdef", 0, 1);
        type("v");
        assertMode(Mode.VISUAL);
        assertEquals(new Range(new Position(0, 1), new Position(0, 2)), selection());

        type("ll");
        assertEquals(new Range(new Position(0, 1), new Position(0, 4)), selection());

        type("d");
        assertText("aef");
        assertEquals("bcd", register('"'));
        assertMode(Mode.NORMAL);
        assertNull(selection());
        assertCursor(0, 1);
    }

    @Test
    public void yankAcrossLinesMovesToTheStart() {
        configure("abc\ndef", 0, 1);
        type("vjy");
        assertEquals("bc\nde", register('"'));
        assertCursor(0, 1);
        assertMode(Mode.NORMAL);
        assertText("abc\ndef");
    }

    @Test
    public void backwardSelection() {
        configure("abcdef", 0, 4);
        type("vhhx");
        assertText("abf");
    }

    @Test
    public void countsAndGgInVisualMode() {
        configure("abcdef", 0, 0);
        type("v3ly");
        assertEquals("abcd", register('"'));

        configure("a\nb\nc", 2, 0);
        type("vggd");
        assertText("");
    }

    @Test
    public void swapAnchorAndCursor() {
        configure("abcdef", 0, 1);
        type("vll");
        type("o");
        assertCursor(0, 1);

        type("h");
        assertEquals(new Range(new Position(0, 0), new Position(0, 4)), selection());
        type("d");
        assertText("ef");
    }

    @Test
    public void lineSelection() {
        configure("a\nbb\nc", 1, 1);
        type("V");
        assertEquals(new Range(new Position(1, 0), new Position(1, 2)), selection());

        type("jd");
        assertText("a");
        assertEquals("bb\nc\n", register('"'));
        assertCursor(0, 0);
    }

    @Test
    public void lineYankThenPasteAbove() {
        configure("a\nb", 1, 0);
        type("VyP");
        assertText("a\nb\nb");
    }

    @Test
    public void lineChangeEntersInsert() {
        configure("a\nb\nc", 0, 0);
        type("Vjc");
        assertText("\nc");
        assertMode(Mode.INSERT);
        assertNull(selection());
    }

    @Test
    public void blockSelectionOperatesOnTheRectangle() {
        configure("abcd\nefgh\nijkl", 0, 1);
        type("<C-v>jl");
        assertMode(Mode.VISUAL_BLOCK);
        assertTrue(editor.getSelectionModel().isBlockSelection());
        assertEquals(new Range(new Position(0, 1), new Position(1, 3)), selection());

        type("y");
        assertEquals("bc\nfg", register('"'));
        assertCursor(0, 1);

        type("<C-v>jld");
        assertText("ad\neh\nijkl");
        assertCursor(0, 1);
    }

    @Test
    public void blockChangeEntersInsertAtTheLeftEdge() {
        configure("abcd\nefgh", 1, 2);
        type("<C-v>khc");
        assertText("ad\neh");
        assertMode(Mode.INSERT);
        assertCursor(0, 1);
    }

    @Test
    public void switchingAndLeavingVisualKinds() {
        configure("abc\ndef", 0, 0);
        type("v");
        type("V");
        assertMode(Mode.VISUAL_LINE);
        assertEquals(new Range(new Position(0, 0), new Position(0, 3)), selection());

        type("<C-v>");
        assertMode(Mode.VISUAL_BLOCK);

        type("<C-v>");
        assertMode(Mode.NORMAL);
        assertNull(selection());

        type("vl<Esc>");
        assertMode(Mode.NORMAL);
        assertNull(selection());
        assertText("abc\ndef");
    }

    @Test
    public void registerPrefixInVisualMode() {
        configure("abc", 0, 0);
        type("vl\"qy");
        assertEquals("ab", register('q'));
    }

    @Test
    public void unknownKeysAreNotConsumed() {
        configure("abc", 0, 0);
        type("v");
        assertFalse(handler.handleKey("Z"));
        assertMode(Mode.VISUAL);
    }
}
