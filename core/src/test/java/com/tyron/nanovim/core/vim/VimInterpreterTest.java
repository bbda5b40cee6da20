package com.tyron.nanovim.core.vim;

import com.google.common.truth.Truth;
import com.tyron.nanovim.api.editor.Position;
import com.tyron.nanovim.api.editor.Range;
import com.tyron.nanovim.api.vim.Mode;
import com.tyron.nanovim.core.editor.SimpleEditor;
import com.tyron.nanovim.core.vim.options.EditorOption;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class VimInterpreterTest extends BaseVimTest {

    @Test
    public void countedVerticalMotionKeepsTheColumn() {
        configure("aaaa\nb\ncccc\ndd", 0, 3);
        type("2j");
        assertCursor(2, 3);

        type("9j");
        assertCursor(3, 1);

        type("gg");
        assertCursor(0, 0);
    }

    @Test
    public void zeroIsAMotionUnlessACountIsBeingTyped() {
        configure("abcdefghijklmn", 0, 4);
        type("0");
        assertCursor(0, 0);

        type("10l");
        assertCursor(0, 10);
    }

    @Test
    public void countAfterAnOperatorAppliesToTheMotion() {
        configure("one two three", 0, 0);
        type("d2w");
        assertText("three");

        configure("a b c d e f g", 0, 0);
        type("2d3w");
        assertText("g");

        configure("abcdefghijkl", 0, 0);
        type("d10l");
        assertText("kl");

        configure("a\nb\nc\nd", 0, 0);
        type("d2d");
        assertText("c\nd");
    }

    @Test
    public void digitsAfterOtherPrefixesAreArguments() {
        configure("abc", 0, 0);
        type("r5");
        assertText("5bc");

        type("\"1yl");
        assertEquals("5", register('1'));
    }

    @Test
    public void hugeCountsSaturate() {
        configure("1\n2\n3\n4\n5", 2, 0);
        type("4294967297G");
        assertCursor(4, 0);

        type("99999999999999k");
        assertCursor(0, 0);
        assertEquals("", vim().getPendingKeys());

        type("99999999<C-f>");
        assertCursor(4, 0);
        type("99999999<C-u>");
        assertCursor(0, 0);
    }

    @Test
    public void deletedLineCanBePastedBack() {
        configure("one\ntwo\nthree", 1, 0);
        type("dd");
        assertText("one\nthree");
        assertEquals("two\n", register('"'));
        assertCursor(1, 0);

        type("p");
        assertText("one\nthree\ntwo");
        assertCursor(2, 0);
    }

    @Test
    public void deletingTheLastLineMovesUp() {
        configure("a\nb", 1, 0);
        type("dd");
        assertText("a");
        assertCursor(0, 0);
    }

    @Test
    public void appendThenEscapeReturnsToTheEntryColumn() {
        configure("abc", 0, 1);
        type("a");
        assertMode(Mode.INSERT);
        assertCursor(0, 2);

        type("<Esc>");
        assertMode(Mode.NORMAL);
        assertCursor(0, 1);

        type("A<Esc>");
        assertCursor(0, 2);

        configure("", 0, 0);
        type("a<Esc>");
        assertCursor(0, 0);
        type("i<Esc>");
        assertCursor(0, 0);
    }

    @Test
    public void liveInsertKeysAreLeftForTheTextWidget() {
        configure("abc", 0, 0);
        type("i");
        assertFalse(handler.handleKey("x"));
        assertFalse(handler.handleKey("Enter"));
        assertText("abc");
        assertMode(Mode.INSERT);
    }

    @Test
    public void yankedLinePastedTwiceStacksBelow() {
        configure("a\nb", 0, 0);
        type("yypp");
        assertText("a\na\na\nb");
        assertEquals(4, editor.getDocument().getLineCount());
        assertCursor(2, 0);
    }

    @Test
    public void searchNextWrapsAround() {
        configure("foo one\nfoo two", 0, 0);
        host.answerNextPrompt("foo");
        type("/");
        Truth.assertThat(host.prompts).containsExactly("/");
        assertCursor(1, 0);

        type("n");
        assertCursor(0, 0);

        type("N");
        assertCursor(1, 0);
    }

    @Test
    public void backwardSearchAndWordUnderCursor() {
        configure("foo bar foo", 0, 8);
        host.answerNextPrompt("bar");
        type("?");
        assertCursor(0, 4);

        type("0*");
        assertCursor(0, 8);
        assertEquals("foo", vim().getSearchState().getPattern());

        type("#");
        assertCursor(0, 0);
    }

    @Test
    public void cancelledSearchPromptDoesNothing() {
        configure("foo foo", 0, 0);
        host.cancelNextPrompt();
        type("/");
        type("n");
        assertCursor(0, 0);
        assertFalse(vim().getSearchState().hasPattern());
    }

    @Test
    public void substituteFirstOrAll() {
        configure("foo foo");
        type(":s/foo/bar/<CR>");
        assertText("bar foo");
        assertMode(Mode.NORMAL);

        configure("foo foo");
        type(":s/foo/bar/g<CR>");
        assertText("bar bar");
        Truth.assertThat(host.errors).isEmpty();
    }

    @Test
    public void marksRestorePositions() {
        configure("abc\n  def", 0, 2);
        type("ma");
        type("j0");
        assertCursor(1, 0);

        type("`a");
        assertCursor(0, 2);

        type("j'a");
        assertCursor(0, 0);

        type("`b");
        assertCursor(0, 0);
    }

    @Test
    public void lineMarkJumpsToFirstNonBlank() {
        configure("abc\n  def", 1, 4);
        type("mx");
        type("gg'x");
        assertCursor(1, 2);
    }

    @Test
    public void previousPositionJumpsToggle() {
        configure("abc\n  def", 0, 2);
        type("G");
        assertCursor(1, 0);

        type("``");
        assertCursor(0, 2);

        type("``");
        assertCursor(1, 0);

        type("''");
        assertCursor(0, 0);
    }

    @Test
    public void recordedDeleteReplaysLikeManualDeletes() {
        configure("1\n2\n3\n4\n5\n6", 0, 0);
        type("qaddq");
        assertFalse(vim().isRecording());
        Truth.assertThat(vim().getMacros().getMacro('a')).containsExactly("d", "d").inOrder();
        assertEquals(5, editor.getDocument().getLineCount());

        type("3@a");
        assertText("5\n6");
    }

    @Test
    public void quitWithUnsavedChangesIsRefused() {
        configure("x");
        host.setModified(true);
        type(":q<CR>");
        Truth.assertThat(host.closeRequests).isEmpty();
        assertEquals(1, host.errors.size());
        Truth.assertThat(host.errors.get(0)).contains(":q!");
        assertMode(Mode.NORMAL);

        type(":q!<CR>");
        Truth.assertThat(host.closeRequests).containsExactly(true);
    }

    @Test
    public void errorsAreReportedAndEditingContinues() {
        configure("abc");
        type(":foo<CR>");
        Truth.assertThat(host.errors).containsExactly("Not an editor command: foo");

        type(":set bogus<CR>");
        assertEquals(2, host.errors.size());

        type("x");
        assertText("bc");
    }

    @Test
    public void repeatReplaysTheLastChange() {
        configure("abcdef", 0, 0);
        type("x");
        type(".");
        assertText("cdef");

        type("2.");
        assertText("ef");

        configure("one two three", 0, 0);
        type("dw");
        type(".");
        assertText("three");
    }

    @Test
    public void repeatReplaysTheLastMotion() {
        configure("1\n2\n3\n4\n5\n6", 0, 0);
        type("2j");
        type(".");
        assertCursor(4, 0);

        type("k.");
        assertCursor(2, 0);

        type("x");
        assertText("1\n2\n\n4\n5\n6");
        type("j.");
        assertCursor(4, 0);
        assertText("1\n2\n\n4\n5\n6");
    }

    @Test
    public void repeatWithNothingToRepeat() {
        configure("abc", 0, 0);
        assertTrue(type("."));
        assertText("abc");
    }

    @Test
    public void deleteWordAtLineEndStopsAtTheLine() {
        configure("foo bar\nbaz", 0, 4);
        type("dw");
        assertText("foo \nbaz");
        assertCursor(0, 3);
    }

    @Test
    public void changeWordDeletesThenInserts() {
        configure("foo bar", 0, 0);
        type("cw");
        assertText("bar");
        assertMode(Mode.INSERT);
        assertCursor(0, 0);
    }

    @Test
    public void charwiseOperators() {
        configure("hello world", 0, 5);
        type("D");
        assertText("hello");
        assertCursor(0, 4);

        configure("foo bar", 0, 0);
        type("de");
        assertText(" bar");

        configure("abcdef", 0, 3);
        type("d0");
        assertText("def");
        assertCursor(0, 0);

        configure("abcdef", 0, 3);
        type("d$");
        assertText("abc");
        assertEquals("def", register('"'));
    }

    @Test
    public void linewiseOperators() {
        configure("a\nb\nc", 0, 0);
        type("dj");
        assertText("c");
        assertEquals("a\nb\n", register('"'));

        configure("a\nb\nc", 1, 0);
        type("dG");
        assertText("a");

        configure("a\nb\nc", 1, 0);
        type("dgg");
        assertText("c");

        configure("1\n2\n3\n4", 0, 0);
        type("3dd");
        assertText("4");
        assertEquals("1\n2\n3\n", register('"'));

        configure("a\nb", 1, 0);
        type("dj");
        assertText("a\nb");
    }

    @Test
    public void yankWordAndPasteBefore() {
        configure("foo bar", 0, 4);
        type("yw");
        assertEquals("bar", register('"'));
        assertCursor(0, 4);

        type("0P");
        assertText("barfoo bar");
        assertCursor(0, 2);
    }

    @Test
    public void changeCommandsEnterInsert() {
        configure("  a\nb", 0, 0);
        type("cc");
        assertText("\nb");
        assertMode(Mode.INSERT);
        assertCursor(0, 0);

        configure("abc", 0, 1);
        type("C");
        assertText("a");
        assertMode(Mode.INSERT);
        assertCursor(0, 1);
    }

    @Test
    public void characterDeletesWithCounts() {
        configure("abcdef", 0, 0);
        type("3x");
        assertText("def");

        configure("abc", 0, 2);
        type("X");
        assertText("ac");
        assertCursor(0, 1);
    }

    @Test
    public void replaceCharacter() {
        configure("abc", 0, 0);
        type("rx");
        assertText("xbc");

        type("3rz");
        assertText("zzz");
        assertCursor(0, 2);

        type("r<Esc>");
        assertText("zzz");
        assertEquals("", vim().getPendingKeys());
    }

    @Test
    public void openLinesAndInsertVariants() {
        configure("a\nb", 0, 0);
        type("o");
        assertText("a\n\nb");
        assertCursor(1, 0);
        assertMode(Mode.INSERT);

        configure("a\nb", 0, 0);
        type("O");
        assertText("\na\nb");
        assertCursor(0, 0);

        configure("  abc", 0, 4);
        type("I");
        assertCursor(0, 2);
    }

    @Test
    public void namedRegistersAppendAndPaste() {
        configure("one\ntwo", 0, 0);
        type("\"ayy");
        assertEquals("one\n", register('a'));

        type("j\"Ayy");
        assertEquals("one\ntwo\n", register('a'));
        assertEquals("one\ntwo\n", register('"'));

        type("x");
        assertEquals("t", register('"'));
        assertEquals("one\ntwo\n", register('a'));

        type("\"ap");
        assertText("one\nwo\none\ntwo");
    }

    @Test
    public void undoAndRedoAreDelegated() {
        configure("abc");
        type("u3u<C-r>");
        assertEquals(4, host.undoCount);
        assertEquals(1, host.redoCount);
    }

    @Test
    public void unknownKeysAreNotConsumedAndClearPendingState() {
        configure("abc");
        assertFalse(handler.handleKey("Z"));
        assertFalse(type("dz"));
        assertEquals("", vim().getPendingKeys());

        type("3d");
        assertEquals("3d", vim().getPendingKeys());
        type("2");
        assertEquals("3d2", vim().getPendingKeys());
        type("<Esc>x");
        assertText("bc");
    }

    @Test
    public void matchingBracketIsAJump() {
        configure("if (a(b)) x", 0, 0);
        type("%");
        assertCursor(0, 8);
        assertEquals(Position.ORIGIN, vim().getJumpList().last());

        type("%");
        assertCursor(0, 3);
    }

    @Test
    public void scrollingMovesByTheVisibleLineCount() {
        configure(IntStream.range(0, 30).mapToObj(Integer::toString).collect(Collectors.joining("\n")));
        ((SimpleEditor) editor).setVisibleLineCount(10);

        type("<C-d>");
        assertCursor(5, 0);
        type("<C-f>");
        assertCursor(15, 0);
        type("<C-u>");
        assertCursor(10, 0);
        type("<C-b>");
        assertCursor(0, 0);
        type("2<C-f>");
        assertCursor(20, 0);
        type("<C-f><C-f>");
        assertCursor(29, 0);
    }

    @Test
    public void replaceModeOverwritesAndAppends() {
        configure("abc", 0, 1);
        type("R");
        assertMode(Mode.REPLACE);
        type("XYZ");
        assertText("aXYZ");

        type("<Esc>");
        assertMode(Mode.NORMAL);
        assertCursor(0, 3);

        type("R<BS><BS>Q<Esc>");
        assertText("aQYZ");
    }

    @Test
    public void commandLineEditing() {
        configure("abc");
        type(":");
        assertMode(Mode.COMMAND_LINE);
        type("ab");
        assertEquals("ab", vim().getCommandLine());

        type("<BS><BS>");
        assertEquals("", vim().getCommandLine());
        assertMode(Mode.COMMAND_LINE);

        type("<BS>");
        assertMode(Mode.NORMAL);

        type(":q<Esc>");
        assertMode(Mode.NORMAL);
        Truth.assertThat(host.closeRequests).isEmpty();
    }

    @Test
    public void setOptionsFromTheCommandLine() {
        configure("x FOO");
        type(":set nu ic<CR>");
        assertTrue(vim().getOptions().isEnabled(EditorOption.NUMBER));
        assertEquals(Boolean.TRUE, host.optionChanges.get("number"));

        host.answerNextPrompt("foo");
        type("/");
        assertCursor(0, 2);
    }

    @Test
    public void goToLineAndJumpList() {
        configure("a\nb\nc\nd");
        type(":3<CR>");
        assertCursor(2, 0);

        assertTrue(vim().jumpBack());
        assertCursor(0, 0);
        assertTrue(vim().jumpForward());
        assertCursor(2, 0);
        assertFalse(vim().jumpForward());

        type(":$<CR>");
        assertCursor(3, 0);
    }

    @Test
    public void writeAndEditGoThroughTheHost() {
        configure("abc");
        type(":w<CR>:e notes.txt<CR>");
        assertEquals(1, host.saveCount);
        Truth.assertThat(host.loads).containsExactly("notes.txt");
    }

    @Test
    public void statusLabels() {
        configure("abc");
        assertEquals("NORMAL", handler.getMode().getLabel());
        type("V");
        assertEquals("V-LINE", handler.getMode().getLabel());
        type("<Esc>R");
        assertEquals("REPLACE", handler.getMode().getLabel());
    }

    @Test
    public void caretFollowsTextReplacedByTheHost() {
        configure("abc\ndef\nghi", 2, 2);
        editor.getDocument().setText("xy");
        assertCursor(0, 1);

        configure("abc", 0, 0);
        type("A");
        editor.getDocument().setText("a");
        assertMode(Mode.INSERT);
        assertCursor(0, 1);
    }

    @Test
    public void visualSelectionFollowsTextReplacedByTheHost() {
        configure("abc\ndef", 1, 2);
        type("vk");
        editor.getDocument().setText("ab");

        assertMode(Mode.VISUAL);
        assertCursor(0, 1);
        assertEquals(new Range(new Position(0, 1), new Position(0, 2)), editor.getSelectionModel().getSelection());

        type("d");
        assertText("a");
    }

    @Test
    public void substituteKeepsLiteralDollarSigns() {
        configure("price x", 0, 0);
        type(":s/x/100$/<CR>");
        assertText("price 100$");
        Truth.assertThat(host.errors).isEmpty();
    }
}
