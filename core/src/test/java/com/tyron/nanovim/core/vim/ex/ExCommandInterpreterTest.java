package com.tyron.nanovim.core.vim.ex;

import com.google.common.truth.Truth;
import com.tyron.nanovim.api.editor.Editor;
import com.tyron.nanovim.api.editor.Position;
import com.tyron.nanovim.core.editor.SimpleEditor;
import com.tyron.nanovim.core.editor.document.InMemoryDocument;
import com.tyron.nanovim.core.vim.mark.JumpList;
import com.tyron.nanovim.core.vim.options.EditorOption;
import com.tyron.nanovim.core.vim.options.VimOptions;
import com.tyron.nanovim.core.vim.search.SearchState;
import com.tyron.nanovim.testFramework.TestEditorHost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ExCommandInterpreterTest {

    private TestEditorHost host;
    private Editor editor;
    private VimOptions options;
    private JumpList jumpList;
    private ExCommandInterpreter ex;

    @BeforeEach
    public void setUp() {
        host = new TestEditorHost();
        editor = new SimpleEditor(new InMemoryDocument("one\ntwo foo\nthree foo"));
        options = new VimOptions(host, Map.of());
        jumpList = new JumpList(10);
        ex = new ExCommandInterpreter(editor, host, options, new SubstitutionEngine(new SearchState(), options),
                jumpList);
    }

    @Test
    public void quitIsRefusedWithUnsavedChanges() throws Exception {
        host.setModified(true);
        ExCommandException e = assertThrows(ExCommandException.class, () -> ex.execute("q"));
        assertEquals(ExCommandException.Kind.UNSAVED_CLOSE_BLOCKED, e.getKind());
        Truth.assertThat(e.getMessage()).contains(":q!");
        Truth.assertThat(host.closeRequests).isEmpty();

        ex.execute("q!");
        Truth.assertThat(host.closeRequests).containsExactly(true);
    }

    @Test
    public void writeAndQuit() throws Exception {
        host.setModified(true);
        ex.execute("w");
        assertEquals(1, host.saveCount);

        ex.execute("quit");
        ex.execute("wq");
        ex.execute("x");
        assertEquals(3, host.saveCount);
        Truth.assertThat(host.closeRequests).containsExactly(false, false, false);
    }

    @Test
    public void editRequestsLoad() throws Exception {
        ex.execute("e src/Main.java");
        ex.execute("edit  other.txt ");
        Truth.assertThat(host.loads).containsExactly("src/Main.java", "other.txt").inOrder();
    }

    @Test
    public void goToLinePushesAJump() throws Exception {
        editor.getCaretModel().moveTo(new Position(0, 2));
        ex.execute("2");
        assertEquals(new Position(1, 0), editor.getCaretModel().getPosition());
        assertEquals(new Position(0, 2), jumpList.last());

        ex.execute("$");
        assertEquals(new Position(2, 0), editor.getCaretModel().getPosition());

        ex.execute("0");
        assertEquals(new Position(0, 0), editor.getCaretModel().getPosition());

        ex.execute("99999999999999");
        assertEquals(new Position(2, 0), editor.getCaretModel().getPosition());
    }

    @Test
    public void substituteOnCurrentLineOrEverywhere() throws Exception {
        editor.getCaretModel().moveTo(new Position(1, 0));
        ex.execute("s/foo/bar/");
        assertEquals("one\ntwo bar\nthree foo", editor.getDocument().getText());

        ex.execute("%s/o/0/g");
        assertEquals("0ne\ntw0 bar\nthree f00", editor.getDocument().getText());
    }

    @Test
    public void substituteClampsTheCursor() throws Exception {
        editor.getCaretModel().moveTo(new Position(2, 8));
        ex.execute("%s/three foo/x/");
        assertEquals(new Position(2, 0), editor.getCaretModel().getPosition());
    }

    @Test
    public void setOptions() throws Exception {
        ex.execute("set nu nowrap");
        assertTrue(options.isEnabled(EditorOption.NUMBER));
        assertFalse(options.isEnabled(EditorOption.WRAP));
        assertEquals(Map.of("number", true, "wrap", false), host.optionChanges);

        ex.execute("set number! invwrap");
        assertFalse(options.isEnabled(EditorOption.NUMBER));
        assertTrue(options.isEnabled(EditorOption.WRAP));
    }

    @Test
    public void unknownOptionChangesNothing() {
        ExCommandException e = assertThrows(ExCommandException.class, () -> ex.execute("set number bogus"));
        assertEquals(ExCommandException.Kind.UNKNOWN_SET_OPTION, e.getKind());
        assertFalse(options.isEnabled(EditorOption.NUMBER));
        Truth.assertThat(host.optionChanges).isEmpty();
    }

    @Test
    public void unrecognizedCommands() {
        for (String line : new String[]{"foo", "", "wqa", "e", "set"}) {
            ExCommandException e = assertThrows(ExCommandException.class, () -> ex.execute(line), line);
            assertEquals(ExCommandException.Kind.UNRECOGNIZED_EX_COMMAND, e.getKind(), line);
        }
    }
}
