package com.tyron.nanovim.core.vim.ex;

import com.tyron.nanovim.api.editor.Editor;
import com.tyron.nanovim.api.editor.Position;
import com.tyron.nanovim.api.vim.EditorHost;
import com.tyron.nanovim.core.vim.mark.JumpList;
import com.tyron.nanovim.core.vim.motion.MotionEngine;
import com.tyron.nanovim.core.vim.options.VimOptions;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes command lines typed after {@code :}.
 */
public final class ExCommandInterpreter {

    private static final Logger LOG = Logger.getLogger(ExCommandInterpreter.class.getName());

    private final Editor editor;
    private final EditorHost host;
    private final VimOptions options;
    private final SubstitutionEngine substitution;
    private final JumpList jumpList;

    public ExCommandInterpreter(@NotNull Editor editor, @NotNull EditorHost host, @NotNull VimOptions options,
                                @NotNull SubstitutionEngine substitution, @NotNull JumpList jumpList) {
        this.editor = Objects.requireNonNull(editor, "editor");
        this.host = Objects.requireNonNull(host, "host");
        this.options = Objects.requireNonNull(options, "options");
        this.substitution = Objects.requireNonNull(substitution, "substitution");
        this.jumpList = Objects.requireNonNull(jumpList, "jumpList");
    }

    /**
     * @throws ExCommandException if the command is unknown or cannot be carried out; nothing has changed then
     */
    public void execute(@NotNull String commandLine) throws ExCommandException {
        ExCommand command = ExCommand.parse(commandLine);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Executing " + command);
        }

        switch (command.type()) {
            case WRITE -> host.requestSave();
            case QUIT -> {
                if (host.isModified()) {
                    throw new ExCommandException(ExCommandException.Kind.UNSAVED_CLOSE_BLOCKED,
                            "No write since last change (add ! to override, use :q!)");
                }
                host.requestClose(false);
            }
            case WRITE_QUIT -> {
                host.requestSave();
                host.requestClose(false);
            }
            case FORCE_QUIT -> host.requestClose(true);
            case EDIT -> host.requestLoad(command.argument());
            case SET -> options.apply(command.argument());
            case SUBSTITUTE_LINE -> {
                int row = editor.getCaretModel().getPosition().clamp(editor.getDocument().getLines()).row();
                substitution.substituteLine(editor.getDocument(), row, command.argument());
                clampCaret();
            }
            case SUBSTITUTE_ALL -> {
                substitution.substituteAll(editor.getDocument(), command.argument());
                clampCaret();
            }
            case GO_TO_LINE -> goToLine(command.argument());
        }
    }

    private void goToLine(String argument) {
        List<String> lines = editor.getDocument().getLines();
        int line;
        if ("$".equals(argument)) {
            line = lines.size();
        } else {
            try {
                line = Integer.parseInt(argument);
            } catch (NumberFormatException e) {
                line = lines.size();
            }
        }
        jumpList.push(editor.getCaretModel().getPosition());
        editor.getCaretModel().moveTo(MotionEngine.goToLine(lines, line));
        editor.scrollToCaret();
    }

    private void clampCaret() {
        List<String> lines = editor.getDocument().getLines();
        Position caret = editor.getCaretModel().getPosition();
        editor.getCaretModel().moveTo(MotionEngine.clampNormal(lines, caret));
    }
}
