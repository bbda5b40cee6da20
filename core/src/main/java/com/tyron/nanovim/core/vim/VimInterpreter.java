package com.tyron.nanovim.core.vim;

import com.tyron.nanovim.api.editor.BracketMatcher;
import com.tyron.nanovim.api.editor.DocumentEvent;
import com.tyron.nanovim.api.editor.DocumentListener;
import com.tyron.nanovim.api.editor.Editor;
import com.tyron.nanovim.api.editor.ObservableDocument;
import com.tyron.nanovim.api.editor.Position;
import com.tyron.nanovim.api.editor.Range;
import com.tyron.nanovim.api.vim.EditorHost;
import com.tyron.nanovim.api.vim.ModalKeyHandler;
import com.tyron.nanovim.api.vim.Mode;
import com.tyron.nanovim.core.config.VimConfig;
import com.tyron.nanovim.core.editor.PlainBracketMatcher;
import com.tyron.nanovim.core.vim.CommandTable.Resolution;
import com.tyron.nanovim.core.vim.CommandTable.ResolvedCommand;
import com.tyron.nanovim.core.vim.edit.EditEngine;
import com.tyron.nanovim.core.vim.ex.ExCommandException;
import com.tyron.nanovim.core.vim.ex.ExCommandInterpreter;
import com.tyron.nanovim.core.vim.ex.SubstitutionEngine;
import com.tyron.nanovim.core.vim.macro.MacroRecorder;
import com.tyron.nanovim.core.vim.mark.JumpList;
import com.tyron.nanovim.core.vim.mark.MarkStore;
import com.tyron.nanovim.core.vim.motion.Motion;
import com.tyron.nanovim.core.vim.motion.MotionEngine;
import com.tyron.nanovim.core.vim.options.VimOptions;
import com.tyron.nanovim.core.vim.register.RegisterStore;
import com.tyron.nanovim.core.vim.search.SearchEngine;
import com.tyron.nanovim.core.vim.search.SearchState;
import com.tyron.nanovim.core.vim.search.SearchState.Direction;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.tyron.nanovim.core.vim.text.WordClassifier.firstNonBlank;

/**
 * Vim-style modal interpreter for one {@link Editor}.
 *
 * Owns all interpreter state (mode, pending keys, registers, marks, jump list, macros, search state and
 * options) and routes every key to the handler of the current mode. One key is processed to completion before
 * {@link #handleKey(String)} returns; macro playback re-enters it synchronously.
 *
 * Not thread safe. Keys must be delivered on a single thread.
 */
public final class VimInterpreter implements ModalKeyHandler {

    private static final Logger LOG = Logger.getLogger(VimInterpreter.class.getName());

    /**
     * A repeatable command as it was dispatched, for {@code .}.
     */
    private record LastCommand(ResolvedCommand command, int count, boolean explicitCount) {
    }

    private final Editor editor;
    private final EditorHost host;
    private final VimConfig config;
    private final BracketMatcher bracketMatcher;

    private final RegisterStore registers = new RegisterStore();
    private final MarkStore marks = new MarkStore();
    private final MacroRecorder macros = new MacroRecorder();
    private final SearchState searchState = new SearchState();
    private final JumpList jumpList;
    private final VimOptions options;
    private final SearchEngine search;
    private final EditEngine edits;
    private final ExCommandInterpreter ex;

    private final DocumentListener documentListener = this::documentChanged;

    private final PendingCommand pending = new PendingCommand();
    private final StringBuilder commandLine = new StringBuilder();

    private Mode mode = Mode.NORMAL;
    private Position visualAnchor = Position.ORIGIN;
    private LastCommand lastCommand;

    private int macroDepth;
    private boolean macroAborted;

    public VimInterpreter(@NotNull Editor editor, @NotNull EditorHost host) {
        this(editor, host, VimConfig.defaults(), new PlainBracketMatcher());
    }

    public VimInterpreter(@NotNull Editor editor, @NotNull EditorHost host, @NotNull VimConfig config,
                          @NotNull BracketMatcher bracketMatcher) {
        this.editor = Objects.requireNonNull(editor, "editor");
        this.host = Objects.requireNonNull(host, "host");
        this.config = Objects.requireNonNull(config, "config");
        this.bracketMatcher = Objects.requireNonNull(bracketMatcher, "bracketMatcher");

        this.jumpList = new JumpList(config.getJumpListCapacity());
        this.options = new VimOptions(host, config.getOptionDefaults());
        this.search = new SearchEngine(editor, jumpList, options, searchState);
        this.edits = new EditEngine(editor, registers);
        this.ex = new ExCommandInterpreter(editor, host, options, new SubstitutionEngine(searchState, options),
                jumpList);

        if (editor.getDocument() instanceof ObservableDocument) {
            ((ObservableDocument) editor.getDocument()).addDocumentListener(documentListener);
        }
    }

    /**
     * Stops following changes of the editor's document. The interpreter must not be used afterwards.
     */
    public void dispose() {
        if (editor.getDocument() instanceof ObservableDocument) {
            ((ObservableDocument) editor.getDocument()).removeDocumentListener(documentListener);
        }
    }

    @Override
    public boolean handleKey(@NotNull String key) {
        Objects.requireNonNull(key, "key");

        boolean wasRecording = macros.isRecording();
        boolean consumed = switch (mode) {
            case NORMAL -> handleNormal(key);
            case INSERT -> handleInsert(key);
            case VISUAL, VISUAL_LINE, VISUAL_BLOCK -> handleVisual(key);
            case COMMAND_LINE -> handleCommandLine(key);
            case REPLACE -> handleReplace(key);
        };

        // The keys that start and stop a recording are not part of it.
        if (macroDepth == 0 && wasRecording && macros.isRecording()) {
            macros.record(key);
        }
        return consumed;
    }

    @NotNull
    @Override
    public Mode getMode() {
        return mode;
    }

    // --- Normal mode

    private boolean handleNormal(String key) {
        if (Keys.ESCAPE.equals(key)) {
            pending.clear();
            registers.resetSelection();
            return true;
        }

        if (acceptsCount(key)) {
            pending.appendDigit(key.charAt(0));
            return true;
        }

        pending.append(key);
        Resolution resolution = CommandTable.resolve(pending.getKeys(), macros.isRecording());
        switch (resolution.status()) {
            case INCOMPLETE:
                return true;
            case UNKNOWN:
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Unknown command: " + pending);
                }
                pending.clear();
                registers.resetSelection();
                return false;
            default:
                break;
        }

        ResolvedCommand command = Objects.requireNonNull(resolution.command());
        if (command.command() == NormalCommand.SELECT_REGISTER) {
            // The count typed before "x still applies to the command after it.
            registers.select(command.argument());
            pending.clearKeys();
            return true;
        }

        int count = pending.getCount();
        boolean explicitCount = pending.hasCount();
        pending.clear();

        execute(command, count, explicitCount);
        if (command.command().isRepeatable()) {
            lastCommand = new LastCommand(command, count, explicitCount);
        }
        registers.resetSelection();
        if (mode == Mode.NORMAL) {
            clampCursor();
        }
        return true;
    }

    /**
     * Counts go before a command or between an operator and its motion. Elsewhere a digit is an argument
     * ({@code r5}, {@code "1}) or the {@code 0} motion.
     */
    private boolean acceptsCount(String key) {
        List<String> keys = pending.getKeys();
        if (!keys.isEmpty() && (keys.size() > 1 || Operator.forKey(keys.get(0)) == null)) {
            return false;
        }
        return Keys.isCountDigit(key, pending.isCountStarted());
    }

    private void execute(ResolvedCommand command, int count, boolean explicitCount) {
        int n = Math.max(1, count);
        switch (command.command()) {
            case MOTION -> moveCursor(Objects.requireNonNull(command.motion()), count, explicitCount);
            case MATCH_BRACKET -> matchBracket();
            case SCROLL_HALF_PAGE_DOWN -> scroll(n, halfPage());
            case SCROLL_HALF_PAGE_UP -> scroll(n, -halfPage());
            case SCROLL_PAGE_DOWN -> scroll(n, page());
            case SCROLL_PAGE_UP -> scroll(n, -page());

            case INSERT -> enterInsert(caret());
            case INSERT_AT_FIRST_NON_BLANK -> {
                Position pos = caret();
                enterInsert(pos.withColumn(firstNonBlank(lines().get(pos.row()))));
            }
            case APPEND -> {
                Position pos = caret();
                int length = lines().get(pos.row()).length();
                enterInsert(pos.withColumn(Math.min(pos.column() + 1, length)));
            }
            case APPEND_AT_LINE_END -> {
                Position pos = caret();
                enterInsert(pos.withColumn(lines().get(pos.row()).length()));
            }
            case OPEN_LINE_BELOW -> {
                edits.openLineBelow();
                setMode(Mode.INSERT);
            }
            case OPEN_LINE_ABOVE -> {
                edits.openLineAbove();
                setMode(Mode.INSERT);
            }
            case VISUAL -> enterVisual(Mode.VISUAL);
            case VISUAL_LINE -> enterVisual(Mode.VISUAL_LINE);
            case VISUAL_BLOCK -> enterVisual(Mode.VISUAL_BLOCK);
            case REPLACE_MODE -> setMode(Mode.REPLACE);
            case COMMAND_LINE -> {
                commandLine.setLength(0);
                setMode(Mode.COMMAND_LINE);
            }

            case DELETE_CHAR -> edits.deleteChars(n);
            case DELETE_CHAR_BEFORE -> edits.deleteCharsBefore(n);
            case DELETE_TO_LINE_END -> edits.deleteToLineEnd();
            case CHANGE_TO_LINE_END -> {
                edits.deleteToLineEnd();
                enterInsert(caret());
            }
            case YANK_LINE -> edits.yankLines(caret().row(), n);
            case OPERATOR_LINES -> operateOnLines(Objects.requireNonNull(command.operator()), caret().row(), n);
            case OPERATOR_MOTION -> operateOnMotion(Objects.requireNonNull(command.operator()),
                    Objects.requireNonNull(command.motion()), count, explicitCount);
            case PASTE_AFTER -> {
                for (int i = 0; i < n; i++) {
                    edits.pasteAfter();
                }
            }
            case PASTE_BEFORE -> {
                for (int i = 0; i < n; i++) {
                    edits.pasteBefore();
                }
            }
            case REPLACE_CHAR -> edits.replaceChars(command.argument(), n);
            case UNDO -> {
                for (int i = 0; i < n; i++) {
                    host.undo();
                }
            }
            case REDO -> {
                for (int i = 0; i < n; i++) {
                    host.redo();
                }
            }
            case REPEAT -> repeatLastCommand(count, explicitCount);

            case SEARCH_FORWARD -> promptSearch("/", Direction.FORWARD);
            case SEARCH_BACKWARD -> promptSearch("?", Direction.BACKWARD);
            case SEARCH_NEXT -> {
                for (int i = 0; i < n; i++) {
                    search.searchNext();
                }
            }
            case SEARCH_PREVIOUS -> {
                for (int i = 0; i < n; i++) {
                    search.searchPrevious();
                }
            }
            case SEARCH_WORD_FORWARD -> search.searchWordUnderCursor(Direction.FORWARD);
            case SEARCH_WORD_BACKWARD -> search.searchWordUnderCursor(Direction.BACKWARD);

            case SET_MARK -> marks.setMark(command.argument(), caret());
            case JUMP_TO_MARK -> jumpToMark(command.argument(), false);
            case JUMP_TO_MARK_LINE -> jumpToMark(command.argument(), true);

            case START_RECORDING -> macros.startRecording(command.argument());
            case STOP_RECORDING -> macros.stopRecording();
            case PLAY_MACRO -> playMacro(command.argument(), n);
            case SELECT_REGISTER -> registers.select(command.argument());
        }
    }

    private void repeatLastCommand(int count, boolean explicitCount) {
        LastCommand last = lastCommand;
        if (last == null) {
            return;
        }
        if (explicitCount) {
            execute(last.command(), count, true);
        } else {
            execute(last.command(), last.count(), last.explicitCount());
        }
    }

    private void moveCursor(Motion motion, int count, boolean explicitCount) {
        List<String> lines = lines();
        Position from = caret();
        Position to = MotionEngine.move(lines, from, motion, count, explicitCount);
        if (motion.isJump()) {
            jumpList.push(from);
        }
        editor.getCaretModel().moveTo(MotionEngine.clampNormal(lines, to));
        if (motion.isJump()) {
            editor.scrollToCaret();
        }
    }

    private void operateOnLines(Operator operator, int row, int count) {
        switch (operator) {
            case DELETE -> edits.deleteLines(row, count);
            case CHANGE -> {
                edits.changeLines(row, count);
                setMode(Mode.INSERT);
            }
            case YANK -> edits.yankLines(row, count);
        }
    }

    private void operateOnMotion(Operator operator, Motion motion, int count, boolean explicitCount) {
        List<String> lines = lines();
        Position from = caret();
        Position to = MotionEngine.move(lines, from, motion, count, explicitCount);

        if (motion.isLinewise()) {
            if ((motion == Motion.UP || motion == Motion.DOWN) && to.row() == from.row()) {
                return;
            }
            int top = Math.min(from.row(), to.row());
            int bottom = Math.max(from.row(), to.row());
            operateOnLines(operator, top, bottom - top + 1);
            if (operator == Operator.YANK && top != from.row()) {
                editor.getCaretModel().moveTo(MotionEngine.clampNormal(lines, new Position(top, from.column())));
            }
            return;
        }

        Position start = Position.min(from, to);
        Position end = Position.max(from, to);
        if (motion.isInclusive()) {
            end = end.withColumn(Math.min(end.column() + 1, lines.get(end.row()).length()));
        } else if (end.column() == 0 && end.row() > start.row()) {
            // An exclusive motion landing at the start of a later line stops at the end of the line before it.
            int row = end.row() - 1;
            end = new Position(row, lines.get(row).length());
        }
        Range range = new Range(start, end);

        switch (operator) {
            case DELETE -> edits.deleteRange(range);
            case CHANGE -> {
                edits.deleteRange(range);
                enterInsert(start);
            }
            case YANK -> edits.yankRange(range);
        }
    }

    private void matchBracket() {
        Position from = caret();
        Position match = bracketMatcher.findMatch(editor.getDocument(), from);
        if (match == null) {
            return;
        }
        jumpList.push(from);
        editor.getCaretModel().moveTo(MotionEngine.clampNormal(lines(), match));
        editor.scrollToCaret();
    }

    private void scroll(int count, int rowsPerStep) {
        List<String> lines = lines();
        long rows = Math.max(-lines.size(), Math.min(lines.size(), (long) count * rowsPerStep));
        editor.getCaretModel().moveTo(MotionEngine.verticalMove(lines, caret(), (int) rows));
        editor.scrollToCaret();
    }

    private int halfPage() {
        return Math.max(1, editor.getVisibleLineCount() / 2);
    }

    private int page() {
        return Math.max(1, editor.getVisibleLineCount());
    }

    private void promptSearch(String prompt, Direction direction) {
        host.requestInput(prompt, new EditorHost.InputCallback() {
            @Override
            public void confirmed(@NotNull String text) {
                search.search(text, direction);
            }
        });
    }

    private void jumpToMark(char name, boolean firstNonBlankOfLine) {
        Position target;
        if (name == '\'' || name == '`') {
            target = jumpList.last();
        } else {
            target = marks.getMark(name);
        }
        if (target == null) {
            return;
        }

        List<String> lines = lines();
        target = target.clamp(lines);
        if (firstNonBlankOfLine) {
            target = target.withColumn(firstNonBlank(lines.get(target.row())));
        }
        jumpList.push(caret());
        editor.getCaretModel().moveTo(MotionEngine.clampNormal(lines, target));
        editor.scrollToCaret();
    }

    // --- Macros

    private void playMacro(char name, int count) {
        char register = name == '@' ? macros.getLastPlayed() : name;
        if (register == Keys.NONE) {
            return;
        }
        List<String> keys = macros.getMacro(register);
        if (keys.isEmpty()) {
            return;
        }
        if (macroDepth >= config.getMacroDepthLimit()) {
            if (!macroAborted) {
                LOG.warning("Macro @" + register + " exceeded the nesting limit of "
                        + config.getMacroDepthLimit() + ", playback stopped");
            }
            macroAborted = true;
            return;
        }

        macros.setLastPlayed(register);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Playing macro @" + register + " x" + count + " at depth " + macroDepth);
        }

        macroDepth++;
        try {
            for (int i = 0; i < count && !macroAborted; i++) {
                for (String key : keys) {
                    if (macroAborted) {
                        break;
                    }
                    handleKey(key);
                }
            }
        } finally {
            macroDepth--;
            if (macroDepth == 0) {
                macroAborted = false;
            }
        }
    }

    // --- Insert and Replace modes

    private void enterInsert(Position position) {
        editor.getCaretModel().moveTo(position.clamp(lines()));
        setMode(Mode.INSERT);
    }

    private boolean handleInsert(String key) {
        if (Keys.ESCAPE.equals(key)) {
            Position pos = caret();
            Position left = pos.withColumn(Math.max(0, pos.column() - 1));
            editor.getCaretModel().moveTo(MotionEngine.clampNormal(lines(), left));
            setMode(Mode.NORMAL);
            return true;
        }
        if (macroDepth > 0) {
            // No text widget sees replayed keys.
            return edits.typeKey(key);
        }
        return false;
    }

    private boolean handleReplace(String key) {
        if (Keys.ESCAPE.equals(key)) {
            setMode(Mode.NORMAL);
            clampCursor();
            return true;
        }
        if (Keys.BACKSPACE.equals(key)) {
            editor.getCaretModel().moveTo(MotionEngine.left(caret()));
            return true;
        }
        char ch = Keys.toChar(key);
        if (ch == Keys.NONE) {
            return false;
        }
        edits.overwriteChar(ch);
        return true;
    }

    // --- Visual modes

    private void enterVisual(Mode visualMode) {
        visualAnchor = caret();
        setMode(visualMode);
        updateSelection();
    }

    private boolean handleVisual(String key) {
        if (Keys.ESCAPE.equals(key)) {
            exitVisual();
            return true;
        }

        List<String> prefix = pending.getKeys();
        if (!prefix.isEmpty()) {
            pending.clearKeys();
            if ("\"".equals(prefix.get(0))) {
                char name = Keys.toChar(key);
                if (name == Keys.NONE) {
                    pending.clear();
                    return false;
                }
                registers.select(name);
                return true;
            }
            if ("g".equals(key)) {
                moveVisual(Motion.FIRST_LINE);
                return true;
            }
            pending.clear();
            return false;
        }

        if (Keys.isCountDigit(key, pending.hasCount())) {
            pending.appendDigit(key.charAt(0));
            return true;
        }

        switch (key) {
            case "g", "\"" -> {
                pending.append(key);
                return true;
            }
            case "v" -> switchVisual(Mode.VISUAL);
            case "V" -> switchVisual(Mode.VISUAL_LINE);
            case "Ctrl+v" -> switchVisual(Mode.VISUAL_BLOCK);
            case "o" -> {
                Position cursor = caret();
                editor.getCaretModel().moveTo(visualAnchor);
                visualAnchor = cursor;
                pending.clear();
                updateSelection();
            }
            case "d", "x" -> operateOnSelection(Operator.DELETE);
            case "c" -> operateOnSelection(Operator.CHANGE);
            case "y" -> operateOnSelection(Operator.YANK);
            case "%" -> {
                matchBracket();
                pending.clear();
                updateSelection();
            }
            default -> {
                Motion motion = Motion.forKeys(key);
                if (motion == null) {
                    pending.clear();
                    return false;
                }
                moveVisual(motion);
            }
        }
        return true;
    }

    private void moveVisual(Motion motion) {
        int count = pending.getCount();
        boolean explicitCount = pending.hasCount();
        pending.clear();
        moveCursor(motion, count, explicitCount);
        updateSelection();
    }

    private void switchVisual(Mode target) {
        if (mode == target) {
            exitVisual();
        } else {
            setMode(target);
            updateSelection();
        }
    }

    private void exitVisual() {
        setMode(Mode.NORMAL);
        clampCursor();
    }

    private void operateOnSelection(Operator operator) {
        List<String> lines = lines();
        Position anchor = visualAnchor.clamp(lines);
        Position cursor = caret();
        Position start = Position.min(anchor, cursor);
        Position end = Position.max(anchor, cursor);

        switch (mode) {
            case VISUAL_LINE -> {
                operateOnLines(operator, start.row(), end.row() - start.row() + 1);
                if (operator == Operator.YANK) {
                    editor.getCaretModel().moveTo(start);
                }
            }
            case VISUAL_BLOCK -> {
                int left = Math.min(anchor.column(), cursor.column());
                int right = Math.max(anchor.column(), cursor.column());
                switch (operator) {
                    case DELETE -> edits.deleteBlock(start.row(), end.row(), left, right);
                    case CHANGE -> {
                        edits.deleteBlock(start.row(), end.row(), left, right);
                        enterInsert(new Position(start.row(), left));
                    }
                    case YANK -> edits.yankBlock(start.row(), end.row(), left, right);
                }
            }
            default -> {
                Range range = new Range(start,
                        end.withColumn(Math.min(end.column() + 1, lines.get(end.row()).length())));
                switch (operator) {
                    case DELETE -> edits.deleteRange(range);
                    case CHANGE -> {
                        edits.deleteRange(range);
                        enterInsert(start);
                    }
                    case YANK -> edits.yankRange(range);
                }
            }
        }

        pending.clear();
        registers.resetSelection();
        if (mode.isVisual()) {
            exitVisual();
        }
    }

    private void updateSelection() {
        List<String> lines = lines();
        Position anchor = visualAnchor.clamp(lines);
        Position cursor = caret();
        Position start = Position.min(anchor, cursor);
        Position end = Position.max(anchor, cursor);

        Editor.SelectionModel selection = editor.getSelectionModel();
        switch (mode) {
            case VISUAL -> selection.setSelection(new Range(start,
                    end.withColumn(Math.min(end.column() + 1, lines.get(end.row()).length()))), false);
            case VISUAL_LINE -> selection.setSelection(new Range(new Position(start.row(), 0),
                    new Position(end.row(), lines.get(end.row()).length())), false);
            case VISUAL_BLOCK -> {
                int left = Math.min(anchor.column(), cursor.column());
                int right = Math.max(anchor.column(), cursor.column());
                selection.setSelection(new Range(new Position(start.row(), left),
                        new Position(end.row(), right + 1)), true);
            }
            default -> selection.removeSelection();
        }
    }

    // --- Command-line mode

    private boolean handleCommandLine(String key) {
        if (Keys.ESCAPE.equals(key)) {
            commandLine.setLength(0);
            setMode(Mode.NORMAL);
            return true;
        }
        if (Keys.isEnter(key)) {
            String line = commandLine.toString();
            commandLine.setLength(0);
            setMode(Mode.NORMAL);
            executeCommandLine(line);
            return true;
        }
        if (Keys.BACKSPACE.equals(key)) {
            if (commandLine.length() == 0) {
                setMode(Mode.NORMAL);
            } else {
                commandLine.setLength(commandLine.length() - 1);
            }
            return true;
        }
        char ch = Keys.toChar(key);
        if (ch == Keys.NONE) {
            return false;
        }
        commandLine.append(ch);
        return true;
    }

    /**
     * Executes an ex command line (without the leading {@code :}). Failures are reported through
     * {@link EditorHost#showError(String)}.
     */
    public void executeCommandLine(@NotNull String line) {
        Objects.requireNonNull(line, "line");
        try {
            ex.execute(line);
        } catch (ExCommandException e) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Command ':" + line + "' failed (" + e.getKind() + "): " + e.getMessage());
            }
            host.showError(e.getMessage());
        }
    }

    // --- Jump list

    /**
     * Moves the cursor to the previous jump list entry.
     *
     * @return false if there is none
     */
    public boolean jumpBack() {
        Position target = jumpList.back(caret());
        return jumpTo(target);
    }

    /**
     * Moves the cursor to the next jump list entry after a {@link #jumpBack()}.
     *
     * @return false if there is none
     */
    public boolean jumpForward() {
        return jumpTo(jumpList.forward());
    }

    private boolean jumpTo(Position target) {
        if (target == null) {
            return false;
        }
        editor.getCaretModel().moveTo(MotionEngine.clampNormal(lines(), target));
        editor.scrollToCaret();
        return true;
    }

    // --- State

    private void setMode(Mode newMode) {
        if (mode == newMode) {
            return;
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Mode " + mode + " -> " + newMode);
        }
        Mode previous = mode;
        mode = newMode;
        pending.clear();
        if (previous.isVisual() && !newMode.isVisual()) {
            editor.getSelectionModel().removeSelection();
        }
    }

    /**
     * Keeps the caret, the visual anchor and the selection inside the text after the host replaced it.
     */
    private void documentChanged(DocumentEvent event) {
        List<String> lines = event.newLines();
        visualAnchor = visualAnchor.clamp(lines);

        Position caret = editor.getCaretModel().getPosition();
        Position clamped = mode == Mode.INSERT || mode == Mode.REPLACE
                ? caret.clamp(lines)
                : MotionEngine.clampNormal(lines, caret);
        if (!clamped.equals(caret)) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Caret " + caret + " moved to " + clamped + " after a change to " + lines.size()
                        + " lines");
            }
            editor.getCaretModel().moveTo(clamped);
        }
        if (mode.isVisual()) {
            updateSelection();
        }
    }

    private void clampCursor() {
        List<String> lines = lines();
        editor.getCaretModel().moveTo(MotionEngine.clampNormal(lines, editor.getCaretModel().getPosition()));
    }

    private Position caret() {
        return editor.getCaretModel().getPosition().clamp(lines());
    }

    private List<String> lines() {
        return editor.getDocument().getLines();
    }

    public Editor getEditor() {
        return editor;
    }

    /**
     * @return The text typed after {@code :} so far.
     */
    public String getCommandLine() {
        return commandLine.toString();
    }

    /**
     * @return The count and keys of the Normal-mode command being typed, e.g. {@code 3d}.
     */
    public String getPendingKeys() {
        return pending.toString();
    }

    public boolean isRecording() {
        return macros.isRecording();
    }

    public RegisterStore getRegisters() {
        return registers;
    }

    public MarkStore getMarks() {
        return marks;
    }

    public JumpList getJumpList() {
        return jumpList;
    }

    public MacroRecorder getMacros() {
        return macros;
    }

    public VimOptions getOptions() {
        return options;
    }

    public SearchState getSearchState() {
        return searchState;
    }
}
