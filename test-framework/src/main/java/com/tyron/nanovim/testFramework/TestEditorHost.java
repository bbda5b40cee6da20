package com.tyron.nanovim.testFramework;

import com.tyron.nanovim.api.vim.EditorHost;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link EditorHost} that records every request instead of performing it.
 *
 * Prompts are answered from a queue filled with {@link #answerNextPrompt(String)}; an empty queue cancels the
 * prompt.
 */
public class TestEditorHost implements EditorHost {

    private final Deque<Optional<String>> answers = new ArrayDeque<>();

    public final List<String> prompts = new ArrayList<>();
    public final List<String> loads = new ArrayList<>();
    public final List<Boolean> closeRequests = new ArrayList<>();
    public final List<String> errors = new ArrayList<>();
    public final Map<String, Boolean> optionChanges = new LinkedHashMap<>();

    public int saveCount;
    public int undoCount;
    public int redoCount;

    private boolean modified;

    public void setModified(boolean modified) {
        this.modified = modified;
    }

    public void answerNextPrompt(@NotNull String text) {
        answers.add(Optional.of(text));
    }

    public void cancelNextPrompt() {
        answers.add(Optional.empty());
    }

    @Override
    public void requestSave() {
        saveCount++;
        modified = false;
    }

    @Override
    public void requestLoad(@NotNull String path) {
        loads.add(path);
    }

    @Override
    public void requestClose(boolean force) {
        closeRequests.add(force);
    }

    @Override
    public boolean isModified() {
        return modified;
    }

    @Override
    public void requestInput(@NotNull String prompt, @NotNull InputCallback callback) {
        prompts.add(prompt);
        Optional<String> answer = answers.poll();
        if (answer != null && answer.isPresent()) {
            callback.confirmed(answer.get());
        } else {
            callback.cancelled();
        }
    }

    @Override
    public void showError(@NotNull String message) {
        errors.add(message);
    }

    @Override
    public void optionChanged(@NotNull String name, boolean value) {
        optionChanges.put(name, value);
    }

    @Override
    public void undo() {
        undoCount++;
    }

    @Override
    public void redo() {
        redoCount++;
    }
}
