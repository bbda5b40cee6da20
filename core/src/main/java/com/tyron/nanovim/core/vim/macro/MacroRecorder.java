package com.tyron.nanovim.core.vim.macro;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records key sequences into named slots.
 *
 * Playback is done by the dispatcher, which feeds {@link #getMacro(char)} back through its key entry point.
 * Macro slots are separate from text registers.
 */
public final class MacroRecorder {

    private static final Logger LOG = Logger.getLogger(MacroRecorder.class.getName());

    private final Map<Character, List<String>> macros = new HashMap<>();

    private boolean recording;
    private char register;
    private List<String> keys = new ArrayList<>();
    private char lastPlayed;

    /**
     * Starts a recording, discarding any recording in progress. An uppercase register appends to the
     * existing macro of its lowercase name.
     */
    public void startRecording(char register) {
        this.recording = true;
        this.register = register;
        this.keys = new ArrayList<>();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Recording macro @" + register);
        }
    }

    public void record(@NotNull String key) {
        if (recording) {
            keys.add(key);
        }
    }

    public void stopRecording() {
        if (!recording) {
            return;
        }
        recording = false;

        char slot = Character.toLowerCase(register);
        List<String> finished = new ArrayList<>();
        if (Character.isUpperCase(register)) {
            finished.addAll(macros.getOrDefault(slot, List.of()));
        }
        finished.addAll(keys);
        macros.put(slot, List.copyOf(finished));
        keys = new ArrayList<>();

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Recorded macro @" + slot + ": " + finished);
        }
    }

    public boolean isRecording() {
        return recording;
    }

    public char getRecordingRegister() {
        return register;
    }

    /**
     * @return The recorded keys, or an empty list if nothing was recorded under that name.
     */
    @NotNull
    public List<String> getMacro(char register) {
        return macros.getOrDefault(Character.toLowerCase(register), List.of());
    }

    public char getLastPlayed() {
        return lastPlayed;
    }

    public void setLastPlayed(char register) {
        this.lastPlayed = register;
    }
}
