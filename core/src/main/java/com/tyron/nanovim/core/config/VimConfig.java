package com.tyron.nanovim.core.config;

import org.jetbrains.annotations.NotNull;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Interpreter settings loaded from YAML.
 *
 * <pre>
 * macroDepthLimit: 32
 * jumpListCapacity: 100
 * options:
 *   number: false
 *   wrapscan: true
 * </pre>
 *
 * Missing or malformed values fall back to the built-in defaults.
 */
public final class VimConfig {

    private static final Logger LOG = Logger.getLogger(VimConfig.class.getName());

    public static final String DEFAULT_RESOURCE = "/nanovim.yaml";

    public static final int DEFAULT_MACRO_DEPTH_LIMIT = 32;
    public static final int DEFAULT_JUMP_LIST_CAPACITY = 100;

    private static volatile VimConfig defaults;

    private final int macroDepthLimit;
    private final int jumpListCapacity;
    private final Map<String, Boolean> optionDefaults;

    public VimConfig(int macroDepthLimit, int jumpListCapacity, Map<String, Boolean> optionDefaults) {
        if (macroDepthLimit <= 0) {
            throw new IllegalArgumentException("macroDepthLimit <= 0: " + macroDepthLimit);
        }
        if (jumpListCapacity <= 0) {
            throw new IllegalArgumentException("jumpListCapacity <= 0: " + jumpListCapacity);
        }
        this.macroDepthLimit = macroDepthLimit;
        this.jumpListCapacity = jumpListCapacity;
        this.optionDefaults = Collections.unmodifiableMap(new LinkedHashMap<>(optionDefaults));
    }

    /**
     * @return The configuration bundled with the library ({@value #DEFAULT_RESOURCE}).
     */
    public static VimConfig defaults() {
        VimConfig result = defaults;
        if (result == null) {
            try (InputStream in = VimConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
                result = in != null ? load(in) : builtIn();
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Failed to read " + DEFAULT_RESOURCE + ", using built-in defaults", e);
                result = builtIn();
            }
            defaults = result;
        }
        return result;
    }

    public static VimConfig load(@NotNull Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public static VimConfig load(@NotNull InputStream in) {
        Objects.requireNonNull(in, "in");

        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            LOG.log(Level.WARNING, "Malformed interpreter configuration, using built-in defaults", e);
            return builtIn();
        }
        if (!(doc instanceof Map<?, ?> map)) {
            return builtIn();
        }

        int depth = intValue(map.get("macroDepthLimit"), DEFAULT_MACRO_DEPTH_LIMIT);
        int capacity = intValue(map.get("jumpListCapacity"), DEFAULT_JUMP_LIST_CAPACITY);

        Map<String, Boolean> options = new LinkedHashMap<>();
        Object opts = map.get("options");
        if (opts instanceof Map<?, ?> optsMap) {
            for (Map.Entry<?, ?> e : optsMap.entrySet()) {
                if (e.getKey() == null) continue;
                if (e.getValue() instanceof Boolean b) {
                    options.put(String.valueOf(e.getKey()), b);
                } else if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Ignoring non-boolean option default '" + e.getKey() + "': " + e.getValue());
                }
            }
        }

        return new VimConfig(depth, capacity, options);
    }

    private static VimConfig builtIn() {
        return new VimConfig(DEFAULT_MACRO_DEPTH_LIMIT, DEFAULT_JUMP_LIST_CAPACITY, Map.of());
    }

    private static int intValue(Object raw, int fallback) {
        if (raw instanceof Number n && n.intValue() > 0) {
            return n.intValue();
        }
        if (raw != null && LOG.isLoggable(Level.FINE)) {
            LOG.fine("Ignoring invalid configuration value: " + raw);
        }
        return fallback;
    }

    public int getMacroDepthLimit() {
        return macroDepthLimit;
    }

    public int getJumpListCapacity() {
        return jumpListCapacity;
    }

    /**
     * @return Option name to default value, as written in the file. Unknown names are kept; callers ignore them.
     */
    public Map<String, Boolean> getOptionDefaults() {
        return optionDefaults;
    }
}
