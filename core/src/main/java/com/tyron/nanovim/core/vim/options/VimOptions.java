package com.tyron.nanovim.core.vim.options;

import com.tyron.nanovim.api.vim.EditorHost;
import com.tyron.nanovim.core.vim.ex.ExCommandException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Current values of the {@link EditorOption}s. Changes are reported to the host.
 */
public final class VimOptions {

    private record Change(EditorOption option, Boolean value) {
    }

    private final EditorHost host;
    private final EnumMap<EditorOption, Boolean> values = new EnumMap<>(EditorOption.class);

    public VimOptions(@NotNull EditorHost host, @NotNull Map<String, Boolean> defaults) {
        this.host = Objects.requireNonNull(host, "host");
        for (EditorOption option : EditorOption.values()) {
            values.put(option, option.getDefaultValue());
        }
        defaults.forEach((name, value) -> {
            EditorOption option = EditorOption.forName(name);
            if (option != null && value != null) {
                values.put(option, value);
            }
        });
    }

    public boolean isEnabled(@NotNull EditorOption option) {
        return values.get(option);
    }

    public void set(@NotNull EditorOption option, boolean value) {
        values.put(option, value);
        host.optionChanged(option.getName(), value);
    }

    /**
     * Applies the arguments of {@code :set}: {@code name}, {@code noname}, {@code invname} or {@code name!},
     * separated by spaces. Nothing changes if any name is unknown.
     */
    public void apply(@NotNull String arguments) throws ExCommandException {
        List<Change> changes = new ArrayList<>();
        for (String token : arguments.trim().split("\\s+")) {
            if (token.isEmpty()) continue;
            changes.add(parse(token));
        }
        if (changes.isEmpty()) {
            throw new ExCommandException(ExCommandException.Kind.UNKNOWN_SET_OPTION, "Option name required");
        }
        for (Change change : changes) {
            boolean value = change.value != null ? change.value : !isEnabled(change.option);
            set(change.option, value);
        }
    }

    private static Change parse(String token) throws ExCommandException {
        EditorOption option = EditorOption.forName(token);
        if (option != null) {
            return new Change(option, Boolean.TRUE);
        }
        if (token.endsWith("!")) {
            option = EditorOption.forName(token.substring(0, token.length() - 1));
            if (option != null) {
                return new Change(option, null);
            }
        }
        if (token.startsWith("inv")) {
            option = EditorOption.forName(token.substring(3));
            if (option != null) {
                return new Change(option, null);
            }
        }
        if (token.startsWith("no")) {
            option = EditorOption.forName(token.substring(2));
            if (option != null) {
                return new Change(option, Boolean.FALSE);
            }
        }
        throw new ExCommandException(ExCommandException.Kind.UNKNOWN_SET_OPTION, "Unknown option: " + token);
    }
}
