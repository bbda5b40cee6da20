package com.tyron.nanovim.core.vim.ex;

import com.tyron.nanovim.api.editor.Document;
import com.tyron.nanovim.core.vim.options.EditorOption;
import com.tyron.nanovim.core.vim.options.VimOptions;
import com.tyron.nanovim.core.vim.search.SearchState;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regex substitution over document lines.
 *
 * An empty pattern reuses the last search pattern; a non-empty one becomes the last search pattern.
 *
 * Replacement text is literal except for group references: {@code \n} and {@code $n} for group {@code n},
 * {@code $name} and {@code ${name}} for named groups, and {@code $$} for a dollar sign. A reference to a group
 * the pattern does not have expands to nothing; a {@code $} that starts no reference is kept as is.
 */
public final class SubstitutionEngine {

    private final SearchState searchState;
    private final VimOptions options;

    public SubstitutionEngine(@NotNull SearchState searchState, @NotNull VimOptions options) {
        this.searchState = Objects.requireNonNull(searchState, "searchState");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Substitutes in line {@code row} only.
     *
     * @return true if any replacement occurred
     */
    public boolean substituteLine(@NotNull Document document, int row, @NotNull String command)
            throws ExCommandException {
        return substitute(document, row, row, command);
    }

    /**
     * Substitutes in every line.
     *
     * @return true if any replacement occurred
     */
    public boolean substituteAll(@NotNull Document document, @NotNull String command) throws ExCommandException {
        return substitute(document, 0, document.getLineCount() - 1, command);
    }

    private boolean substitute(Document document, int firstRow, int lastRow, String command)
            throws ExCommandException {
        SubstituteCommand sub = SubstituteCommand.parse(command);
        Pattern pattern = compile(sub);

        List<String> lines = new ArrayList<>(document.getLines());
        boolean changed = false;
        for (int row = firstRow; row <= lastRow && row < lines.size(); row++) {
            Matcher matcher = pattern.matcher(lines.get(row));
            StringBuilder result = new StringBuilder();
            boolean found = false;
            while (matcher.find()) {
                found = true;
                matcher.appendReplacement(result, Matcher.quoteReplacement(expand(sub.replacement(), matcher)));
                if (!sub.global()) {
                    break;
                }
            }
            if (found) {
                matcher.appendTail(result);
                lines.set(row, result.toString());
                changed = true;
            }
        }

        if (changed) {
            document.setText(String.join("\n", lines));
        }
        return changed;
    }

    private Pattern compile(SubstituteCommand sub) throws ExCommandException {
        String regex = sub.pattern();
        if (regex.isEmpty()) {
            regex = searchState.getPattern();
            if (regex.isEmpty()) {
                throw new ExCommandException(ExCommandException.Kind.INVALID_SUBSTITUTION_SYNTAX,
                        "No previous regular expression");
            }
        } else {
            searchState.setPattern(regex);
        }

        int flags = 0;
        if (sub.ignoreCase() || options.isEnabled(EditorOption.IGNORE_CASE)) {
            flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        try {
            return Pattern.compile(regex, flags);
        } catch (PatternSyntaxException e) {
            throw new ExCommandException(ExCommandException.Kind.INVALID_SUBSTITUTION_SYNTAX,
                    "Invalid pattern: " + e.getDescription(), e);
        }
    }

    /**
     * @return {@code replacement} with the group references resolved against the current match of
     * {@code match}
     */
    static String expand(String replacement, Matcher match) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < replacement.length()) {
            char ch = replacement.charAt(i);
            char next = i + 1 < replacement.length() ? replacement.charAt(i + 1) : '\0';

            if (ch == '\\' && isDigit(next)) {
                out.append(group(match, String.valueOf(next)));
                i += 2;
            } else if (ch == '$' && next == '$') {
                out.append('$');
                i += 2;
            } else if (ch == '$' && next == '{' && replacement.indexOf('}', i + 2) > i + 2) {
                int close = replacement.indexOf('}', i + 2);
                out.append(group(match, replacement.substring(i + 2, close)));
                i = close + 1;
            } else if (ch == '$' && (isDigit(next) || isNameStart(next))) {
                int end = i + 1;
                if (isDigit(next)) {
                    while (end < replacement.length() && isDigit(replacement.charAt(end))) {
                        end++;
                    }
                } else {
                    while (end < replacement.length() && isNamePart(replacement.charAt(end))) {
                        end++;
                    }
                }
                out.append(group(match, replacement.substring(i + 1, end)));
                i = end;
            } else {
                out.append(ch);
                i++;
            }
        }
        return out.toString();
    }

    private static String group(Matcher match, String reference) {
        String value;
        if (isDigit(reference.charAt(0))) {
            int index;
            try {
                index = Integer.parseInt(reference);
            } catch (NumberFormatException e) {
                return "";
            }
            value = index <= match.groupCount() ? match.group(index) : null;
        } else {
            try {
                value = match.group(reference);
            } catch (IllegalArgumentException e) {
                // No group with that name.
                value = null;
            }
        }
        return value == null ? "" : value;
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isNameStart(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
    }

    private static boolean isNamePart(char ch) {
        return isNameStart(ch) || isDigit(ch);
    }
}
