package com.tyron.nanovim.core.vim.text;

/**
 * Character classes used by word motions, plus indentation helpers.
 */
public final class WordClassifier {

    private static final String PUNCTUATION = ".,;:!?\"'()[]{}<>";

    private WordClassifier() {
    }

    /**
     * @return true for whitespace and the fixed punctuation set; everything else is a word character.
     */
    public static boolean isWordBoundary(char ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r' || PUNCTUATION.indexOf(ch) >= 0;
    }

    public static boolean isWordChar(char ch) {
        return !isWordBoundary(ch);
    }

    /**
     * Leading spaces count 1 and tabs count 4; the sum is divided by 4 and floored.
     */
    public static int indentLevel(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ' ') {
                width++;
            } else if (ch == '\t') {
                width += 4;
            } else {
                break;
            }
        }
        return width / 4;
    }

    /**
     * @return Column of the first character that is not a space or tab, or 0 for a blank line.
     */
    public static int firstNonBlank(String line) {
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch != ' ' && ch != '\t') {
                return i;
            }
        }
        return 0;
    }
}
