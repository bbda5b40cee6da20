package com.tyron.nanovim.api.editor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Finds the bracket that pairs with the one at (or after) a position.
 *
 * Language aware implementations may skip brackets in strings and comments.
 */
public interface BracketMatcher {

    /**
     * @return The position of the matching bracket, or null if there is none.
     */
    @Nullable
    Position findMatch(@NotNull Document document, @NotNull Position position);
}
