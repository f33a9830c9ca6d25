package com.tasklang.playground.parser.ast;

import java.util.Locale;
import java.util.Optional;

/**
 * Element locator strategies accepted in a selector clause.
 */
public enum SelectorKind {
    ID,
    NAME,
    XPATH,
    CSS,
    TAG;

    public static Optional<SelectorKind> fromKeyword(String word) {
        for (SelectorKind kind : values()) {
            if (kind.name().equals(word.toUpperCase(Locale.ROOT))) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
