package com.tasklang.playground.lexer;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum TokenKind {
    OPEN,
    GO,
    TYPE,
    CLICK,
    ENTER,
    WAIT,
    SCREENSHOT,
    CLOSE,
    IDENTIFIER,
    STRING,
    NUMBER,
    URL;

    private static final Map<String, TokenKind> KEYWORDS = Map.of(
            "open", OPEN,
            "go", GO,
            "type", TYPE,
            "click", CLICK,
            "enter", ENTER,
            "wait", WAIT,
            "screenshot", SCREENSHOT,
            "close", CLOSE);

    /**
     * Case-insensitive lookup of a reserved word.
     */
    public static Optional<TokenKind> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word.toLowerCase(Locale.ROOT)));
    }
}
