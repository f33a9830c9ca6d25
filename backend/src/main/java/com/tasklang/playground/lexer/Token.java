package com.tasklang.playground.lexer;

/**
 * A lexeme with its kind and the 1-based position of its first character.
 * For {@link TokenKind#STRING} the text excludes the surrounding quotes.
 */
public record Token(TokenKind kind, String text, int line, int column) {

    @Override
    public String toString() {
        return "TOKEN(" + kind + ", '" + text + "', " + line + ", " + column + ")";
    }
}
