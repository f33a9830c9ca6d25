package com.tasklang.playground.lexer;

import com.tasklang.playground.exception.LexerException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-pass scanner for TaskLang source text.
 *
 * <p>At each position the matchers are tried in a fixed order: whitespace, {@code #}
 * comments, URLs, string literals, integers and finally keywords/identifiers. URLs
 * come before identifiers because {@code https} would otherwise scan as one.
 */
public class Lexer {

    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    // Unicode-aware so a no-break space ends a URL just as it separates tokens.
    private static final Pattern URL_PATTERN = Pattern.compile("https?://\\S+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WORD_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Matcher urlMatcher;
    private final Matcher wordMatcher;

    private int current = 0;
    private int line = 1;
    private int column = 1;

    public Lexer(String source) {
        this.source = source;
        this.urlMatcher = URL_PATTERN.matcher(source);
        this.wordMatcher = WORD_PATTERN.matcher(source);
    }

    public List<Token> tokenize() throws LexerException {
        tokens.clear();
        current = 0;
        line = 1;
        column = 1;

        while (!isAtEnd()) {
            scanToken();
        }

        logger.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
        return List.copyOf(tokens);
    }

    private void scanToken() throws LexerException {
        char c = peek();

        if (isWhitespace(c)) {
            advance();
            return;
        }
        if (c == '#') {
            while (!isAtEnd() && peek() != '\n') {
                advance();
            }
            return;
        }
        if (url()) {
            return;
        }
        if (c == '"') {
            string();
            return;
        }
        if (isDigit(c) || (c == '-' && isDigit(peekNext()))) {
            number();
            return;
        }
        if (word()) {
            return;
        }

        throw new LexerException("Unexpected character: '" + c + "'", line, column);
    }

    private boolean url() {
        urlMatcher.region(current, source.length());
        if (!urlMatcher.lookingAt()) {
            return false;
        }
        emit(TokenKind.URL, urlMatcher.group(), urlMatcher.end());
        return true;
    }

    private void string() throws LexerException {
        int startLine = line;
        int startColumn = column;
        advance(); // opening quote

        int valueStart = current;
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                throw new LexerException("Unterminated string literal", startLine, startColumn);
            }
            advance();
        }
        if (isAtEnd()) {
            throw new LexerException("Unterminated string literal", startLine, startColumn);
        }

        String value = source.substring(valueStart, current);
        advance(); // closing quote
        tokens.add(new Token(TokenKind.STRING, value, startLine, startColumn));
    }

    private void number() {
        int end = current;
        if (source.charAt(end) == '-') {
            end++;
        }
        while (end < source.length() && isDigit(source.charAt(end))) {
            end++;
        }
        emit(TokenKind.NUMBER, source.substring(current, end), end);
    }

    private boolean word() {
        wordMatcher.region(current, source.length());
        if (!wordMatcher.lookingAt()) {
            return false;
        }
        String text = wordMatcher.group();
        TokenKind kind = TokenKind.keyword(text).orElse(TokenKind.IDENTIFIER);
        emit(kind, text, wordMatcher.end());
        return true;
    }

    // Tokens emitted here never span a newline, so the column moves by the lexeme length.
    private void emit(TokenKind kind, String text, int end) {
        tokens.add(new Token(kind, text, line, column));
        column += end - current;
        current = end;
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) {
            return '\0';
        }
        return source.charAt(current + 1);
    }

    private boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }
}
