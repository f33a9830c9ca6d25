package com.tasklang.playground.parser;

import com.tasklang.playground.exception.ParserException;
import com.tasklang.playground.lexer.Token;
import com.tasklang.playground.lexer.TokenKind;
import com.tasklang.playground.parser.ast.Program;
import com.tasklang.playground.parser.ast.Selector;
import com.tasklang.playground.parser.ast.SelectorKind;
import com.tasklang.playground.parser.ast.Statement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser with one rule per statement keyword.
 *
 * <p>There is no statement terminator: each rule consumes its keyword plus a fixed
 * argument list, and the optional selector clause of {@code type}, {@code click} and
 * {@code enter} is recognised by a following identifier.
 */
public class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public Program parse() throws ParserException {
        current = 0;
        List<Statement> statements = new ArrayList<>();

        while (!isAtEnd()) {
            statements.add(statement());
        }

        logger.debug("Parsed {} tokens into {} statements", tokens.size(), statements.size());
        return new Program(statements);
    }

    private Statement statement() throws ParserException {
        Token token = peek();
        switch (token.kind()) {
            case OPEN:
                return openStatement();
            case GO:
                return goStatement();
            case TYPE:
                return typeStatement();
            case CLICK:
                return clickStatement();
            case ENTER:
                return enterStatement();
            case WAIT:
                return waitStatement();
            case SCREENSHOT:
                return screenshotStatement();
            case CLOSE:
                return closeStatement();
            default:
                throw new ParserException("Unexpected token: " + token.kind(), token.line(), token.column());
        }
    }

    private Statement openStatement() throws ParserException {
        advance();
        Token browser = consume(TokenKind.IDENTIFIER, "Expected browser identifier after 'open'");
        return new Statement.Open(browser.text());
    }

    private Statement goStatement() throws ParserException {
        advance();
        Token url = consume(TokenKind.URL, "Expected URL after 'go'");
        return new Statement.Go(url.text());
    }

    private Statement typeStatement() throws ParserException {
        advance();
        Token text = consume(TokenKind.STRING, "Expected string literal after 'type'");
        return new Statement.Type(text.text(), selectorClause());
    }

    private Statement clickStatement() throws ParserException {
        advance();
        return new Statement.Click(selectorClause());
    }

    private Statement enterStatement() throws ParserException {
        advance();
        return new Statement.Enter(selectorClause());
    }

    private Statement waitStatement() throws ParserException {
        advance();
        Token number = consume(TokenKind.NUMBER, "Expected number after 'wait'");
        try {
            return new Statement.Wait(Integer.parseInt(number.text()));
        } catch (NumberFormatException e) {
            throw new ParserException("Invalid number: " + number.text(), number.line(), number.column());
        }
    }

    private Statement screenshotStatement() throws ParserException {
        advance();
        Token filename = consume(TokenKind.IDENTIFIER, "Expected filename after 'screenshot'");
        return new Statement.Screenshot(filename.text());
    }

    private Statement closeStatement() {
        advance();
        return new Statement.Close();
    }

    // selector-clause := (id | name | xpath | css | tag) STRING
    private Optional<Selector> selectorClause() throws ParserException {
        if (!check(TokenKind.IDENTIFIER)) {
            return Optional.empty();
        }

        Token kindToken = advance();
        SelectorKind kind = SelectorKind.fromKeyword(kindToken.text())
                .orElseThrow(() -> new ParserException(
                        "Unknown selector kind '" + kindToken.text() + "'", kindToken.line(), kindToken.column()));
        Token value = consume(TokenKind.STRING,
                "Expected selector string after '" + kindToken.text() + "'");
        return Optional.of(new Selector(kind, value.text()));
    }

    private Token consume(TokenKind kind, String message) throws ParserException {
        if (isAtEnd()) {
            Token last = tokens.get(tokens.size() - 1);
            throw new ParserException(message + " (reached end of file)", last.line(), last.column());
        }

        Token token = peek();
        if (token.kind() != kind) {
            throw new ParserException(
                    message + ", but found " + token.kind() + " ('" + token.text() + "')",
                    token.line(),
                    token.column());
        }
        return advance();
    }

    private boolean check(TokenKind kind) {
        return !isAtEnd() && peek().kind() == kind;
    }

    private Token advance() {
        return tokens.get(current++);
    }

    private Token peek() {
        return tokens.get(current);
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }
}
