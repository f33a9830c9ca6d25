package com.tasklang.playground.service;

import com.tasklang.playground.dto.SyntaxAnalysisRequest;
import com.tasklang.playground.dto.SyntaxAnalysisResponse;
import com.tasklang.playground.dto.SyntaxToken;
import com.tasklang.playground.dto.SyntaxToken.Role;
import com.tasklang.playground.dto.SyntaxToken.TokenType;
import com.tasklang.playground.exception.LexerException;
import com.tasklang.playground.lexer.Lexer;
import com.tasklang.playground.lexer.Token;
import com.tasklang.playground.lexer.TokenKind;
import com.tasklang.playground.parser.ast.SelectorKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Token listing for editor highlighting. Each token is classified by kind and,
 * where the preceding token makes it unambiguous, by the role it plays in its statement.
 */
@Service
public class TaskLangSyntaxAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(TaskLangSyntaxAnalysisService.class);

    public SyntaxAnalysisResponse analyzeSyntax(SyntaxAnalysisRequest request) {
        long startTime = System.currentTimeMillis();

        String userCode = sanitizeInput(request.sourceCode());
        logger.debug("Starting syntax analysis for {} characters of code", userCode.length());

        try {
            List<Token> tokens = new Lexer(userCode).tokenize();

            List<SyntaxToken> syntaxTokens = new ArrayList<>(tokens.size());
            Token previous = null;
            for (Token token : tokens) {
                syntaxTokens.add(toSyntaxToken(token, previous));
                previous = token;
            }

            long analysisTime = System.currentTimeMillis() - startTime;
            logger.debug("Syntax analysis completed in {}ms with {} tokens", analysisTime, syntaxTokens.size());

            return SyntaxAnalysisResponse.success(syntaxTokens, analysisTime);

        } catch (LexerException e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.debug("Syntax analysis stopped at lexer error: {}", e.getMessage());
            return SyntaxAnalysisResponse.lexerError(e.getMessage(), e.getLine(), e.getColumn(), analysisTime);
        }
    }

    private SyntaxToken toSyntaxToken(Token token, Token previous) {
        // string tokens drop their quotes, so add them back for the source span
        int length = token.kind() == TokenKind.STRING ? token.text().length() + 2 : token.text().length();

        Role role = roleOf(token, previous);
        return new SyntaxToken(
                token.line(),
                token.column(),
                token.line(),
                token.column() + length,
                tokenTypeOf(token.kind()).name(),
                token.text(),
                role != null ? role.name() : null);
    }

    private TokenType tokenTypeOf(TokenKind kind) {
        switch (kind) {
            case IDENTIFIER:
                return TokenType.IDENTIFIER;
            case STRING:
                return TokenType.STRING_LITERAL;
            case NUMBER:
                return TokenType.NUMBER_LITERAL;
            case URL:
                return TokenType.URL;
            default:
                return TokenType.KEYWORD;
        }
    }

    private Role roleOf(Token token, Token previous) {
        TokenKind before = previous != null ? previous.kind() : null;

        switch (token.kind()) {
            case URL:
                return Role.NAVIGATION_TARGET;
            case NUMBER:
                return Role.DURATION;
            case IDENTIFIER:
                if (before == TokenKind.OPEN) {
                    return Role.BROWSER;
                }
                if (before == TokenKind.SCREENSHOT) {
                    return Role.FILENAME;
                }
                return isSelectorKind(token) ? Role.SELECTOR_KIND : null;
            case STRING:
                if (before == TokenKind.TYPE) {
                    return Role.TEXT;
                }
                return previous != null && isSelectorKind(previous) ? Role.SELECTOR : null;
            default:
                return null;
        }
    }

    private boolean isSelectorKind(Token token) {
        return token.kind() == TokenKind.IDENTIFIER && SelectorKind.fromKeyword(token.text()).isPresent();
    }

    private String sanitizeInput(String input) {
        if (input == null)
            return "";

        return input.replace("\r\n", "\n")
                .replace("\r", "\n");
    }
}
