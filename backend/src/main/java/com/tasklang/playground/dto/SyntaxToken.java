package com.tasklang.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Editor-facing view of a token. End columns are exclusive.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyntaxToken(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    String tokenType,
    String value,
    String semanticInfo
) {
    public enum TokenType {
        KEYWORD,
        IDENTIFIER,
        STRING_LITERAL,
        NUMBER_LITERAL,
        URL
    }

    public enum Role {
        BROWSER,
        NAVIGATION_TARGET,
        TEXT,
        SELECTOR_KIND,
        SELECTOR,
        DURATION,
        FILENAME
    }
}
