package com.tasklang.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyntaxAnalysisResponse(
        boolean success,
        List<SyntaxToken> tokens,
        String error,
        String errorStage,
        Integer errorLine,
        Integer errorColumn,
        long analysisTimeMs) {

    public static SyntaxAnalysisResponse success(List<SyntaxToken> tokens, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(true, tokens, null, null, null, null, analysisTimeMs);
    }

    public static SyntaxAnalysisResponse lexerError(String error, int line, int column, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(false, List.of(), error, "lexer", line, column, analysisTimeMs);
    }

    /**
     * A failure outside the source text, so no position is reported.
     */
    public static SyntaxAnalysisResponse internalError(String error) {
        return new SyntaxAnalysisResponse(false, List.of(), error, "internal", null, null, 0);
    }
}
