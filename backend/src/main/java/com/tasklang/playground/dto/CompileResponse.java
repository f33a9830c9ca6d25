package com.tasklang.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompileResponse(
        boolean success,
        String generatedCode,
        String ast,
        Integer tokenCount,
        Integer statementCount,
        String outputPath,
        String error,
        String errorStage,
        Integer line,
        Integer column,
        Integer statementIndex,
        Long compilationTimeMs,
        String resultType
) {

    public static CompileResponse success(String generatedCode, String ast, int tokenCount,
                                          int statementCount, String outputPath, long compilationTimeMs) {
        return new CompileResponse(
                true,
                generatedCode,
                ast,
                tokenCount,
                statementCount,
                outputPath,
                null,
                null,
                null,
                null,
                null,
                compilationTimeMs,
                "success");
    }

    public static CompileResponse compilationError(String error) {
        return new CompileResponse(
                false,
                null,
                null,
                null,
                null,
                null,
                error,
                null,
                null,
                null,
                null,
                null,
                "compilation_error");
    }

    public static CompileResponse sourceError(String stage, String error, int line, int column,
                                              long compilationTimeMs) {
        return new CompileResponse(
                false,
                null,
                null,
                null,
                null,
                null,
                error,
                stage,
                line,
                column,
                null,
                compilationTimeMs,
                "compilation_error");
    }

    public static CompileResponse semanticError(String error, int statementIndex, long compilationTimeMs) {
        return new CompileResponse(
                false,
                null,
                null,
                null,
                null,
                null,
                error,
                "semantic",
                null,
                null,
                statementIndex,
                compilationTimeMs,
                "semantic_error");
    }

    public static CompileResponse outputError(String generatedCode, String error, long compilationTimeMs) {
        return new CompileResponse(
                false,
                generatedCode,
                null,
                null,
                null,
                null,
                error,
                "output",
                null,
                null,
                null,
                compilationTimeMs,
                "output_error");
    }
}
