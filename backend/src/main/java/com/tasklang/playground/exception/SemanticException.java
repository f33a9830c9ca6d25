package com.tasklang.playground.exception;

/**
 * Raised on the first statement that breaks the browser-session ordering rules.
 * Positions are statement indexes (1-based) rather than source coordinates.
 */
public class SemanticException extends CompilationException {

    private final int statementIndex;

    public SemanticException(String reason, int statementIndex) {
        super(reason, "Semantic error: " + reason + " at statement " + statementIndex);
        this.statementIndex = statementIndex;
    }

    public int getStatementIndex() {
        return statementIndex;
    }

    @Override
    public String getStage() {
        return "semantic";
    }
}
