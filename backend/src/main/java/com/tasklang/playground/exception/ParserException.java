package com.tasklang.playground.exception;

public class ParserException extends CompilationException {

    private final int line;
    private final int column;

    public ParserException(String reason, int line, int column) {
        super(reason, "Syntax error: " + reason + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getStage() {
        return "parser";
    }
}
