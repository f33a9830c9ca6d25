package com.tasklang.playground.parser.ast;

import java.util.List;

/**
 * Root of a parsed script. The statement list is an immutable copy.
 */
public record Program(List<Statement> statements) {

    public Program {
        statements = List.copyOf(statements);
    }

    public int size() {
        return statements.size();
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
