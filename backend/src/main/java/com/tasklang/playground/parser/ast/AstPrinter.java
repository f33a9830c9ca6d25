package com.tasklang.playground.parser.ast;

import java.util.Optional;

/**
 * Renders a program as an indented tree for display in the playground.
 */
public class AstPrinter implements Statement.Visitor<String> {

    public String print(Program program) {
        if (program.isEmpty()) {
            return "Program([])";
        }

        StringBuilder out = new StringBuilder("Program(\n");
        int last = program.size() - 1;
        for (int i = 0; i <= last; i++) {
            out.append(i < last ? "  ├─ " : "  └─ ")
               .append(program.statements().get(i).accept(this))
               .append('\n');
        }
        return out.append(')').toString();
    }

    @Override
    public String visitOpen(Statement.Open statement) {
        return "Open(browser=" + quote(statement.browser()) + ")";
    }

    @Override
    public String visitGo(Statement.Go statement) {
        return "Go(url=" + quote(statement.url()) + ")";
    }

    @Override
    public String visitType(Statement.Type statement) {
        return "Type(text=" + quote(statement.text()) + selectorSuffix(statement.selector(), true) + ")";
    }

    @Override
    public String visitClick(Statement.Click statement) {
        return "Click(" + selectorSuffix(statement.selector(), false) + ")";
    }

    @Override
    public String visitEnter(Statement.Enter statement) {
        return "Enter(" + selectorSuffix(statement.selector(), false) + ")";
    }

    @Override
    public String visitWait(Statement.Wait statement) {
        return "Wait(seconds=" + statement.seconds() + ")";
    }

    @Override
    public String visitScreenshot(Statement.Screenshot statement) {
        return "Screenshot(filename=" + quote(statement.filename()) + ")";
    }

    @Override
    public String visitClose(Statement.Close statement) {
        return "Close()";
    }

    private String selectorSuffix(Optional<Selector> selector, boolean afterField) {
        return selector
                .map(s -> (afterField ? ", " : "") + "selector=" + s.kind().keyword() + ":" + quote(s.value()))
                .orElse("");
    }

    private String quote(String value) {
        return "'" + value + "'";
    }
}
