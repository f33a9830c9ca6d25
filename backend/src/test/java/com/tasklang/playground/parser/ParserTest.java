package com.tasklang.playground.parser;

import com.tasklang.playground.exception.LexerException;
import com.tasklang.playground.exception.ParserException;
import com.tasklang.playground.lexer.Lexer;
import com.tasklang.playground.parser.ast.Program;
import com.tasklang.playground.parser.ast.Selector;
import com.tasklang.playground.parser.ast.SelectorKind;
import com.tasklang.playground.parser.ast.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserTest {

    private static Program parse(String source) throws LexerException, ParserException {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    @Test
    void parsesDemoScriptIntoSevenStatements() throws Exception {
        Program program = parse(String.join("\n",
                "open chrome",
                "go https://google.com",
                "type \"compiler project\"",
                "enter",
                "wait 2",
                "screenshot test.png",
                "close"));

        assertThat(program.statements()).containsExactly(
                new Statement.Open("chrome"),
                new Statement.Go("https://google.com"),
                new Statement.Type("compiler project"),
                new Statement.Enter(),
                new Statement.Wait(2),
                new Statement.Screenshot("test.png"),
                new Statement.Close());
    }

    @Test
    void emptyTokenListGivesEmptyProgram() throws Exception {
        assertThat(new Parser(List.of()).parse().statements()).isEmpty();
        assertThat(parse("# nothing here\n").isEmpty()).isTrue();
    }

    @Test
    void statementsNeedNoSeparator() throws Exception {
        Program program = parse("open firefox go https://a.org close");

        assertThat(program.statements()).containsExactly(
                new Statement.Open("firefox"),
                new Statement.Go("https://a.org"),
                new Statement.Close());
    }

    @Test
    void parsesOptionalSelectorClauses() throws Exception {
        Program program = parse(String.join("\n",
                "type \"hello\" id \"search\"",
                "click CSS \"button.submit, #go\"",
                "enter xpath \"//input[@name='q']\"",
                "click",
                "enter"));

        assertThat(program.statements()).containsExactly(
                new Statement.Type("hello", Optional.of(new Selector(SelectorKind.ID, "search"))),
                new Statement.Click(Optional.of(new Selector(SelectorKind.CSS, "button.submit, #go"))),
                new Statement.Enter(Optional.of(new Selector(SelectorKind.XPATH, "//input[@name='q']"))),
                new Statement.Click(),
                new Statement.Enter());
    }

    @Test
    void waitKeepsNonPositiveValuesForLaterChecks() throws Exception {
        assertThat(parse("wait 0").statements()).containsExactly(new Statement.Wait(0));
        assertThat(parse("wait -5").statements()).containsExactly(new Statement.Wait(-5));
    }

    @Test
    void waitOverflowIsInvalidNumber() {
        assertThatThrownBy(() -> parse("wait 99999999999"))
                .isInstanceOf(ParserException.class)
                .hasMessageContaining("Invalid number: 99999999999");
    }

    @Test
    void unexpectedLeadingTokenIsReported() {
        assertThatThrownBy(() -> parse("open chrome\nchrome"))
                .isInstanceOf(ParserException.class)
                .hasMessageContaining("Unexpected token: IDENTIFIER")
                .satisfies(e -> {
                    ParserException error = (ParserException) e;
                    assertThat(error.getLine()).isEqualTo(2);
                    assertThat(error.getColumn()).isEqualTo(1);
                });
    }

    @Test
    void wrongArgumentKindIsReportedAtThatToken() {
        assertThatThrownBy(() -> parse("go google.com"))
                .isInstanceOf(ParserException.class)
                .hasMessageContaining("Expected URL after 'go', but found IDENTIFIER ('google.com')")
                .satisfies(e -> {
                    ParserException error = (ParserException) e;
                    assertThat(error.getLine()).isEqualTo(1);
                    assertThat(error.getColumn()).isEqualTo(4);
                });
    }

    @Test
    void missingArgumentAtEndOfFileUsesLastToken() {
        assertThatThrownBy(() -> parse("open chrome\nscreenshot"))
                .isInstanceOf(ParserException.class)
                .hasMessageContaining("Expected filename after 'screenshot' (reached end of file)")
                .satisfies(e -> {
                    ParserException error = (ParserException) e;
                    assertThat(error.getLine()).isEqualTo(2);
                    assertThat(error.getColumn()).isEqualTo(1);
                });
    }

    @Test
    void unknownSelectorKindIsRejected() {
        assertThatThrownBy(() -> parse("click label \"Submit\""))
                .isInstanceOf(ParserException.class)
                .hasMessageContaining("Unknown selector kind 'label'");
    }

    @Test
    void selectorKindNeedsAString() {
        assertThatThrownBy(() -> parse("click css close"))
                .isInstanceOf(ParserException.class)
                .hasMessageContaining("Expected selector string after 'css', but found CLOSE");
    }
}
