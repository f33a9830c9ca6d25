package com.tasklang.playground.semantic;

import com.tasklang.playground.exception.SemanticException;
import com.tasklang.playground.lexer.Lexer;
import com.tasklang.playground.parser.Parser;
import com.tasklang.playground.parser.ast.Program;
import com.tasklang.playground.parser.ast.Statement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class SemanticAnalyzerTest {

    private final SemanticAnalyzer analyzer = new SemanticAnalyzer();

    private static Program parse(String source) throws Exception {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    private SemanticException rejection(String source) throws Exception {
        Program program = parse(source);
        Throwable thrown = catchThrowable(() -> analyzer.analyze(program));
        assertThat(thrown).isInstanceOf(SemanticException.class);
        return (SemanticException) thrown;
    }

    @Test
    void validProgramPasses() throws Exception {
        Program program = parse(String.join("\n",
                "open chrome",
                "go https://google.com",
                "type \"compiler project\"",
                "click css \"#submit\"",
                "enter",
                "wait 2",
                "screenshot test.png",
                "close"));

        assertThatCode(() -> analyzer.analyze(program)).doesNotThrowAnyException();
    }

    @Test
    void emptyProgramPasses() {
        assertThatCode(() -> analyzer.analyze(new Program(List.of()))).doesNotThrowAnyException();
    }

    @Test
    void goBeforeOpenFailsAtFirstStatement() throws Exception {
        SemanticException error = rejection("go https://google.com");

        assertThat(error.getStatementIndex()).isEqualTo(1);
        assertThat(error.getMessage())
                .contains("Cannot navigate to URL 'https://google.com'")
                .contains("before opening a browser");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -5})
    void nonPositiveWaitFails(int seconds) throws Exception {
        SemanticException error = rejection("open chrome\nwait " + seconds);

        assertThat(error.getStatementIndex()).isEqualTo(2);
        assertThat(error.getMessage()).contains("Wait time must be greater than 0, but got " + seconds);
    }

    @Test
    void positiveWaitPasses() throws Exception {
        Program program = parse("open chrome\nwait 1");

        assertThatCode(() -> analyzer.analyze(program)).doesNotThrowAnyException();
    }

    @Test
    void waitNeedsNoBrowser() {
        Program program = new Program(List.of(new Statement.Wait(1)));

        assertThatCode(() -> analyzer.analyze(program)).doesNotThrowAnyException();
    }

    @Test
    void typeBeforeGoFails() throws Exception {
        SemanticException error = rejection("open chrome\ntype \"hello\"");

        assertThat(error.getStatementIndex()).isEqualTo(2);
        assertThat(error.getReason()).startsWith("Cannot type text 'hello' before loading a page");
    }

    @Test
    void clickAndEnterNeedALoadedPage() throws Exception {
        assertThat(rejection("open chrome\nclick").getReason())
                .startsWith("Cannot click element before loading a page");
        assertThat(rejection("open chrome\nenter").getReason())
                .startsWith("Cannot press Enter before loading a page");
    }

    @Test
    void screenshotAndCloseNeedABrowser() throws Exception {
        SemanticException screenshot = rejection("screenshot shot.png");
        assertThat(screenshot.getStatementIndex()).isEqualTo(1);
        assertThat(screenshot.getReason()).startsWith("Cannot take screenshot 'shot.png' before opening a browser");

        assertThat(rejection("close").getReason()).startsWith("Cannot close browser before opening one");
    }

    @Test
    void reopeningBrowserDiscardsLoadedPage() throws Exception {
        SemanticException error = rejection(String.join("\n",
                "open chrome",
                "go https://example.com",
                "open firefox",
                "type \"x\""));

        assertThat(error.getStatementIndex()).isEqualTo(4);
        assertThat(error.getReason()).contains("before loading a page");
    }

    @Test
    void multipleOpensAreAllowed() throws Exception {
        Program program = parse("open chrome\nopen firefox\ngo https://example.com\ntype \"x\"");

        assertThatCode(() -> analyzer.analyze(program)).doesNotThrowAnyException();
    }

    @Test
    void stopsAtFirstViolation() throws Exception {
        SemanticException error = rejection("open chrome\nwait 0\ngo https://a.com\nclose\nclick");

        assertThat(error.getStatementIndex()).isEqualTo(2);
    }

    @Test
    void analyzerInstanceCanBeReused() throws Exception {
        Program invalid = parse("go https://a.com");
        Program valid = parse("open chrome\ngo https://a.com");

        assertThatThrownBy(() -> analyzer.analyze(invalid)).isInstanceOf(SemanticException.class);
        assertThatCode(() -> analyzer.analyze(valid)).doesNotThrowAnyException();
        assertThatThrownBy(() -> analyzer.analyze(invalid)).isInstanceOf(SemanticException.class);
    }
}
