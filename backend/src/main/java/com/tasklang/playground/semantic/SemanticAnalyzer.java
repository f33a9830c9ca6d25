package com.tasklang.playground.semantic;

import com.tasklang.playground.exception.SemanticException;
import com.tasklang.playground.parser.ast.Program;
import com.tasklang.playground.parser.ast.Statement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that statements respect the browser-session lifecycle: a page needs an open
 * browser, element interaction needs a loaded page, and waits must be positive.
 *
 * <p>The pass is a left-to-right fold over the statements. Session flags live in an
 * immutable {@link Session} value local to one {@link #analyze} call, so an analyzer
 * instance can be shared freely.
 */
public class SemanticAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private static final String OPEN_FIRST = " You must use 'open' command first.";
    private static final String GO_FIRST = " You must use 'go' command to navigate to a URL first.";

    public void analyze(Program program) throws SemanticException {
        Session session = Session.INITIAL;
        int index = 0;

        for (Statement statement : program.statements()) {
            index++;
            Outcome outcome = statement.accept(new Rules(session));
            if (outcome.violation() != null) {
                logger.debug("Statement {} rejected: {}", index, outcome.violation());
                throw new SemanticException(outcome.violation(), index);
            }
            session = outcome.session();
        }

        logger.debug("Semantic analysis passed for {} statements", program.size());
    }

    private record Session(boolean browserOpened, boolean pageLoaded) {
        static final Session INITIAL = new Session(false, false);
    }

    private record Outcome(Session session, String violation) {
        static Outcome ok(Session session) {
            return new Outcome(session, null);
        }

        static Outcome violation(String message) {
            return new Outcome(null, message);
        }
    }

    private static final class Rules implements Statement.Visitor<Outcome> {

        private final Session session;

        Rules(Session session) {
            this.session = session;
        }

        @Override
        public Outcome visitOpen(Statement.Open statement) {
            // a fresh browser has no page yet
            return Outcome.ok(new Session(true, false));
        }

        @Override
        public Outcome visitGo(Statement.Go statement) {
            if (!session.browserOpened()) {
                return Outcome.violation("Cannot navigate to URL '" + statement.url()
                        + "' before opening a browser." + OPEN_FIRST);
            }
            return Outcome.ok(new Session(true, true));
        }

        @Override
        public Outcome visitType(Statement.Type statement) {
            if (!session.pageLoaded()) {
                return Outcome.violation("Cannot type text '" + statement.text()
                        + "' before loading a page." + GO_FIRST);
            }
            return Outcome.ok(session);
        }

        @Override
        public Outcome visitClick(Statement.Click statement) {
            if (!session.pageLoaded()) {
                return Outcome.violation("Cannot click element before loading a page." + GO_FIRST);
            }
            return Outcome.ok(session);
        }

        @Override
        public Outcome visitEnter(Statement.Enter statement) {
            if (!session.pageLoaded()) {
                return Outcome.violation("Cannot press Enter before loading a page." + GO_FIRST);
            }
            return Outcome.ok(session);
        }

        @Override
        public Outcome visitWait(Statement.Wait statement) {
            if (statement.seconds() <= 0) {
                return Outcome.violation("Wait time must be greater than 0, but got " + statement.seconds()
                        + ". Please specify a positive number of seconds.");
            }
            return Outcome.ok(session);
        }

        @Override
        public Outcome visitScreenshot(Statement.Screenshot statement) {
            if (!session.browserOpened()) {
                return Outcome.violation("Cannot take screenshot '" + statement.filename()
                        + "' before opening a browser." + OPEN_FIRST);
            }
            return Outcome.ok(session);
        }

        @Override
        public Outcome visitClose(Statement.Close statement) {
            if (!session.browserOpened()) {
                return Outcome.violation("Cannot close browser before opening one." + OPEN_FIRST);
            }
            return Outcome.ok(session);
        }
    }
}
