package com.tasklang.playground.parser.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * One TaskLang instruction. The variant set is closed; consumers go through
 * {@link Visitor} so that every variant must be handled.
 */
public sealed interface Statement {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitOpen(Open statement);

        R visitGo(Go statement);

        R visitType(Type statement);

        R visitClick(Click statement);

        R visitEnter(Enter statement);

        R visitWait(Wait statement);

        R visitScreenshot(Screenshot statement);

        R visitClose(Close statement);
    }

    record Open(String browser) implements Statement {
        public Open {
            Objects.requireNonNull(browser, "browser");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOpen(this);
        }
    }

    record Go(String url) implements Statement {
        public Go {
            Objects.requireNonNull(url, "url");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGo(this);
        }
    }

    record Type(String text, Optional<Selector> selector) implements Statement {
        public Type {
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(selector, "selector");
        }

        public Type(String text) {
            this(text, Optional.empty());
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitType(this);
        }
    }

    record Click(Optional<Selector> selector) implements Statement {
        public Click {
            Objects.requireNonNull(selector, "selector");
        }

        public Click() {
            this(Optional.empty());
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClick(this);
        }
    }

    record Enter(Optional<Selector> selector) implements Statement {
        public Enter {
            Objects.requireNonNull(selector, "selector");
        }

        public Enter() {
            this(Optional.empty());
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEnter(this);
        }
    }

    /**
     * Seconds may be zero or negative here; the semantic pass rejects those.
     */
    record Wait(int seconds) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWait(this);
        }
    }

    record Screenshot(String filename) implements Statement {
        public Screenshot {
            Objects.requireNonNull(filename, "filename");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitScreenshot(this);
        }
    }

    record Close() implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClose(this);
        }
    }
}
