package com.tasklang.playground.parser.ast;

import java.util.Objects;

public record Selector(SelectorKind kind, String value) {

    public Selector {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
    }
}
