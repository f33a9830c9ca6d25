package com.tasklang.playground.codegen;

import java.util.Locale;

/**
 * Browsers with a dedicated initialization block. Anything else falls back to Chrome.
 */
public enum BrowserKind {
    CHROME,
    FIREFOX,
    EDGE,
    SAFARI,
    UNKNOWN;

    public static BrowserKind fromName(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "chrome":
                return CHROME;
            case "firefox":
                return FIREFOX;
            case "edge":
                return EDGE;
            case "safari":
                return SAFARI;
            default:
                return UNKNOWN;
        }
    }
}
