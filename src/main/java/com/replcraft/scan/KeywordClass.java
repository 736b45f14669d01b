package com.replcraft.scan;

public enum KeywordClass {
    /** Not reserved. */
    IDENTIFIER,
    /** Ends a statement by itself: break, continue, fallthrough, return. */
    TERMINAL,
    /** Any other reserved word; a following clause is expected. */
    KEYWORD
}
