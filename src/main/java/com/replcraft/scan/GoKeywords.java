package com.replcraft.scan;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Go reserved words, optionally extended with the keywords of a dialect.
 * Extra words are never terminal.
 */
public final class GoKeywords implements KeywordTable {
    private static final Set<String> TERMINAL = new HashSet<String>(Arrays.asList(
            "break", "continue", "fallthrough", "return"));

    private static final Set<String> RESERVED = new HashSet<String>(Arrays.asList(
            "break", "case", "chan", "const", "continue",
            "default", "defer", "else", "fallthrough", "for",
            "func", "go", "goto", "if", "import",
            "interface", "map", "package", "range", "return",
            "select", "struct", "switch", "type", "var"));

    private final Set<String> extra;

    public GoKeywords() {
        this(Collections.<String>emptySet());
    }

    public GoKeywords(Collection<String> extra) {
        this.extra = Collections.unmodifiableSet(new HashSet<String>(extra));
    }

    @Override
    public KeywordClass classify(String word) {
        if (TERMINAL.contains(word)) return KeywordClass.TERMINAL;
        if (RESERVED.contains(word) || extra.contains(word)) return KeywordClass.KEYWORD;
        return KeywordClass.IDENTIFIER;
    }
}
