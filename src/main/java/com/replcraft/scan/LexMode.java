package com.replcraft.scan;

/**
 * Lexical context of the scanner. Exactly one is active at a time; all the
 * behaviour lives in {@link Transitions}.
 */
public enum LexMode {
    NORMAL("norm"),
    PLUS_RUN("plus"),
    MINUS_RUN("minus"),
    RUNE("rune"),
    STRING("string"),
    RUNE_ESCAPE("runesc"),
    STRING_ESCAPE("stresc"),
    RAW_STRING("strraw"),
    SLASH("slash"),
    HASH("hash"),
    LINE_COMMENT("lcomm"),
    COMMENT("comment"),
    COMMENT_STAR("comm*"),
    TILDE("tilde");

    private final String label;

    LexMode(String label) {
        this.label = label;
    }

    public String label() { return label; }

    @Override
    public String toString() { return label; }
}
