package com.replcraft.input;

import java.util.OptionalInt;

/**
 * A raw control byte, newline included, inside a rune or string literal.
 * The partial text ends with the offending byte.
 */
public final class InvalidLiteralCharacterException extends ReadException {
    private static final long serialVersionUID = 1L;

    private final int character;
    private final String literal;

    public InvalidLiteralCharacterException(int character, String literal, byte[] partial, OptionalInt firstToken) {
        super("unexpected character " + quote(character) + " inside " + literal + " literal", null, partial, firstToken);
        this.character = character;
        this.literal = literal;
    }

    public int character() { return character; }

    /** "rune" or "string". */
    public String literal() { return literal; }

    static String quote(int ch) {
        switch (ch) {
            case '\n': return "'\\n'";
            case '\r': return "'\\r'";
            case '\t': return "'\\t'";
            case 0: return "'\\x00'";
            default:
                if (ch < ' ' || ch >= 0x7f) return String.format("'\\x%02x'", ch);
                return "'" + (char) ch + "'";
        }
    }
}
