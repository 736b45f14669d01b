package com.replcraft.scan;

/**
 * Outcome of feeding one character to {@link Transitions#step}. Immutable.
 */
public final class Step {
    public enum Suppress { KEEP, SET, CLEAR }

    private final LexMode mode;
    private final int parenDelta;
    private final Suppress suppress;
    private final boolean resolved;
    private final boolean token;
    private final boolean previousToken;
    private final boolean shebang;
    private final String invalidLiteral;

    private Step(LexMode mode, int parenDelta, Suppress suppress, boolean resolved,
                 boolean token, boolean previousToken, boolean shebang, String invalidLiteral) {
        this.mode = mode;
        this.parenDelta = parenDelta;
        this.suppress = suppress;
        this.resolved = resolved;
        this.token = token;
        this.previousToken = previousToken;
        this.shebang = shebang;
        this.invalidLiteral = invalidLiteral;
    }

    /** A character that settles the lexical context; {@code token} when it is significant. */
    static Step resolved(LexMode mode, int parenDelta, Suppress suppress, boolean token, boolean previousToken) {
        return new Step(mode, parenDelta, suppress, true, token, previousToken, false, null);
    }

    /** Whitespace, comment text or a character whose meaning depends on the next one. */
    static Step skipped(LexMode mode, Suppress suppress, boolean previousToken) {
        return new Step(mode, 0, suppress, false, false, previousToken, false, null);
    }

    static Step hashBang() {
        return new Step(LexMode.LINE_COMMENT, 0, Suppress.KEEP, false, false, false, true, null);
    }

    static Step invalid(LexMode mode, String literal) {
        return new Step(mode, 0, Suppress.KEEP, false, false, false, false, literal);
    }

    public LexMode mode() { return mode; }
    public int parenDelta() { return parenDelta; }
    public Suppress suppress() { return suppress; }

    /** False when the character is skipped: the continuation reset rule does not run for it. */
    public boolean resolved() { return resolved; }

    /** The current character is a token. */
    public boolean token() { return token; }

    /** The deferred {@code /} or {@code #} just before this character turned out to be a token. */
    public boolean previousToken() { return previousToken; }

    /** {@code #!} seen: both bytes are rewritten to {@code //}. */
    public boolean shebang() { return shebang; }

    public boolean isInvalid() { return invalidLiteral != null; }

    /** "rune" or "string" when the character is not allowed inside that literal, else null. */
    public String invalidLiteral() { return invalidLiteral; }
}
