package com.replcraft.scan;

import com.replcraft.scan.Step.Suppress;

/**
 * Per-character transition function of the scanner. Pure: the result depends
 * only on the current mode, the byte (as an unsigned value) and the bracket
 * depth before the byte is applied.
 */
public final class Transitions {
    private Transitions() { }

    public static Step step(LexMode mode, int ch, int parenDepth) {
        switch (mode) {
            case PLUS_RUN:
            case MINUS_RUN:
                if (ch == '+') {
                    return tok(mode == LexMode.PLUS_RUN ? LexMode.NORMAL : LexMode.PLUS_RUN, 0, Suppress.KEEP, ch, false);
                }
                if (ch == '-') {
                    return tok(mode == LexMode.MINUS_RUN ? LexMode.NORMAL : LexMode.MINUS_RUN, 0, Suppress.KEEP, ch, false);
                }
                // a single + or - is a binary operator waiting for its right operand
                if (ch <= ' ') return Step.skipped(LexMode.NORMAL, Suppress.SET, false);
                return normal(ch, parenDepth, Suppress.SET, false);

            case NORMAL:
                return normal(ch, parenDepth, Suppress.KEEP, false);

            case RUNE:
                if (ch == '\\') return tok(LexMode.RUNE_ESCAPE, 0, Suppress.KEEP, ch, false);
                if (ch == '\'') return tok(LexMode.NORMAL, 0, Suppress.KEEP, ch, false);
                if (ch < ' ') return Step.invalid(mode, "rune");
                return tok(LexMode.RUNE, 0, Suppress.KEEP, ch, false);

            case RUNE_ESCAPE:
                if (ch < ' ') return Step.invalid(mode, "rune");
                return tok(LexMode.RUNE, 0, Suppress.KEEP, ch, false);

            case STRING:
                if (ch == '\\') return tok(LexMode.STRING_ESCAPE, 0, Suppress.KEEP, ch, false);
                if (ch == '"') return tok(LexMode.NORMAL, 0, Suppress.KEEP, ch, false);
                if (ch < ' ') return Step.invalid(mode, "string");
                return tok(LexMode.STRING, 0, Suppress.KEEP, ch, false);

            case STRING_ESCAPE:
                if (ch < ' ') return Step.invalid(mode, "string");
                return tok(LexMode.STRING, 0, Suppress.KEEP, ch, false);

            case RAW_STRING:
                return tok(ch == '`' ? LexMode.NORMAL : LexMode.RAW_STRING, 0, Suppress.KEEP, ch, false);

            case SLASH:
                if (ch == '/') return Step.skipped(LexMode.LINE_COMMENT, Suppress.KEEP, false);
                if (ch == '*') return Step.skipped(LexMode.COMMENT, Suppress.KEEP, false);
                // division: the pending slash was a token
                if (ch <= ' ') return Step.resolved(LexMode.NORMAL, 0, Suppress.SET, false, true);
                return normal(ch, parenDepth, Suppress.KEEP, true);

            case HASH:
                if (ch == '!') return Step.hashBang();
                return normal(ch, parenDepth, Suppress.KEEP, true);

            case LINE_COMMENT:
                return Step.skipped(LexMode.LINE_COMMENT, Suppress.KEEP, false);

            case COMMENT:
                return Step.skipped(ch == '*' ? LexMode.COMMENT_STAR : LexMode.COMMENT, Suppress.KEEP, false);

            case COMMENT_STAR:
                if (ch == '/') return Step.skipped(LexMode.NORMAL, Suppress.KEEP, false);
                return Step.skipped(ch == '*' ? LexMode.COMMENT_STAR : LexMode.COMMENT, Suppress.KEEP, false);

            case TILDE:
                // the character after ~ belongs to the quote operator
                return tok(LexMode.NORMAL, 0, Suppress.KEEP, ch, false);

            default:
                throw new IllegalStateException("unknown mode " + mode);
        }
    }

    private static Step normal(int ch, int parenDepth, Suppress pending, boolean previousToken) {
        switch (ch) {
            case '(':
            case '[':
            case '{':
                return tok(LexMode.NORMAL, 1, pending, ch, previousToken);
            case ')':
            case ']':
            case '}':
                return tok(LexMode.NORMAL, -1, pending, ch, previousToken);
            case '\'':
                return tok(LexMode.RUNE, 0, pending, ch, previousToken);
            case '"':
                return tok(LexMode.STRING, 0, pending, ch, previousToken);
            case '`':
                return tok(LexMode.RAW_STRING, 0, pending, ch, previousToken);
            case '/':
                return Step.skipped(LexMode.SLASH, pending, previousToken);
            case '#':
                return Step.skipped(LexMode.HASH, pending, previousToken);
            case '~':
                return tok(LexMode.TILDE, 0, pending, ch, previousToken);
            case '!':
            case '%':
            case '&':
            case '*':
            case ',':
            case '.':
            case '<':
            case '=':
            case '>':
            case '^':
            case '|':
                return tok(LexMode.NORMAL, 0, parenDepth == 0 ? Suppress.SET : Suppress.CLEAR, ch, previousToken);
            case '+':
                return tok(parenDepth == 0 ? LexMode.PLUS_RUN : LexMode.NORMAL, 0, Suppress.CLEAR, ch, previousToken);
            case '-':
                return tok(parenDepth == 0 ? LexMode.MINUS_RUN : LexMode.NORMAL, 0, Suppress.CLEAR, ch, previousToken);
            default:
                if (ch <= ' ') return Step.skipped(LexMode.NORMAL, pending, previousToken);
                return tok(LexMode.NORMAL, 0, Suppress.CLEAR, ch, previousToken);
        }
    }

    private static Step tok(LexMode next, int parenDelta, Suppress suppress, int ch, boolean previousToken) {
        return Step.resolved(next, parenDelta, suppress, ch > ' ', previousToken);
    }
}
