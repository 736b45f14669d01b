package com.replcraft.scan;

import java.io.ByteArrayOutputStream;
import java.util.OptionalInt;

/**
 * Mutable state of one reading episode. Offsets are byte offsets into the
 * accumulated buffer.
 */
public final class ScanState {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private LexMode mode = LexMode.NORMAL;
    private int parenDepth;
    private boolean suppressCompletion;
    private int firstToken = -1;
    private int lastToken = -1;
    private int unmatchedClosers;

    public LexMode mode() { return mode; }
    public int parenDepth() { return parenDepth; }
    public boolean suppressCompletion() { return suppressCompletion; }
    public void suppressCompletion(boolean b) { suppressCompletion = b; }

    public boolean hasFirstToken() { return firstToken >= 0; }

    public OptionalInt firstToken() {
        return firstToken < 0 ? OptionalInt.empty() : OptionalInt.of(firstToken);
    }

    /** Offset of the last token byte, -1 when none was seen. */
    public int lastToken() { return lastToken; }

    /** Closing brackets seen at depth 0; they are not counted. */
    public int unmatchedClosers() { return unmatchedClosers; }

    /** Bytes accumulated from completed lines; also the offset where the current line starts. */
    public int length() { return buffer.size(); }

    public byte[] bytes() { return buffer.toByteArray(); }

    /**
     * Applies the outcome of the byte at {@code pos} of the line being
     * scanned. The line is not yet part of the buffer.
     */
    public void apply(Step s, int pos) {
        mode = s.mode();

        parenDepth += s.parenDelta();
        if (parenDepth < 0) {
            parenDepth = 0;
            unmatchedClosers++;
        }

        if (s.suppress() == Step.Suppress.SET) suppressCompletion = true;
        else if (s.suppress() == Step.Suppress.CLEAR) suppressCompletion = false;

        if (s.resolved() && Continuation.resets(parenDepth, mode)) suppressCompletion = false;

        int lineStart = buffer.size();
        if (s.previousToken()) foundToken(lineStart + pos - 1);
        if (s.token()) foundToken(lineStart + pos);
    }

    private void foundToken(int offset) {
        lastToken = offset;
        if (firstToken < 0) firstToken = offset;
    }

    /**
     * Appends a scanned line. Line comments end with the line, and so does a
     * pending + or - run.
     */
    public void endLine(byte[] line) {
        buffer.write(line, 0, line.length);
        if (mode == LexMode.LINE_COMMENT || mode == LexMode.PLUS_RUN || mode == LexMode.MINUS_RUN) {
            mode = LexMode.NORMAL;
        }
    }
}
