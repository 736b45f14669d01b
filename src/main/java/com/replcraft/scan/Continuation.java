package com.replcraft.scan;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides when a pending "statement continues" flag is dropped and when a line
 * ends a complete unit.
 */
public final class Continuation {
    private Continuation() { }

    // contexts in which the flag survives; comments never drop it
    private static final Set<LexMode> HOLDING = EnumSet.of(
            LexMode.NORMAL, LexMode.SLASH, LexMode.HASH,
            LexMode.LINE_COMMENT, LexMode.COMMENT, LexMode.COMMENT_STAR);

    /**
     * True when the flag must be cleared after a resolved character. Inside
     * brackets or literals more input is needed anyway, so the flag is moot.
     */
    public static boolean resets(int parenDepth, LexMode mode) {
        return parenDepth > 0 || !HOLDING.contains(mode);
    }

    /**
     * True when the text scanned so far may be handed on, before the keyword
     * tail check. Without {@code collectAllComments} a comment-only unit is
     * complete too.
     */
    public static boolean lineComplete(ScanState st, boolean collectAllComments) {
        return st.parenDepth() <= 0
                && !st.suppressCompletion()
                && st.mode() == LexMode.NORMAL
                && (st.hasFirstToken() || !collectAllComments);
    }
}
