package com.replcraft.input;

import java.io.PrintStream;

public final class ContinuationPrompt {
    private ContinuationPrompt() { }

    private static final String DOTS = ". . . . . . . . . . . . . . . . ";

    /** Prints {@code count} characters of the dotted pattern. */
    public static void print(PrintStream out, int count) {
        while (count >= DOTS.length()) {
            out.print(DOTS);
            count -= DOTS.length();
        }
        if (count > 0) out.print(DOTS.substring(0, count));
        out.flush();
    }

    /** Width for the given bracket depth. */
    public static int width(int parenDepth) {
        return 4 + 2 * parenDepth;
    }
}
