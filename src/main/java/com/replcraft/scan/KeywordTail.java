package com.replcraft.scan;

import java.nio.charset.StandardCharsets;

/**
 * Looks at the word ending a line: {@code if}, {@code else}, {@code func} and
 * the like expect a clause on the next line, {@code return} and friends do not.
 */
public final class KeywordTail {
    private final KeywordTable keywords;

    public KeywordTail(KeywordTable keywords) {
        this.keywords = keywords;
    }

    /**
     * @param line the line just scanned
     * @param last offset of the last token byte within {@code line}, negative
     *             or out of range when the line has no token
     */
    public boolean forcesContinuation(byte[] line, int last) {
        String word = trailingWord(line, last);
        return word != null && keywords.classify(word) == KeywordClass.KEYWORD;
    }

    /** The run of lowercase ASCII letters ending at {@code last}, or null. */
    static String trailingWord(byte[] line, int last) {
        if (last < 0 || last >= line.length || !isLower(line[last])) return null;

        int start = last;
        while (start > 0 && isLower(line[start - 1])) start--;
        // tail of a longer identifier such as xif, Xif or a_if
        if (start > 0 && isIdentifierPart(line[start - 1] & 0xFF)) return null;

        return new String(line, start, last + 1 - start, StandardCharsets.US_ASCII);
    }

    private static boolean isLower(byte b) {
        return b >= 'a' && b <= 'z';
    }

    private static boolean isIdentifierPart(int ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9')
                || ch == '_' || ch >= 0x80;
    }
}
