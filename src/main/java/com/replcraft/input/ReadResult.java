package com.replcraft.input;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.OptionalInt;

/**
 * A complete unit: the raw accumulated text and the byte offset where the
 * first non-comment token starts.
 */
public final class ReadResult {
    private final byte[] bytes;
    private final int firstToken;
    private final boolean eof;

    public ReadResult(byte[] bytes, OptionalInt firstToken, boolean eof) {
        this.bytes = bytes.clone();
        this.firstToken = firstToken.orElse(-1);
        this.eof = eof;
    }

    public String text() { return new String(bytes, StandardCharsets.UTF_8); }

    public byte[] bytes() { return bytes.clone(); }

    public OptionalInt firstToken() {
        return firstToken < 0 ? OptionalInt.empty() : OptionalInt.of(firstToken);
    }

    /** The input ended with this unit. */
    public boolean eof() { return eof; }

    public boolean hasCode() { return firstToken >= 0; }

    /** Text before the first token; all of it when there is no token. */
    public String comments() {
        int end = firstToken < 0 ? bytes.length : firstToken;
        return new String(Arrays.copyOfRange(bytes, 0, end), StandardCharsets.UTF_8);
    }

    /** Text from the first token on; empty when there is no token. */
    public String code() {
        if (firstToken < 0) return "";
        return new String(Arrays.copyOfRange(bytes, firstToken, bytes.length), StandardCharsets.UTF_8);
    }
}
