package com.replcraft.input;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;

/**
 * An episode ended without a complete unit. Carries the text read so far so
 * the caller can show it, drop it or prompt again.
 */
public class ReadException extends IOException {
    private static final long serialVersionUID = 1L;

    private final byte[] partial;
    private final int firstToken;

    public ReadException(String message, Throwable cause, byte[] partial, OptionalInt firstToken) {
        super(message, cause);
        this.partial = partial.clone();
        this.firstToken = firstToken.orElse(-1);
    }

    public String partialText() { return new String(partial, StandardCharsets.UTF_8); }

    public int partialLength() { return partial.length; }

    public OptionalInt firstToken() {
        return firstToken < 0 ? OptionalInt.empty() : OptionalInt.of(firstToken);
    }
}
