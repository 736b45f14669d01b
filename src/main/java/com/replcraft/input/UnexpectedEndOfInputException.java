package com.replcraft.input;

import java.io.EOFException;
import java.util.OptionalInt;

/** The input ended while brackets were still open. */
public final class UnexpectedEndOfInputException extends ReadException {
    private static final long serialVersionUID = 1L;

    public UnexpectedEndOfInputException(byte[] partial, OptionalInt firstToken) {
        super("unexpected EOF", new EOFException(), partial, firstToken);
    }
}
