package com.replcraft.input;

import java.io.IOException;

/**
 * One physical line as read, with the trailing newline when there was one.
 * A line without newline is the last one: the stream ended or failed.
 */
public final class Line {
    private final byte[] bytes;
    private final boolean eof;
    private final IOException error;

    private Line(byte[] bytes, boolean eof, IOException error) {
        this.bytes = bytes;
        this.eof = eof;
        this.error = error;
    }

    static Line complete(byte[] bytes) { return new Line(bytes, false, null); }
    static Line eof(byte[] bytes) { return new Line(bytes, true, null); }
    static Line failed(byte[] bytes, IOException e) { return new Line(bytes, false, e); }

    public byte[] bytes() { return bytes; }
    public boolean eof() { return eof; }
    public IOException error() { return error; }

    /** Nothing more can be read after this line. */
    public boolean last() { return eof || error != null; }
}
