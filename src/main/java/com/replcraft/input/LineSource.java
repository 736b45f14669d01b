package com.replcraft.input;

import com.replcraft.util.Sources;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Splits a byte stream into lines terminated by {@code '\n'}. Shared by all
 * episodes read from the same input.
 */
public final class LineSource implements AutoCloseable {
    private final InputStream in;

    public LineSource(InputStream in) {
        this.in = (in instanceof BufferedInputStream) ? in : new BufferedInputStream(in);
    }

    /**
     * Streams are read lazily, line by line; {@code byte[]}, {@code String}
     * and {@code ByteArrayOutputStream} sources are taken as a whole.
     */
    public static LineSource from(Object src) {
        if (src instanceof InputStream) return new LineSource((InputStream) src);
        return new LineSource(new ByteArrayInputStream(Sources.readBytes(src)));
    }

    /**
     * Reads up to and including the next newline. Bytes read before the
     * stream ended or failed are kept in the returned line.
     */
    public Line next() {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        try {
            int b;
            while ((b = in.read()) != -1) {
                line.write(b);
                if (b == '\n') return Line.complete(line.toByteArray());
            }
            return Line.eof(line.toByteArray());
        } catch (IOException e) {
            return Line.failed(line.toByteArray(), e);
        }
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
