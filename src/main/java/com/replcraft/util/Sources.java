package com.replcraft.util;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Turns the accepted source representations into bytes or text: {@code byte[]},
 * {@code String}, {@code ByteArrayOutputStream} and any {@code InputStream},
 * which is drained.
 */
public final class Sources {
    private Sources() { }

    public static byte[] readBytes(Object src) {
        if (src instanceof byte[]) return (byte[]) src;
        if (src instanceof String) return ((String) src).getBytes(StandardCharsets.UTF_8);
        // already in memory
        if (src instanceof ByteArrayOutputStream) return ((ByteArrayOutputStream) src).toByteArray();
        if (src instanceof InputStream) return drain((InputStream) src);
        throw new UnsupportedSourceTypeException(src);
    }

    public static String readString(Object src) {
        if (src instanceof String) return (String) src;
        return new String(readBytes(src), StandardCharsets.UTF_8);
    }

    private static byte[] drain(InputStream is) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        int n;
        try {
            while ((n = is.read(buf)) != -1) {
                baos.write(buf, 0, n);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return baos.toByteArray();
    }
}
