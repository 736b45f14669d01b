package com.replcraft.util;

public final class UnsupportedSourceTypeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public UnsupportedSourceTypeException(Object src) {
        super("unsupported source, cannot read from: " + src + " <" + (src == null ? "null" : src.getClass().getName()) + ">");
    }
}
