package com.replcraft.input;

public enum ReadOption {
    SHOW_PROMPT,
    /** Keep reading until a non-comment token is found instead of returning comments one by one. */
    COLLECT_ALL_COMMENTS
}
