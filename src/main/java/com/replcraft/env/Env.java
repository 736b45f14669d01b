package com.replcraft.env;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Settings taken from the environment.
 */
public final class Env {
    static final String ENV_PROMPT = "REPLCRAFT_PROMPT";
    static final String ENV_TRACE = "REPLCRAFT_TRACE";
    static final String ENV_ALL_COMMENTS = "REPLCRAFT_ALL_COMMENTS";
    static final String ENV_KEYWORDS = "REPLCRAFT_KEYWORDS";

    static final String DEFAULT_PROMPT = "> ";

    private final Map<String, String> vars;

    public Env(Map<String, String> vars) {
        this.vars = vars;
    }

    public static Env system() {
        return new Env(System.getenv());
    }

    public String prompt() {
        String s = vars.get(ENV_PROMPT);
        return (s == null || s.isEmpty()) ? DEFAULT_PROMPT : s;
    }

    public boolean trace() { return flag(ENV_TRACE); }

    public boolean collectAllComments() { return flag(ENV_ALL_COMMENTS); }

    /** Dialect keywords on top of the Go ones, separated by commas or the path separator. */
    public List<String> extraKeywords() {
        String s = vars.get(ENV_KEYWORDS);
        if (s == null || s.isEmpty()) return new ArrayList<String>();

        char sep = File.pathSeparatorChar;
        ArrayList<String> out = new ArrayList<String>();
        int start = 0;

        for (int i = 0, n = s.length(); i <= n; i++) {
            if (i == n || s.charAt(i) == sep || s.charAt(i) == ',') {
                String word = s.substring(start, i).trim();
                if (!word.isEmpty()) out.add(word);
                start = i + 1;
            }
        }
        return out;
    }

    private boolean flag(String name) {
        String s = vars.get(name);
        if (s == null) return false;
        s = s.trim().toLowerCase(Locale.ROOT);
        return s.equals("1") || s.equals("true") || s.equals("yes") || s.equals("on");
    }
}
