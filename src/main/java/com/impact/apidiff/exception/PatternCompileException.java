package com.impact.apidiff.exception;

public class PatternCompileException extends Exception {

    private final String pattern;

    public PatternCompileException(String pattern, Throwable cause) {
        super("Invalid usage pattern: " + pattern, cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
