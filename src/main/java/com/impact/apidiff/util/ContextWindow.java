package com.impact.apidiff.util;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Cuts the lines surrounding a usage out of a file, for display next to the usage.
 */
public final class ContextWindow {

    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private ContextWindow() {}

    public static String[] splitLines(String source) {
        return LINE_BREAK.split(source, -1);
    }

    /**
     * @param line 1-based line of the usage
     * @return up to {@code before} lines above, the line itself and up to {@code after} lines below, newline joined
     */
    public static String around(String[] lines, int line, int before, int after) {
        if (lines.length == 0) {
            return "";
        }
        int index = Math.min(Math.max(line - 1, 0), lines.length - 1);
        int start = Math.max(0, index - before);
        int end = Math.min(lines.length, index + after + 1);
        return String.join("\n", Arrays.asList(lines).subList(start, end));
    }
}
