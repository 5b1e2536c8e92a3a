package com.impact.apidiff.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContextWindowTest {

    private static final String[] LINES = ContextWindow.splitLines("one\r\ntwo\nthree\nfour\nfive");

    @Test
    @DisplayName("splitLines accepts both line endings")
    void splitsLines() {
        assertThat(LINES).containsExactly("one", "two", "three", "four", "five");
    }

    @Test
    @DisplayName("around clamps the window at both ends of the file")
    void clampsWindow() {
        assertThat(ContextWindow.around(LINES, 3, 1, 1)).isEqualTo("two\nthree\nfour");
        assertThat(ContextWindow.around(LINES, 1, 5, 2)).isEqualTo("one\ntwo\nthree");
        assertThat(ContextWindow.around(LINES, 5, 2, 2)).isEqualTo("three\nfour\nfive");
        assertThat(ContextWindow.around(new String[0], 1, 2, 2)).isEmpty();
    }
}
