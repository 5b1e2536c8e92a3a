package com.impact.apidiff.service;

import com.impact.apidiff.analyzer.CandidateFiles;
import com.impact.apidiff.config.AnalyzerProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class WorkingTreeFilesTest {

    @TempDir
    Path root;

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    private WorkingTreeFiles workingTreeFiles(AnalyzerProperties properties) {
        return new WorkingTreeFiles(new FileSelection(properties), properties);
    }

    @Test
    @DisplayName("Lists selected Python files sorted, skipping hidden and cache directories")
    void listsSelectedFiles() throws Exception {
        // Arrange
        write("pkg/b.py", "b = 1\n");
        write("pkg/a.py", "a = 1\n");
        write("pkg/stub.pyi", "def f() -> int: ...\n");
        write("pkg/notes.txt", "text");
        write("pkg/test_a.py", "");
        write(".git/hooks/x.py", "");
        write("pkg/__pycache__/a.py", "");
        write("node_modules/n/x.py", "");

        // Act
        CandidateFiles candidates = workingTreeFiles(new AnalyzerProperties()).list(root);

        // Assert
        assertThat(candidates.getPaths()).containsExactly("pkg/a.py", "pkg/b.py");
        assertThat(candidates.getReader().read("pkg/a.py")).isEqualTo("a = 1\n");
    }

    @Test
    @DisplayName("The candidate list is capped at max-usage-search-files")
    void capsCandidateCount() throws Exception {
        write("a.py", "");
        write("b.py", "");
        write("c.py", "");
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.setMaxUsageSearchFiles(2);

        CandidateFiles candidates = workingTreeFiles(properties).list(root);

        assertThat(candidates.getPaths()).containsExactly("a.py", "b.py");
    }

    @Test
    @DisplayName("Invalid UTF-8 is decoded with replacement characters instead of failing")
    void malformedBytesAreReplaced() throws Exception {
        Files.write(root.resolve("latin.py"), new byte[]{'x', '=', '"', (byte) 0xE9, '"', '\n'});

        CandidateFiles candidates = workingTreeFiles(new AnalyzerProperties()).list(root);

        assertThat(candidates.getReader().read("latin.py")).startsWith("x=\"").contains("�");
    }
}
