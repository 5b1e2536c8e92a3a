package com.impact.apidiff.service;

import com.impact.apidiff.analyzer.CandidateFiles;
import com.impact.apidiff.config.AnalyzerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Lists the Python files of a checked-out tree that are searched for usages.
 */
@Slf4j
@Component
public class WorkingTreeFiles {

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("__pycache__", "node_modules");

    private final FileSelection selection;
    private final int maxFiles;

    public WorkingTreeFiles(FileSelection selection, AnalyzerProperties properties) {
        this.selection = selection;
        this.maxFiles = properties.getMaxUsageSearchFiles();
    }

    /**
     * Collects candidate files below {@code root}, sorted, at most {@code max-usage-search-files} of them.
     */
    public CandidateFiles list(Path root) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        List<String> files = new ArrayList<>();

        Files.walkFileTree(base, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(base)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (name.startsWith(".") || SKIPPED_DIRECTORIES.contains(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && file.getFileName().toString().endsWith(".py")) {
                    String relative = base.relativize(file).toString().replace('\\', '/');
                    if (selection.isSelected(relative)) {
                        files.add(relative);
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Cannot access {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        Collections.sort(files);
        List<String> selected = files;
        if (files.size() > maxFiles) {
            log.warn("Found {} candidate files; searching only the first {}.", files.size(), maxFiles);
            selected = new ArrayList<>(files.subList(0, maxFiles));
        }
        log.info("Collected {} candidate file(s) under {}.", selected.size(), base);

        return new CandidateFiles(selected, relativePath -> readUtf8(base, relativePath));
    }

    private static String readUtf8(Path base, String relativePath) throws IOException {
        // Malformed bytes are replaced rather than failing the read
        return new String(Files.readAllBytes(base.resolve(relativePath)), StandardCharsets.UTF_8);
    }
}
