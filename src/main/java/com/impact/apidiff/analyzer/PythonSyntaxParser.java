package com.impact.apidiff.analyzer;

import com.impact.apidiff.exception.SourceParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * Parses Python source text into a tree-sitter syntax tree.
 * <p>
 * {@link TSParser} is not thread-safe, so each thread gets its own parser instance.
 */
@Slf4j
@Component
public class PythonSyntaxParser {

    private static final TSLanguage PYTHON = new TreeSitterPython();

    /** Node types the grammar accepts only for Python 2 compatibility. */
    private static final Set<String> LEGACY_STATEMENTS = Set.of("print_statement", "exec_statement");

    private final ThreadLocal<TSParser> parsers = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(PYTHON)) {
            throw new IllegalStateException("Failed to load the tree-sitter Python grammar");
        }
        return parser;
    });

    /**
     * Parses {@code source}; a tree containing error or missing nodes, or a Python 2
     * {@code print}/{@code exec} statement, is rejected.
     *
     * @throws SourceParseException when the text is not valid Python
     */
    public ParsedSource parse(String source, String filePath) throws SourceParseException {
        TSTree tree;
        try {
            tree = parsers.get().parseString(null, source);
        } catch (RuntimeException e) {
            throw new SourceParseException("tree-sitter failed to parse " + filePath, filePath, e);
        }
        if (tree == null) {
            throw new SourceParseException("tree-sitter returned no tree for " + filePath, filePath, 0);
        }

        TSNode root = tree.getRootNode();
        if (root.hasError()) {
            int errorLine = firstErrorLine(root);
            throw new SourceParseException(
                    "Syntax error in " + filePath + " near line " + errorLine, filePath, errorLine);
        }
        TSNode legacy = firstLegacyStatement(root);
        if (legacy != null) {
            int legacyLine = legacy.getStartPoint().getRow() + 1;
            throw new SourceParseException("Python 2 " + legacy.getType().replace('_', ' ') + " in "
                    + filePath + " near line " + legacyLine, filePath, legacyLine);
        }
        log.trace("Parsed {} ({} top-level nodes)", filePath, root.getNamedChildCount());
        return new ParsedSource(tree, source.getBytes(StandardCharsets.UTF_8), source);
    }

    private static int firstErrorLine(TSNode root) {
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if ("ERROR".equals(node.getType()) || node.isMissing()) {
                return node.getStartPoint().getRow() + 1;
            }
            if (!node.hasError()) {
                continue;
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                stack.push(node.getChild(i));
            }
        }
        return root.getStartPoint().getRow() + 1;
    }

    private static TSNode firstLegacyStatement(TSNode root) {
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (LEGACY_STATEMENTS.contains(node.getType())) {
                return node;
            }
            for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                stack.push(node.getNamedChild(i));
            }
        }
        return null;
    }
}
