package com.impact.apidiff.analyzer;

import com.impact.apidiff.api.model.UsageKind;
import com.impact.apidiff.api.model.UsageLocation;
import com.impact.apidiff.exception.SourceParseException;
import com.impact.apidiff.util.ContextWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.impact.apidiff.analyzer.ParsedSource.field;
import static com.impact.apidiff.analyzer.ParsedSource.namedChildren;
import static com.impact.apidiff.analyzer.ParsedSource.children;
import static com.impact.apidiff.analyzer.ParsedSource.line;
import static com.impact.apidiff.analyzer.ParsedSource.sameNode;

/**
 * Syntax-aware half of the usage search. Walks a candidate file in source order, remembers which local
 * names imports bind to, and reports calls, attribute accesses and name references whose resolved name
 * contains the changed element.
 */
@Slf4j
@Component
public class StructuralUsageFinder {

    static final int CONTEXT_BEFORE = 5;
    static final int CONTEXT_AFTER = 2;

    static final double EXACT_CONFIDENCE = 0.9;
    static final double PARTIAL_CONFIDENCE = 0.5;
    static final double STAR_IMPORT_CONFIDENCE = 0.3;

    private final PythonSyntaxParser parser;

    public StructuralUsageFinder(PythonSyntaxParser parser) {
        this.parser = parser;
    }

    /**
     * Returns the usages of {@code elementName} in one file. A file that does not parse yields nothing.
     */
    public List<UsageLocation> find(String filePath, String source, String elementName) {
        ParsedSource parsed;
        try {
            parsed = parser.parse(source, filePath);
        } catch (SourceParseException e) {
            log.debug("Structural search skipped for {}: {}", filePath, e.getMessage());
            return List.of();
        }
        Walker walker = new Walker(parsed, filePath, elementName);
        walker.walk(parsed.root());
        return walker.found;
    }

    private static final class Walker {

        private final ParsedSource parsed;
        private final String filePath;
        private final String elementName;
        private final String[] lines;

        /** Local name to the dotted name it was imported as. */
        private final Map<String, String> bindings = new HashMap<>();
        private final List<UsageLocation> found = new ArrayList<>();
        private final Deque<TSNode> pending = new ArrayDeque<>();

        Walker(ParsedSource parsed, String filePath, String elementName) {
            this.parsed = parsed;
            this.filePath = filePath;
            this.elementName = elementName;
            this.lines = ContextWindow.splitLines(parsed.source());
        }

        /**
         * Pre-order walk in source order. An explicit stack keeps deeply nested expressions
         * from exhausting the thread stack.
         */
        void walk(TSNode root) {
            pending.push(root);
            while (!pending.isEmpty()) {
                visit(pending.pop());
            }
        }

        private void visit(TSNode node) {
            switch (node.getType()) {
                case "import_statement":
                    bindImports(node);
                    return;
                case "import_from_statement":
                case "future_import_statement":
                    bindFromImports(node);
                    return;
                case "global_statement":
                case "nonlocal_statement":
                case "dotted_name":
                case "comment":
                    return;
                case "parameters":
                case "lambda_parameters":
                    visitParameters(node);
                    return;
                case "function_definition":
                case "class_definition":
                case "keyword_argument":
                    scheduleChildrenExcept(node, field(node, "name"));
                    return;
                case "call":
                    visitCall(node);
                    return;
                case "attribute":
                    visitAttribute(node, UsageKind.ATTRIBUTE_ACCESS);
                    return;
                case "identifier":
                    check(parsed.text(node), UsageKind.NAME_REFERENCE, node);
                    return;
                default:
                    scheduleChildrenExcept(node, null);
            }
        }

        private void scheduleChildrenExcept(TSNode node, TSNode skipped) {
            List<TSNode> next = new ArrayList<>();
            for (TSNode child : children(node)) {
                if (!sameNode(child, skipped)) {
                    next.add(child);
                }
            }
            schedule(next);
        }

        // Pushed in reverse so the first child is visited first
        private void schedule(List<TSNode> nodes) {
            for (int i = nodes.size() - 1; i >= 0; i--) {
                pending.push(nodes.get(i));
            }
        }

        // import a.b -> a.b: a.b ; import a.b as c -> c: a.b
        private void bindImports(TSNode node) {
            for (TSNode child : namedChildren(node)) {
                if ("dotted_name".equals(child.getType())) {
                    String name = parsed.text(child);
                    bindings.put(name, name);
                } else if ("aliased_import".equals(child.getType())) {
                    String name = parsed.text(field(child, "name"));
                    String alias = parsed.text(field(child, "alias"));
                    bindings.put(alias, name);
                }
            }
        }

        // from m import n -> n: m.n ; from m import n as y -> y: m.n ; from m import * is reported immediately
        private void bindFromImports(TSNode node) {
            TSNode moduleNode = field(node, "module_name");
            String module = "future_import_statement".equals(node.getType())
                    ? "__future__"
                    : stripRelativeDots(moduleNode == null ? "" : parsed.text(moduleNode));

            for (TSNode child : namedChildren(node)) {
                if (sameNode(child, moduleNode)) {
                    continue;
                }
                switch (child.getType()) {
                    case "wildcard_import":
                        record(UsageKind.STAR_IMPORT, node, STAR_IMPORT_CONFIDENCE);
                        break;
                    case "dotted_name": {
                        String name = parsed.text(child);
                        bindings.put(name, qualify(module, name));
                        break;
                    }
                    case "aliased_import": {
                        String name = parsed.text(field(child, "name"));
                        bindings.put(parsed.text(field(child, "alias")), qualify(module, name));
                        break;
                    }
                    default:
                        break;
                }
            }
        }

        private void visitParameters(TSNode parameters) {
            // Parameter names are declarations; only defaults and annotations can hold references
            List<TSNode> next = new ArrayList<>();
            for (TSNode parameter : namedChildren(parameters)) {
                switch (parameter.getType()) {
                    case "default_parameter":
                    case "typed_default_parameter":
                    case "typed_parameter":
                        addIfPresent(next, field(parameter, "type"));
                        addIfPresent(next, field(parameter, "value"));
                        break;
                    default:
                        break;
                }
            }
            schedule(next);
        }

        private void visitCall(TSNode call) {
            TSNode function = field(call, "function");
            List<TSNode> next = new ArrayList<>();
            if (function != null && "identifier".equals(function.getType())) {
                check(parsed.text(function), UsageKind.FUNCTION_CALL, call);
            } else if (function != null && "attribute".equals(function.getType())) {
                addIfPresent(next, checkAttribute(function, UsageKind.METHOD_CALL));
            } else {
                function = null;
            }
            // The receiver expression, when there is one, is walked before the arguments
            for (TSNode child : children(call)) {
                if (!sameNode(child, function)) {
                    next.add(child);
                }
            }
            schedule(next);
        }

        private void visitAttribute(TSNode attribute, UsageKind kind) {
            TSNode receiver = checkAttribute(attribute, kind);
            if (receiver != null) {
                pending.push(receiver);
            }
        }

        /**
         * Checks {@code a.b.c} style chains as one name. When the object part is an arbitrary expression
         * nothing is checked and that expression is returned for walking instead.
         */
        private TSNode checkAttribute(TSNode attribute, UsageKind kind) {
            String dotted = dottedName(attribute);
            if (dotted == null) {
                return field(attribute, "object");
            }
            check(dotted, kind, attribute);
            return null;
        }

        private String dottedName(TSNode node) {
            Deque<String> segments = new ArrayDeque<>();
            TSNode current = node;
            while ("attribute".equals(current.getType())) {
                TSNode object = field(current, "object");
                TSNode attr = field(current, "attribute");
                if (object == null || attr == null) {
                    return null;
                }
                segments.push(parsed.text(attr));
                current = object;
            }
            if (!"identifier".equals(current.getType())) {
                return null;
            }
            segments.push(parsed.text(current));
            return String.join(".", segments);
        }

        private static void addIfPresent(List<TSNode> nodes, TSNode node) {
            if (node != null) {
                nodes.add(node);
            }
        }

        private void check(String name, UsageKind kind, TSNode node) {
            String resolved = resolve(name);
            if (!resolved.contains(elementName)) {
                return;
            }
            boolean exact = resolved.equals(elementName) || resolved.endsWith("." + elementName);
            record(kind, node, exact ? EXACT_CONFIDENCE : PARTIAL_CONFIDENCE);
        }

        private String resolve(String name) {
            String bound = bindings.get(name);
            if (bound != null) {
                return bound;
            }
            int dot = name.indexOf('.');
            if (dot > 0) {
                String head = bindings.get(name.substring(0, dot));
                if (head != null) {
                    return head + name.substring(dot);
                }
            }
            return name;
        }

        private void record(UsageKind kind, TSNode node, double confidence) {
            int usageLine = line(node);
            found.add(UsageLocation.builder()
                    .filePath(filePath)
                    .line(usageLine)
                    .context(ContextWindow.around(lines, usageLine, CONTEXT_BEFORE, CONTEXT_AFTER))
                    .usageKind(kind)
                    .confidence(confidence)
                    .build());
        }

        private static String stripRelativeDots(String module) {
            int i = 0;
            while (i < module.length() && module.charAt(i) == '.') {
                i++;
            }
            return module.substring(i);
        }

        private static String qualify(String module, String name) {
            return module.isEmpty() ? name : module + "." + name;
        }
    }
}
