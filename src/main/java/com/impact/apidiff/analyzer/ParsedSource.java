package com.impact.apidiff.analyzer;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A successfully parsed Python file: the syntax tree plus the UTF-8 bytes its offsets refer to.
 */
public final class ParsedSource {

    private final TSTree tree;
    private final byte[] sourceBytes;
    private final String source;

    ParsedSource(TSTree tree, byte[] sourceBytes, String source) {
        this.tree = tree;
        this.sourceBytes = sourceBytes;
        this.source = source;
    }

    public TSNode root() {
        return tree.getRootNode();
    }

    public String source() {
        return source;
    }

    /**
     * Literal source text of a node. Offsets are UTF-8 byte offsets, so slicing the String directly
     * would be wrong for non-ASCII files.
     */
    public String text(TSNode node) {
        if (isAbsent(node)) {
            return "";
        }
        int start = Math.max(0, node.getStartByte());
        int end = Math.min(sourceBytes.length, node.getEndByte());
        if (end <= start) {
            return "";
        }
        return new String(sourceBytes, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * 1-based line on which the node starts.
     */
    public static int line(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    public static boolean isAbsent(TSNode node) {
        return node == null || node.isNull();
    }

    public static TSNode field(TSNode node, String fieldName) {
        TSNode child = node.getChildByFieldName(fieldName);
        return isAbsent(child) ? null : child;
    }

    public static List<TSNode> namedChildren(TSNode node) {
        int count = node.getNamedChildCount();
        List<TSNode> children = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            TSNode child = node.getNamedChild(i);
            if (!isAbsent(child)) {
                children.add(child);
            }
        }
        return children;
    }

    public static List<TSNode> children(TSNode node) {
        int count = node.getChildCount();
        List<TSNode> children = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (!isAbsent(child)) {
                children.add(child);
            }
        }
        return children;
    }

    /**
     * Tree-sitter nodes are value handles; two handles denote the same node when type and span agree.
     */
    public static boolean sameNode(TSNode a, TSNode b) {
        if (isAbsent(a) || isAbsent(b)) {
            return false;
        }
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }
}
