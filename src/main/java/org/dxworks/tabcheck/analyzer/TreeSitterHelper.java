package org.dxworks.tabcheck.analyzer;

import org.dxworks.tabcheck.model.SourceLocation;
import org.treesitter.TSNode;
import org.treesitter.TSPoint;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeSitterHelper {

    public static String getNodeText(SourceFile source, TSNode node) {
        if (node == null || node.isNull()) return null;
        String text = source.slice(node.getStartByte(), node.getEndByte());
        // Normalize line endings to LF for cross-platform consistency
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }

    /**
     * Node text with all whitespace removed, so that {@code this . button1} and
     * {@code this.button1} render the same.
     */
    public static String getCompactText(SourceFile source, TSNode node) {
        String text = getNodeText(source, node);
        return text == null ? null : text.replaceAll("\\s+", "");
    }

    public static SourceLocation getLocation(TSNode node) {
        TSPoint start = node.getStartPoint();
        TSPoint end = node.getEndPoint();
        return new SourceLocation(start.getRow() + 1, start.getColumn() + 1,
                end.getRow() + 1, end.getColumn() + 1,
                node.getStartByte(), node.getEndByte());
    }

    public static TSNode findFirstChild(TSNode parent, String nodeType) {
        if (parent == null || parent.isNull()) return null;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (child != null && !child.isNull() && nodeType.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    public static List<TSNode> findAllChildren(TSNode parent, String nodeType) {
        List<TSNode> result = new ArrayList<>();
        if (parent == null || parent.isNull()) return result;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (child != null && !child.isNull() && nodeType.equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Named children that are not comments.
     */
    public static List<TSNode> getCodeChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (parent == null || parent.isNull()) return result;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (child != null && !child.isNull() && !"comment".equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    public static TSNode getFirstCodeChild(TSNode parent) {
        List<TSNode> children = getCodeChildren(parent);
        return children.isEmpty() ? null : children.get(0);
    }

    public static TSNode getLastCodeChild(TSNode parent) {
        List<TSNode> children = getCodeChildren(parent);
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    public static List<TSNode> findAllDescendants(TSNode root, String nodeType) {
        List<TSNode> result = new ArrayList<>();
        if (root == null || root.isNull()) return result;

        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (node == null || node.isNull()) continue;

            if (nodeType.equals(node.getType())) {
                result.add(node);
            }
            int count = node.getNamedChildCount();
            for (int i = count - 1; i >= 0; i--) {
                TSNode child = node.getNamedChild(i);
                if (child != null && !child.isNull()) {
                    stack.push(child);
                }
            }
        }
        return result;
    }

    public static TSNode findEnclosing(TSNode node, String... types) {
        if (node == null || node.isNull()) return null;
        TSNode current = node.getParent();
        while (current != null && !current.isNull()) {
            if (isNodeTypeOneOf(current, types)) {
                return current;
            }
            current = current.getParent();
        }
        return null;
    }

    public static TSNode getChildByFieldName(TSNode parent, String fieldName) {
        if (parent == null || parent.isNull()) return null;
        // Use getChildCount() and getChild(i) because getFieldNameForChild(i)
        // expects the total child index (including anonymous nodes like operators, punctuation),
        // not the named child index
        for (int i = 0; i < parent.getChildCount(); i++) {
            String fn = parent.getFieldNameForChild(i);
            if (fieldName.equals(fn)) return parent.getChild(i);
        }
        return null;
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (node == null || node.isNull()) return false;
        return isTypeOneOf(node.getType(), types);
    }

    /**
     * The object part of a member access ({@code a.b} in {@code a.b.c}).
     */
    public static TSNode getMemberReceiver(TSNode memberAccess) {
        TSNode byField = getChildByFieldName(memberAccess, "expression");
        if (byField != null && !byField.isNull()) return byField;
        List<TSNode> children = getCodeChildren(memberAccess);
        return children.size() >= 2 ? children.get(0) : null;
    }

    /**
     * The member part of a member access ({@code c} in {@code a.b.c}).
     */
    public static TSNode getMemberName(TSNode memberAccess) {
        TSNode byField = getChildByFieldName(memberAccess, "name");
        if (byField != null && !byField.isNull()) return byField;
        return getLastCodeChild(memberAccess);
    }

    /**
     * Return the argument list node ("argument_list") if present.
     */
    public static TSNode getArgumentListNode(TSNode invocation) {
        if (invocation == null || invocation.isNull()) return null;
        TSNode byField = getChildByFieldName(invocation, "arguments");
        if (byField != null && !byField.isNull()) return byField;
        return findFirstChild(invocation, "argument_list");
    }
}
