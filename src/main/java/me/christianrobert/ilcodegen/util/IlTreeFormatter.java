package me.christianrobert.ilcodegen.util;

import me.christianrobert.ilcodegen.il.IlNode;

import java.util.List;
import java.util.Map;

/**
 * Formats IL trees into human-readable, indented text.
 *
 * <p>Useful for debugging how a document was read, in particular which kinds ended up as
 * unknown nodes and which fields were present.</p>
 *
 * <p>Example output:</p>
 * <pre>
 * Program
 *   body:
 *     FunctionDeclaration : uint32
 *       id:
 *         Identifier [name="rotl32"]
 *       params:
 *         Identifier [name="x"] : uint32
 *         Identifier [name="n"] : uint32
 *       body:
 *         BlockStatement
 * </pre>
 */
public class IlTreeFormatter {

    private static final String INDENT = "  ";
    private static final int MAX_TEXT_LENGTH = 50;

    /**
     * Formats an IL tree into human-readable text.
     *
     * @param root Root of the IL tree
     * @return Formatted string representation
     */
    public static String format(IlNode root) {
        if (root == null) {
            return "(null tree)";
        }
        StringBuilder sb = new StringBuilder();
        formatNode(root, 0, sb);
        return sb.toString();
    }

    private static void formatNode(IlNode node, int depth, StringBuilder sb) {
        indent(depth, sb);
        sb.append(node.getRawKind());

        // Scalar fields inline
        StringBuilder scalars = new StringBuilder();
        for (Map.Entry<String, Object> field : node.getFields().entrySet()) {
            Object value = field.getValue();
            if (value == null || value instanceof IlNode || value instanceof List) {
                continue;
            }
            if (scalars.length() > 0) {
                scalars.append(", ");
            }
            scalars.append(field.getKey()).append('=');
            if (value instanceof String) {
                scalars.append('"').append(escapeAndTruncate((String) value)).append('"');
            } else {
                scalars.append(value);
            }
        }
        if (scalars.length() > 0) {
            sb.append(" [").append(scalars).append(']');
        }
        if (node.getResultType() != null) {
            sb.append(" : ").append(node.getResultType());
        }
        if (node.getLocation() != null) {
            sb.append(" @").append(node.getLocation());
        }
        sb.append('\n');

        // Child fields, labelled
        for (Map.Entry<String, Object> field : node.getFields().entrySet()) {
            Object value = field.getValue();
            if (value instanceof IlNode) {
                indent(depth + 1, sb);
                sb.append(field.getKey()).append(":\n");
                formatNode((IlNode) value, depth + 2, sb);
            } else if (value instanceof List && !((List<?>) value).isEmpty()) {
                indent(depth + 1, sb);
                sb.append(field.getKey()).append(":\n");
                for (Object item : (List<?>) value) {
                    if (item instanceof IlNode) {
                        formatNode((IlNode) item, depth + 2, sb);
                    }
                }
            }
        }
    }

    private static void indent(int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
    }

    /**
     * Escapes and truncates text for display.
     */
    private static String escapeAndTruncate(String text) {
        String escaped = text.replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
        if (escaped.length() > MAX_TEXT_LENGTH) {
            escaped = escaped.substring(0, MAX_TEXT_LENGTH) + "...";
        }
        return escaped;
    }
}
