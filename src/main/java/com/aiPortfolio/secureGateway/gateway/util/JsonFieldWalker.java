package com.aiPortfolio.secureGateway.gateway.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.function.UnaryOperator;

/**
 * Rewrites the text values found at a dotted path inside a JSON body.
 *
 * A segment ending in {@code []} fans out over every element of the array it names, so
 * {@code artifacts[].content} visits the {@code content} of each artifact. Absent and null
 * values are skipped. Any other value whose shape differs from the path (a number or array
 * where text is expected, a string where an array or object is expected) raises
 * {@link UnexpectedShapeException}, so no text can slip past the rewriter by being wrapped.
 */
public final class JsonFieldWalker {

    private static final String ARRAY_SUFFIX = "[]";

    private JsonFieldWalker() {
    }

    /**
     * Replaces every text leaf at {@code path} with {@code rewriter.apply(value)}.
     *
     * @param root JSON body, modified in place
     * @param path dotted path, e.g. {@code question} or {@code artifacts[].content}
     * @param rewriter called once per text leaf, in document order
     * @return the number of leaves visited
     * @throws UnexpectedShapeException if a present value does not have the shape the path expects
     */
    public static int rewrite(JsonNode root, String path, UnaryOperator<String> rewriter) {
        if (root == null || path == null || path.isBlank()) {
            return 0;
        }
        return walk(root, path, path.split("\\."), 0, rewriter);
    }

    /**
     * Checks the shape of the values at {@code path} without changing them.
     *
     * @throws UnexpectedShapeException if a present value does not have the shape the path expects
     */
    public static void checkShape(JsonNode root, String path) {
        rewrite(root, path, UnaryOperator.identity());
    }

    private static int walk(JsonNode node, String path, String[] segments, int index, UnaryOperator<String> rewriter) {
        if (!(node instanceof ObjectNode)) {
            throw new UnexpectedShapeException(path, "object");
        }
        ObjectNode object = (ObjectNode) node;
        String segment = segments[index];
        boolean fanOut = segment.endsWith(ARRAY_SUFFIX);
        String name = fanOut ? segment.substring(0, segment.length() - ARRAY_SUFFIX.length()) : segment;
        boolean leaf = index == segments.length - 1;

        JsonNode child = object.get(name);
        if (child == null || child.isNull()) {
            return 0;
        }

        if (!fanOut) {
            if (leaf) {
                if (!child.isTextual()) {
                    throw new UnexpectedShapeException(path, "string");
                }
                object.put(name, rewriter.apply(child.textValue()));
                return 1;
            }
            return walk(child, path, segments, index + 1, rewriter);
        }

        if (!child.isArray()) {
            throw new UnexpectedShapeException(path, "array");
        }
        ArrayNode array = (ArrayNode) child;
        int visited = 0;
        for (int i = 0; i < array.size(); i++) {
            JsonNode element = array.get(i);
            if (leaf) {
                if (!element.isTextual()) {
                    throw new UnexpectedShapeException(path, "array of strings");
                }
                array.set(i, TextNode.valueOf(rewriter.apply(element.textValue())));
                visited++;
            } else {
                visited += walk(element, path, segments, index + 1, rewriter);
            }
        }
        return visited;
    }

    /**
     * A value at an inspected path is neither absent, null nor of the expected JSON type.
     */
    public static class UnexpectedShapeException extends RuntimeException {

        private final String path;

        public UnexpectedShapeException(String path, String expected) {
            super("Field '" + path + "' must be " + (expected.startsWith("a") || expected.startsWith("o") ? "an " : "a ") + expected);
            this.path = path;
        }

        public String getPath() {
            return path;
        }
    }
}
