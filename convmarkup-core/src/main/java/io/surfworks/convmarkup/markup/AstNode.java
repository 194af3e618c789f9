package io.surfworks.convmarkup.markup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node in a parsed markup file. Each node corresponds to a single block.
 *
 * <p>The root node produced by {@link MarkupParser#parse(String)} has an empty
 * block name, no attributes and the line {@link #NO_LINE}; its children are
 * the top-level blocks of the file.
 *
 * @param line       0-based source line of the declaration
 * @param blockName  block name as written, e.g. "Conv"
 * @param attributes numeric attributes in source order
 * @param children   body blocks in source order
 */
public record AstNode(int line, String blockName, Map<String, Double> attributes, List<AstNode> children) {

    /** Line number of the synthetic root node. */
    public static final int NO_LINE = -1;

    public AstNode {
        Objects.requireNonNull(blockName, "blockName");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = List.copyOf(children);
    }

    /**
     * Creates a root node holding the given top-level blocks.
     */
    public static AstNode root(List<AstNode> children) {
        return new AstNode(NO_LINE, "", Map.of(), children);
    }

    /**
     * Creates a leaf node with no body.
     */
    public static AstNode leaf(int line, String blockName, Map<String, Double> attributes) {
        return new AstNode(line, blockName, attributes, List.of());
    }

    public boolean isRoot() {
        return line == NO_LINE && blockName.isEmpty();
    }

    /**
     * Counts this node and all of its descendants.
     */
    public int nodeCount() {
        int count = 1;
        for (AstNode child : children) {
            count += child.nodeCount();
        }
        return count;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(blockName.isEmpty() ? "<root>" : blockName);
        if (!attributes.isEmpty()) {
            sb.append(attributes);
        }
        if (!children.isEmpty()) {
            sb.append(" ").append(children);
        }
        return sb.toString();
    }
}
