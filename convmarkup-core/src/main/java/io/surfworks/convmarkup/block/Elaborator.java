package io.surfworks.convmarkup.block;

import io.surfworks.convmarkup.block.Blocks.Block;
import io.surfworks.convmarkup.markup.AstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a parsed markup tree into a tree of typed blocks.
 *
 * Children are elaborated first, in order. The first child receives the
 * node's input dimensions and every later child receives the output of the
 * child before it. The node's own creator then sees the node's input, its
 * attributes and the elaborated children.
 *
 * <p>An Elaborator holds no mutable state and can be shared between threads.
 */
public final class Elaborator {

    private static final Logger LOG = Logger.getLogger(Elaborator.class.getName());

    private static final Elaborator DEFAULT = new Elaborator(CreatorRegistry.defaults());

    private final CreatorRegistry registry;

    public Elaborator(CreatorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public static Elaborator withDefaults() {
        return DEFAULT;
    }

    /**
     * Elaborates a node and its subtree.
     *
     * @param node the node to elaborate, usually the root from the parser
     * @param in   dimensions flowing into the node
     * @throws ElaborationException at the first block that fails, carrying its source line
     */
    public Block elaborate(AstNode node, Dims in) {
        List<Block> children = new ArrayList<>(node.children().size());
        Dims childIn = in;
        for (AstNode child : node.children()) {
            Block block = elaborate(child, childIn);
            children.add(block);
            childIn = block.outDims();
        }
        return create(node, in, children);
    }

    private Block create(AstNode node, Dims in, List<Block> children) {
        Block block;
        try {
            block = registry.lookup(node.blockName()).create(in, node.attributes(), children);
        } catch (ElaborationException e) {
            ElaborationException located = e.atLine(node.line());
            LOG.log(Level.FINE, "Elaboration failed: {0}", located.getMessage());
            throw located;
        }
        Objects.requireNonNull(block, () -> "Creator for '" + node.blockName() + "' returned null");
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(describe(node) + ": " + in + " -> " + block.outDims());
        }
        return block;
    }

    private static String describe(AstNode node) {
        if (node.isRoot()) {
            return "root";
        }
        return node.blockName() + " (line " + (node.line() + 1) + ")";
    }
}
