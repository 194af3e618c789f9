package io.surfworks.convmarkup.block;

import io.surfworks.convmarkup.block.Blocks.Activation;
import io.surfworks.convmarkup.block.Blocks.Assert;
import io.surfworks.convmarkup.block.Blocks.Block;
import io.surfworks.convmarkup.block.Blocks.Conv;
import io.surfworks.convmarkup.block.Blocks.FullyConnected;
import io.surfworks.convmarkup.block.Blocks.Input;
import io.surfworks.convmarkup.block.Blocks.Linear;
import io.surfworks.convmarkup.block.Blocks.Padding;
import io.surfworks.convmarkup.block.Blocks.Pool;
import io.surfworks.convmarkup.block.Blocks.PoolKind;
import io.surfworks.convmarkup.block.Blocks.Projection;
import io.surfworks.convmarkup.block.Blocks.Repeat;
import io.surfworks.convmarkup.block.Blocks.Residual;
import io.surfworks.convmarkup.block.Blocks.Resize;
import io.surfworks.convmarkup.block.Blocks.Sequence;
import io.surfworks.convmarkup.block.ElaborationException.ErrorKind;

import java.util.List;
import java.util.Map;

import static io.surfworks.convmarkup.block.AttributeSpec.optionalInt;
import static io.surfworks.convmarkup.block.AttributeSpec.optionalReal;
import static io.surfworks.convmarkup.block.AttributeSpec.requiredInt;

/**
 * Creators for the built-in block types.
 */
public final class Creators {

    private Creators() {}

    static final AttributeSchema INPUT = AttributeSchema.of(
            requiredInt("w", 1), requiredInt("h", 1), requiredInt("d", 1));

    static final AttributeSchema ASSERT = AttributeSchema.of(
            requiredInt("w", 0), requiredInt("h", 0), requiredInt("d", 0));

    static final AttributeSchema CONV = AttributeSchema.of(
            requiredInt("w", 1), requiredInt("h", 1), requiredInt("n", 1),
            optionalInt("sx", 1, 1), optionalInt("sy", 1, 1));

    // Strides default to the window size.
    static final AttributeSchema POOL = AttributeSchema.of(
            requiredInt("w", 1), requiredInt("h", 1),
            optionalInt("sx", 1), optionalInt("sy", 1));

    static final AttributeSchema PADDING = AttributeSchema.of(
            optionalInt("t", 0, 0), optionalInt("r", 0, 0),
            optionalInt("b", 0, 0), optionalInt("l", 0, 0));

    static final AttributeSchema RESIZE = AttributeSchema.of(
            requiredInt("w", 1), requiredInt("h", 1));

    static final AttributeSchema FC = AttributeSchema.of(requiredInt("out", 1));

    static final AttributeSchema LINEAR = AttributeSchema.of(
            optionalReal("scale", 1), optionalReal("bias", 0));

    static final AttributeSchema REPEAT = AttributeSchema.of(requiredInt("n", 1));

    // ==================== Structural ====================

    /**
     * Root sequencing block: requires at least one child and outputs what the
     * last child outputs.
     */
    public static Block sequence(Dims in, Map<String, Double> attributes, List<Block> children) {
        AttributeSchema.none().validate("", attributes);
        if (children.isEmpty()) {
            throw ElaborationException.insufficientChildren("");
        }
        return new Sequence(children, last(children).outDims());
    }

    public static Block projection(Dims in, Map<String, Double> attributes, List<Block> children) {
        AttributeSchema.none().validate("Projection", attributes);
        if (children.isEmpty()) {
            throw ElaborationException.insufficientChildren("Projection");
        }
        return new Projection(children, in);
    }

    /**
     * Residual grouping. A leading Projection is detached and its children
     * become the projection branch; the remaining children are the residual
     * mapping, whose output must equal the projection's output, or the
     * block's input when there is no projection.
     */
    public static Block residual(Dims in, Map<String, Double> attributes, List<Block> children) {
        AttributeSchema.none().validate("Residual", attributes);
        if (children.isEmpty()) {
            throw ElaborationException.insufficientChildren("Residual");
        }
        List<Block> projection = List.of();
        List<Block> mapping = children;
        if (children.get(0) instanceof Projection p) {
            projection = p.children();
            mapping = children.subList(1, children.size());
        }
        if (mapping.isEmpty()) {
            throw ElaborationException.insufficientChildren("Residual");
        }
        Dims branchOut = last(mapping).outDims();
        Dims expected = projection.isEmpty() ? in : last(projection).outDims();
        if (!branchOut.equals(expected)) {
            throw ElaborationException.shapeMismatch("Residual", expected, branchOut);
        }
        return new Residual(projection, mapping);
    }

    public static Block repeat(Dims in, Map<String, Double> attributes, List<Block> children) {
        AttributeSchema.Values values = REPEAT.validate("Repeat", attributes);
        if (!children.isEmpty() && !last(children).outDims().equals(in)) {
            throw ElaborationException.shapeMismatch("Repeat", in, last(children).outDims());
        }
        return new Repeat(values.getInt("n"), children, in);
    }

    // ==================== Meta ====================

    public static Block input(Dims in, Map<String, Double> attributes, List<Block> children) {
        requireLeaf("Input", children);
        AttributeSchema.Values values = INPUT.validate("Input", attributes);
        return new Input(new Dims(values.getInt("w"), values.getInt("h"), values.getInt("d")));
    }

    public static Block assertion(Dims in, Map<String, Double> attributes, List<Block> children) {
        requireLeaf("Assert", children);
        AttributeSchema.Values values = ASSERT.validate("Assert", attributes);
        Dims expected = new Dims(values.getInt("w"), values.getInt("h"), values.getInt("d"));
        if (!expected.equals(in)) {
            throw ElaborationException.shapeMismatch("Assert", expected, in);
        }
        return new Assert(expected);
    }

    // ==================== Layers ====================

    public static Block conv(Dims in, Map<String, Double> attributes, List<Block> children) {
        requireLeaf("Conv", children);
        AttributeSchema.Values values = CONV.validate("Conv", attributes);
        int w = values.getInt("w");
        int h = values.getInt("h");
        int n = values.getInt("n");
        int sx = values.getInt("sx");
        int sy = values.getInt("sy");
        Dims out = new Dims(windowCount(in.width(), w, sx), windowCount(in.height(), h, sy), n);
        return new Conv(w, h, n, sx, sy, out);
    }

    public static BlockCreator pool(PoolKind kind) {
        return (in, attributes, children) -> {
            String name = kind.blockName();
            requireLeaf(name, children);
            AttributeSchema.Values values = POOL.validate(name, attributes);
            int w = values.getInt("w");
            int h = values.getInt("h");
            int sx = values.getInt("sx", w);
            int sy = values.getInt("sy", h);
            Dims out = new Dims(windowCount(in.width(), w, sx), windowCount(in.height(), h, sy), in.depth());
            return new Pool(kind, w, h, sx, sy, out);
        };
    }

    public static Block padding(Dims in, Map<String, Double> attributes, List<Block> children) {
        requireLeaf("Padding", children);
        AttributeSchema.Values values = PADDING.validate("Padding", attributes);
        int t = values.getInt("t");
        int r = values.getInt("r");
        int b = values.getInt("b");
        int l = values.getInt("l");
        Dims out = new Dims(paddedSize("width", in.width(), l, r), paddedSize("height", in.height(), t, b),
                in.depth());
        return new Padding(t, r, b, l, out);
    }

    public static Block resize(Dims in, Map<String, Double> attributes, List<Block> children) {
        requireLeaf("Resize", children);
        AttributeSchema.Values values = RESIZE.validate("Resize", attributes);
        if (in.hasZeroComponent()) {
            throw new ElaborationException(ErrorKind.SHAPE_MISMATCH, "Resize",
                    "cannot resize empty input " + in);
        }
        return new Resize(new Dims(values.getInt("w"), values.getInt("h"), in.depth()));
    }

    public static Block fullyConnected(Dims in, Map<String, Double> attributes, List<Block> children) {
        requireLeaf("FC", children);
        AttributeSchema.Values values = FC.validate("FC", attributes);
        return new FullyConnected(values.getInt("out"));
    }

    public static Block linear(Dims in, Map<String, Double> attributes, List<Block> children) {
        requireLeaf("Linear", children);
        AttributeSchema.Values values = LINEAR.validate("Linear", attributes);
        return new Linear(values.getReal("scale"), values.getReal("bias"), in);
    }

    /**
     * Creator for a shape-preserving block with no attributes and no children.
     */
    public static BlockCreator activation(String name) {
        return (in, attributes, children) -> {
            requireLeaf(name, children);
            AttributeSchema.none().validate(name, attributes);
            return new Activation(name, in);
        };
    }

    // ==================== Helpers ====================

    /**
     * Number of window positions along one axis, {@code 1 + (size - window) / stride}
     * with floor division, clamped at zero.
     */
    static int windowCount(int size, int window, int stride) {
        return Math.max(0, 1 + Math.floorDiv(size - window, stride));
    }

    private static int paddedSize(String axis, int size, int before, int after) {
        long padded = (long) size + before + after;
        if (padded > Integer.MAX_VALUE) {
            throw new ElaborationException(ErrorKind.SHAPE_MISMATCH, "Padding",
                    "padded " + axis + " " + padded + " exceeds " + Integer.MAX_VALUE);
        }
        return (int) padded;
    }

    private static void requireLeaf(String blockName, List<Block> children) {
        if (!children.isEmpty()) {
            throw ElaborationException.unexpectedChildren(blockName);
        }
    }

    private static Block last(List<Block> blocks) {
        return blocks.get(blocks.size() - 1);
    }
}
