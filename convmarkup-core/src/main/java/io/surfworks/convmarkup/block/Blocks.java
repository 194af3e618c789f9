package io.surfworks.convmarkup.block;

import java.util.ArrayList;
import java.util.List;

/**
 * Elaborated, shape-typed blocks.
 *
 * Every block knows the type name it was declared with and the dimensions of
 * the tensor it produces. Blocks are immutable and own their children.
 */
public final class Blocks {

    private Blocks() {}

    // ==================== Base types ====================

    /**
     * Base interface for all elaborated blocks.
     */
    public sealed interface Block permits
            Sequence, Input, Assert, Conv, Pool, Padding, Resize, FullyConnected,
            Linear, Activation, Projection, Residual, Repeat, ExtensionBlock {

        /**
         * Returns the block name used in markup, or "" for the root sequence.
         */
        String type();

        Dims outDims();

        /**
         * Child blocks owned by this block, in evaluation order.
         */
        default List<Block> children() {
            return List.of();
        }

        <R> R accept(Visitor<R> visitor);
    }

    /**
     * Block types contributed through a custom {@link CreatorRegistry}.
     */
    public non-sealed interface ExtensionBlock extends Block {
        @Override
        default <R> R accept(Visitor<R> visitor) {
            return visitor.visitExtension(this);
        }
    }

    /**
     * Exhaustive dispatch over the block variants.
     */
    public interface Visitor<R> {
        R visitSequence(Sequence block);
        R visitInput(Input block);
        R visitAssert(Assert block);
        R visitConv(Conv block);
        R visitPool(Pool block);
        R visitPadding(Padding block);
        R visitResize(Resize block);
        R visitFullyConnected(FullyConnected block);
        R visitLinear(Linear block);
        R visitActivation(Activation block);
        R visitProjection(Projection block);
        R visitResidual(Residual block);
        R visitRepeat(Repeat block);
        R visitExtension(ExtensionBlock block);
    }

    // ==================== Structural blocks ====================

    /**
     * The root block: evaluates its children in order.
     */
    public record Sequence(List<Block> children, Dims outDims) implements Block {
        public Sequence {
            children = List.copyOf(children);
        }

        @Override
        public String type() { return ""; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSequence(this); }
    }

    /**
     * Meta-block for a {@link Residual}: an alternate branch whose output the
     * residual mapping must match. Its own output is the input it received,
     * so the residual mapping that follows it sees the unprojected input.
     */
    public record Projection(List<Block> children, Dims inDims) implements Block {
        public Projection {
            children = List.copyOf(children);
        }

        @Override
        public String type() { return "Projection"; }

        @Override
        public Dims outDims() { return inDims; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitProjection(this); }
    }

    /**
     * A residual grouping.
     *
     * @param projection children of the leading Projection, empty if there was none
     * @param residual   the residual mapping
     */
    public record Residual(List<Block> projection, List<Block> residual) implements Block {
        public Residual {
            projection = List.copyOf(projection);
            residual = List.copyOf(residual);
            if (residual.isEmpty()) {
                throw new IllegalArgumentException("Residual mapping must not be empty");
            }
        }

        public boolean hasProjection() {
            return !projection.isEmpty();
        }

        @Override
        public String type() { return "Residual"; }

        @Override
        public Dims outDims() { return residual.get(residual.size() - 1).outDims(); }

        @Override
        public List<Block> children() {
            List<Block> all = new ArrayList<>(projection);
            all.addAll(residual);
            return List.copyOf(all);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitResidual(this); }
    }

    /**
     * Repeats its body {@code count} times. The body preserves shape, so the
     * output equals the input.
     */
    public record Repeat(int count, List<Block> children, Dims inDims) implements Block {
        public Repeat {
            children = List.copyOf(children);
        }

        @Override
        public String type() { return "Repeat"; }

        @Override
        public Dims outDims() { return inDims; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitRepeat(this); }
    }

    // ==================== Meta blocks ====================

    /**
     * Declares the input tensor dimensions.
     */
    public record Input(Dims outDims) implements Block {
        @Override
        public String type() { return "Input"; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitInput(this); }
    }

    /**
     * Checks that its input has exactly the expected dimensions.
     */
    public record Assert(Dims expected) implements Block {
        @Override
        public String type() { return "Assert"; }

        @Override
        public Dims outDims() { return expected; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitAssert(this); }
    }

    // ==================== Layers ====================

    public record Conv(
            int filterWidth,
            int filterHeight,
            int filterCount,
            int strideX,
            int strideY,
            Dims outDims
    ) implements Block {
        @Override
        public String type() { return "Conv"; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitConv(this); }
    }

    public enum PoolKind {
        MAX("MaxPool"),
        MEAN("MeanPool");

        private final String blockName;

        PoolKind(String blockName) {
            this.blockName = blockName;
        }

        public String blockName() {
            return blockName;
        }
    }

    /**
     * Max or mean pooling. Partial windows at the edges are dropped.
     */
    public record Pool(
            PoolKind kind,
            int width,
            int height,
            int strideX,
            int strideY,
            Dims outDims
    ) implements Block {
        @Override
        public String type() { return kind.blockName(); }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitPool(this); }
    }

    public record Padding(int top, int right, int bottom, int left, Dims outDims) implements Block {
        @Override
        public String type() { return "Padding"; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitPadding(this); }
    }

    /**
     * Interpolating resize of the spatial dimensions.
     */
    public record Resize(Dims outDims) implements Block {
        @Override
        public String type() { return "Resize"; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitResize(this); }
    }

    /**
     * Fully-connected layer. Spatial dimensions collapse to 1x1.
     */
    public record FullyConnected(int outCount) implements Block {
        @Override
        public String type() { return "FC"; }

        @Override
        public Dims outDims() { return new Dims(1, 1, outCount); }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitFullyConnected(this); }
    }

    /**
     * Computes {@code scale * x + bias} for every component.
     */
    public record Linear(double scale, double bias, Dims outDims) implements Block {
        @Override
        public String type() { return "Linear"; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitLinear(this); }
    }

    /**
     * Shape-preserving block without attributes: BatchNorm, ReLU, Sigmoid, Tanh, Softmax.
     */
    public record Activation(String name, Dims outDims) implements Block {
        @Override
        public String type() { return name; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitActivation(this); }
    }

    // ==================== Utilities ====================

    /**
     * Counts a block and all blocks it owns.
     */
    public static int count(Block block) {
        int total = 1;
        for (Block child : block.children()) {
            total += count(child);
        }
        return total;
    }
}
