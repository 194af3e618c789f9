package io.surfworks.convmarkup.realize;

import io.surfworks.convmarkup.block.Blocks.Block;

/**
 * Thrown when every realizer in a chain declines a block.
 */
public class UnsupportedBlockException extends RealizationException {

    private final transient Block block;

    public UnsupportedBlockException(Block block) {
        super("unsupported block: " + describe(block) + " (" + block.getClass().getName() + ")");
        this.block = block;
    }

    public Block getBlock() {
        return block;
    }

    private static String describe(Block block) {
        return block.type().isEmpty() ? "root" : block.type();
    }
}
