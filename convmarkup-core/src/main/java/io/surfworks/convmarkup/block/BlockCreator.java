package io.surfworks.convmarkup.block;

import io.surfworks.convmarkup.block.Blocks.Block;

import java.util.List;
import java.util.Map;

/**
 * Creates a typed block from its input dimensions, raw attributes and
 * already-elaborated children.
 *
 * <p>Implementations validate their arguments and throw
 * {@link ElaborationException} when they are unacceptable. They must not
 * depend on anything but their arguments.
 */
@FunctionalInterface
public interface BlockCreator {

    Block create(Dims in, Map<String, Double> attributes, List<Block> children);
}
