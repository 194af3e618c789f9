package io.surfworks.convmarkup.realize;

import io.surfworks.convmarkup.block.Blocks.Assert;
import io.surfworks.convmarkup.block.Blocks.Block;
import io.surfworks.convmarkup.block.Blocks.Input;
import io.surfworks.convmarkup.block.Dims;

import java.util.Optional;

/**
 * Realizer for the meta-blocks Input and Assert, which have no runtime effect.
 * Declines every other block.
 *
 * @param <T> type of the external representation
 */
public final class MetaRealizer<T> implements Realizer<T> {

    @Override
    public Optional<Realization<T>> realize(RealizerChain<T> chain, Dims in, Block block) {
        if (block instanceof Input || block instanceof Assert) {
            return Optional.of(Realization.none());
        }
        return Optional.empty();
    }
}
