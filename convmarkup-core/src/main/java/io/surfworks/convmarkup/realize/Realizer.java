package io.surfworks.convmarkup.realize;

import io.surfworks.convmarkup.block.Blocks.Block;
import io.surfworks.convmarkup.block.Dims;

import java.util.Optional;

/**
 * Lowers elaborated blocks into some external representation, typically only
 * blocks of a certain variety.
 *
 * <p>A Realizer receives the chain it is part of so it can realize child
 * blocks through the whole chain rather than only through itself:
 * <pre>{@code
 * public Optional<Realization<Layer>> realize(RealizerChain<Layer> chain, Dims in, Block block) {
 *     if (!(block instanceof Residual residual)) {
 *         return Optional.empty();
 *     }
 *     List<Layer> mapping = chain.realizeSequence(in, residual.residual());
 *     return Optional.of(Realization.of(new ResidualLayer(mapping)));
 * }
 * }</pre>
 *
 * @param <T> type of the external representation
 */
@FunctionalInterface
public interface Realizer<T> {

    /**
     * Attempts to realize a block.
     *
     * @param chain the chain to use for child blocks
     * @param in    dimensions flowing into the block
     * @param block the block to realize
     * @return empty to decline the block, which must have no side effects;
     *         {@link Realization#none()} for a handled block without a value
     * @throws RealizationException if the block is supported but cannot be realized
     */
    Optional<Realization<T>> realize(RealizerChain<T> chain, Dims in, Block block);
}
