package io.surfworks.convmarkup.realize;

import io.surfworks.convmarkup.block.Blocks.Block;
import io.surfworks.convmarkup.block.Dims;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Realizes blocks by trying one {@link Realizer} at a time, in order, until
 * one accepts.
 *
 * <p>Example usage:
 * <pre>{@code
 * RealizerChain<Layer> chain = RealizerChain.of(new MetaRealizer<>(), new CpuLayerRealizer());
 * Realization<Layer> net = chain.realize(Dims.ZERO, ConvMarkup.compile(text));
 * }</pre>
 *
 * @param <T> type of the external representation
 */
public final class RealizerChain<T> {

    private static final Logger LOG = Logger.getLogger(RealizerChain.class.getName());

    private final List<Realizer<T>> realizers;

    public RealizerChain(List<? extends Realizer<T>> realizers) {
        this.realizers = List.copyOf(realizers);
    }

    @SafeVarargs
    public static <T> RealizerChain<T> of(Realizer<T>... realizers) {
        return new RealizerChain<>(List.of(realizers));
    }

    public List<Realizer<T>> realizers() {
        return realizers;
    }

    /**
     * Returns a chain that tries {@code realizer} after the realizers of this chain.
     */
    public RealizerChain<T> then(Realizer<T> realizer) {
        List<Realizer<T>> extended = new ArrayList<>(realizers);
        extended.add(Objects.requireNonNull(realizer, "realizer"));
        return new RealizerChain<>(extended);
    }

    /**
     * Realizes a block with the first realizer that does not decline it.
     *
     * @param in    dimensions flowing into the block
     * @param block the block to realize
     * @throws UnsupportedBlockException if every realizer declines
     * @throws RealizationException      if the accepting realizer fails
     */
    public Realization<T> realize(Dims in, Block block) {
        for (Realizer<T> realizer : realizers) {
            Optional<Realization<T>> result = realizer.realize(this, in, block);
            if (result.isPresent()) {
                return result.get();
            }
            if (LOG.isLoggable(Level.FINEST)) {
                LOG.finest(realizer.getClass().getSimpleName() + " declined " + describe(block));
            }
        }
        LOG.fine("No realizer supports " + describe(block));
        throw new UnsupportedBlockException(block);
    }

    /**
     * Realizes sibling blocks in order, feeding each block the output
     * dimensions of the one before it. Blocks realized without a value are
     * left out of the result.
     */
    public List<T> realizeSequence(Dims in, List<Block> blocks) {
        List<T> values = new ArrayList<>();
        Dims next = in;
        for (Block block : blocks) {
            realize(next, block).value().ifPresent(values::add);
            next = block.outDims();
        }
        return values;
    }

    private static String describe(Block block) {
        return block.type().isEmpty() ? "root block" : block.type() + " block";
    }
}
