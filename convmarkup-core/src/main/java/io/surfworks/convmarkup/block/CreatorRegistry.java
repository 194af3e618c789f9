package io.surfworks.convmarkup.block;

import io.surfworks.convmarkup.block.Blocks.PoolKind;
import io.surfworks.convmarkup.block.ElaborationException.ErrorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mapping from block names to the creators that elaborate them.
 *
 * <p>The empty name is reserved for the root sequencing block. Custom
 * registries start from {@link #defaults()} and add or override entries:
 * <pre>{@code
 * CreatorRegistry registry = CreatorRegistry.builder()
 *     .putAll(CreatorRegistry.defaults())
 *     .put("Dropout", new DropoutCreator())
 *     .build();
 * }</pre>
 */
public final class CreatorRegistry {

    /** Name under which the root sequencing creator is registered. */
    public static final String ROOT = "";

    private static final CreatorRegistry DEFAULTS = builder()
            .put(ROOT, Creators::sequence)
            .put("Input", Creators::input)
            .put("Assert", Creators::assertion)
            .put("Conv", Creators::conv)
            .put("MaxPool", Creators.pool(PoolKind.MAX))
            .put("MeanPool", Creators.pool(PoolKind.MEAN))
            .put("Padding", Creators::padding)
            .put("Resize", Creators::resize)
            .put("FC", Creators::fullyConnected)
            .put("Linear", Creators::linear)
            .put("BatchNorm", Creators.activation("BatchNorm"))
            .put("ReLU", Creators.activation("ReLU"))
            .put("Sigmoid", Creators.activation("Sigmoid"))
            .put("Tanh", Creators.activation("Tanh"))
            .put("Softmax", Creators.activation("Softmax"))
            .put("Projection", Creators::projection)
            .put("Residual", Creators::residual)
            .put("Repeat", Creators::repeat)
            .build();

    private final Map<String, BlockCreator> creators;

    private CreatorRegistry(Map<String, BlockCreator> creators) {
        this.creators = Collections.unmodifiableMap(new LinkedHashMap<>(creators));
    }

    /**
     * Returns the registry of built-in block types.
     */
    public static CreatorRegistry defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy of this registry with one entry added or replaced.
     */
    public CreatorRegistry with(String blockName, BlockCreator creator) {
        return builder().putAll(this).put(blockName, creator).build();
    }

    /**
     * Looks up the creator for a block name.
     *
     * @throws ElaborationException if nothing is registered under the name
     */
    public BlockCreator lookup(String blockName) {
        BlockCreator creator = creators.get(blockName);
        if (creator == null) {
            throw new ElaborationException(ErrorKind.UNKNOWN_BLOCK, blockName,
                    "unknown block type: " + blockName);
        }
        return creator;
    }

    public boolean contains(String blockName) {
        return creators.containsKey(blockName);
    }

    /**
     * Builder for {@link CreatorRegistry}.
     */
    public static final class Builder {

        private final Map<String, BlockCreator> creators = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String blockName, BlockCreator creator) {
            creators.put(Objects.requireNonNull(blockName, "blockName"),
                    Objects.requireNonNull(creator, "creator"));
            return this;
        }

        public Builder putAll(CreatorRegistry registry) {
            creators.putAll(registry.creators);
            return this;
        }

        public Builder remove(String blockName) {
            creators.remove(blockName);
            return this;
        }

        public CreatorRegistry build() {
            return new CreatorRegistry(creators);
        }
    }
}
