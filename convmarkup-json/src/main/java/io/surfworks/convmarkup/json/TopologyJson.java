package io.surfworks.convmarkup.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;

import io.surfworks.convmarkup.block.Blocks.Block;
import io.surfworks.convmarkup.block.Dims;
import io.surfworks.convmarkup.realize.MetaRealizer;
import io.surfworks.convmarkup.realize.RealizerChain;

/**
 * Renders elaborated block trees as JSON.
 *
 * <p>The default chain drops Input and Assert blocks, which have no runtime
 * effect, and describes every other built-in block:
 * <pre>{@code
 * String json = TopologyJson.describe(ConvMarkup.compile(markup));
 * }</pre>
 */
public final class TopologyJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private static final RealizerChain<JsonElement> DEFAULT_CHAIN =
            RealizerChain.of(new MetaRealizer<>(), new TopologyJsonRealizer());

    private TopologyJson() {}

    public static RealizerChain<JsonElement> defaultChain() {
        return DEFAULT_CHAIN;
    }

    /**
     * Lowers a block tree with the default chain.
     */
    public static JsonElement toJsonTree(Block root) {
        return toJsonTree(root, DEFAULT_CHAIN);
    }

    public static JsonElement toJsonTree(Block root, RealizerChain<JsonElement> chain) {
        return chain.realize(Dims.ZERO, root).value().orElse(JsonNull.INSTANCE);
    }

    /**
     * Returns pretty-printed JSON for a block tree.
     */
    public static String describe(Block root) {
        return GSON.toJson(toJsonTree(root));
    }
}
