package io.surfworks.convmarkup.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import io.surfworks.convmarkup.block.Blocks.Activation;
import io.surfworks.convmarkup.block.Blocks.Assert;
import io.surfworks.convmarkup.block.Blocks.Block;
import io.surfworks.convmarkup.block.Blocks.Conv;
import io.surfworks.convmarkup.block.Blocks.ExtensionBlock;
import io.surfworks.convmarkup.block.Blocks.FullyConnected;
import io.surfworks.convmarkup.block.Blocks.Input;
import io.surfworks.convmarkup.block.Blocks.Linear;
import io.surfworks.convmarkup.block.Blocks.Padding;
import io.surfworks.convmarkup.block.Blocks.Pool;
import io.surfworks.convmarkup.block.Blocks.Projection;
import io.surfworks.convmarkup.block.Blocks.Repeat;
import io.surfworks.convmarkup.block.Blocks.Residual;
import io.surfworks.convmarkup.block.Blocks.Resize;
import io.surfworks.convmarkup.block.Blocks.Sequence;
import io.surfworks.convmarkup.block.Blocks.Visitor;
import io.surfworks.convmarkup.block.Dims;
import io.surfworks.convmarkup.realize.Realization;
import io.surfworks.convmarkup.realize.Realizer;
import io.surfworks.convmarkup.realize.RealizerChain;

import java.util.List;
import java.util.Optional;

/**
 * Lowers built-in blocks into a JSON description of the network topology.
 *
 * <p>Each block becomes an object with its type, input and output
 * dimensions and its parameters. Composite blocks realize their children
 * through the chain, so blocks this realizer does not know (extension blocks)
 * can be handled by another realizer placed in the same chain.
 */
public final class TopologyJsonRealizer implements Realizer<JsonElement> {

    static final String ROOT_TYPE = "Network";

    @Override
    public Optional<Realization<JsonElement>> realize(RealizerChain<JsonElement> chain, Dims in, Block block) {
        JsonObject json = block.accept(new Lowering(chain, in));
        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(Realization.of(json));
    }

    /**
     * Encodes dimensions as a {@code [width, height, depth]} array.
     */
    static JsonArray dims(Dims dims) {
        JsonArray array = new JsonArray();
        array.add(dims.width());
        array.add(dims.height());
        array.add(dims.depth());
        return array;
    }

    private static final class Lowering implements Visitor<JsonObject> {

        private final RealizerChain<JsonElement> chain;
        private final Dims in;

        Lowering(RealizerChain<JsonElement> chain, Dims in) {
            this.chain = chain;
            this.in = in;
        }

        @Override
        public JsonObject visitSequence(Sequence block) {
            JsonObject json = header(ROOT_TYPE, block);
            json.add("blocks", sequence(in, block.children()));
            return json;
        }

        @Override
        public JsonObject visitInput(Input block) {
            return header("Input", block);
        }

        @Override
        public JsonObject visitAssert(Assert block) {
            return header("Assert", block);
        }

        @Override
        public JsonObject visitConv(Conv block) {
            JsonObject json = header("Conv", block);
            json.addProperty("filterWidth", block.filterWidth());
            json.addProperty("filterHeight", block.filterHeight());
            json.addProperty("filterCount", block.filterCount());
            json.addProperty("strideX", block.strideX());
            json.addProperty("strideY", block.strideY());
            return json;
        }

        @Override
        public JsonObject visitPool(Pool block) {
            JsonObject json = header(block.type(), block);
            json.addProperty("width", block.width());
            json.addProperty("height", block.height());
            json.addProperty("strideX", block.strideX());
            json.addProperty("strideY", block.strideY());
            return json;
        }

        @Override
        public JsonObject visitPadding(Padding block) {
            JsonObject json = header("Padding", block);
            json.addProperty("top", block.top());
            json.addProperty("right", block.right());
            json.addProperty("bottom", block.bottom());
            json.addProperty("left", block.left());
            return json;
        }

        @Override
        public JsonObject visitResize(Resize block) {
            return header("Resize", block);
        }

        @Override
        public JsonObject visitFullyConnected(FullyConnected block) {
            JsonObject json = header("FC", block);
            json.addProperty("outCount", block.outCount());
            return json;
        }

        @Override
        public JsonObject visitLinear(Linear block) {
            JsonObject json = header("Linear", block);
            json.addProperty("scale", block.scale());
            json.addProperty("bias", block.bias());
            return json;
        }

        @Override
        public JsonObject visitActivation(Activation block) {
            return header(block.name(), block);
        }

        @Override
        public JsonObject visitProjection(Projection block) {
            JsonObject json = header("Projection", block);
            json.add("blocks", sequence(in, block.children()));
            return json;
        }

        @Override
        public JsonObject visitResidual(Residual block) {
            JsonObject json = header("Residual", block);
            if (block.hasProjection()) {
                json.add("projection", sequence(in, block.projection()));
            }
            json.add("residual", sequence(in, block.residual()));
            return json;
        }

        @Override
        public JsonObject visitRepeat(Repeat block) {
            JsonObject json = header("Repeat", block);
            json.addProperty("count", block.count());
            json.add("blocks", sequence(in, block.children()));
            return json;
        }

        @Override
        public JsonObject visitExtension(ExtensionBlock block) {
            return null;
        }

        private JsonObject header(String type, Block block) {
            JsonObject json = new JsonObject();
            json.addProperty("type", type);
            json.add("in", dims(in));
            json.add("out", dims(block.outDims()));
            return json;
        }

        private JsonArray sequence(Dims start, List<Block> blocks) {
            JsonArray array = new JsonArray();
            for (JsonElement element : chain.realizeSequence(start, blocks)) {
                array.add(element);
            }
            return array;
        }
    }
}
