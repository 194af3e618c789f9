package io.surfworks.convmarkup.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import io.surfworks.convmarkup.ConvMarkup;
import io.surfworks.convmarkup.block.Blocks.Block;
import io.surfworks.convmarkup.block.Blocks.ExtensionBlock;
import io.surfworks.convmarkup.block.CreatorRegistry;
import io.surfworks.convmarkup.block.Dims;
import io.surfworks.convmarkup.realize.Realization;
import io.surfworks.convmarkup.realize.RealizerChain;
import io.surfworks.convmarkup.realize.UnsupportedBlockException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TopologyJsonTest {

    private static final String NETWORK = """
            Input(w=32, h=32, d=3)
            Conv(w=3, h=3, n=16, sx=2)
            Assert(w=15, h=30, d=16)
            Residual {
                Projection {
                    Conv(w=1, h=1, n=8)
                }
                Conv(w=1, h=1, n=8)
                ReLU
            }
            Repeat(n=3) {
                Linear(scale=0.5, bias=-1)
            }
            MaxPool(w=3, h=3, sx=2, sy=2)
            FC(out=10)
            """;

    private static JsonObject lower(String markup) {
        return TopologyJson.toJsonTree(ConvMarkup.compile(markup)).getAsJsonObject();
    }

    private static JsonArray dims(int w, int h, int d) {
        return TopologyJsonRealizer.dims(Dims.of(w, h, d));
    }

    @Nested
    @DisplayName("Built-in blocks")
    class BuiltInTests {

        private final JsonObject root = lower(NETWORK);
        private final JsonArray blocks = root.getAsJsonArray("blocks");

        @Test
        void rootDescribesWholeNetwork() {
            assertEquals("Network", root.get("type").getAsString());
            assertEquals(dims(0, 0, 0), root.get("in"));
            assertEquals(dims(1, 1, 10), root.get("out"));
        }

        @Test
        void metaBlocksAreOmitted() {
            assertEquals(5, blocks.size());
            for (JsonElement block : blocks) {
                String type = block.getAsJsonObject().get("type").getAsString();
                assertFalse(type.equals("Input") || type.equals("Assert"), type);
            }
        }

        @Test
        void convCarriesFilterAndStrides() {
            JsonObject conv = blocks.get(0).getAsJsonObject();
            assertEquals("Conv", conv.get("type").getAsString());
            assertEquals(dims(32, 32, 3), conv.get("in"));
            assertEquals(dims(15, 30, 16), conv.get("out"));
            assertEquals(3, conv.get("filterWidth").getAsInt());
            assertEquals(3, conv.get("filterHeight").getAsInt());
            assertEquals(16, conv.get("filterCount").getAsInt());
            assertEquals(2, conv.get("strideX").getAsInt());
            assertEquals(1, conv.get("strideY").getAsInt());
        }

        @Test
        void residualKeepsBothBranches() {
            JsonObject residual = blocks.get(1).getAsJsonObject();
            assertEquals("Residual", residual.get("type").getAsString());

            JsonArray projection = residual.getAsJsonArray("projection");
            assertEquals(1, projection.size());
            assertEquals(dims(15, 30, 16), projection.get(0).getAsJsonObject().get("in"));

            JsonArray branch = residual.getAsJsonArray("residual");
            assertEquals(2, branch.size());
            assertEquals("ReLU", branch.get(1).getAsJsonObject().get("type").getAsString());
            assertEquals(dims(15, 30, 8), residual.get("out"));
        }

        @Test
        void residualWithoutProjectionHasNoProjectionKey() {
            JsonObject net = lower("Input(w=4, h=4, d=2)\nResidual {\n  ReLU\n}");
            JsonObject residual = net.getAsJsonArray("blocks").get(0).getAsJsonObject();
            assertFalse(residual.has("projection"));
            assertTrue(residual.has("residual"));
        }

        @Test
        void repeatCarriesCountAndBody() {
            JsonObject repeat = blocks.get(2).getAsJsonObject();
            assertEquals(3, repeat.get("count").getAsInt());
            JsonObject linear = repeat.getAsJsonArray("blocks").get(0).getAsJsonObject();
            assertEquals(0.5, linear.get("scale").getAsDouble());
            assertEquals(-1.0, linear.get("bias").getAsDouble());
        }

        @Test
        void poolAndFullyConnected() {
            JsonObject pool = blocks.get(3).getAsJsonObject();
            assertEquals("MaxPool", pool.get("type").getAsString());
            assertEquals(dims(7, 14, 8), pool.get("out"));
            assertEquals(2, pool.get("strideY").getAsInt());

            JsonObject fc = blocks.get(4).getAsJsonObject();
            assertEquals("FC", fc.get("type").getAsString());
            assertEquals(10, fc.get("outCount").getAsInt());
        }
    }

    @Nested
    @DisplayName("Extension blocks")
    class ExtensionTests {

        record Dropout(Dims outDims) implements ExtensionBlock {
            @Override
            public String type() {
                return "Dropout";
            }
        }

        private final CreatorRegistry registry = CreatorRegistry.defaults()
                .with("Dropout", (in, attrs, children) -> new Dropout(in));

        private final Block net = ConvMarkup.compile("Input(w=4, h=4, d=1)\nDropout\nFC(out=2)", registry);

        @Test
        void defaultChainDoesNotSupportThem() {
            UnsupportedBlockException e = assertThrows(UnsupportedBlockException.class,
                    () -> TopologyJson.toJsonTree(net));
            assertEquals("Dropout", e.getBlock().type());
        }

        @Test
        void extraRealizerHandlesThem() {
            RealizerChain<JsonElement> chain = TopologyJson.defaultChain().then((c, in, block) -> {
                if (!(block instanceof Dropout)) {
                    return Optional.empty();
                }
                JsonObject json = new JsonObject();
                json.addProperty("type", "Dropout");
                return Optional.of(Realization.of(json));
            });

            JsonArray blocks = TopologyJson.toJsonTree(net, chain).getAsJsonObject().getAsJsonArray("blocks");

            assertEquals(2, blocks.size());
            assertEquals("Dropout", blocks.get(0).getAsJsonObject().get("type").getAsString());
            assertEquals("FC", blocks.get(1).getAsJsonObject().get("type").getAsString());
        }
    }

    @Test
    void describeProducesPrettyJson() {
        String json = TopologyJson.describe(ConvMarkup.compile("Input(w=2, h=2, d=1)\nSigmoid"));

        assertTrue(json.contains("\n  \"type\": \"Network\""), json);
        JsonObject parsed = JsonParser.parseString(json).getAsJsonObject();
        assertEquals("Sigmoid", parsed.getAsJsonArray("blocks").get(0).getAsJsonObject().get("type").getAsString());
    }
}
