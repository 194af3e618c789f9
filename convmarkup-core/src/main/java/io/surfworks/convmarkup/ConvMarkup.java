package io.surfworks.convmarkup;

import io.surfworks.convmarkup.block.Blocks.Block;
import io.surfworks.convmarkup.block.CreatorRegistry;
import io.surfworks.convmarkup.block.Dims;
import io.surfworks.convmarkup.block.Elaborator;
import io.surfworks.convmarkup.markup.MarkupParser;

/**
 * Entry point that parses markup text and elaborates it into a block tree.
 *
 * <pre>{@code
 * Block net = ConvMarkup.compile("""
 *     Input(w=224, h=224, d=3)
 *     Conv(w=3, h=3, n=64)
 *     ReLU
 *     """);
 * Dims out = net.outDims();   // (222,222,64)
 * }</pre>
 */
public final class ConvMarkup {

    private ConvMarkup() {}

    /**
     * Parses and elaborates markup with the built-in block types.
     *
     * @throws io.surfworks.convmarkup.markup.MarkupParseException if the text is malformed
     * @throws io.surfworks.convmarkup.block.ElaborationException  if a block is invalid
     */
    public static Block compile(String text) {
        return compile(text, CreatorRegistry.defaults());
    }

    public static Block compile(String text, CreatorRegistry registry) {
        return new Elaborator(registry).elaborate(MarkupParser.parse(text), Dims.ZERO);
    }
}
