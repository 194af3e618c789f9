package io.surfworks.convmarkup.markup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the network markup text format.
 *
 * The format is line based. After whitespace is stripped, a line is either
 * empty, a comment (starting with #), a closing brace, or a block declaration:
 * <pre>
 *   Input(w=224, h=224, d=3)
 *   ReLU
 *   Residual {
 *       Padding(l=1, r=1, t=1, b=1)
 *       Conv(w=3, h=3, n=64)
 *   }
 * </pre>
 *
 * Bodies are parsed recursively over the same line array, so every node keeps
 * the line number it has in the original text.
 */
public final class MarkupParser {

    private static final Pattern DECLARATION = Pattern.compile("^([A-Za-z]*)(\\(([^)]*)\\))?( \\{)?$");
    private static final Pattern ATTRIBUTE = Pattern.compile("^ *([A-Za-z]*)=([\\-0-9.]*) *$");

    private final String[] lines;

    private MarkupParser(String[] lines) {
        this.lines = lines;
    }

    /**
     * Parses markup text into a root node whose children are the top-level blocks.
     *
     * @throws MarkupParseException at the first malformed line
     */
    public static AstNode parse(String text) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String stripped = lines[i].strip();
            lines[i] = stripped.startsWith("#") ? "" : stripped;
        }
        MarkupParser parser = new MarkupParser(lines);
        return AstNode.root(parser.parseLines(0, lines.length));
    }

    // ==================== Blocks ====================

    private List<AstNode> parseLines(int start, int end) {
        List<AstNode> nodes = new ArrayList<>();
        for (int i = start; i < end; i++) {
            String line = lines[i];
            if (line.isEmpty()) {
                continue;
            }
            Matcher m = DECLARATION.matcher(line);
            if (!m.matches()) {
                throw new MarkupParseException("invalid block declaration", i);
            }
            String name = m.group(1);
            Map<String, Double> attributes = parseAttributes(m.group(3), i);

            if (m.group(4) == null) {
                nodes.add(AstNode.leaf(i, name, attributes));
                continue;
            }
            int close = matchingClose(i, end);
            nodes.add(new AstNode(i, name, attributes, parseLines(i + 1, close)));
            i = close;
        }
        return nodes;
    }

    private int matchingClose(int open, int end) {
        int depth = 1;
        for (int i = open + 1; i < end; i++) {
            String line = lines[i];
            if (line.equals("}")) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            } else if (line.endsWith("{")) {
                depth++;
            }
        }
        throw new MarkupParseException("no matching }", open);
    }

    // ==================== Attributes ====================

    private static Map<String, Double> parseAttributes(String list, int line) {
        Map<String, Double> result = new LinkedHashMap<>();
        if (list == null || list.isEmpty()) {
            return result;
        }
        String[] pairs = list.split(",", -1);
        for (int i = 0; i < pairs.length; i++) {
            Matcher m = ATTRIBUTE.matcher(pairs[i]);
            if (!m.matches()) {
                throw new MarkupParseException("bad format for attribute " + i, line);
            }
            String name = m.group(1);
            double value;
            try {
                value = Double.parseDouble(m.group(2));
            } catch (NumberFormatException e) {
                throw new MarkupParseException("bad format for attribute " + i, line);
            }
            if (result.containsKey(name)) {
                throw new MarkupParseException("duplicate attribute: " + name, line);
            }
            result.put(name, value);
        }
        return result;
    }
}
