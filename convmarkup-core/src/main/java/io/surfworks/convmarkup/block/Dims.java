package io.surfworks.convmarkup.block;

/**
 * Dimensions of a 3D tensor flowing between blocks.
 *
 * @param width  spatial width
 * @param height spatial height
 * @param depth  channel count
 */
public record Dims(int width, int height, int depth) {

    public static final Dims ZERO = new Dims(0, 0, 0);

    public Dims {
        if (width < 0 || height < 0 || depth < 0) {
            throw new IllegalArgumentException(
                    String.format("Dimensions must be non-negative: (%d,%d,%d)", width, height, depth));
        }
    }

    public static Dims of(int width, int height, int depth) {
        return new Dims(width, height, depth);
    }

    public boolean hasZeroComponent() {
        return width == 0 || height == 0 || depth == 0;
    }

    @Override
    public String toString() {
        return "(" + width + "," + height + "," + depth + ")";
    }
}
