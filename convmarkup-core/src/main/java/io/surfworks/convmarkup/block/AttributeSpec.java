package io.surfworks.convmarkup.block;

/**
 * Declaration of one attribute a block accepts.
 *
 * @param name         attribute name as written in markup
 * @param kind         whether the value must be integral
 * @param required     whether the attribute must be present
 * @param minimum      smallest accepted value for integer attributes
 * @param defaultValue value used when an optional attribute is absent (NaN if none)
 */
public record AttributeSpec(String name, Kind kind, boolean required, int minimum, double defaultValue) {

    public enum Kind {
        INTEGER,
        REAL
    }

    public static AttributeSpec requiredInt(String name, int minimum) {
        return new AttributeSpec(name, Kind.INTEGER, true, minimum, Double.NaN);
    }

    public static AttributeSpec optionalInt(String name, int minimum, int defaultValue) {
        return new AttributeSpec(name, Kind.INTEGER, false, minimum, defaultValue);
    }

    /**
     * Optional integer whose default is decided by the creator.
     */
    public static AttributeSpec optionalInt(String name, int minimum) {
        return new AttributeSpec(name, Kind.INTEGER, false, minimum, Double.NaN);
    }

    public static AttributeSpec optionalReal(String name, double defaultValue) {
        return new AttributeSpec(name, Kind.REAL, false, Integer.MIN_VALUE, defaultValue);
    }

    public boolean hasDefault() {
        return !Double.isNaN(defaultValue);
    }
}
