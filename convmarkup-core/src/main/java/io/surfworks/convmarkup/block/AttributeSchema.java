package io.surfworks.convmarkup.block;

import io.surfworks.convmarkup.block.ElaborationException.ErrorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The set of attributes a block type accepts.
 *
 * Validation runs in a fixed order so that the reported error does not depend
 * on which problems happen to coexist:
 * <ol>
 *   <li>every attribute present must be declared</li>
 *   <li>every required attribute must be present</li>
 *   <li>integer attributes must be whole numbers no smaller than their minimum</li>
 * </ol>
 */
public final class AttributeSchema {

    private static final AttributeSchema NONE = new AttributeSchema(Map.of());

    private final Map<String, AttributeSpec> specs;

    private AttributeSchema(Map<String, AttributeSpec> specs) {
        this.specs = specs;
    }

    /**
     * Schema for blocks that take no attributes.
     */
    public static AttributeSchema none() {
        return NONE;
    }

    public static AttributeSchema of(AttributeSpec... specs) {
        Map<String, AttributeSpec> map = new LinkedHashMap<>();
        for (AttributeSpec spec : specs) {
            if (map.put(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate attribute spec: " + spec.name());
            }
        }
        return new AttributeSchema(Collections.unmodifiableMap(map));
    }

    /**
     * Validates raw attributes for the named block.
     *
     * @throws ElaborationException naming the first offending attribute
     */
    public Values validate(String blockName, Map<String, Double> attributes) {
        for (String name : attributes.keySet()) {
            if (!specs.containsKey(name)) {
                throw new ElaborationException(ErrorKind.UNKNOWN_ATTRIBUTE, blockName, name,
                        "unexpected attribute: " + name);
            }
        }
        for (AttributeSpec spec : specs.values()) {
            if (spec.required() && !attributes.containsKey(spec.name())) {
                throw new ElaborationException(ErrorKind.MISSING_ATTRIBUTE, blockName, spec.name(),
                        "missing attribute: " + spec.name());
            }
        }
        for (Map.Entry<String, Double> entry : attributes.entrySet()) {
            AttributeSpec spec = specs.get(entry.getKey());
            if (spec.kind() == AttributeSpec.Kind.INTEGER) {
                checkInteger(blockName, spec, entry.getValue());
            }
        }
        return new Values(blockName, attributes);
    }

    private static void checkInteger(String blockName, AttributeSpec spec, double value) {
        if (value != Math.floor(value) || Math.abs(value) > Integer.MAX_VALUE) {
            throw new ElaborationException(ErrorKind.NON_INTEGER_ATTRIBUTE, blockName, spec.name(),
                    "attribute " + spec.name() + " must be integer");
        }
        if (value < spec.minimum()) {
            throw new ElaborationException(ErrorKind.ATTRIBUTE_BELOW_MINIMUM, blockName, spec.name(),
                    "attribute " + spec.name() + " must be at least " + spec.minimum());
        }
    }

    /**
     * Attribute values that passed validation, with declared defaults applied.
     */
    public final class Values {

        private final String blockName;
        private final Map<String, Double> raw;

        private Values(String blockName, Map<String, Double> raw) {
            this.blockName = blockName;
            this.raw = raw;
        }

        public boolean has(String name) {
            return raw.containsKey(name);
        }

        public int getInt(String name) {
            return (int) getReal(name);
        }

        /**
         * Returns the attribute, or {@code fallback} when it is absent and
         * declares no default.
         */
        public int getInt(String name, int fallback) {
            if (!raw.containsKey(name) && !spec(name).hasDefault()) {
                return fallback;
            }
            return getInt(name);
        }

        public double getReal(String name) {
            Double value = raw.get(name);
            if (value != null) {
                return value;
            }
            AttributeSpec spec = spec(name);
            if (!spec.hasDefault()) {
                throw new IllegalStateException(blockName + " has no value or default for " + name);
            }
            return spec.defaultValue();
        }

        private AttributeSpec spec(String name) {
            AttributeSpec spec = specs.get(name);
            if (spec == null) {
                throw new IllegalArgumentException(blockName + " does not declare attribute " + name);
            }
            return spec;
        }
    }
}
