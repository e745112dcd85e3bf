package com.bizsim.drg.api;

/**
 * Kind of an attribute in the model.
 *
 * INPUT attributes carry a default value and are supplied externally (or by a
 * scenario override). CALCULATED attributes carry exactly one formula and an
 * explicit dependency declaration.
 */
public enum AttributeKind {
    INPUT,
    CALCULATED;

    /** Case-insensitive lookup used by the JSON loader. */
    public static AttributeKind fromString(String kind) {
        if (kind == null)
            throw new IllegalArgumentException("Attribute kind is required");
        return valueOf(kind.trim().toUpperCase());
    }
}
