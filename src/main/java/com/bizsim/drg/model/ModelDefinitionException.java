package com.bizsim.drg.model;

/**
 * Raised when a model or scenario definition is invalid.
 *
 * Definition errors are fatal: they abort construction of the registry or the
 * scenario store entirely. The {@link ErrorKind} tells callers which rule was
 * broken, and {@link #identity()} names the offending attribute, block or
 * scenario.
 */
public class ModelDefinitionException extends IllegalArgumentException {

    /** The rule a definition violated. */
    public enum ErrorKind {
        DUPLICATE_BLOCK,
        UNKNOWN_BLOCK,
        DUPLICATE_ATTRIBUTE,
        UNKNOWN_ATTRIBUTE,
        UNKNOWN_DEPENDENCY,
        MISSING_FORMULA,
        UNEXPECTED_FORMULA,
        UNKNOWN_FORMULA,
        MISSING_DEPENDENCIES,
        UNEXPECTED_DEPENDENCIES,
        INVALID_NAME,
        INVALID_VALUE,
        INVALID_OVERRIDE,
        DUPLICATE_SCENARIO,
        UNKNOWN_SCENARIO
    }

    private final ErrorKind kind;
    private final String identity;

    public ModelDefinitionException(ErrorKind kind, String identity, String message) {
        super(kind + " [" + identity + "]: " + message);
        this.kind = kind;
        this.identity = identity;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String identity() {
        return identity;
    }
}
