package com.simario.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of dictionary failure reported to callers.
 */
public enum ErrorKind {
    VARNAME_RESOLUTION("varname-resolution"),
    UNKNOWN_VARIABLE("unknown-variable"),
    MALFORMED_FLATTENED_CODE("malformed-flattened-code"),
    CODINGS_EXPRESSION("codings-expression");

    private final String value;

    ErrorKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
