package com.simario.exception;

import com.simario.model.enums.ErrorKind;
import lombok.Getter;

/**
 * Base class for failures raised while annotating results with the dictionary.
 * Subclasses carry the offending variable name or raw value as typed fields.
 */
@Getter
public abstract class DictionaryException extends RuntimeException {

    private final ErrorKind kind;

    protected DictionaryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected DictionaryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Variable the failure concerns, if known.
     */
    public abstract String getVarname();

    /**
     * Raw input that could not be handled, if any.
     */
    public String getValue() {
        return null;
    }
}
