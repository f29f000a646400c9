package com.simario.exception;

import com.simario.model.enums.ErrorKind;
import lombok.Getter;

/**
 * No variable name could be derived from a result: it had no metadata name
 * and its structure offered none either.
 */
@Getter
public class VarnameResolutionException extends DictionaryException {

    /**
     * Name of the call argument that held the result.
     */
    private final String argument;

    /**
     * Shape of the result that was inspected.
     */
    private final String shape;

    public VarnameResolutionException(String argument, String shape) {
        super(ErrorKind.VARNAME_RESOLUTION,
            "cannot determine varname from " + argument + ": no meta or names (" + shape + ")");
        this.argument = argument;
        this.shape = shape;
    }

    @Override
    public String getVarname() {
        return null;
    }

    @Override
    public String getValue() {
        return argument;
    }
}
