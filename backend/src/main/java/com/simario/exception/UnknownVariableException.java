package com.simario.exception;

import com.simario.model.enums.ErrorKind;

/**
 * The variable name has no description in the dictionary.
 */
public class UnknownVariableException extends DictionaryException {

    private final String varname;

    public UnknownVariableException(String varname) {
        super(ErrorKind.UNKNOWN_VARIABLE, "'" + varname + "' does not exist in the data dictionary");
        this.varname = varname;
    }

    @Override
    public String getVarname() {
        return varname;
    }
}
