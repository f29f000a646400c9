package com.simario.exception;

import com.simario.model.enums.ErrorKind;
import lombok.Getter;

/**
 * A codings expression could not be evaluated into label/code pairs.
 */
@Getter
public class CodingsExpressionException extends DictionaryException {

    private final String varname;
    private final String expression;
    private final String reason;

    public CodingsExpressionException(String expression, String reason) {
        this(null, expression, reason, null);
    }

    private CodingsExpressionException(String varname, String expression, String reason, Throwable cause) {
        super(ErrorKind.CODINGS_EXPRESSION,
            "cannot evaluate codings" + (varname != null ? " for " + varname : "")
                + " (" + reason + "): " + expression,
            cause);
        this.varname = varname;
        this.expression = expression;
        this.reason = reason;
    }

    /**
     * Same failure, attributed to the variable whose codings row held the expression.
     */
    public CodingsExpressionException forVariable(String varname) {
        return new CodingsExpressionException(varname, expression, reason, this);
    }

    @Override
    public String getValue() {
        return expression;
    }
}
