package com.simario.model.dictionary;

/**
 * Turns the textual codings expression of a codings table row into the
 * variable's ordered label/code pairs.
 *
 * Implementations must preserve the order given in the expression and report
 * failures as {@link com.simario.exception.CodingsExpressionException}.
 */
@FunctionalInterface
public interface CodingsExpressionEvaluator {

    java.util.List<Coding> evaluate(String expression);
}
