package com.simario.model.dictionary;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Row of the codings table. {@code codingsExpr} is the textual expression that
 * evaluates to the variable's ordered label/code pairs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodingRow(
    String varname,
    String codingsExpr
) {

    @JsonCreator
    public CodingRow(
            @JsonProperty("Varname") String varname,
            @JsonProperty("CodingsExpr") @JsonAlias("Codings_Expr") String codingsExpr) {
        this.varname = varname;
        this.codingsExpr = codingsExpr;
    }
}
