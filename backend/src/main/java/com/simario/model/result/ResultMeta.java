package com.simario.model.result;

import lombok.Builder;
import lombok.Value;

/**
 * Metadata a statistic producer attaches to its output.
 */
@Value
@Builder
public class ResultMeta {

    /**
     * Variable the result summarises.
     */
    String varname;

    /**
     * Free-text grouping, rendered as " by {grouping}".
     */
    String grouping;

    /**
     * Variable the result is cross-tabulated by.
     */
    String grpbyTag;

    /**
     * Free-text qualifier naming the subset, e.g. "males".
     */
    String set;

    /**
     * Weighting tag; the baseline tag means the result is not a scenario.
     */
    String weighting;

    public static ResultMeta ofVarname(String varname) {
        return ResultMeta.builder().varname(varname).build();
    }
}
