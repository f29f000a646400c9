package com.simario.config;

import com.simario.model.dictionary.Dictionary;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Dictionary settings under {@code simario.dictionary}.
 */
@Data
@ConfigurationProperties(prefix = "simario.dictionary")
public class DictionaryProperties {

    /**
     * Resource location of the descriptions table.
     */
    private String descriptions;

    /**
     * Resource location of the codings table; blank when there are no codings.
     */
    private String codings;

    /**
     * Weighting tag of baseline results. Results with any other weighting are
     * described as scenario results.
     */
    private String baselineWeighting = Dictionary.DEFAULT_BASELINE_WEIGHTING;

    private String scenarioSuffix = Dictionary.DEFAULT_SCENARIO_SUFFIX;
}
