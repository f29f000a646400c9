package com.simario.model.dictionary;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Row of the descriptions table. Additional columns are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DescriptionRow(
    @JsonProperty("Varname") String varname,
    @JsonProperty("Description") String description
) {}
