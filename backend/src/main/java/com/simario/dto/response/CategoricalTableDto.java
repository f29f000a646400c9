package com.simario.dto.response;

import java.util.List;

/**
 * Response DTO for a labelled percentage table.
 */
public record CategoricalTableDto(
    String varname,
    String description,
    List<String> labels,
    List<Double> percentages
) {}
