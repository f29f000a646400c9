package com.simario.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO for a labelled percentage table of a categorical variable.
 */
public record CategoricalTableRequest(
    @NotBlank(message = "Varname is required")
    String varname,

    @NotNull(message = "Values are required")
    List<Object> values
) {}
