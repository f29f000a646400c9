package com.simario.dto.request;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO for matching raw coded values to category labels.
 */
public record MatchCodesRequest(
    @NotNull(message = "Values are required")
    List<Object> values,
    String varname
) {}
