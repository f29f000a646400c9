package com.simario.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO for matching flattened (optionally grouped) codes.
 */
public record MatchFlattenedCodesRequest(
    @NotNull(message = "Codes are required")
    List<String> codes,

    @NotBlank(message = "Varname is required")
    String varname,

    String grpbyTag
) {}
