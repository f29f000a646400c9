package com.simario.dto.request;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CodingLabelsRequest(
    @NotEmpty(message = "At least one varname is required")
    List<String> varnames
) {}
