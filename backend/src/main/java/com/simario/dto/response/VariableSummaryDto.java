package com.simario.dto.response;

public record VariableSummaryDto(
    String varname,
    String description,
    boolean coded
) {}
