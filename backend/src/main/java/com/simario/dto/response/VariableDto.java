package com.simario.dto.response;

import java.util.List;

/**
 * Response DTO for a dictionary variable.
 * Codings is empty for variables without categories.
 */
public record VariableDto(
    String varname,
    String description,
    List<CodingDto> codings
) {

    public record CodingDto(
        Object code,
        String label
    ) {}
}
