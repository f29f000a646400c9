package com.simario.dto.response;

import java.util.List;

public record LabelsDto(
    List<?> labels
) {}
