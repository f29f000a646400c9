package com.simario.dto.response;

public record DescriptionDto(
    String description
) {}
