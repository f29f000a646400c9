package com.simario.dto.request;

import java.util.List;

/**
 * Request DTO describing a result by its metadata and/or structure.
 * Exactly the parts the producer knows need be supplied.
 */
public record DescribeRequest(
    ResultMetaDto meta,
    List<String> dimensionNames,
    List<String> text
) {

    public record ResultMetaDto(
        String varname,
        String grouping,
        String grpbyTag,
        String set,
        String weighting
    ) {}
}
