package com.simario.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.simario.model.enums.ErrorKind;

/**
 * Error body returned by the dictionary API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error,
    ErrorKind kind,
    String varname,
    String value
) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null, null, null);
    }
}
