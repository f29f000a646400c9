package com.simario.exception;

import com.simario.model.enums.ErrorKind;
import lombok.Getter;

/**
 * A flattened code for a grouped result is not of the form
 * {@code "<group code> <variable code>"}.
 */
@Getter
public class MalformedFlattenedCodeException extends DictionaryException {

    private final String rawCode;
    private final String grpbyTag;

    public MalformedFlattenedCodeException(String rawCode, String grpbyTag) {
        super(ErrorKind.MALFORMED_FLATTENED_CODE,
            "flattened code '" + rawCode + "' is not a '<group> <code>' pair for grouping " + grpbyTag);
        this.rawCode = rawCode;
        this.grpbyTag = grpbyTag;
    }

    @Override
    public String getVarname() {
        return grpbyTag;
    }

    @Override
    public String getValue() {
        return rawCode;
    }
}
