package com.simario.model.dictionary;

import com.simario.exception.MalformedFlattenedCodeException;
import com.simario.model.enums.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FlattenedCodeTest {

    @Test
    void splitsGroupAndVariableCode() {
        assertEquals(new FlattenedCode("2", "1"), FlattenedCode.parse("2 1", "r1stchildethn"));
    }

    @Test
    void variableCodeKeepsEverythingAfterFirstWhitespace() {
        assertEquals(new FlattenedCode("3", "Semi skilled"), FlattenedCode.parse(" 3\tSemi skilled ", "g"));
    }

    @Test
    void singleTokenIsMalformed() {
        MalformedFlattenedCodeException ex = assertThrows(MalformedFlattenedCodeException.class,
            () -> FlattenedCode.parse("3", "r1stchildethn"));

        assertEquals("3", ex.getRawCode());
        assertEquals("r1stchildethn", ex.getGrpbyTag());
        assertEquals(ErrorKind.MALFORMED_FLATTENED_CODE, ex.getKind());
    }

    @Test
    void nullIsMalformed() {
        assertThrows(MalformedFlattenedCodeException.class, () -> FlattenedCode.parse(null, "g"));
    }
}
