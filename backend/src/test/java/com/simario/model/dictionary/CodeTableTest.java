package com.simario.model.dictionary;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodeTableTest {

    private final CodeTable ses = CodeTable.of("SESBTH",
        new Coding("Professional", 1L),
        new Coding("Clerical", 2L),
        new Coding("Semi-skilled", 3L));

    @Test
    void labelForMatchesNumericCodesRegardlessOfType() {
        assertEquals("Professional", ses.labelFor(1).orElseThrow());
        assertEquals("Clerical", ses.labelFor(2.0).orElseThrow());
        assertEquals("Semi-skilled", ses.labelFor("3").orElseThrow());
        assertEquals("Semi-skilled", ses.labelFor(" 3.00 ").orElseThrow());
    }

    @Test
    void labelForUnknownOrNullCodeIsEmpty() {
        assertTrue(ses.labelFor(4).isEmpty());
        assertTrue(ses.labelFor(null).isEmpty());
        assertTrue(ses.labelFor("Professional").isEmpty());
    }

    @Test
    void labelThenReverseLookupReturnsOriginalCode() {
        for (Object code : ses.codes()) {
            String label = ses.labelFor(code).orElseThrow();
            assertEquals(code, ses.codeFor(label).orElseThrow());
        }
    }

    @Test
    void translatePassesUnknownCodesThrough() {
        assertEquals(List.of("Professional", 9, "Semi-skilled"), ses.translate(List.of(1, 9, 3)));
    }

    @Test
    void stringCodesMatchByTrimmedValue() {
        CodeTable region = CodeTable.of("region", new Coding("North", "N"), new Coding("South", "S"));

        assertEquals("South", region.labelFor(" S").orElseThrow());
        assertTrue(region.labelFor("s").isEmpty());
    }

    @Test
    void preservesSuppliedOrder() {
        assertEquals(List.of("Professional", "Clerical", "Semi-skilled"), ses.labels());
        assertEquals(List.of(1L, 2L, 3L), ses.codes());
        assertEquals(3, ses.size());
    }

    @Test
    void rejectsDuplicateCodes() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> CodeTable.of("kids", new Coding("None", 0), new Coding("Zero", 0.0)));
        assertTrue(ex.getMessage().contains("kids"));
    }

    @Test
    void keyOfNormalisesNumbers() {
        assertEquals("10", CodeTable.keyOf(10.0));
        assertEquals("10", CodeTable.keyOf("1E+1"));
        assertEquals("0", CodeTable.keyOf(0.0));
        assertEquals("0.5", CodeTable.keyOf("0.50"));
        assertEquals("NaN", CodeTable.keyOf(Double.NaN));
    }

    @Test
    void keyOfKeepsExtremeExponentsShort() {
        assertEquals("1E+2000000000", CodeTable.keyOf("1E2000000000"));
        assertEquals("1E-2000000000", CodeTable.keyOf("1.0E-2000000000"));
        assertTrue(ses.labelFor("1E2000000000").isEmpty());
    }
}
