package com.simario.service;

import com.simario.exception.CodingsExpressionException;
import com.simario.model.dictionary.CodeTable;
import com.simario.model.dictionary.Coding;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VectorLiteralEvaluatorTest {

    private final VectorLiteralEvaluator evaluator = new VectorLiteralEvaluator();

    @Test
    void evaluatesQuotedLabelsInOrder() {
        List<Coding> codings = evaluator.evaluate("c(\"Other\"=1, \"Pacific\"=2, \"Maori\"=3)");

        assertEquals(List.of(
            new Coding("Other", 1L),
            new Coding("Pacific", 2L),
            new Coding("Maori", 3L)), codings);
    }

    @Test
    void acceptsMixedLabelAndCodeForms() {
        List<Coding> codings = evaluator.evaluate(" c( No = 0 , 'Semi-skilled'=1.5, `21+`=\"x\", \"Say \\\"hi\\\"\"=-2 ) ");

        assertEquals(List.of(
            new Coding("No", 0L),
            new Coding("Semi-skilled", 1.5),
            new Coding("21+", "x"),
            new Coding("Say \"hi\"", -2L)), codings);
    }

    @Test
    void keepsAllDigitsOfCodesBeyondLongRange() {
        List<Coding> codings = evaluator.evaluate("c(\"Huge\"=12345678901234567890)");

        assertEquals(new BigDecimal("12345678901234567890"), codings.get(0).code());
        assertEquals("Huge", CodeTable.of("id", codings.toArray(Coding[]::new))
            .labelFor("12345678901234567890").orElseThrow());
    }

    @Test
    void emptyVectorHasNoCodings() {
        assertTrue(evaluator.evaluate("c()").isEmpty());
    }

    @Test
    void rejectsNonVectorExpression() {
        CodingsExpressionException ex = assertThrows(CodingsExpressionException.class,
            () -> evaluator.evaluate("list(No=0)"));
        assertEquals("list(No=0)", ex.getExpression());
    }

    @Test
    void rejectsUnnamedEntries() {
        assertThrows(CodingsExpressionException.class, () -> evaluator.evaluate("c(1, 2, 3)"));
    }

    @Test
    void rejectsMissingSeparator() {
        assertThrows(CodingsExpressionException.class, () -> evaluator.evaluate("c(\"No\"=0 \"Yes\"=1)"));
    }

    @Test
    void rejectsTrailingComma() {
        assertThrows(CodingsExpressionException.class, () -> evaluator.evaluate("c(\"No\"=0,)"));
    }
}
