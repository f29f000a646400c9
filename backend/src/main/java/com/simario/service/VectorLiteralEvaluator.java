package com.simario.service;

import com.simario.exception.CodingsExpressionException;
import com.simario.model.dictionary.Coding;
import com.simario.model.dictionary.CodingsExpressionEvaluator;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Codings Expression Evaluator
 *
 * Evaluates the named-vector literals used in codings tables, e.g.
 * {@code c("Professional"=1, "Clerical"=2, "Semi-skilled"=3)}.
 *
 * Accepted forms:
 * - Labels: double-quoted, single-quoted, backquoted, or a bare name
 * - Codes: integer or decimal numbers, or quoted strings
 *
 * Entry order is preserved.
 */
@Service
public class VectorLiteralEvaluator implements CodingsExpressionEvaluator {

    private static final Pattern VECTOR = Pattern.compile("^\\s*c\\s*\\((.*)\\)\\s*$", Pattern.DOTALL);

    private static final Pattern ENTRY = Pattern.compile(
        "\\s*(?:\"((?:[^\"\\\\]|\\\\.)*)\"|'((?:[^'\\\\]|\\\\.)*)'|`([^`]*)`|([A-Za-z.][A-Za-z0-9._]*))"
            + "\\s*=\\s*"
            + "(?:\"((?:[^\"\\\\]|\\\\.)*)\"|'((?:[^'\\\\]|\\\\.)*)'|([-+]?\\d+(?:\\.\\d*)?(?:[eE][-+]?\\d+)?|[-+]?\\.\\d+))"
            + "\\s*(,|$)");

    private static final Pattern ESCAPE = Pattern.compile("\\\\(.)");

    @Override
    public List<Coding> evaluate(String expression) {
        if (expression == null) {
            throw new CodingsExpressionException(null, "no expression");
        }

        Matcher vector = VECTOR.matcher(expression);
        if (!vector.matches()) {
            throw new CodingsExpressionException(expression, "expected c(...)");
        }

        String body = vector.group(1);
        List<Coding> codings = new ArrayList<>();
        if (body.isBlank()) {
            return codings;
        }

        Matcher entry = ENTRY.matcher(body);
        int position = 0;
        while (position < body.length()) {
            entry.region(position, body.length());
            if (!entry.lookingAt()) {
                throw new CodingsExpressionException(expression,
                    "unexpected input at '" + body.substring(position).strip() + "'");
            }

            codings.add(new Coding(label(entry), code(entry)));
            position = entry.end();

            boolean trailingComma = ",".equals(entry.group(8));
            if (trailingComma && body.substring(position).isBlank()) {
                throw new CodingsExpressionException(expression, "trailing comma");
            }
            if (!trailingComma) {
                break;
            }
        }

        return Collections.unmodifiableList(codings);
    }

    private static String label(Matcher entry) {
        for (int group = 1; group <= 4; group++) {
            if (entry.group(group) != null) {
                return group <= 2 ? unescape(entry.group(group)) : entry.group(group);
            }
        }
        throw new IllegalStateException("Entry matched without a label");
    }

    private static Object code(Matcher entry) {
        if (entry.group(5) != null) {
            return unescape(entry.group(5));
        }
        if (entry.group(6) != null) {
            return unescape(entry.group(6));
        }

        String number = entry.group(7);
        if (number.matches("[-+]?\\d+")) {
            try {
                return Long.parseLong(number.startsWith("+") ? number.substring(1) : number);
            } catch (NumberFormatException e) {
                return new BigDecimal(number);
            }
        }
        return Double.parseDouble(number);
    }

    private static String unescape(String quoted) {
        return ESCAPE.matcher(quoted).replaceAll("$1");
    }
}
