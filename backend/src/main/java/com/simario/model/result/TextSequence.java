package com.simario.model.result;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A sequence of strings. Its first element names the variable.
 */
public record TextSequence(
    List<String> values
) implements AnnotatedResult {

    public TextSequence {
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static TextSequence of(String... values) {
        return new TextSequence(Arrays.asList(values));
    }
}
