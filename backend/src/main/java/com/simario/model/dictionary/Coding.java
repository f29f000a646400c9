package com.simario.model.dictionary;

import java.util.Objects;

/**
 * One category of a coded variable: the raw code as it appears in simulation
 * output and its human-readable label.
 */
public record Coding(
    String label,
    Object code
) {
    public Coding {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(code, "code");
    }
}
