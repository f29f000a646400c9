package com.simario.model.result;

import java.util.Objects;

/**
 * A value with metadata attached. When the metadata has no variable name the
 * wrapped value's structure is used instead.
 */
public record MetadataTagged(
    ResultMeta meta,
    AnnotatedResult value
) implements AnnotatedResult {

    public MetadataTagged {
        Objects.requireNonNull(meta, "meta");
        if (value == null) {
            value = new Unrecognized(null);
        }
    }

    public static MetadataTagged of(ResultMeta meta) {
        return new MetadataTagged(meta, null);
    }
}
