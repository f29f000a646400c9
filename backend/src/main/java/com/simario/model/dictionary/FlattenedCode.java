package com.simario.model.dictionary;

import com.simario.exception.MalformedFlattenedCodeException;

/**
 * A cross-tabulated cell code such as {@code "2 1"}: group code first, then
 * the variable code.
 *
 * The group code is a single whitespace-free token. Everything after the first
 * whitespace belongs to the variable code.
 */
public record FlattenedCode(
    String groupCode,
    String varCode
) {

    /**
     * Parse a flattened code produced for a grouped result.
     *
     * @throws MalformedFlattenedCodeException if the entry has no group/variable split
     */
    public static FlattenedCode parse(String raw, String grpbyTag) {
        if (raw == null) {
            throw new MalformedFlattenedCodeException(null, grpbyTag);
        }
        String trimmed = raw.strip();
        int split = firstWhitespace(trimmed);
        if (split < 0) {
            throw new MalformedFlattenedCodeException(raw, grpbyTag);
        }

        String varCode = trimmed.substring(split + 1).strip();
        if (varCode.isEmpty()) {
            throw new MalformedFlattenedCodeException(raw, grpbyTag);
        }
        return new FlattenedCode(trimmed.substring(0, split), varCode);
    }

    private static int firstWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
