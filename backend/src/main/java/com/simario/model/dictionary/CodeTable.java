package com.simario.model.dictionary;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.*;

/**
 * Ordered code to label mapping for a single categorical variable.
 *
 * Codes compare by value rather than by Java type, so {@code 1}, {@code 1.0}
 * and {@code "1"} all address the same category. Order is the order the
 * codings were supplied in, which by convention is ascending numeric order.
 *
 * Immutable after construction.
 */
@Getter
public final class CodeTable {

    static final int MAX_PLAIN_SCALE = 64;

    private final String varname;
    private final List<Coding> codings;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, String> labelsByKey;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Object> codesByLabel;

    public CodeTable(String varname, List<Coding> codings) {
        this.varname = Objects.requireNonNull(varname, "varname");
        this.codings = List.copyOf(codings);

        Map<String, String> byKey = new LinkedHashMap<>();
        Map<String, Object> byLabel = new LinkedHashMap<>();
        for (Coding coding : this.codings) {
            String key = keyOf(coding.code());
            if (byKey.putIfAbsent(key, coding.label()) != null) {
                throw new IllegalArgumentException(
                    "Duplicate code '" + coding.code() + "' in codings for " + varname);
            }
            byLabel.putIfAbsent(coding.label(), coding.code());
        }
        this.labelsByKey = Collections.unmodifiableMap(byKey);
        this.codesByLabel = Collections.unmodifiableMap(byLabel);
    }

    public static CodeTable of(String varname, Coding... codings) {
        return new CodeTable(varname, Arrays.asList(codings));
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    /**
     * Label for a single code, or empty if the code is not part of this table.
     */
    public Optional<String> labelFor(Object code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(labelsByKey.get(keyOf(code)));
    }

    /**
     * Code for a label, the reverse of {@link #labelFor(Object)}.
     */
    public Optional<Object> codeFor(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(codesByLabel.get(label));
    }

    /**
     * Translate a list of codes to labels. Codes without a category pass
     * through unchanged.
     */
    public List<Object> translate(List<?> codes) {
        List<Object> result = new ArrayList<>(codes.size());
        for (Object code : codes) {
            result.add(labelFor(code).<Object>map(label -> label).orElse(code));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Labels in coding order.
     */
    public List<String> labels() {
        return codings.stream().map(Coding::label).toList();
    }

    /**
     * Codes in coding order.
     */
    public List<Object> codes() {
        return codings.stream().map(Coding::code).toList();
    }

    public int size() {
        return codings.size();
    }

    // ========================================================================
    // Code normalization
    // ========================================================================

    /**
     * Canonical comparison key for a raw code. Numbers and numeric strings
     * reduce to their plain decimal form without trailing zeros; anything else
     * compares by its trimmed string form. Numbers whose exponent is beyond
     * {@link #MAX_PLAIN_SCALE} keep scientific notation, so the key stays short.
     */
    public static String keyOf(Object code) {
        String text = code.toString().trim();
        BigDecimal number;
        try {
            number = new BigDecimal(text).stripTrailingZeros();
        } catch (NumberFormatException e) {
            return text;
        }
        return Math.abs(number.scale()) > MAX_PLAIN_SCALE ? number.toString() : number.toPlainString();
    }

    @Override
    public String toString() {
        return "CodeTable[" + varname + ", " + codings + "]";
    }
}
