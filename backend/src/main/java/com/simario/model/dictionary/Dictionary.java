package com.simario.model.dictionary;

import com.simario.exception.CodingsExpressionException;
import com.simario.exception.MalformedFlattenedCodeException;
import com.simario.exception.UnknownVariableException;
import com.simario.exception.VarnameResolutionException;
import com.simario.model.result.*;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Data dictionary for simulation output.
 *
 * Holds variable descriptions and the code tables of categorical variables,
 * and turns computed results into the text a reader of the study sees.
 *
 * Immutable once built; one instance may be shared freely across threads.
 */
@Slf4j
public final class Dictionary {

    public static final String DEFAULT_BASELINE_WEIGHTING = "weightBase";
    public static final String DEFAULT_SCENARIO_SUFFIX = " scenario";

    /**
     * Rendered in place of a flattened code component that has no category.
     */
    public static final String MISSING_LABEL = "NA";

    @Getter
    private final Map<String, String> descriptions;

    @Getter
    private final Map<String, CodeTable> codeTables;

    @Getter
    private final String baselineWeighting;

    private final String scenarioSuffix;

    @Builder
    private Dictionary(
            @Singular Map<String, String> descriptions,
            @Singular List<CodeTable> codeTables,
            String baselineWeighting,
            String scenarioSuffix) {
        this.descriptions = Collections.unmodifiableMap(new LinkedHashMap<>(descriptions));

        Map<String, CodeTable> tables = new LinkedHashMap<>();
        for (CodeTable table : codeTables) {
            if (tables.putIfAbsent(table.getVarname(), table) != null) {
                log.warn("Ignoring repeated codings for {}", table.getVarname());
            } else if (!this.descriptions.containsKey(table.getVarname())) {
                log.warn("Codings for {} have no description", table.getVarname());
            }
        }
        this.codeTables = Collections.unmodifiableMap(tables);

        this.baselineWeighting = baselineWeighting != null ? baselineWeighting : DEFAULT_BASELINE_WEIGHTING;
        this.scenarioSuffix = scenarioSuffix != null ? scenarioSuffix : DEFAULT_SCENARIO_SUFFIX;
    }

    // ========================================================================
    // Construction from source tables
    // ========================================================================

    /**
     * Build a dictionary from a descriptions table and no codings.
     */
    public static Dictionary of(List<DescriptionRow> descriptionRows) {
        return of(descriptionRows, null, null);
    }

    /**
     * Build a dictionary from a descriptions table and an optional codings table.
     *
     * Rows with a blank variable name are dropped from both tables, as are
     * codings rows with a blank expression. Each remaining expression is
     * evaluated into that variable's code table.
     *
     * @param codingRows codings table, or null if there are no codings
     * @param evaluator  evaluator for codings expressions; required when codingRows is given
     */
    public static Dictionary of(
            List<DescriptionRow> descriptionRows,
            List<CodingRow> codingRows,
            CodingsExpressionEvaluator evaluator) {
        return fromRows(descriptionRows, codingRows, evaluator).build();
    }

    /**
     * Builder pre-populated from source tables, for callers that also need to
     * set rendering options.
     */
    public static DictionaryBuilder fromRows(
            List<DescriptionRow> descriptionRows,
            List<CodingRow> codingRows,
            CodingsExpressionEvaluator evaluator) {
        DictionaryBuilder builder = builder();

        Map<String, String> descriptionMap = new LinkedHashMap<>();
        for (DescriptionRow row : descriptionRows) {
            if (isBlank(row.varname())) {
                log.debug("Skipping description row without a variable name");
                continue;
            }
            if (descriptionMap.putIfAbsent(row.varname(), row.description()) != null) {
                log.warn("Ignoring repeated description for {}", row.varname());
            }
        }
        builder.descriptions(descriptionMap);

        if (codingRows != null) {
            Objects.requireNonNull(evaluator, "evaluator is required to build codings");
            for (CodingRow row : codingRows) {
                if (isBlank(row.varname()) || isBlank(row.codingsExpr())) {
                    log.debug("Skipping codings row without a variable name or expression: {}", row.varname());
                    continue;
                }
                try {
                    builder.codeTable(new CodeTable(row.varname(), evaluator.evaluate(row.codingsExpr())));
                } catch (CodingsExpressionException e) {
                    throw e.forVariable(row.varname());
                }
            }
        }

        return builder;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public Optional<String> description(String varname) {
        return Optional.ofNullable(descriptions.get(varname));
    }

    public Optional<CodeTable> codeTable(String varname) {
        return varname == null ? Optional.empty() : Optional.ofNullable(codeTables.get(varname));
    }

    // ========================================================================
    // Code matching
    // ========================================================================

    /**
     * Category labels for a list of coded values.
     *
     * Returns {@code values} itself when varname is null or has no code
     * table. Otherwise each value is replaced by its label, or by null when
     * the value is not one of the variable's codes.
     */
    public List<?> matchCodes(List<?> values, String varname) {
        if (varname == null) {
            return values;
        }
        CodeTable table = codeTables.get(varname);
        if (table == null) {
            return values;
        }

        List<String> labels = new ArrayList<>(values.size());
        for (Object value : values) {
            labels.add(table.labelFor(value).orElse(null));
        }
        return Collections.unmodifiableList(labels);
    }

    /**
     * Category labels for flattened codes.
     *
     * Without a grouping tag every entry is a plain code of varname. With one,
     * every entry is a {@code "<group code> <variable code>"} pair and resolves
     * to {@code "<group label> <variable label>"}.
     *
     * @throws MalformedFlattenedCodeException if grouped entries are not pairs
     */
    public List<String> matchFlattenedCodes(List<String> flatCodes, String varname, String grpbyTag) {
        if (isBlank(grpbyTag)) {
            return matchCodes(flatCodes, varname).stream()
                .map(label -> label == null ? null : label.toString())
                .toList();
        }

        List<FlattenedCode> parsed = flatCodes.stream()
            .map(raw -> FlattenedCode.parse(raw, grpbyTag))
            .toList();

        List<String> result = new ArrayList<>(parsed.size());
        for (FlattenedCode code : parsed) {
            result.add(render(matchOne(code.groupCode(), grpbyTag)) + " " + render(matchOne(code.varCode(), varname)));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Ordered category labels for each variable. Variables without codings map
     * to an empty list.
     */
    public Map<String, List<String>> codingLabelsFor(List<String> varnames) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String varname : varnames) {
            Objects.requireNonNull(varname, "varname");
            result.put(varname, codeTable(varname).map(CodeTable::labels).orElse(List.of()));
        }
        return Collections.unmodifiableMap(result);
    }

    private Object matchOne(String code, String varname) {
        return matchCodes(List.of(code), varname).get(0);
    }

    private static String render(Object label) {
        return label == null ? MISSING_LABEL : label.toString();
    }

    // ========================================================================
    // Description resolution
    // ========================================================================

    /**
     * Human-readable description of a result.
     *
     * The variable name comes from the result's metadata if present,
     * otherwise from its structure: the last named dimension of a table, or
     * the first element of a text sequence. Metadata also contributes the
     * grouping, weighting and set suffixes, in that order.
     *
     * @throws VarnameResolutionException if no variable name can be derived
     * @throws UnknownVariableException   if the variable has no description
     */
    public String resolveDescription(AnnotatedResult result) {
        return resolveDescription(result, "result");
    }

    /**
     * As {@link #resolveDescription(AnnotatedResult)}, naming the argument
     * that held the result in any {@link VarnameResolutionException}.
     */
    public String resolveDescription(AnnotatedResult result, String argument) {
        Objects.requireNonNull(result, argument);

        ResultMeta meta = null;
        AnnotatedResult payload = result;
        if (result instanceof MetadataTagged tagged) {
            meta = tagged.meta();
            payload = tagged.value();
        }

        String varname = meta != null && !isBlank(meta.getVarname())
            ? meta.getVarname()
            : varnameFromStructure(payload, argument);

        String description = descriptions.get(varname);
        if (description == null || description.isEmpty()) {
            throw new UnknownVariableException(varname);
        }

        if (meta == null) {
            return description;
        }
        return description + groupingSuffix(meta) + weightingSuffix(meta) + setSuffix(meta);
    }

    private String varnameFromStructure(AnnotatedResult payload, String argument) {
        if (payload instanceof LabeledTable table) {
            List<String> named = table.namedDimensions();
            if (!named.isEmpty()) {
                return named.get(named.size() - 1);
            }
        } else if (payload instanceof TextSequence text) {
            // a blank first element is still the name; the lookup reports it as unknown
            if (!text.values().isEmpty() && text.values().get(0) != null) {
                return text.values().get(0);
            }
        }
        throw new VarnameResolutionException(argument, payload.shape());
    }

    private String groupingSuffix(ResultMeta meta) {
        if (!isBlank(meta.getGrouping())) {
            return " by " + meta.getGrouping();
        }
        if (!isBlank(meta.getGrpbyTag())) {
            return " by " + resolveDescription(TextSequence.of(meta.getGrpbyTag()), "grpbyTag");
        }
        return "";
    }

    private String weightingSuffix(ResultMeta meta) {
        if (meta.getWeighting() == null || baselineWeighting.equals(meta.getWeighting())) {
            return "";
        }
        return scenarioSuffix;
    }

    private static String setSuffix(ResultMeta meta) {
        return isBlank(meta.getSet()) ? "" : " (" + meta.getSet() + ")";
    }

    // ========================================================================
    // Ordering
    // ========================================================================

    /**
     * The items sorted by their resolved descriptions. The sort is stable.
     * Every description is resolved before anything is sorted, so a failure
     * leaves no partial result.
     */
    public <T extends AnnotatedResult> List<T> orderByDescription(List<T> items) {
        List<Map.Entry<String, T>> keyed = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            T item = items.get(i);
            keyed.add(Map.entry(resolveDescription(item, "items[" + i + "]"), item));
        }

        keyed.sort(Map.Entry.comparingByKey());
        return keyed.stream().map(Map.Entry::getValue).toList();
    }

    @SafeVarargs
    public final <T extends AnnotatedResult> List<T> orderByDescription(T... items) {
        return orderByDescription(Arrays.asList(items));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        return "Dictionary[" + descriptions.size() + " descriptions, " + codeTables.size() + " codings]";
    }
}
