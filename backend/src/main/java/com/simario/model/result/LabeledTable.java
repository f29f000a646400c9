package com.simario.model.result;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A table, matrix or array with optionally named dimensions.
 *
 * Cells are stored with the first dimension varying fastest. Dimension names
 * may be null or empty; such dimensions are skipped when the table is used to
 * derive a variable name.
 */
public record LabeledTable(
    List<String> dimensionNames,
    List<List<String>> dimensionLabels,
    List<Double> cells
) implements AnnotatedResult {

    public LabeledTable {
        dimensionNames = copyOf(dimensionNames);
        dimensionLabels = dimensionLabels == null
            ? List.of()
            : dimensionLabels.stream().map(LabeledTable::copyOf).toList();
        cells = copyOf(cells);

        if (!dimensionLabels.isEmpty()) {
            if (dimensionLabels.size() != dimensionNames.size()) {
                throw new IllegalArgumentException("Expected labels for " + dimensionNames.size()
                    + " dimensions, got " + dimensionLabels.size());
            }
            int expected = dimensionLabels.stream().mapToInt(List::size).reduce(1, (a, b) -> a * b);
            if (expected != cells.size()) {
                throw new IllegalArgumentException("Expected " + expected + " cells, got " + cells.size());
            }
        }
    }

    /**
     * Structure-only table with the given dimension names and no cells.
     */
    public static LabeledTable withDimensions(String... dimensionNames) {
        return new LabeledTable(Arrays.asList(dimensionNames), null, null);
    }

    /**
     * One-dimensional table.
     */
    public static LabeledTable oneWay(String dimensionName, List<String> labels, List<Double> cells) {
        return new LabeledTable(
            Collections.singletonList(dimensionName),
            List.of(labels),
            cells);
    }

    /**
     * Dimension names with null and empty entries removed, in order.
     */
    public List<String> namedDimensions() {
        return dimensionNames.stream()
            .filter(name -> name != null && !name.isEmpty())
            .toList();
    }

    public int rank() {
        return dimensionNames.size();
    }

    /**
     * Cell of a one-dimensional table by label, or null if the label is absent.
     */
    public Double cell(String label) {
        if (rank() != 1 || dimensionLabels.isEmpty()) {
            throw new IllegalStateException("Label lookup requires a labelled one-dimensional table");
        }
        int index = dimensionLabels.get(0).indexOf(label);
        return index < 0 ? null : cells.get(index);
    }

    private static <T> List<T> copyOf(List<T> source) {
        return source == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(source));
    }
}
