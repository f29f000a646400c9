package com.simario.service;

import com.simario.model.dictionary.CodeTable;
import com.simario.model.result.LabeledTable;
import com.simario.model.result.MetadataTagged;
import com.simario.model.result.ResultMeta;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.*;

/**
 * Result Table Service
 *
 * Shapes raw simulation values into the labelled, metadata-tagged tables the
 * dictionary describes:
 * - Categorical percentages labelled from a code table
 * - Continuous percentages over binned intervals
 * - Splitting collated result rows into means and error amounts
 */
@Service
public class ResultTableService {

    public static final String PERCENT_SUFFIX = " (%)";
    public static final String MISSING_BIN = "NA";

    // ========================================================================
    // Frequency tables
    // ========================================================================

    /**
     * Percentage of values in each category of a coded variable.
     *
     * Cells appear in code table order, followed by any values that are not
     * codes of the table in ascending key order. Cells are labelled
     * "{label} (%)", using the raw value when it has no label. Null values are
     * not counted.
     */
    public MetadataTagged catvarTable(List<?> values, CodeTable coding) {
        Map<String, Long> counts = new HashMap<>();
        Map<String, Object> rawByKey = new HashMap<>();
        long total = 0;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            String key = CodeTable.keyOf(value);
            counts.merge(key, 1L, Long::sum);
            rawByKey.putIfAbsent(key, value);
            total++;
        }

        List<String> labels = new ArrayList<>();
        List<Double> cells = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Object code : coding.codes()) {
            String key = CodeTable.keyOf(code);
            Long count = counts.get(key);
            if (count != null) {
                labels.add(coding.labelFor(code).orElseThrow() + PERCENT_SUFFIX);
                cells.add(percent(count, total));
                seen.add(key);
            }
        }

        List<String> unmatched = new ArrayList<>(counts.keySet());
        unmatched.removeAll(seen);
        Collections.sort(unmatched);
        for (String key : unmatched) {
            labels.add(rawByKey.get(key) + PERCENT_SUFFIX);
            cells.add(percent(counts.get(key), total));
        }

        return new MetadataTagged(
            ResultMeta.ofVarname(coding.getVarname()),
            LabeledTable.oneWay(null, labels, cells));
    }

    /**
     * Percentage of continuous values falling in each interval.
     *
     * Intervals are left-open and right-closed, e.g. "(0,4]". Every interval
     * has a cell, even if empty. Null values and values outside the breaks are
     * counted in a trailing "NA" cell, present only if there are any.
     *
     * @param breaks two or more strictly increasing cut points
     */
    public MetadataTagged contvarTable(List<Double> values, List<Double> breaks, String varname) {
        if (breaks.size() < 2) {
            throw new IllegalArgumentException("At least two breaks are required for " + varname);
        }
        for (int i = 1; i < breaks.size(); i++) {
            if (!(breaks.get(i) > breaks.get(i - 1))) {
                throw new IllegalArgumentException("Breaks must be strictly increasing for " + varname + ": " + breaks);
            }
        }

        int bins = breaks.size() - 1;
        long[] counts = new long[bins];
        long missing = 0;
        for (Double value : values) {
            int bin = value == null ? -1 : binOf(value, breaks);
            if (bin < 0) {
                missing++;
            } else {
                counts[bin]++;
            }
        }

        long total = values.size();
        List<String> labels = new ArrayList<>(bins + 1);
        List<Double> cells = new ArrayList<>(bins + 1);
        for (int i = 0; i < bins; i++) {
            labels.add("(" + plain(breaks.get(i)) + "," + plain(breaks.get(i + 1)) + "]");
            cells.add(percent(counts[i], total));
        }
        if (missing > 0) {
            labels.add(MISSING_BIN);
            cells.add(percent(missing, total));
        }

        return new MetadataTagged(
            ResultMeta.ofVarname(varname),
            LabeledTable.oneWay(null, labels, cells));
    }

    private static int binOf(double value, List<Double> breaks) {
        for (int i = 1; i < breaks.size(); i++) {
            if (value > breaks.get(i - 1) && value <= breaks.get(i)) {
                return i - 1;
            }
        }
        return -1;
    }

    private static double percent(long count, long total) {
        return total == 0 ? 0.0 : count * 100.0 / total;
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    // ========================================================================
    // Means and errors
    // ========================================================================

    /**
     * Split a collated result row into means and error amounts.
     *
     * A row with confidence intervals names its cells "{x} Mean", "{x} Lower"
     * and "{x} Upper". Means are keyed by the cell name with "Mean" removed
     * and trimmed; each error is the mean minus the matching lower bound, in
     * row order. A row without Lower cells is taken to be all means with zero
     * error.
     *
     * @param row cells in column order; pass an insertion-ordered map such as
     *            {@link LinkedHashMap} so Mean and Lower cells pair up
     * @throws IllegalArgumentException if the row has unequal numbers of Mean and Lower cells,
     *                                  or a missing (null) cell value
     */
    public MeansAndErrs asMeansAndErrs(Map<String, Double> row) {
        List<Map.Entry<String, Double>> means = new ArrayList<>();
        List<Double> lowers = new ArrayList<>();
        for (Map.Entry<String, Double> cell : row.entrySet()) {
            if (cell.getValue() == null) {
                throw new IllegalArgumentException("Result row has no value for " + cell.getKey());
            }
            if (cell.getKey().contains("Mean")) {
                means.add(cell);
            }
            if (cell.getKey().contains("Lower")) {
                lowers.add(cell.getValue());
            }
        }

        if (means.size() != lowers.size()) {
            throw new IllegalArgumentException("Result row has " + means.size() + " Mean cells but "
                + lowers.size() + " Lower cells: " + row.keySet());
        }

        Map<String, Double> meanValues = new LinkedHashMap<>();
        Map<String, Double> errs = new LinkedHashMap<>();
        if (lowers.isEmpty()) {
            row.forEach((name, value) -> {
                meanValues.put(name, value);
                errs.put(name, 0.0);
            });
        } else {
            for (int i = 0; i < means.size(); i++) {
                String name = means.get(i).getKey().replace("Mean", "").trim();
                double mean = means.get(i).getValue();
                meanValues.put(name, mean);
                errs.put(name, mean - lowers.get(i));
            }
        }

        return new MeansAndErrs(
            Collections.unmodifiableMap(meanValues),
            Collections.unmodifiableMap(errs));
    }

    /**
     * Means of a result row and the distance from each mean to its lower bound.
     */
    public record MeansAndErrs(
        Map<String, Double> means,
        Map<String, Double> errs
    ) {}
}
