package com.simario.model.result;

/**
 * A computed statistic as seen by the dictionary.
 *
 * The set of shapes is closed:
 * <ul>
 *   <li>{@link MetadataTagged}: a value carrying {@link ResultMeta}</li>
 *   <li>{@link LabeledTable}: a multi-dimensional table with named dimensions</li>
 *   <li>{@link TextSequence}: a sequence of strings</li>
 *   <li>{@link Unrecognized}: anything else</li>
 * </ul>
 */
public interface AnnotatedResult {

    /**
     * Short name of this shape, used in diagnostics.
     */
    default String shape() {
        return getClass().getSimpleName();
    }
}
