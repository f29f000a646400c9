package com.simario.repository;

import com.simario.model.dictionary.CodingRow;
import com.simario.model.dictionary.DescriptionRow;

import java.util.List;
import java.util.Optional;

/**
 * Source of the descriptions and codings tables a dictionary is built from.
 */
public interface DictionaryTableRepository {

    /**
     * All rows of the descriptions table, in source order.
     */
    List<DescriptionRow> findDescriptions();

    /**
     * All rows of the codings table, in source order, or empty if no codings
     * table is configured.
     */
    Optional<List<CodingRow>> findCodings();
}
