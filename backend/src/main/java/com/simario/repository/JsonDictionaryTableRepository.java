package com.simario.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simario.config.DictionaryProperties;
import com.simario.model.dictionary.CodingRow;
import com.simario.model.dictionary.DescriptionRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

/**
 * Reads the dictionary tables from JSON resources. Each table is an array of
 * row objects keyed by column name; columns other than the ones a row type
 * declares are ignored.
 */
@Repository
@Slf4j
public class JsonDictionaryTableRepository implements DictionaryTableRepository {

    private final DictionaryProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public JsonDictionaryTableRepository(
            DictionaryProperties properties,
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<DescriptionRow> findDescriptions() {
        if (properties.getDescriptions() == null || properties.getDescriptions().isBlank()) {
            throw new IllegalStateException("simario.dictionary.descriptions is not configured");
        }
        return read(properties.getDescriptions(), new TypeReference<List<DescriptionRow>>() {});
    }

    @Override
    public Optional<List<CodingRow>> findCodings() {
        if (properties.getCodings() == null || properties.getCodings().isBlank()) {
            log.info("No codings table configured");
            return Optional.empty();
        }
        return Optional.of(read(properties.getCodings(), new TypeReference<List<CodingRow>>() {}));
    }

    private <T> List<T> read(String location, TypeReference<List<T>> type) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            List<T> rows = objectMapper.readValue(in, type);
            log.info("Read {} rows from {}", rows.size(), location);
            return rows;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dictionary table " + location, e);
        }
    }
}
