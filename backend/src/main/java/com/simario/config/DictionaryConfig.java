package com.simario.config;

import com.simario.model.dictionary.CodingsExpressionEvaluator;
import com.simario.model.dictionary.Dictionary;
import com.simario.repository.DictionaryTableRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the application's dictionary once at startup from the configured
 * descriptions and codings tables.
 */
@Configuration
@Slf4j
public class DictionaryConfig {

    @Bean
    public Dictionary dictionary(
            DictionaryTableRepository tableRepository,
            CodingsExpressionEvaluator codingsEvaluator,
            DictionaryProperties properties) {
        Dictionary dictionary = Dictionary.fromRows(
                tableRepository.findDescriptions(),
                tableRepository.findCodings().orElse(null),
                codingsEvaluator)
            .baselineWeighting(properties.getBaselineWeighting())
            .scenarioSuffix(properties.getScenarioSuffix())
            .build();

        log.info("Loaded dictionary with {} descriptions and {} codings",
            dictionary.getDescriptions().size(), dictionary.getCodeTables().size());
        return dictionary;
    }
}
