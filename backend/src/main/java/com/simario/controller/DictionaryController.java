package com.simario.controller;

import com.simario.dto.mapper.DictionaryMapper;
import com.simario.dto.request.*;
import com.simario.dto.response.*;
import com.simario.exception.DictionaryException;
import com.simario.exception.MalformedFlattenedCodeException;
import com.simario.exception.UnknownVariableException;
import com.simario.exception.VarnameResolutionException;
import com.simario.model.dictionary.CodeTable;
import com.simario.model.dictionary.Dictionary;
import com.simario.model.result.LabeledTable;
import com.simario.model.result.MetadataTagged;
import com.simario.service.ResultTableService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the data dictionary.
 * Read-only lookups used by the reporting front end to label results.
 */
@RestController
@RequestMapping("/api/dictionary")
@Slf4j
public class DictionaryController {

    private final Dictionary dictionary;
    private final ResultTableService resultTableService;
    private final DictionaryMapper dictionaryMapper;

    public DictionaryController(
            Dictionary dictionary,
            ResultTableService resultTableService,
            DictionaryMapper dictionaryMapper) {
        this.dictionary = dictionary;
        this.resultTableService = resultTableService;
        this.dictionaryMapper = dictionaryMapper;
    }

    // ========================================================================
    // Variables
    // ========================================================================

    /**
     * Get all variables with their descriptions.
     */
    @GetMapping("/variables")
    public ResponseEntity<List<VariableSummaryDto>> getAllVariables() {
        return ResponseEntity.ok(dictionaryMapper.toSummaryDtoList(dictionary));
    }

    /**
     * Get a single variable with its codings.
     */
    @GetMapping("/variables/{varname}")
    public ResponseEntity<VariableDto> getVariable(@PathVariable String varname) {
        if (dictionary.description(varname).isEmpty()) {
            throw new UnknownVariableException(varname);
        }
        return ResponseEntity.ok(dictionaryMapper.toVariableDto(dictionary, varname));
    }

    // ========================================================================
    // Code matching
    // ========================================================================

    /**
     * Match raw coded values to labels. Values pass through unchanged for
     * variables without codings.
     */
    @PostMapping("/codes/match")
    public ResponseEntity<LabelsDto> matchCodes(@Valid @RequestBody MatchCodesRequest request) {
        log.info("Matching {} codes for {}", request.values().size(), request.varname());
        return ResponseEntity.ok(new LabelsDto(dictionary.matchCodes(request.values(), request.varname())));
    }

    /**
     * Match flattened codes, e.g. "2 1" for group code 2 and variable code 1.
     */
    @PostMapping("/codes/match-flattened")
    public ResponseEntity<LabelsDto> matchFlattenedCodes(@Valid @RequestBody MatchFlattenedCodesRequest request) {
        log.info("Matching {} flattened codes for {} by {}",
            request.codes().size(), request.varname(), request.grpbyTag());
        return ResponseEntity.ok(new LabelsDto(
            dictionary.matchFlattenedCodes(request.codes(), request.varname(), request.grpbyTag())));
    }

    /**
     * Category labels for a batch of variables.
     */
    @PostMapping("/codes/labels")
    public ResponseEntity<Map<String, List<String>>> getCodingLabels(@Valid @RequestBody CodingLabelsRequest request) {
        return ResponseEntity.ok(dictionary.codingLabelsFor(request.varnames()));
    }

    // ========================================================================
    // Descriptions and tables
    // ========================================================================

    /**
     * Describe a result from its metadata or structure.
     */
    @PostMapping("/describe")
    public ResponseEntity<DescriptionDto> describe(@RequestBody DescribeRequest request) {
        String description = dictionary.resolveDescription(dictionaryMapper.toAnnotatedResult(request), "request");
        return ResponseEntity.ok(new DescriptionDto(description));
    }

    /**
     * Labelled percentage table for raw values of a categorical variable.
     */
    @PostMapping("/tables/categorical")
    public ResponseEntity<?> categoricalTable(@Valid @RequestBody CategoricalTableRequest request) {
        CodeTable coding = dictionary.codeTable(request.varname()).orElse(null);
        if (coding == null) {
            return ResponseEntity.badRequest()
                .body(ErrorResponse.of("Variable has no codings: " + request.varname()));
        }

        log.info("Tabulating {} values of {}", request.values().size(), request.varname());
        MetadataTagged table = resultTableService.catvarTable(request.values(), coding);
        LabeledTable cells = (LabeledTable) table.value();

        return ResponseEntity.ok(new CategoricalTableDto(
            request.varname(),
            dictionary.resolveDescription(table),
            cells.dimensionLabels().get(0),
            cells.cells()));
    }

    // ========================================================================
    // Exception Handling
    // ========================================================================

    @ExceptionHandler(UnknownVariableException.class)
    public ResponseEntity<ErrorResponse> handleUnknownVariable(UnknownVariableException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(dictionaryMapper.toErrorResponse(ex));
    }

    @ExceptionHandler({VarnameResolutionException.class, MalformedFlattenedCodeException.class})
    public ResponseEntity<ErrorResponse> handleUnresolvable(DictionaryException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(dictionaryMapper.toErrorResponse(ex));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ErrorResponse.of(ex.getMessage()));
    }
}
