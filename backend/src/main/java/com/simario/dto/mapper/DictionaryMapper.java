package com.simario.dto.mapper;

import com.simario.dto.request.DescribeRequest;
import com.simario.dto.request.DescribeRequest.ResultMetaDto;
import com.simario.dto.response.ErrorResponse;
import com.simario.dto.response.VariableDto;
import com.simario.dto.response.VariableDto.CodingDto;
import com.simario.dto.response.VariableSummaryDto;
import com.simario.exception.DictionaryException;
import com.simario.model.dictionary.CodeTable;
import com.simario.model.dictionary.Dictionary;
import com.simario.model.result.*;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper between dictionary model objects and API DTOs.
 */
@Component
public class DictionaryMapper {

    // ========================================================================
    // Model -> DTO Conversions
    // ========================================================================

    public VariableDto toVariableDto(Dictionary dictionary, String varname) {
        List<CodingDto> codings = dictionary.codeTable(varname)
            .map(CodeTable::getCodings)
            .orElse(List.of())
            .stream()
            .map(coding -> new CodingDto(coding.code(), coding.label()))
            .toList();

        return new VariableDto(varname, dictionary.description(varname).orElse(null), codings);
    }

    public List<VariableSummaryDto> toSummaryDtoList(Dictionary dictionary) {
        return dictionary.getDescriptions().entrySet().stream()
            .map(e -> new VariableSummaryDto(
                e.getKey(),
                e.getValue(),
                dictionary.getCodeTables().containsKey(e.getKey())))
            .toList();
    }

    public ErrorResponse toErrorResponse(DictionaryException ex) {
        return new ErrorResponse(ex.getMessage(), ex.getKind(), ex.getVarname(), ex.getValue());
    }

    // ========================================================================
    // DTO -> Model Conversions
    // ========================================================================

    /**
     * Build the result shape for a describe request. Metadata wraps whichever
     * structure is supplied; dimension names take precedence over text.
     */
    public AnnotatedResult toAnnotatedResult(DescribeRequest request) {
        AnnotatedResult structure;
        if (request.dimensionNames() != null && !request.dimensionNames().isEmpty()) {
            structure = new LabeledTable(request.dimensionNames(), null, null);
        } else if (request.text() != null) {
            structure = new TextSequence(request.text());
        } else {
            structure = new Unrecognized(null);
        }

        if (request.meta() == null) {
            return structure;
        }
        return new MetadataTagged(toResultMeta(request.meta()), structure);
    }

    public ResultMeta toResultMeta(ResultMetaDto dto) {
        return ResultMeta.builder()
            .varname(dto.varname())
            .grouping(dto.grouping())
            .grpbyTag(dto.grpbyTag())
            .set(dto.set())
            .weighting(dto.weighting())
            .build();
    }
}
