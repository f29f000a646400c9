package com.simario.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
    "simario.dictionary.descriptions=classpath:fixtures/descriptions.json",
    "simario.dictionary.codings=classpath:fixtures/codings.json"
})
@AutoConfigureMockMvc
class DictionaryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void listsVariablesWithoutBlankRows() throws Exception {
        mockMvc.perform(get("/api/dictionary/variables"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(5)))
            .andExpect(jsonPath("$[0].varname").value("kids"))
            .andExpect(jsonPath("$[0].coded").value(false))
            .andExpect(jsonPath("$[1].coded").value(true));
    }

    @Test
    void getsVariableWithCodings() throws Exception {
        mockMvc.perform(get("/api/dictionary/variables/r1stchildethn"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.description").value("Ethnicity"))
            .andExpect(jsonPath("$.codings[1].code").value(2))
            .andExpect(jsonPath("$.codings[1].label").value("Maori"));
    }

    @Test
    void unknownVariableIsNotFound() throws Exception {
        mockMvc.perform(get("/api/dictionary/variables/doesnotexist"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("unknown-variable"))
            .andExpect(jsonPath("$.varname").value("doesnotexist"));
    }

    @Test
    void matchesCodes() throws Exception {
        mockMvc.perform(post("/api/dictionary/codes/match")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"values\": [1, \"3\", 9], \"varname\": \"SESBTH\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.labels[0]").value("Professional"))
            .andExpect(jsonPath("$.labels[1]").value("Semi-skilled"))
            .andExpect(jsonPath("$.labels[2]").value(nullValue()));
    }

    @Test
    void matchCodesRequiresValues() throws Exception {
        mockMvc.perform(post("/api/dictionary/codes/match")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"varname\": \"SESBTH\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void matchesGroupedFlattenedCodes() throws Exception {
        mockMvc.perform(post("/api/dictionary/codes/match-flattened")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"codes\": [\"1 0\", \"2 1\"], \"varname\": \"z1singleLvl1\", \"grpbyTag\": \"r1stchildethn\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.labels", contains("European No", "Maori Yes")));
    }

    @Test
    void malformedFlattenedCodeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/dictionary/codes/match-flattened")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"codes\": [\"1\"], \"varname\": \"z1singleLvl1\", \"grpbyTag\": \"r1stchildethn\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("malformed-flattened-code"))
            .andExpect(jsonPath("$.value").value("1"));
    }

    @Test
    void getsCodingLabelsForBatch() throws Exception {
        mockMvc.perform(post("/api/dictionary/codes/labels")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"varnames\": [\"z1singleLvl1\", \"kids\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.z1singleLvl1", contains("No", "Yes")))
            .andExpect(jsonPath("$.kids", empty()));
    }

    @Test
    void describesResultFromMetadata() throws Exception {
        mockMvc.perform(post("/api/dictionary/describe")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"meta\": {\"varname\": \"kids\", \"grpbyTag\": \"r1stchildethn\", \"weighting\": \"weightBase\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.description").value("Number of children by Ethnicity"));
    }

    @Test
    void describesResultFromDimensionNames() throws Exception {
        mockMvc.perform(post("/api/dictionary/describe")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"dimensionNames\": [null, \"SESBTH\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.description").value("Socio-economic status at birth"));
    }

    @Test
    void describeWithoutNameIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/dictionary/describe")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("varname-resolution"))
            .andExpect(jsonPath("$.value").value("request"));
    }

    @Test
    void tabulatesCategoricalValues() throws Exception {
        mockMvc.perform(post("/api/dictionary/tables/categorical")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"varname\": \"z1singleLvl1\", \"values\": [0, 1, 1, 1]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.description").value("Single parent"))
            .andExpect(jsonPath("$.labels", contains("No (%)", "Yes (%)")))
            .andExpect(jsonPath("$.percentages", contains(25.0, 75.0)));
    }

    @Test
    void tabulatingUncodedVariableIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/dictionary/tables/categorical")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"varname\": \"gptotvis\", \"values\": [3, 5]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error", containsString("gptotvis")));
    }
}
