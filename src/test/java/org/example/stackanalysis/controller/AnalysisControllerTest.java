package org.example.stackanalysis.controller;

import org.example.stackanalysis.model.ParameterBag;
import org.example.stackanalysis.model.PipelineResult;
import org.example.stackanalysis.service.AnalysisPipeline;
import org.example.stackanalysis.variant.AnalysisVariant;
import org.example.stackanalysis.variant.CorrelationVariant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class AnalysisControllerTest {

    private AnalysisPipeline pipeline;
    private MockMvc mvc;
    private final CorrelationVariant correlation = new CorrelationVariant();

    @BeforeEach
    void setUp() {
        pipeline = mock(AnalysisPipeline.class);
        when(pipeline.findVariant(anyString())).thenReturn(Optional.empty());
        when(pipeline.findVariant("correlation")).thenReturn(Optional.of(correlation));
        when(pipeline.getVariants()).thenReturn(List.of(correlation));
        mvc = MockMvcBuilders.standaloneSetup(new AnalysisController(pipeline)).build();
    }

    @Test
    void listsVariants() throws Exception {
        mvc.perform(get("/api/analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("correlation"));
    }

    @Test
    void returnsDefaults() throws Exception {
        mvc.perform(get("/api/analysis/correlation/defaults"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.Method").value("Otsu"))
                .andExpect(jsonPath("$.Intersect").value(true));
    }

    @Test
    void runReportsProcessedCount() throws Exception {
        when(pipeline.run(eq(correlation), any())).thenReturn(PipelineResult.processed(1));

        mvc.perform(post("/api/analysis/correlation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"IDs\": [42], \"Upload results\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.variant").value("correlation"))
                .andExpect(jsonPath("$.processed").value(1))
                .andExpect(jsonPath("$.message").value("Processed 1 image"));

        ArgumentCaptor<ParameterBag> bag = ArgumentCaptor.forClass(ParameterBag.class);
        verify(pipeline).run(eq(correlation), bag.capture());
        assertEquals(List.of(42L), bag.getValue().getLongList(ParameterBag.IDS));
        assertEquals(true, bag.getValue().getBoolean(ParameterBag.UPLOAD_RESULTS));
    }

    @Test
    void validationFailureIsBadRequest() throws Exception {
        when(pipeline.run(eq(correlation), any()))
                .thenReturn(PipelineResult.validationFailure(List.of("No images selected")));

        mvc.perform(post("/api/analysis/correlation"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.processed").value(-1))
                .andExpect(jsonPath("$.message").value("Errors found in the input parameters"))
                .andExpect(jsonPath("$.violations[0]").value("No images selected"));
    }

    @Test
    void unknownVariantIsNotFound() throws Exception {
        mvc.perform(post("/api/analysis/deconvolution")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound());
        verify(pipeline, never()).run(any(AnalysisVariant.class), any());
    }
}
