package org.example.stackanalysis.service;

import org.example.stackanalysis.model.ParameterBag;
import org.example.stackanalysis.model.PipelineResult;
import org.example.stackanalysis.variant.AnalysisVariant;

import java.util.List;
import java.util.Optional;

public interface AnalysisPipeline {
    PipelineResult run(AnalysisVariant variant, ParameterBag parameters);
    Optional<AnalysisVariant> findVariant(String key);
    List<AnalysisVariant> getVariants();
}
