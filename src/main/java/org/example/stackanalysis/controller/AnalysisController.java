package org.example.stackanalysis.controller;

import lombok.RequiredArgsConstructor;
import org.example.stackanalysis.dto.response.PipelineRunResponse;
import org.example.stackanalysis.model.ParameterBag;
import org.example.stackanalysis.model.PipelineResult;
import org.example.stackanalysis.service.AnalysisPipeline;
import org.example.stackanalysis.variant.AnalysisVariant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisPipeline pipeline;

    @GetMapping
    public List<String> variants() {
        return pipeline.getVariants().stream().map(AnalysisVariant::getKey).toList();
    }

    @GetMapping("/{variant}/defaults")
    public Map<String, Object> defaults(@PathVariable String variant) {
        return variant(variant).getDefaults();
    }

    /**
     * Runs the analysis synchronously; the request returns when ImageJ has finished
     * and the results were distributed.
     */
    @PostMapping("/{variant}")
    public ResponseEntity<PipelineRunResponse> run(@PathVariable String variant,
                                                   @RequestBody(required = false) Map<String, Object> body) {
        AnalysisVariant v = variant(variant);
        PipelineResult result;
        try {
            result = pipeline.run(v, new ParameterBag(body == null ? Map.of() : body));
        } catch (UncheckedIOException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
        }

        PipelineRunResponse response = PipelineRunResponse.builder()
                .variant(v.getKey())
                .processed(result.getProcessedCount())
                .message(result.getMessage())
                .violations(result.getViolations())
                .build();
        return result.isValidationFailure()
                ? ResponseEntity.badRequest().body(response)
                : ResponseEntity.ok(response);
    }

    private AnalysisVariant variant(String key) {
        return pipeline.findVariant(key)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "unknown analysis: " + key));
    }
}
