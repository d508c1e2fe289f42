package org.example.stackanalysis.model;

import lombok.Getter;

import java.util.List;

/**
 * Outcome of a pipeline run: either a processed image count (zero included)
 * or the validation problems that stopped the run before it started.
 */
@Getter
public class PipelineResult {

    public static final int VALIDATION_FAILED = -1;

    private final int processedCount;
    private final List<String> violations;

    private PipelineResult(int processedCount, List<String> violations) {
        this.processedCount = processedCount;
        this.violations = List.copyOf(violations);
    }

    public static PipelineResult processed(int count) {
        if (count < 0) throw new IllegalArgumentException("count < 0: " + count);
        return new PipelineResult(count, List.of());
    }

    public static PipelineResult validationFailure(List<String> violations) {
        return new PipelineResult(VALIDATION_FAILED, violations);
    }

    public boolean isValidationFailure() {
        return processedCount == VALIDATION_FAILED;
    }

    public String getMessage() {
        if (isValidationFailure()) {
            return "Errors found in the input parameters";
        }
        return "Processed " + processedCount + " image" + (processedCount != 1 ? "s" : "");
    }
}
