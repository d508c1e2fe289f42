package org.example.stackanalysis.dto.response;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data @Builder
public class PipelineRunResponse {
    private String variant;
    private int processed;
    private String message;
    private List<String> violations;
}
