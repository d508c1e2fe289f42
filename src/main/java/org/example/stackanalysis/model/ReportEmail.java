package org.example.stackanalysis.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ReportEmail {
    private String subject;
    private String body;
    private String attachmentName;
    private String attachmentText;
}
