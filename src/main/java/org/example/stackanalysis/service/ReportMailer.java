package org.example.stackanalysis.service;

import org.example.stackanalysis.model.ReportEmail;

public interface ReportMailer {
    void sendReport(ReportEmail email, String recipient);
}
