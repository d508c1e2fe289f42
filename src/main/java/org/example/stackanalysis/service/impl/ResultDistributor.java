package org.example.stackanalysis.service.impl;

import lombok.RequiredArgsConstructor;
import org.apache.commons.csv.CSVFormat;
import org.example.stackanalysis.model.AnalysisParameters;
import org.example.stackanalysis.model.ImageRef;
import org.example.stackanalysis.model.Report;
import org.example.stackanalysis.model.ReportEmail;
import org.example.stackanalysis.model.ResultBlock;
import org.example.stackanalysis.repository.ImageStore;
import org.example.stackanalysis.service.ReportMailer;
import org.example.stackanalysis.variant.AnalysisVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Hands the parsed results back to the user: as attachments on each image,
 * and as one CSV report sent by e-mail.
 */
@Service
@RequiredArgsConstructor
public class ResultDistributor {

    private static final Logger logger = LoggerFactory.getLogger(ResultDistributor.class);

    static final String REPORT_PREFIX_COLUMNS = "Project,Dataset,Image ID,Name";
    static final String REPORT_ATTACHMENT = "results.csv";

    private final ImageStore imageStore;
    private final ReportMailer reportMailer;

    /**
     * Uploads and/or e-mails the results as the parameters ask. Failures are logged per
     * image or message and do not undo what was already delivered.
     *
     * @param images images of the run, by id; results for other ids are not reported
     */
    public Report distribute(Map<Long, ResultBlock> results, AnalysisParameters parameters,
                             Map<Long, ImageRef> images, AnalysisVariant variant, Workspace workspace) {
        if (parameters.isUploadResults()) {
            uploadResults(results, parameters, images, variant, workspace);
        }

        Report report = createReport(results, images, variant);
        report.getRows().forEach(logger::info);

        if (parameters.isEmailResults()) {
            emailResults(results, report, parameters, images, variant);
        }
        return report;
    }

    public static String attachmentName(long imageId, AnalysisParameters parameters, AnalysisVariant variant) {
        return imageId + "." + variant.resultFilenameSuffix(parameters);
    }

    void uploadResults(Map<Long, ResultBlock> results, AnalysisParameters parameters,
                       Map<Long, ImageRef> images, AnalysisVariant variant, Workspace workspace) {
        for (ResultBlock block : results.values()) {
            long id = block.getImageId();
            if (!images.containsKey(id)) continue;

            String name = attachmentName(id, parameters, variant);
            Path tmp = null;
            try {
                tmp = workspace.newTempFile("result", ".csv");
                Files.writeString(tmp, block.toText(), StandardCharsets.UTF_8);
                imageStore.attach(id, name, Files.readAllBytes(tmp), variant.getAttachmentNamespace());
                logger.info("Uploaded {} to image {}", name, id);
            } catch (IOException | RuntimeException e) {
                logger.error("Cannot upload {} to image {}", name, id, e);
            } finally {
                if (tmp != null) workspace.delete(tmp);
            }
        }
    }

    public Report createReport(Map<Long, ResultBlock> results, Map<Long, ImageRef> images, AnalysisVariant variant) {
        Report report = new Report(REPORT_PREFIX_COLUMNS + "," + variant.getReportColumns());
        for (ResultBlock block : results.values()) {
            ImageRef img = images.get(block.getImageId());
            if (img == null) continue;
            String prefix = CSVFormat.DEFAULT.format(
                    orDash(img.getProjectName()), orDash(img.getDatasetName()),
                    img.getId(), img.getBaseName());
            for (String row : block.getRows()) {
                report.addRow(prefix + "," + row);
            }
        }
        return report;
    }

    void emailResults(Map<Long, ResultBlock> results, Report report, AnalysisParameters parameters,
                      Map<Long, ImageRef> images, AnalysisVariant variant) {
        ReportEmail email = ReportEmail.builder()
                .subject(variant.getEmailSubject())
                .body(emailBody(results, parameters, images, variant))
                .attachmentName(REPORT_ATTACHMENT)
                .attachmentText(report.toCsv())
                .build();
        try {
            reportMailer.sendReport(email, parameters.getEmail());
        } catch (RuntimeException e) {
            logger.error("Cannot e-mail results to {}", parameters.getEmail(), e);
        }
    }

    String emailBody(Map<Long, ResultBlock> results, AnalysisParameters parameters,
                     Map<Long, ImageRef> images, AnalysisVariant variant) {
        List<String> names = new ArrayList<>();
        for (Long id : results.keySet()) {
            ImageRef img = images.get(id);
            if (img == null) continue;
            names.add(String.format("[%s][%s] Image %d : %s",
                    orDash(img.getProjectName()), orDash(img.getDatasetName()), id, img.getBaseName()));
        }
        return variant.getName() + " analysis performed on:\n\n"
                + String.join("\n", names) + "\n\n"
                + "Parameters: \n\n"
                + String.join("\n", variant.describeParameters(parameters)) + "\n\n"
                + "Your analysis results are attached.\n\n"
                + "---\n"
                + "OMERO @ " + hostName() + " ";
    }

    private static String orDash(String s) {
        return s == null || s.isBlank() ? "-" : s;
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
