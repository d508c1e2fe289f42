package org.example.stackanalysis.service.impl;

import org.example.stackanalysis.TestImages;
import org.example.stackanalysis.model.AnalysisParameters;
import org.example.stackanalysis.model.ImageRef;
import org.example.stackanalysis.model.Report;
import org.example.stackanalysis.model.ReportEmail;
import org.example.stackanalysis.model.ResultBlock;
import org.example.stackanalysis.model.ThresholdMethod;
import org.example.stackanalysis.repository.ImageStore;
import org.example.stackanalysis.service.ReportMailer;
import org.example.stackanalysis.variant.ColocalisationVariant;
import org.example.stackanalysis.variant.CorrelationVariant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailSendException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class ResultDistributorTest {

    @TempDir
    Path parent;

    private ImageStore store;
    private ReportMailer mailer;
    private ResultDistributor distributor;
    private Workspace workspace;

    private final CorrelationVariant corr = new CorrelationVariant();
    private final ImageRef img1 = TestImages.image(1, "/raw/a.tif", "D1", "P1", "c1", "c2");
    private final ImageRef img2 = TestImages.image(2, "b.tif", null, null, "c1", "c2");
    private Map<Long, ImageRef> images;
    private Map<Long, ResultBlock> results;

    @BeforeEach
    void setUp() throws IOException {
        store = mock(ImageStore.class);
        mailer = mock(ReportMailer.class);
        distributor = new ResultDistributor(store, mailer);
        workspace = Workspace.create(parent, "dist");

        images = new LinkedHashMap<>();
        images.put(1L, img1);
        images.put(2L, img2);
        results = new LinkedHashMap<>();
        results.put(1L, new ResultBlock(1, "Stack correlation (Otsu) : 1.ome.tif",
                List.of("t1,c1,c2,100,1%,0.5", "t2,c1,c2,101,1%,0.6")));
        results.put(2L, new ResultBlock(2, "Stack correlation (Otsu) : 2.ome.tif",
                List.of("t1,c1,c2,200,2%,0.7")));
    }

    @AfterEach
    void tearDown() {
        workspace.dispose();
    }

    private static AnalysisParameters.AnalysisParametersBuilder params() {
        return AnalysisParameters.builder().method(ThresholdMethod.OTSU);
    }

    @Test
    void reportHasOneRowPerResultLine() {
        Report report = distributor.createReport(results, images, corr);

        assertEquals(List.of(
                "Project,Dataset,Image ID,Name,Frame,Channel A,Channel B,No of pixels,Overlap,Correlation",
                "P1,D1,1,a.tif,t1,c1,c2,100,1%,0.5",
                "P1,D1,1,a.tif,t2,c1,c2,101,1%,0.6",
                "-,-,2,b.tif,t1,c1,c2,200,2%,0.7"), report.getRows());
        assertEquals(3, report.getDataRowCount());
    }

    @Test
    void reportQuotesMetadataContainingCommas() {
        ImageRef odd = TestImages.image(3, "x,y.tif", "D,1", "P1", "c1");
        Map<Long, ResultBlock> r = Map.of(3L, new ResultBlock(3, "h", List.of("t1,row")));

        Report report = distributor.createReport(r, Map.of(3L, odd), corr);

        assertEquals("P1,\"D,1\",3,\"x,y.tif\",t1,row", report.getRows().get(1));
    }

    @Test
    void uploadsOneAttachmentPerImage() throws IOException {
        AnalysisParameters p = params().uploadResults(true).build();

        distributor.distribute(results, p, images, corr, workspace);

        ArgumentCaptor<byte[]> content = ArgumentCaptor.forClass(byte[].class);
        verify(store).attach(eq(1L), eq("1.Correlation_Otsu.csv"), content.capture(), eq("gdsc.sussex.ac.uk/correlation"));
        assertEquals(results.get(1L).toText(), new String(content.getValue(), StandardCharsets.UTF_8));
        verify(store).attach(eq(2L), eq("2.Correlation_Otsu.csv"), any(byte[].class), anyString());
        verifyNoInteractions(mailer);
        assertWorkspaceEmpty();
    }

    @Test
    void failedUploadDoesNotStopOthers() throws IOException {
        doThrow(new IOException("server gone")).when(store)
                .attach(eq(1L), anyString(), any(byte[].class), anyString());

        Report report = distributor.distribute(results, params().uploadResults(true).build(), images, corr, workspace);

        verify(store).attach(eq(2L), anyString(), any(byte[].class), anyString());
        assertEquals(3, report.getDataRowCount());
        assertWorkspaceEmpty();
    }

    @Test
    void colocalisationAttachmentName() throws IOException {
        AnalysisParameters p = params().channel1("1").channel2("2").uploadResults(true).build();
        Map<Long, ResultBlock> one = Map.of(1L, results.get(1L));

        distributor.distribute(one, p, images, new ColocalisationVariant(), workspace);

        verify(store).attach(eq(1L), eq("1.Colocalisation_Otsu_Ch1_Ch2.csv"), any(byte[].class),
                eq("gdsc.sussex.ac.uk/colocalisation"));
    }

    @Test
    void emailsReportWhenRequested() throws IOException {
        AnalysisParameters p = params().emailResults(true).email("user@example.org").build();

        Report report = distributor.distribute(results, p, images, corr, workspace);

        ArgumentCaptor<ReportEmail> email = ArgumentCaptor.forClass(ReportEmail.class);
        verify(mailer).sendReport(email.capture(), eq("user@example.org"));
        ReportEmail sent = email.getValue();
        assertEquals("[OMERO Job] Correlation analysis", sent.getSubject());
        assertEquals("results.csv", sent.getAttachmentName());
        assertEquals(report.toCsv(), sent.getAttachmentText());
        assertTrue(sent.getBody().startsWith("Correlation analysis performed on:"));
        assertTrue(sent.getBody().contains("[P1][D1] Image 1 : a.tif"));
        assertTrue(sent.getBody().contains("[-][-] Image 2 : b.tif"));
        assertTrue(sent.getBody().contains("Method            : Otsu"));
        verify(store, never()).attach(anyLong(), anyString(), any(byte[].class), anyString());
    }

    @Test
    void mailFailureStillReturnsReport() {
        doThrow(new MailSendException("no smtp")).when(mailer).sendReport(any(), anyString());
        AnalysisParameters p = params().emailResults(true).email("user@example.org").build();

        Report report = distributor.distribute(results, p, images, corr, workspace);

        assertEquals(3, report.getDataRowCount());
    }

    @Test
    void resultsForUnknownImagesAreNotDistributed() throws IOException {
        Map<Long, ImageRef> onlyFirst = Map.of(1L, img1);

        Report report = distributor.distribute(results, params().uploadResults(true).build(), onlyFirst, corr, workspace);

        assertEquals(2, report.getDataRowCount());
        verify(store, never()).attach(eq(2L), anyString(), any(byte[].class), anyString());
    }

    private void assertWorkspaceEmpty() throws IOException {
        try (Stream<Path> s = Files.list(workspace.path())) {
            assertEquals(0, s.count());
        }
    }
}
