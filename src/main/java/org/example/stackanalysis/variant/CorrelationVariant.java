package org.example.stackanalysis.variant;

import org.example.stackanalysis.model.AnalysisParameters;
import org.example.stackanalysis.model.ImageRef;
import org.example.stackanalysis.model.ParameterBag;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All-vs-all channel correlation within the thresholded foreground of each channel.
 */
@Component
public class CorrelationVariant implements AnalysisVariant {

    private final CaptureGrammar grammar = new StageLabelGrammar();

    @Override
    public String getName() {
        return "Correlation";
    }

    @Override
    public String getKey() {
        return "correlation";
    }

    @Override
    public Map<String, Object> getDefaults() {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(ParameterBag.DATA_TYPE, "Image");
        d.put(ParameterBag.METHOD, "Otsu");
        d.put(ParameterBag.INTERSECT, true);
        d.put(ParameterBag.AGGREGATE_STACK, true);
        d.put(ParameterBag.UPLOAD_RESULTS, false);
        d.put(ParameterBag.EMAIL_RESULTS, true);
        d.put(ParameterBag.EMAIL, null);
        return d;
    }

    @Override
    public List<String> checkParameters(AnalysisParameters parameters, List<ImageRef> images) {
        // Every channel pair is analysed, so channel selectors have no meaning here.
        List<String> errors = new ArrayList<>();
        String[] channels = {parameters.getChannel1(), parameters.getChannel2(), parameters.getChannel3()};
        for (int i = 0; i < channels.length; i++) {
            if (channels[i] != null) {
                errors.add("Channel " + (i + 1) + " is not used by the correlation analysis: " + channels[i]);
            }
        }
        return errors;
    }

    @Override
    public String buildCommand(ImageRef image, Path localFile, AnalysisParameters p) {
        return "// Stack correlation analyser macro\n"
                + "open(\"" + AnalysisVariant.macroPath(localFile) + "\");\n"
                + AnalysisVariant.hyperstackCommand(image)
                + "run(\"Stack Correlation Analyser\", \"" + String.join(" ", arguments(p)) + "\");\n"
                + "close();\n";
    }

    private static List<String> arguments(AnalysisParameters p) {
        List<String> args = new ArrayList<>();
        args.add("method=" + p.getMethod().getLabel());
        if (p.isIntersect()) args.add("intersect");
        if (p.isAggregateStack()) args.add("aggregate");
        return args;
    }

    @Override
    public CaptureGrammar getGrammar() {
        return grammar;
    }

    @Override
    public String getScriptFileName() {
        return "correlate.ijm";
    }

    @Override
    public String getCaptureFileName() {
        return "correlate.stdout";
    }

    @Override
    public String resultFilenameSuffix(AnalysisParameters p) {
        List<String> name = new ArrayList<>();
        name.add(getName());
        name.add(p.getMethod().getLabel());
        if (p.isIntersect()) name.add("Intersect");
        if (p.isAggregateStack()) name.add("Aggregate");
        return String.join("_", name) + ".csv";
    }

    @Override
    public String getReportColumns() {
        return "Frame,Channel A,Channel B,No of pixels,Overlap,Correlation";
    }

    @Override
    public List<String> describeParameters(AnalysisParameters p) {
        return List.of(
                "Method            : " + p.getMethod().getLabel(),
                "Intersect         : " + p.isIntersect(),
                "Aggregate z-stack : " + p.isAggregateStack());
    }

    @Override
    public String getAttachmentNamespace() {
        return "gdsc.sussex.ac.uk/correlation";
    }

    @Override
    public String getEmailSubject() {
        return "[OMERO Job] Correlation analysis";
    }
}
