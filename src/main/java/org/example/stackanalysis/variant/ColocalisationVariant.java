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
 * Confined Displacement Algorithm analysis of channel 1 against channel 2,
 * optionally restricted to the mask of channel 3.
 */
@Component
public class ColocalisationVariant implements AnalysisVariant {

    static final String NONE_TOKEN = "[None]";

    private final CaptureGrammar grammar = new ResultsTableGrammar();

    @Override
    public String getName() {
        return "Colocalisation";
    }

    @Override
    public String getKey() {
        return "colocalisation";
    }

    @Override
    public Map<String, Object> getDefaults() {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(ParameterBag.DATA_TYPE, "Image");
        d.put(ParameterBag.CHANNEL_1, "1");
        d.put(ParameterBag.CHANNEL_2, "2");
        d.put(ParameterBag.CHANNEL_3, null);
        d.put(ParameterBag.METHOD, "Otsu");
        d.put(ParameterBag.PERMUTATIONS, 100);
        d.put(ParameterBag.MIN_SHIFT, 9);
        d.put(ParameterBag.MAX_SHIFT, 16);
        d.put(ParameterBag.SIGNIFICANCE, 0.05);
        d.put(ParameterBag.UPLOAD_RESULTS, false);
        d.put(ParameterBag.EMAIL_RESULTS, true);
        d.put(ParameterBag.EMAIL, null);
        return d;
    }

    @Override
    public List<String> checkParameters(AnalysisParameters p, List<ImageRef> images) {
        List<String> errors = new ArrayList<>();
        if (p.getChannel1() == null) errors.add("Channel 1 is required");
        if (p.getChannel2() == null) errors.add("Channel 2 is required");

        for (ImageRef img : images) {
            for (String c : p.getChannelSelectors()) {
                if (img.findChannelIndex(c) < 0) {
                    errors.add(String.format("Image %d: %s does not have channel: %s",
                            img.getId(), img.getName(), c));
                }
            }
        }

        if (p.getPermutations() < 1) {
            errors.add("Permutations (" + p.getPermutations() + ") must be at least 1");
        }
        if (p.getMinimumShift() < 1) {
            errors.add("Minimum shift (" + p.getMinimumShift() + ") must be at least 1");
        }
        if (p.getMaximumShift() < 2) {
            errors.add("Maximum shift (" + p.getMaximumShift() + ") must be at least 2");
        }
        if (p.getMaximumShift() <= p.getMinimumShift()) {
            errors.add(String.format("Maximum shift (%d) is not greater than minimum shift (%d)",
                    p.getMaximumShift(), p.getMinimumShift()));
        }
        if (!(p.getSignificance() >= 0 && p.getSignificance() <= 1)) {
            errors.add("Significance (" + p.getSignificance() + ") must be between 0 and 1");
        }
        return errors;
    }

    @Override
    public String buildCommand(ImageRef image, Path localFile, AnalysisParameters p) {
        int c1 = image.findChannelIndex(p.getChannel1());
        int c2 = image.findChannelIndex(p.getChannel2());
        int c3 = p.getChannel3() == null ? -1 : image.findChannelIndex(p.getChannel3());

        String args = "log_results"
                + " method=" + p.getMethod().getLabel()
                + " permutations=" + p.getPermutations()
                + " minimum_shift=" + p.getMinimumShift()
                + " maximum_shift=" + p.getMaximumShift()
                + " significance=" + p.getSignificance();
        String channels = String.format("channel_1=%d channel_2=%d channel_3=%s",
                c1 + 1, c2 + 1, c3 >= 0 ? String.valueOf(c3 + 1) : NONE_TOKEN);

        return "// Stack colocalisation analyser macro\n"
                + "open(\"" + AnalysisVariant.macroPath(localFile) + "\");\n"
                + AnalysisVariant.hyperstackCommand(image)
                + "run(\"Stack Colocalisation Analyser\", \"" + args + " " + channels + "\");\n"
                + "close();\n";
    }

    @Override
    public CaptureGrammar getGrammar() {
        return grammar;
    }

    @Override
    public String resultFilenameSuffix(AnalysisParameters p) {
        List<String> name = new ArrayList<>();
        name.add(getName());
        name.add(p.getMethod().getLabel());
        name.add("Ch" + p.getChannel1());
        name.add("Ch" + p.getChannel2());
        if (p.getChannel3() != null) {
            name.add("Ch" + p.getChannel3());
        }
        return String.join("_", name) + ".csv";
    }

    @Override
    public String getReportColumns() {
        return "p,Method,Frame,Ch1,Ch2,Ch3,n,Area,M1,Sig,M2,Sig,R,Sig";
    }

    @Override
    public List<String> describeParameters(AnalysisParameters p) {
        return List.of(
                "Channel 1     : " + p.getChannel1(),
                "Channel 2     : " + p.getChannel2(),
                "Channel 3     : " + p.getChannel3(),
                "Method        : " + p.getMethod().getLabel(),
                "Permutations  : " + p.getPermutations(),
                "Minimum shift : " + p.getMinimumShift(),
                "Maximum shift : " + p.getMaximumShift(),
                "Significance  : " + p.getSignificance());
    }

    @Override
    public String getAttachmentNamespace() {
        return "gdsc.sussex.ac.uk/colocalisation";
    }

    @Override
    public String getEmailSubject() {
        return "[OMERO Job] Colocalisation analysis";
    }
}
