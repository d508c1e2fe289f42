package org.example.stackanalysis.variant;

import org.example.stackanalysis.model.AnalysisParameters;
import org.example.stackanalysis.model.ImageRef;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * The parts of an analysis that differ between the GDSC stack analysers.
 * Everything else (export, process control, distribution) is shared.
 */
public interface AnalysisVariant {

    /** Display name, used in attachment names and messages, e.g. {@code Colocalisation}. */
    String getName();

    /** Lower case identifier used in URLs and workspace file names. */
    String getKey();

    /** Default operator values, keyed as in {@link org.example.stackanalysis.model.ParameterBag}. */
    Map<String, Object> getDefaults();

    /**
     * Checks specific to this analysis. Every problem found is returned, not just the first.
     */
    List<String> checkParameters(AnalysisParameters parameters, List<ImageRef> images);

    /** Macro block that opens the exported file, runs the analyser on it and closes it. */
    String buildCommand(ImageRef image, Path localFile, AnalysisParameters parameters);

    CaptureGrammar getGrammar();

    /** File name suffix of per-image attachments, appended to {@code <imageId>.} */
    String resultFilenameSuffix(AnalysisParameters parameters);

    /** Report columns that follow {@code Project,Dataset,Image ID,Name}. */
    String getReportColumns();

    /** Parameter summary lines for the e-mail body. */
    List<String> describeParameters(AnalysisParameters parameters);

    String getAttachmentNamespace();

    String getEmailSubject();

    default String getScriptFileName() {
        return getKey() + ".ijm";
    }

    default String getCaptureFileName() {
        return getKey() + ".stdout";
    }

    /** Restates the dimensions so the analyser sees the stack in xyzct order. */
    static String hyperstackCommand(ImageRef image) {
        return String.format("run(\"Stack to Hyperstack...\", \"order=xyzct channels=%d slices=%d frames=%d\");\n",
                image.getSizeC(), image.getSizeZ(), image.getSizeT());
    }

    /** Forward slashes keep Windows paths valid inside macro string literals. */
    static String macroPath(Path p) {
        return p.toAbsolutePath().toString().replace('\\', '/');
    }
}
