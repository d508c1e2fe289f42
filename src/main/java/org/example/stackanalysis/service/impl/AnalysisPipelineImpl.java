package org.example.stackanalysis.service.impl;

import lombok.RequiredArgsConstructor;
import org.example.stackanalysis.model.AnalysisParameters;
import org.example.stackanalysis.model.ExportedImage;
import org.example.stackanalysis.model.ImageRef;
import org.example.stackanalysis.model.ParameterBag;
import org.example.stackanalysis.model.PipelineResult;
import org.example.stackanalysis.model.ResultBlock;
import org.example.stackanalysis.repository.ImageStore;
import org.example.stackanalysis.service.AnalysisPipeline;
import org.example.stackanalysis.service.ParameterValidationException;
import org.example.stackanalysis.service.ProcessFailureException;
import org.example.stackanalysis.service.ProcessRunner;
import org.example.stackanalysis.variant.AnalysisVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validate, export, write the macro, run ImageJ, parse its output, distribute.
 * One run at a time per call, each in its own workspace.
 */
@Service
@RequiredArgsConstructor
public class AnalysisPipelineImpl implements AnalysisPipeline {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisPipelineImpl.class);

    /** Parent of the per-run workspaces; the system temp directory when empty. */
    @Value("${analysis.workspace.parent:}")
    private String workspaceParent;

    private final List<AnalysisVariant> variants;
    private final ImageStore imageStore;
    private final ParameterValidator validator;
    private final ImageExporter exporter;
    private final ScriptBuilder scriptBuilder;
    private final ProcessRunner processRunner;
    private final ResultExtractor extractor;
    private final ResultDistributor distributor;

    @Override
    public Optional<AnalysisVariant> findVariant(String key) {
        return variants.stream().filter(v -> v.getKey().equalsIgnoreCase(key)).findFirst();
    }

    @Override
    public List<AnalysisVariant> getVariants() {
        return variants;
    }

    @Override
    public PipelineResult run(AnalysisVariant variant, ParameterBag bag) {
        logger.info("{} parameters = {}", variant.getName(), bag);

        List<ImageRef> images = resolveSelection(bag);
        AnalysisParameters parameters;
        try {
            parameters = validator.validate(variant, bag, images);
        } catch (ParameterValidationException e) {
            e.getViolations().forEach(v -> logger.error("ERROR: {}", v));
            return PipelineResult.validationFailure(e.getViolations());
        }

        Workspace workspace;
        try {
            workspace = Workspace.create(workspaceParentPath(), variant.getKey());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create workspace", e);
        }
        try {
            return PipelineResult.processed(execute(variant, parameters, images, workspace));
        } finally {
            workspace.dispose();
        }
    }

    private int execute(AnalysisVariant variant, AnalysisParameters parameters,
                        List<ImageRef> images, Workspace workspace) {
        List<ExportedImage> exported = exporter.export(images, workspace);
        if (exported.isEmpty()) {
            logger.error("ERROR: None of the {} selected image(s) could be exported", images.size());
            return 0;
        }

        Map<Long, ImageRef> byId = new LinkedHashMap<>();
        exported.forEach(e -> byId.put(e.getImage().getId(), e.getImage()));

        Map<Long, ResultBlock> results = runAnalysis(variant, parameters, exported, workspace);
        results.keySet().removeIf(id -> {
            if (byId.containsKey(id)) return false;
            logger.warn("Ignoring result for image {} which was not part of this run", id);
            return true;
        });

        if (results.isEmpty()) {
            logger.error("ERROR: No results generated for {} images", exported.size());
            return 0;
        }
        distributor.distribute(results, parameters, byId, variant, workspace);
        return results.size();
    }

    private Map<Long, ResultBlock> runAnalysis(AnalysisVariant variant, AnalysisParameters parameters,
                                               List<ExportedImage> exported, Workspace workspace) {
        try {
            Path macro = scriptBuilder.build(exported, parameters, variant, workspace);
            Path capture = processRunner.run(macro, workspace, variant.getCaptureFileName());
            return new LinkedHashMap<>(extractor.extract(capture, variant.getGrammar()));
        } catch (ProcessFailureException e) {
            logger.warn("{} analysis failed: {}", variant.getName(), e.getMessage());
        } catch (IOException e) {
            logger.error("{} analysis failed", variant.getName(), e);
        }
        return new LinkedHashMap<>();
    }

    /**
     * Images named by the selection, in selection order. Ids that do not resolve are skipped.
     */
    List<ImageRef> resolveSelection(ParameterBag bag) {
        List<ImageRef> images = new ArrayList<>();
        List<Long> ids;
        try {
            ids = bag.getLongList(ParameterBag.IDS);
        } catch (NumberFormatException e) {
            logger.error("ERROR: Invalid IDs: {}", bag.getString(ParameterBag.IDS));
            return images;
        }
        boolean datasets = "Dataset".equals(bag.getString(ParameterBag.DATA_TYPE));
        for (Long id : ids) {
            if (datasets) {
                List<ImageRef> children = imageStore.listImages(id);
                if (children.isEmpty()) logger.warn("Dataset {} has no images", id);
                images.addAll(children);
            } else {
                Optional<ImageRef> img = imageStore.getImage(id);
                if (img.isPresent()) images.add(img.get());
                else logger.warn("Image {} not found", id);
            }
        }
        return images;
    }

    private Path workspaceParentPath() {
        return workspaceParent == null || workspaceParent.isBlank() ? null : Paths.get(workspaceParent);
    }
}
