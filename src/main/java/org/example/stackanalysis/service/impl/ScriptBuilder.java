package org.example.stackanalysis.service.impl;

import org.example.stackanalysis.model.AnalysisParameters;
import org.example.stackanalysis.model.ExportedImage;
import org.example.stackanalysis.variant.AnalysisVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the ImageJ macro that analyses every exported image in turn.
 */
@Service
public class ScriptBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ScriptBuilder.class);

    public Path build(List<ExportedImage> images, AnalysisParameters parameters,
                      AnalysisVariant variant, Workspace workspace) throws IOException {
        Path macro = workspace.newFile(variant.getScriptFileName());
        try (BufferedWriter out = Files.newBufferedWriter(macro, StandardCharsets.UTF_8)) {
            for (ExportedImage e : images) {
                out.write(variant.buildCommand(e.getImage(), e.getLocalFile(), parameters));
            }
        }
        logger.debug("Wrote macro {} for {} image(s)", macro, images.size());
        return macro;
    }
}
