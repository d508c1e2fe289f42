package org.example.stackanalysis.service.impl;

import org.example.stackanalysis.service.ProcessFailureException;
import org.example.stackanalysis.service.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs headless ImageJ in batch mode:
 * {@code java -cp <classpath> -Djava.awt.headless=true ij.ImageJ -ijpath <imagej> -batch <macro>}.
 * The classpath must list the headless jar before {@code ij.jar}, and the ImageJ
 * plugins directory must hold the GDSC plugins.
 */
@Service
public class ImageJProcessRunner implements ProcessRunner {

    private static final Logger logger = LoggerFactory.getLogger(ImageJProcessRunner.class);

    @Value("${analysis.imagej.java:java}")
    private String javaBin = "java";

    @Value("${analysis.imagej.classpath:/usr/local/ImageJ/headless.jar:/usr/local/ImageJ/ij.jar}")
    private String classpath = "/usr/local/ImageJ/headless.jar:/usr/local/ImageJ/ij.jar";

    @Value("${analysis.imagej.path:/usr/local/ImageJ}")
    private String imagejPath = "/usr/local/ImageJ";

    /** Replaces the ImageJ command when set; the macro path is appended as last argument. */
    @Value("${analysis.imagej.command:}")
    private List<String> commandOverride = List.of();

    List<String> command(Path script) {
        List<String> cmd = new ArrayList<>();
        if (commandOverride != null) {
            commandOverride.stream().filter(s -> s != null && !s.isBlank()).forEach(cmd::add);
        }
        if (cmd.isEmpty()) {
            cmd.add(javaBin);
            cmd.add("-cp");
            cmd.add(classpath);
            cmd.add("-Djava.awt.headless=true");
            cmd.add("ij.ImageJ");
            cmd.add("-ijpath");
            cmd.add(imagejPath);
            cmd.add("-batch");
        }
        cmd.add(script.toAbsolutePath().toString());
        return cmd;
    }

    @Override
    public Path run(Path script, Workspace workspace, String captureFileName) throws ProcessFailureException {
        Path capture = workspace.newFile(captureFileName);
        List<String> cmd = command(script);
        logger.info("Script command = {}", String.join(" ", cmd));

        ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.directory(workspace.path().toFile());
        pb.redirectOutput(capture.toFile());
        pb.redirectError(ProcessBuilder.Redirect.INHERIT);

        int exit;
        try {
            exit = pb.start().waitFor();
        } catch (IOException e) {
            throw new ProcessFailureException("Execution failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessFailureException("Interrupted waiting for " + cmd.get(0), e);
        }
        if (exit != 0) {
            throw new ProcessFailureException(exit);
        }
        return capture;
    }
}
