package org.example.stackanalysis.service;

import org.example.stackanalysis.service.impl.Workspace;

import java.nio.file.Path;

/**
 * Runs the external analysis tool on a macro and captures what it prints.
 */
public interface ProcessRunner {

    /**
     * Blocks until the tool exits. There is no timeout.
     *
     * @return the file holding the tool's standard output, inside the workspace
     */
    Path run(Path script, Workspace workspace, String captureFileName) throws ProcessFailureException;
}
