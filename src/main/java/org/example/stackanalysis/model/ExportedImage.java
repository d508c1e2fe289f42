package org.example.stackanalysis.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.nio.file.Path;

@Getter
@RequiredArgsConstructor
public class ExportedImage {
    private final ImageRef image;
    private final Path localFile;
}
