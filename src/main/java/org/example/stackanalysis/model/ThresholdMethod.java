package org.example.stackanalysis.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Auto-threshold methods understood by the GDSC stack analysers.
 */
public enum ThresholdMethod {
    LI("Li"),
    MAX_ENTROPY("MaxEntropy"),
    MEAN("Mean"),
    MIN_ERROR("MinError(I)"),
    MOMENTS("Moments"),
    NONE("None"),
    OTSU("Otsu"),
    PERCENTILE("Percentile"),
    RENYI_ENTROPY("RenyiEntropy"),
    TRIANGLE("Triangle"),
    YEN("Yen");

    private final String label;

    ThresholdMethod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<ThresholdMethod> fromLabel(String label) {
        return Arrays.stream(values()).filter(m -> m.label.equals(label)).findFirst();
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(ThresholdMethod::getLabel).toList();
    }
}
