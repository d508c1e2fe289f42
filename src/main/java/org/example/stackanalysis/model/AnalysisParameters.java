package org.example.stackanalysis.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of one run. Built by the validator only after every check
 * passed, and never changed afterwards.
 */
@Getter
@Builder
@ToString
public class AnalysisParameters {
    private final ThresholdMethod method;

    private final String channel1;
    private final String channel2;
    /** Optional; null when no third (mask) channel was requested. */
    private final String channel3;

    private final int permutations;
    private final int minimumShift;
    private final int maximumShift;
    private final double significance;

    private final boolean intersect;
    private final boolean aggregateStack;

    private final boolean uploadResults;
    private final boolean emailResults;
    private final String email;

    public List<String> getChannelSelectors() {
        List<String> channels = new ArrayList<>();
        if (channel1 != null) channels.add(channel1);
        if (channel2 != null) channels.add(channel2);
        if (channel3 != null) channels.add(channel3);
        return channels;
    }
}
