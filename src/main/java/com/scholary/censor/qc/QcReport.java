package com.scholary.censor.qc;

import java.util.List;

/**
 * Audio QC verdict: muted spans must be quieter than control spans by at least the threshold.
 */
public record QcReport(
    double thresholdDb,
    double controlMeanDb,
    double muteMeanDb,
    double deltaDb,
    boolean passed,
    List<VolumeSample> muteSamples,
    List<VolumeSample> controlSamples) {}
