package com.scholary.censor.qc;

/**
 * Mean loudness measured over one span of audio.
 *
 * @param start span start in seconds
 * @param end span end in seconds
 * @param meanVolumeDb mean volume in dBFS (negative, 0 is full scale)
 */
public record VolumeSample(double start, double end, double meanVolumeDb) {}
