package com.scholary.censor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for matching, masking and the downstream muting/QC stages.
 *
 * <p>Bound from the {@code censor} prefix in application.yml.
 */
@ConfigurationProperties(prefix = "censor")
@Validated
public record CensorProperties(
    @NotNull @Valid MatchingProperties matching,
    @NotNull @Valid MaskingProperties masking,
    @NotNull @Valid IntervalProperties intervals,
    @NotNull @Valid QcProperties qc,
    @NotNull @Valid OutputProperties output) {

  public record MatchingProperties(
      @DecimalMin("0.0") @DecimalMax("100.0") double defaultThreshold) {}

  public record MaskingProperties(@Positive int threads, @Positive int queueSize) {}

  public record IntervalProperties(@PositiveOrZero double mergeEpsilon) {}

  public record QcProperties(
      @Positive double sampleSeconds, @Positive int maxSamples, double thresholdDb) {}

  public record OutputProperties(
      @NotBlank String maskedSubtitleFile,
      @NotBlank String matchesCsvFile,
      @NotBlank String windowsSidecarFile) {}
}
