package com.scholary.censor.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.censor.subtitle.SubtitleEvent;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request for masking a batch of subtitle events.
 *
 * <p>{@code terms} takes the same shapes as a catalog file: an array of words and objects, or
 * an object with a {@code profanities} array.
 */
public record MaskRequest(
    @NotNull JsonNode terms,
    @NotNull List<SubtitleEvent> units,
    @DecimalMin("0.0") @DecimalMax("100.0") Double defaultThreshold) {}
