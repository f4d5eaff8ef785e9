package com.scholary.censor.api;

import com.scholary.censor.interval.Interval;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

/** Request for merging time intervals; {@code epsilon} defaults to the configured tolerance. */
public record MergeRequest(@NotNull List<Interval> intervals, @PositiveOrZero Double epsilon) {}
