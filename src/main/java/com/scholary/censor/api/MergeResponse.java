package com.scholary.censor.api;

import com.scholary.censor.interval.Interval;
import java.util.List;

public record MergeResponse(List<Interval> intervals) {}
