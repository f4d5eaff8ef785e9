package com.scholary.censor.api;

import com.scholary.censor.record.MatchRecord;
import com.scholary.censor.subtitle.SubtitleEvent;
import java.util.List;

/** Masked events in request order, plus one record per match. */
public record MaskResponse(List<SubtitleEvent> units, List<MatchRecord> records) {}
