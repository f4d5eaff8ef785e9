package com.scholary.censor.service;

import com.scholary.censor.record.MatchRecord;
import com.scholary.censor.subtitle.SubtitleEvent;
import java.util.List;

/**
 * Result of masking a subtitle track.
 *
 * @param events all events in source order, text masked where something matched
 * @param records one record per match, in event order then match order
 */
public record MaskingReport(List<SubtitleEvent> events, List<MatchRecord> records) {

  public boolean hasMatches() {
    return !records.isEmpty();
  }
}
