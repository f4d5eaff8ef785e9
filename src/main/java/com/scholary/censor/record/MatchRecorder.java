package com.scholary.censor.record;

import com.scholary.censor.matching.MatchResult;
import com.scholary.censor.subtitle.SubtitleEvent;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Projects the matches of one subtitle event into flat records, one per match. */
@Component
public class MatchRecorder {

  /**
   * Build records for one event.
   *
   * <p>Every record of the event shares its timing and both text snapshots. Nothing is merged,
   * so two terms matching the same word give two records.
   *
   * @param event the event as it was before masking
   * @param maskedText the event's text after masking
   * @param matches matches found in the event, in match order
   * @return one record per match, in the same order
   */
  public List<MatchRecord> record(SubtitleEvent event, String maskedText, List<MatchResult> matches) {
    List<MatchRecord> records = new ArrayList<>(matches.size());
    for (MatchResult match : matches) {
      records.add(
          new MatchRecord(
              event.startMs(),
              event.endMs(),
              match.windowText(),
              match.term().word(),
              match.score(),
              event.text(),
              maskedText));
    }
    return records;
  }
}
