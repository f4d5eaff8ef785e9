package com.scholary.censor.masking;

import com.scholary.censor.matching.MatchResult;
import java.util.List;

/**
 * Result of masking one line.
 *
 * @param maskedText the line with every located match replaced by asterisks
 * @param unredacted matches whose text could not be found in the original line; they left no
 *     visible trace in {@code maskedText}
 */
public record Redaction(String maskedText, List<MatchResult> unredacted) {

  public Redaction {
    unredacted = List.copyOf(unredacted);
  }

  public boolean fullyRedacted() {
    return unredacted.isEmpty();
  }
}
