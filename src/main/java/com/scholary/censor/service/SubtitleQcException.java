package com.scholary.censor.service;

/** Exception thrown when masked subtitles still contain configured terms. */
public class SubtitleQcException extends RuntimeException {

  private final int hits;

  public SubtitleQcException(int hits) {
    super("Subtitle QC failed: found " + hits + " profanity occurrences in masked subtitles");
    this.hits = hits;
  }

  public int getHits() {
    return hits;
  }
}
