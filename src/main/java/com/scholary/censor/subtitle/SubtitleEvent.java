package com.scholary.censor.subtitle;

/**
 * One subtitle dialogue event.
 *
 * <p>Times are milliseconds from the start of the track. Masking only ever replaces the
 * text; the timing is never touched.
 */
public record SubtitleEvent(long startMs, long endMs, String text) {

  public SubtitleEvent {
    if (text == null) {
      text = "";
    }
  }

  public SubtitleEvent withText(String newText) {
    return new SubtitleEvent(startMs, endMs, newText);
  }
}
