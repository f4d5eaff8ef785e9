package com.scholary.censor.interval;

/**
 * A time interval in seconds.
 *
 * <p>Used for mute windows, QC control spans and the gaps between them. Times are seconds
 * with fractional precision.
 */
public record Interval(double start, double end) {

  public Interval {
    if (Double.isNaN(start) || Double.isNaN(end)) {
      throw new IllegalArgumentException("Interval bounds cannot be NaN");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  /** Build an interval from millisecond bounds. */
  public static Interval ofMillis(long startMs, long endMs) {
    return new Interval(startMs / 1000.0, endMs / 1000.0);
  }

  public double duration() {
    return end - start;
  }
}
