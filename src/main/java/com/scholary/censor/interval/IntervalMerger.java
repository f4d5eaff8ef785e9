package com.scholary.censor.interval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Merges time intervals and extracts the gaps between them.
 *
 * <p>Used twice downstream of matching: mute windows are merged before they reach the
 * transcoder, and audio QC samples control spans from the gaps between merged windows.
 */
public final class IntervalMerger {

  /** Default adjacency tolerance: one millisecond. */
  public static final double DEFAULT_EPSILON = 0.001;

  public static final double DEFAULT_SAMPLE_SECONDS = 1.0;
  public static final int DEFAULT_MAX_SAMPLES = 5;

  private static final Comparator<Interval> BY_START_THEN_END =
      Comparator.comparingDouble(Interval::start).thenComparingDouble(Interval::end);

  private IntervalMerger() {}

  public static List<Interval> merge(Collection<Interval> intervals) {
    return merge(intervals, DEFAULT_EPSILON);
  }

  /**
   * Merge overlapping or near-adjacent intervals.
   *
   * <p>Algorithm: sort by (start, end), then walk the list keeping one open interval. An
   * interval starting no later than {@code open.end + epsilon} extends it; anything else
   * closes it and opens a new one.
   *
   * <p>Example: [1.0-2.0], [1.9-2.1], [3.0-3.2] merges into [1.0-2.1], [3.0-3.2].
   *
   * @param intervals intervals in any order
   * @param epsilon largest gap still treated as adjacency
   * @return minimal list of intervals, sorted by start
   */
  public static List<Interval> merge(Collection<Interval> intervals, double epsilon) {
    if (intervals.isEmpty()) {
      return List.of();
    }

    List<Interval> sorted = new ArrayList<>(intervals);
    sorted.sort(BY_START_THEN_END);

    List<Interval> merged = new ArrayList<>();
    Interval open = sorted.get(0);
    for (int i = 1; i < sorted.size(); i++) {
      Interval next = sorted.get(i);
      if (next.start() <= open.end() + epsilon) {
        open = new Interval(open.start(), Math.max(open.end(), next.end()));
      } else {
        merged.add(open);
        open = next;
      }
    }
    merged.add(open);
    return merged;
  }

  /**
   * Find the gaps between merged intervals inside {@code [0, total]}.
   *
   * @param merged merged intervals, sorted by start (output of {@link #merge})
   * @param total end of the timeline in seconds
   * @param minLength shortest gap worth returning
   * @param maxCount maximum number of gaps to return
   * @return maximal gaps of at least {@code minLength}, sorted, at most {@code maxCount}
   */
  public static List<Interval> gaps(
      List<Interval> merged, double total, double minLength, int maxCount) {
    if (minLength < 0) {
      throw new IllegalArgumentException("Minimum gap length cannot be negative");
    }
    List<Interval> gaps = new ArrayList<>();
    double cursor = 0.0;

    for (Interval window : merged) {
      if (gaps.size() >= maxCount) {
        return gaps;
      }
      double gapEnd = Math.min(window.start(), total);
      if (gapEnd - cursor >= minLength) {
        gaps.add(new Interval(cursor, gapEnd));
      }
      cursor = Math.max(cursor, window.end());
    }

    if (gaps.size() < maxCount && total - cursor >= minLength) {
      gaps.add(new Interval(cursor, total));
    }
    return gaps;
  }

  public static List<Interval> controlSpans(List<Interval> merged, double total) {
    return controlSpans(merged, total, DEFAULT_SAMPLE_SECONDS, DEFAULT_MAX_SAMPLES);
  }

  /**
   * Pick control spans for audio QC: the first {@code sampleLength} seconds of each gap.
   *
   * @param merged merged mute windows
   * @param total audio duration in seconds
   * @param sampleLength length of each control span
   * @param maxSamples maximum number of spans
   * @return control spans, sorted, none overlapping a window
   */
  public static List<Interval> controlSpans(
      List<Interval> merged, double total, double sampleLength, int maxSamples) {
    List<Interval> spans = new ArrayList<>();
    for (Interval gap : gaps(merged, total, sampleLength, maxSamples)) {
      spans.add(new Interval(gap.start(), Math.min(gap.start() + sampleLength, gap.end())));
    }
    return spans;
  }
}
