package com.scholary.censor.matching;

import java.util.List;
import java.util.Set;

/** Fixed word tables used by the matcher. Immutable, shared by all threads. */
final class MatchingTables {

  /**
   * Closed-class words that never count as a match on their own, whatever the threshold.
   * Without this, loose thresholds flag "a", "it" and friends all over the place.
   */
  static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "the", "and", "or", "but", "if", "then", "else",
          "of", "to", "in", "on", "for", "by", "with", "at", "from",
          "as", "is", "it", "its", "be", "are", "was", "were", "am",
          "he", "she", "they", "we", "you", "i", "me", "him", "her",
          "them", "us", "my", "your", "his", "their", "our");

  /** Inflections treated as the same word ("damn" / "damned" / "damning"). */
  static final List<String> BASE_SUFFIXES = List.of("s", "ed", "er", "ing", "in");

  /** Base suffixes plus derivational ones, for aggressive terms. */
  static final List<String> AGGRESSIVE_SUFFIXES =
      List.of(
          "s", "ed", "er", "ing", "in",
          "ly", "ness", "able", "ible", "ful", "less", "ward", "wise",
          "like", "ish", "ment", "tion", "sion");

  /** Particles allowed to bracket an aggressive term ("misuse", "upshot"). */
  static final List<String> COMPOUND_PARTICLES =
      List.of(
          "un", "re", "pre", "mis", "dis", "over", "under", "out", "up", "down",
          "back", "fore", "anti", "pro", "semi", "multi", "non", "sub", "super",
          "inter", "intra", "extra", "ultra", "mega", "mini", "micro", "macro");

  private MatchingTables() {}
}
