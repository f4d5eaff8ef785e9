package com.scholary.censor.matching;

import com.scholary.censor.catalog.Term;

/**
 * A scored match of one term against one window of normalized words.
 *
 * <p>There are no offsets: the masker re-locates {@code windowText} in the original text on
 * its own.
 *
 * @param term the term that matched
 * @param windowText the normalized words that produced the score, joined by single spaces
 * @param score similarity score, 0-100
 */
public record MatchResult(Term term, String windowText, double score) {}
