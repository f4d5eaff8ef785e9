package com.scholary.censor.service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Files written by a masking run.
 *
 * @param maskedSubtitles the masked SRT file
 * @param matchesCsv the match CSV, absent when nothing matched
 * @param records number of match records written
 */
public record MaskingOutput(Path maskedSubtitles, Optional<Path> matchesCsv, int records) {}
