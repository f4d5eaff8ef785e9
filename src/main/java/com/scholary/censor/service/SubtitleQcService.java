package com.scholary.censor.service;

import com.scholary.censor.catalog.Term;
import com.scholary.censor.catalog.TermCatalog;
import com.scholary.censor.catalog.TermCatalogLoader;
import com.scholary.censor.config.CensorProperties;
import com.scholary.censor.logging.StructuredLogger;
import com.scholary.censor.masking.Masker;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Checks that masked subtitles no longer contain any configured term.
 *
 * <p>This is a literal check: each term word is searched as a whole word, case-insensitively.
 * Fuzzy variants are not searched again; they were masked by the matching pass or recorded as
 * unredacted there.
 */
@Service
public class SubtitleQcService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleQcService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final TermCatalogLoader catalogLoader;
  private final CensorProperties properties;

  public SubtitleQcService(TermCatalogLoader catalogLoader, CensorProperties properties) {
    this.catalogLoader = catalogLoader;
    this.properties = properties;
  }

  /**
   * Check masked subtitle text.
   *
   * @param maskedText the masked subtitle content
   * @param catalog the terms that must not appear
   * @throws com.scholary.censor.catalog.EmptyCatalogException if the catalog has no terms
   * @throws SubtitleQcException if any term still appears
   */
  public void check(String maskedText, TermCatalog catalog) {
    catalog.requireNonEmpty();

    int totalHits = 0;
    for (Term term : catalog.terms()) {
      int hits = Masker.countWholeWords(maskedText, term.word());
      if (hits > 0) {
        LOGGER.debug("Term '{}' still appears {} times", term.word(), hits);
      }
      totalHits += hits;
    }

    if (totalHits > 0) {
      STRUCTURED_LOGGER.logQcVerdict("subtitle", false, "hits=" + totalHits);
      throw new SubtitleQcException(totalHits);
    }
    STRUCTURED_LOGGER.logQcVerdict("subtitle", true, "no profanities found");
  }

  /**
   * Check a masked subtitle file.
   *
   * @param subtitlePath the masked subtitle file
   * @param catalogPath the term catalog
   * @throws IOException if the subtitle file can't be read
   */
  public void checkFile(Path subtitlePath, Path catalogPath) throws IOException {
    TermCatalog catalog = catalogLoader.load(catalogPath, properties.matching().defaultThreshold());
    check(Files.readString(subtitlePath, StandardCharsets.UTF_8), catalog);
  }
}
