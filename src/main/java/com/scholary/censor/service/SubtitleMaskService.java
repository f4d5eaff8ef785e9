package com.scholary.censor.service;

import com.scholary.censor.catalog.TermCatalog;
import com.scholary.censor.catalog.TermCatalogLoader;
import com.scholary.censor.config.CensorProperties;
import com.scholary.censor.logging.StructuredLogger;
import com.scholary.censor.masking.Masker;
import com.scholary.censor.masking.Redaction;
import com.scholary.censor.matching.FuzzyMatcher;
import com.scholary.censor.matching.MatchResult;
import com.scholary.censor.record.MatchRecord;
import com.scholary.censor.record.MatchRecordCsvWriter;
import com.scholary.censor.record.MatchRecorder;
import com.scholary.censor.subtitle.SrtCodec;
import com.scholary.censor.subtitle.SubtitleEvent;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Masks a subtitle track and collects the match records for the muting stage.
 *
 * <p>Per event: find matches in the original text, mask the original text, record one row per
 * match. Events are independent, so they are matched on the masking executor; results are
 * joined back in source order so records always come out in event order, then match order.
 */
@Service
public class SubtitleMaskService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleMaskService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final FuzzyMatcher matcher;
  private final Masker masker;
  private final MatchRecorder recorder;
  private final TermCatalogLoader catalogLoader;
  private final SrtCodec srtCodec;
  private final MatchRecordCsvWriter csvWriter;
  private final Executor executor;
  private final CensorProperties properties;

  public SubtitleMaskService(
      FuzzyMatcher matcher,
      Masker masker,
      MatchRecorder recorder,
      TermCatalogLoader catalogLoader,
      SrtCodec srtCodec,
      MatchRecordCsvWriter csvWriter,
      @Qualifier("maskingExecutor") Executor executor,
      CensorProperties properties) {
    this.matcher = matcher;
    this.masker = masker;
    this.recorder = recorder;
    this.catalogLoader = catalogLoader;
    this.srtCodec = srtCodec;
    this.csvWriter = csvWriter;
    this.executor = executor;
    this.properties = properties;
  }

  /**
   * Mask a list of subtitle events.
   *
   * @param events events in source order
   * @param catalog terms to redact
   * @return masked events and match records
   * @throws com.scholary.censor.catalog.EmptyCatalogException if the catalog has no terms
   */
  public MaskingReport mask(List<SubtitleEvent> events, TermCatalog catalog) {
    catalog.requireNonEmpty();
    long startedAt = System.currentTimeMillis();

    List<CompletableFuture<EventResult>> futures = new ArrayList<>(events.size());
    for (int i = 0; i < events.size(); i++) {
      final int index = i;
      final SubtitleEvent event = events.get(i);
      futures.add(CompletableFuture.supplyAsync(() -> process(index, event, catalog), executor));
    }

    List<SubtitleEvent> maskedEvents = new ArrayList<>(events.size());
    List<MatchRecord> records = new ArrayList<>();
    int maskedCount = 0;

    for (int i = 0; i < futures.size(); i++) {
      EventResult result = join(futures.get(i));
      maskedEvents.add(result.event());
      records.addAll(result.records());
      if (!result.records().isEmpty()) {
        maskedCount++;
      }
      for (MatchResult unredacted : result.unredacted()) {
        STRUCTURED_LOGGER.logMatchUnredacted(i, unredacted.windowText(), unredacted.term().word());
      }
    }

    STRUCTURED_LOGGER.logMaskingCompleted(
        events.size(), maskedCount, records.size(), System.currentTimeMillis() - startedAt);
    return new MaskingReport(maskedEvents, records);
  }

  /**
   * Mask an SRT file and write the results to a directory.
   *
   * <p>Always writes the masked subtitles. The match CSV is written only when at least one
   * match was found.
   *
   * @param subtitlePath the SRT file to mask
   * @param catalogPath the term catalog
   * @param outputDir directory for the outputs, created if missing
   * @return the written files
   * @throws IOException if reading or writing fails
   */
  public MaskingOutput maskFile(Path subtitlePath, Path catalogPath, Path outputDir)
      throws IOException {
    String correlationId = UUID.randomUUID().toString();
    StructuredLogger.setRunContext(correlationId, subtitlePath.toString());

    try {
      Files.createDirectories(outputDir);

      TermCatalog catalog =
          catalogLoader.load(catalogPath, properties.matching().defaultThreshold()).requireNonEmpty();
      STRUCTURED_LOGGER.logCatalogLoaded(catalog.source(), catalog.size());

      List<SubtitleEvent> events =
          srtCodec.parse(Files.readString(subtitlePath, StandardCharsets.UTF_8));
      LOGGER.info("Parsed {} subtitle events from {}", events.size(), subtitlePath);

      MaskingReport report = mask(events, catalog);

      Path maskedPath = outputDir.resolve(properties.output().maskedSubtitleFile());
      Files.writeString(maskedPath, srtCodec.write(report.events()), StandardCharsets.UTF_8);
      LOGGER.info("Masked subtitles saved to {}", maskedPath);

      Optional<Path> csvPath = Optional.empty();
      if (report.hasMatches()) {
        Path path = outputDir.resolve(properties.output().matchesCsvFile());
        csvWriter.write(report.records(), path);
        LOGGER.info("Match CSV saved to {} ({} rows)", path, report.records().size());
        csvPath = Optional.of(path);
      } else {
        LOGGER.info("No profanity matches found; CSV not written");
      }

      return new MaskingOutput(maskedPath, csvPath, report.records().size());
    } finally {
      StructuredLogger.clearRunContext();
    }
  }

  private EventResult process(int index, SubtitleEvent event, TermCatalog catalog) {
    List<MatchResult> matches = matcher.findMatches(event.text(), catalog);
    if (matches.isEmpty()) {
      return new EventResult(event, List.of(), List.of());
    }

    Redaction redaction = masker.redact(event.text(), matches);
    List<MatchRecord> records = recorder.record(event, redaction.maskedText(), matches);
    STRUCTURED_LOGGER.logEventMasked(index, event.startMs(), event.endMs(), matches.size());
    return new EventResult(event.withText(redaction.maskedText()), records, redaction.unredacted());
  }

  private static EventResult join(CompletableFuture<EventResult> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw e;
    }
  }

  private record EventResult(
      SubtitleEvent event, List<MatchRecord> records, List<MatchResult> unredacted) {}
}
