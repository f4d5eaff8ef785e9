package com.scholary.censor.api;

import com.scholary.censor.catalog.EmptyCatalogException;
import com.scholary.censor.catalog.TermCatalog;
import com.scholary.censor.catalog.TermCatalogException;
import com.scholary.censor.catalog.TermCatalogLoader;
import com.scholary.censor.config.CensorProperties;
import com.scholary.censor.interval.IntervalMerger;
import com.scholary.censor.service.MaskingReport;
import com.scholary.censor.service.SubtitleMaskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for subtitle masking.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Masking a batch of subtitle events against an inline term catalog
 *   <li>Merging time intervals into mute windows
 * </ul>
 */
@RestController
@Tag(name = "Masking", description = "Subtitle term masking and mute window API")
public class MaskController {

  private static final Logger LOGGER = LoggerFactory.getLogger(MaskController.class);

  private final SubtitleMaskService maskService;
  private final TermCatalogLoader catalogLoader;
  private final CensorProperties properties;

  public MaskController(
      SubtitleMaskService maskService,
      TermCatalogLoader catalogLoader,
      CensorProperties properties) {
    this.maskService = maskService;
    this.catalogLoader = catalogLoader;
    this.properties = properties;
  }

  /** Mask subtitle events. */
  @PostMapping("/api/mask")
  @Operation(
      summary = "Mask subtitle events",
      description = "Find catalog terms in each event, mask them, and return one record per match")
  public ResponseEntity<MaskResponse> mask(@Valid @RequestBody MaskRequest request) {
    double defaultThreshold =
        request.defaultThreshold() != null
            ? request.defaultThreshold()
            : properties.matching().defaultThreshold();

    try {
      TermCatalog catalog =
          TermCatalog.fromEntries(
              catalogLoader.parseJson(request.terms()), defaultThreshold, "request");
      LOGGER.info("Mask request: terms={}, units={}", catalog.size(), request.units().size());

      MaskingReport report = maskService.mask(request.units(), catalog);
      return ResponseEntity.ok(new MaskResponse(report.events(), report.records()));
    } catch (EmptyCatalogException e) {
      LOGGER.warn("Rejected mask request: {}", e.getMessage());
      return ResponseEntity.badRequest().build();
    } catch (TermCatalogException e) {
      LOGGER.warn("Rejected mask request with invalid terms: {}", e.getMessage());
      return ResponseEntity.badRequest().build();
    } catch (Exception e) {
      LOGGER.error("Failed to mask subtitle events", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  /** Merge intervals. */
  @PostMapping("/api/intervals/merge")
  @Operation(
      summary = "Merge intervals",
      description = "Sort and merge overlapping or near-adjacent time intervals")
  public ResponseEntity<MergeResponse> merge(@Valid @RequestBody MergeRequest request) {
    double epsilon =
        request.epsilon() != null ? request.epsilon() : properties.intervals().mergeEpsilon();
    return ResponseEntity.ok(new MergeResponse(IntervalMerger.merge(request.intervals(), epsilon)));
  }
}
