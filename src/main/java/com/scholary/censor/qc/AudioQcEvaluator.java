package com.scholary.censor.qc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.censor.config.CensorProperties;
import com.scholary.censor.interval.Interval;
import com.scholary.censor.interval.IntervalMerger;
import com.scholary.censor.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether muted audio is actually quiet.
 *
 * <p>Loudness is measured by the transcoder outside this service. This class picks where to
 * measure (the mute windows, plus control spans taken from the gaps between them), parses the
 * measurement output, and compares the two groups: the control mean minus the mute mean must
 * reach the threshold.
 */
@Component
public class AudioQcEvaluator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioQcEvaluator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  // Example: [Parsed_volumedetect_0 @ 0x...] mean_volume: -23.4 dB
  private static final Pattern MEAN_VOLUME_PATTERN =
      Pattern.compile("mean_volume:\\s*(-?[0-9]+\\.?[0-9]*) dB");

  private final CensorProperties.QcProperties properties;
  private final ObjectMapper objectMapper;

  public AudioQcEvaluator(CensorProperties properties, ObjectMapper objectMapper) {
    this.properties = properties.qc();
    this.objectMapper = objectMapper;
  }

  /**
   * Choose control spans outside every mute window.
   *
   * @param windows merged mute windows
   * @param durationSeconds total audio duration
   * @return up to {@code maxSamples} spans of {@code sampleSeconds} each
   * @throws AudioQcException if the audio has no gap long enough
   */
  public List<Interval> selectControlSpans(List<Interval> windows, double durationSeconds) {
    List<Interval> spans =
        IntervalMerger.controlSpans(
            windows, durationSeconds, properties.sampleSeconds(), properties.maxSamples());
    if (spans.isEmpty()) {
      throw new AudioQcException("No control spans available for QC");
    }
    return spans;
  }

  /**
   * Parse the mean volume out of a volumedetect run's stderr.
   *
   * @param output the transcoder's stderr
   * @return the mean volume in dB, or empty if the line is missing
   */
  public OptionalDouble parseMeanVolume(String output) {
    if (output == null) {
      return OptionalDouble.empty();
    }
    Matcher matcher = MEAN_VOLUME_PATTERN.matcher(output);
    if (!matcher.find()) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(Double.parseDouble(matcher.group(1)));
  }

  public QcReport evaluate(List<VolumeSample> muteSamples, List<VolumeSample> controlSamples) {
    return evaluate(muteSamples, controlSamples, properties.thresholdDb());
  }

  /**
   * Compare muted and control loudness.
   *
   * @param muteSamples measurements over the mute windows
   * @param controlSamples measurements over the control spans
   * @param thresholdDb minimum required drop in dB
   * @return the verdict with both means and the delta
   */
  public QcReport evaluate(
      List<VolumeSample> muteSamples, List<VolumeSample> controlSamples, double thresholdDb) {
    double muteMean = meanDb(muteSamples);
    double controlMean = meanDb(controlSamples);
    double delta = controlMean - muteMean;
    boolean passed = delta >= thresholdDb;

    STRUCTURED_LOGGER.logQcVerdict(
        "audio",
        passed,
        String.format(Locale.ROOT, "delta=%.2f dB, threshold=%.2f dB", delta, thresholdDb));

    return new QcReport(
        thresholdDb,
        controlMean,
        muteMean,
        delta,
        passed,
        List.copyOf(muteSamples),
        List.copyOf(controlSamples));
  }

  /**
   * Write a report as pretty-printed JSON.
   *
   * @param report the verdict
   * @param path destination file
   * @throws IOException if writing fails
   */
  public void writeReport(QcReport report, Path path) throws IOException {
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), report);
    LOGGER.info("QC report written to {}", path);
  }

  private static double meanDb(List<VolumeSample> samples) {
    return samples.stream().mapToDouble(VolumeSample::meanVolumeDb).average().orElse(0.0);
  }
}
