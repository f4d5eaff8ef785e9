package com.scholary.censor.subtitle;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SrtCodecTest {

  private SrtCodec codec;

  @BeforeEach
  void setUp() {
    codec = new SrtCodec();
  }

  @Test
  void parse_shouldReadNumberedBlocks() {
    String srt =
        "1\n00:00:01,000 --> 00:00:02,500\nThis is damn funny\n\n"
            + "2\n00:00:03,000 --> 00:00:04,000\nSecond line\nand more\n";

    List<SubtitleEvent> events = codec.parse(srt);

    assertThat(events)
        .containsExactly(
            new SubtitleEvent(1000, 2500, "This is damn funny"),
            new SubtitleEvent(3000, 4000, "Second line\nand more"));
  }

  @Test
  void parse_shouldHandleCrlfAndBom() {
    String srt = "\uFEFF1\r\n00:00:01,000 --> 00:00:02,000\r\nHello\r\n\r\n";

    List<SubtitleEvent> events = codec.parse(srt);

    assertThat(events).containsExactly(new SubtitleEvent(1000, 2000, "Hello"));
  }

  @Test
  void parse_shouldAcceptMissingIndexAndDotSeparator() {
    String srt = "00:01:02.5 --> 00:01:03.250\nNo index here\n";

    List<SubtitleEvent> events = codec.parse(srt);

    assertThat(events).containsExactly(new SubtitleEvent(62500, 63250, "No index here"));
  }

  @Test
  void parse_shouldSkipMalformedBlocks() {
    String srt =
        "1\nnot a timing line\nText\n\n" + "2\n00:00:05,000 --> 00:00:06,000\nKept\n\n" + "3\n";

    List<SubtitleEvent> events = codec.parse(srt);

    assertThat(events).containsExactly(new SubtitleEvent(5000, 6000, "Kept"));
  }

  @Test
  void parse_emptyContent() {
    assertThat(codec.parse("")).isEmpty();
    assertThat(codec.parse(null)).isEmpty();
  }

  @Test
  void write_shouldProduceValidSrtFormat() {
    List<SubtitleEvent> events =
        List.of(
            new SubtitleEvent(0, 5200, "Hello world"),
            new SubtitleEvent(5200, 10500, "This is a **** test"));

    String srt = codec.write(events);

    assertThat(srt)
        .isEqualTo(
            "1\n00:00:00,000 --> 00:00:05,200\nHello world\n\n"
                + "2\n00:00:05,200 --> 00:00:10,500\nThis is a **** test\n\n");
  }

  @Test
  void write_shouldRoundTripThroughParse() {
    List<SubtitleEvent> events =
        List.of(new SubtitleEvent(1000, 2000, "One"), new SubtitleEvent(2500, 4000, "Two\nlines"));

    assertThat(codec.parse(codec.write(events))).isEqualTo(events);
  }

  @Test
  void write_emptyList() {
    assertThat(codec.write(List.of())).isEmpty();
  }

  @Test
  void formatTime_shouldFormatHoursMinutesSecondsMillis() {
    assertThat(SrtCodec.formatTime(0)).isEqualTo("00:00:00,000");
    assertThat(SrtCodec.formatTime(3_661_500)).isEqualTo("01:01:01,500");
    assertThat(SrtCodec.formatTime(-5)).isEqualTo("00:00:00,000");
  }
}
