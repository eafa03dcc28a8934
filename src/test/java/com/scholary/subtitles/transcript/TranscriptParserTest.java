package com.scholary.subtitles.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranscriptParserTest {

  private static final String RESULT =
      """
      {
        "file_url": "https://example.com/audio.opus",
        "properties": {
          "audio_format": "opus",
          "channels": [0],
          "original_sampling_rate": 16000,
          "original_duration_in_milliseconds": 4000
        },
        "transcripts": [
          {
            "channel_id": 0,
            "content_duration_in_milliseconds": 3500,
            "text": "こんにちは。N.G.",
            "sentences": [
              {
                "begin_time": 100,
                "end_time": 1200,
                "text": "こんにちは。",
                "sentence_id": 1,
                "words": [
                  {"begin_time": 100, "end_time": 1200, "text": "こんにちは", "punctuation": "。"}
                ]
              },
              {
                "begin_time": 1300,
                "end_time": 1500,
                "text": "N.",
                "sentence_id": 2,
                "speaker_id": 1,
                "emotion": "neutral",
                "words": [
                  {"begin_time": 1300, "end_time": 1500, "text": "N"}
                ]
              }
            ]
          }
        ]
      }
      """;

  @TempDir Path tempDir;

  private final TranscriptParser parser = new TranscriptParser(new ObjectMapper());

  @Test
  void read_shouldMapSnakeCaseFields() {
    AsrResult result = parser.read(RESULT);

    assertThat(result.fileUrl()).isEqualTo("https://example.com/audio.opus");
    assertThat(result.properties().originalSamplingRate()).isEqualTo(16000);

    ChannelTranscript channel = result.channel(0).orElseThrow();
    assertThat(channel.sentences()).hasSize(2);

    Sentence first = channel.sentences().get(0);
    assertThat(first.beginTime()).isEqualTo(100);
    assertThat(first.speakerId()).isNull();
    assertThat(first.firstWord().punctuation()).isEqualTo("。");

    Sentence second = channel.sentences().get(1);
    assertThat(second.speakerId()).isEqualTo(1);
  }

  @Test
  void read_shouldDefaultMissingPunctuationToEmpty() {
    Word word = parser.read(RESULT).channel(0).orElseThrow().sentences().get(1).firstWord();

    assertThat(word.punctuation()).isEmpty();
    assertThat(word.displayText()).isEqualTo("N");
  }

  @Test
  void channel_shouldBeEmptyForUnknownChannel() {
    assertThat(parser.read(RESULT).channel(3)).isEmpty();
  }

  @Test
  void read_shouldReadFromFile() throws IOException {
    Path file = tempDir.resolve("asr.json");
    Files.writeString(file, RESULT);

    assertThat(parser.read(file).transcripts()).hasSize(1);
  }

  @Test
  void read_shouldRejectMissingRequiredField() {
    String missingSentences =
        """
        {"file_url": "x", "properties": {}, "transcripts": [{"channel_id": 0}]}
        """;

    assertThatThrownBy(() -> parser.read(missingSentences))
        .isInstanceOf(TranscriptParseException.class);
  }

  @Test
  void read_shouldRejectMalformedJson() {
    assertThatThrownBy(() -> parser.read("{\"file_url\": "))
        .isInstanceOf(TranscriptParseException.class);
  }

  @Test
  void read_shouldReportMissingFile() {
    assertThatThrownBy(() -> parser.read(tempDir.resolve("absent.json")))
        .isInstanceOf(TranscriptParseException.class)
        .hasMessageContaining("absent.json");
  }
}
