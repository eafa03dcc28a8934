package com.scholary.subtitles.transcript;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Reads recognizer result documents into the transcript model. */
@Component
public class TranscriptParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptParser.class);

  private final ObjectReader reader;

  public TranscriptParser(ObjectMapper objectMapper) {
    this.reader =
        objectMapper
            .readerFor(AsrResult.class)
            .with(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
  }

  public AsrResult read(Path file) {
    LOGGER.debug("Reading recognizer result: {}", file);
    try {
      AsrResult result = reader.readValue(file.toFile());
      LOGGER.info(
          "Parsed recognizer result: file={}, channels={}", file, result.transcripts().size());
      return result;
    } catch (IOException e) {
      throw new TranscriptParseException("Failed to read recognizer result: " + file, e);
    }
  }

  public AsrResult read(String json) {
    try {
      return reader.readValue(json);
    } catch (IOException e) {
      throw new TranscriptParseException("Failed to parse recognizer result", e);
    }
  }
}
