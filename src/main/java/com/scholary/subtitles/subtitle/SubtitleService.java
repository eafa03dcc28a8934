package com.scholary.subtitles.subtitle;

import com.scholary.subtitles.segmentation.DisplayCue;
import com.scholary.subtitles.segmentation.TranscriptNormalizer;
import com.scholary.subtitles.transcript.AsrResult;
import com.scholary.subtitles.transcript.TranscriptParser;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Service;

/** Converts a stored recognizer result into an SRT file. */
@Service
public class SubtitleService {

  private final TranscriptParser parser;
  private final TranscriptNormalizer normalizer;
  private final SubtitleWriter writer;

  public SubtitleService(
      TranscriptParser parser, TranscriptNormalizer normalizer, SubtitleWriter writer) {
    this.parser = parser;
    this.normalizer = normalizer;
    this.writer = writer;
  }

  public List<DisplayCue> generateSrt(Path asrJson, Path srtFile) throws IOException {
    AsrResult result = parser.read(asrJson);
    List<DisplayCue> cues = normalizer.normalize(result);
    writer.writeSrt(cues, srtFile);
    return cues;
  }
}
