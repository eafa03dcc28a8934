package com.scholary.subtitles.subtitle;

import com.scholary.subtitles.segmentation.DisplayCue;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes subtitle cues in SRT (SubRip) format and converts SRT to WebVTT.
 *
 * <p>SRT format:
 *
 * <pre>
 * 1
 * 00:00:00,000 --&gt; 00:00:05,200
 * Hello world
 *
 * 2
 * 00:00:05,200 --&gt; 00:00:10,300
 * This is a test
 * </pre>
 *
 * <p>Indexes start at 1 and are contiguous over the cues actually written.
 */
@Component
public class SubtitleWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleWriter.class);
  private static final Pattern SRT_TIMECODE = Pattern.compile("(\\d{2}:\\d{2}:\\d{2}),(\\d{3})");

  private final boolean dropEmptyCues;

  public SubtitleWriter(SubtitleProperties properties) {
    this.dropEmptyCues = properties.dropEmptyCues();
  }

  public String writeSrt(List<DisplayCue> cues) {
    StringBuilder srt = new StringBuilder();
    int index = 0;
    int dropped = 0;

    for (DisplayCue cue : cues) {
      if (cue.isBlank() && dropEmptyCues) {
        dropped++;
        continue;
      }
      index++;

      srt.append(index).append("\n");
      srt.append(SrtTime.format(cue.beginTime()))
          .append(" --> ")
          .append(SrtTime.format(cue.endTime()))
          .append("\n");
      srt.append(cue.isBlank() ? "" : cue.text()).append("\n");
      srt.append("\n");
    }

    if (dropped > 0) {
      LOGGER.debug("Dropped {} empty cues", dropped);
    }
    return srt.toString();
  }

  public void writeSrt(List<DisplayCue> cues, Path target) throws IOException {
    Files.createDirectories(target.toAbsolutePath().getParent());
    Files.writeString(target, writeSrt(cues), StandardCharsets.UTF_8);
    LOGGER.info("Wrote SRT: file={}, cues={}", target, cues.size());
  }

  /** Convert SRT text to WebVTT: header, LF line endings, "." as the millisecond separator. */
  public static String toVtt(String srt) {
    String body = SRT_TIMECODE.matcher(srt.replace("\r\n", "\n")).replaceAll("$1.$2");
    return "WEBVTT\n\n" + body;
  }

  public void convertToVtt(Path srtFile, Path vttFile) throws IOException {
    String srt = Files.readString(srtFile, StandardCharsets.UTF_8);
    Files.writeString(vttFile, toVtt(srt), StandardCharsets.UTF_8);
    LOGGER.info("Wrote VTT: {}", vttFile);
  }
}
