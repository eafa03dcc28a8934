package com.scholary.subtitles.project;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses user input (a page URL or a bare video id) into a {@link VideoSource}.
 *
 * <p>Recognized forms, checked in order:
 *
 * <ul>
 *   <li>a Bilibili {@code BV} id anywhere in the input
 *   <li>a TVer {@code episodes/<id>} URL
 *   <li>a YouTube {@code v=<id>} or {@code youtu.be/<id>} URL
 *   <li>a bare id of 6 to 30 characters from {@code [A-Za-z0-9_-]}, treated as a TVer episode
 * </ul>
 */
@Component
public class SourceParser {

  private static final Pattern BILIBILI =
      Pattern.compile("BV[0-9A-Za-z]{10}", Pattern.CASE_INSENSITIVE);
  private static final Pattern TVER = Pattern.compile("episodes/(\\w+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern YOUTUBE =
      Pattern.compile("(?:v=|youtu\\.be/)([A-Za-z0-9_-]{11})", Pattern.CASE_INSENSITIVE);
  private static final Pattern RAW_ID = Pattern.compile("^[A-Za-z0-9_-]{6,30}$");

  public VideoSource parse(String input) {
    if (input == null || input.isBlank()) {
      throw new InvalidSourceException(String.valueOf(input));
    }
    String trimmed = input.trim();

    Matcher bilibili = BILIBILI.matcher(trimmed);
    if (bilibili.find()) {
      // BV ids are case-sensitive after the prefix
      String id = bilibili.group();
      return new VideoSource(
          VideoPlatform.BILIBILI, id.substring(0, 2).toUpperCase(Locale.ROOT) + id.substring(2));
    }

    Matcher tver = TVER.matcher(trimmed);
    if (tver.find()) {
      return new VideoSource(VideoPlatform.TVER, tver.group(1));
    }

    Matcher youtube = YOUTUBE.matcher(trimmed);
    if (youtube.find()) {
      return new VideoSource(VideoPlatform.YOUTUBE, youtube.group(1));
    }

    if (RAW_ID.matcher(trimmed).matches()) {
      return new VideoSource(VideoPlatform.TVER, trimmed);
    }

    throw new InvalidSourceException(trimmed);
  }
}
