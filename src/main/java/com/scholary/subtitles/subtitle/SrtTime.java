package com.scholary.subtitles.subtitle;

import java.util.Locale;

/**
 * SRT timecode formatting.
 *
 * <p>Format: HH:MM:SS,mmm (hours:minutes:seconds,milliseconds). Hours are padded to two digits but
 * never capped, so a 100-hour offset renders as {@code 100:00:00,000}.
 */
public final class SrtTime {

  private static final long MILLIS_PER_HOUR = 3_600_000L;
  private static final long MILLIS_PER_MINUTE = 60_000L;
  private static final long MILLIS_PER_SECOND = 1_000L;

  private SrtTime() {}

  /**
   * Format a millisecond offset as an SRT timecode.
   *
   * @param millis offset from the start of the media, must not be negative
   * @return the timecode, e.g. {@code 01:01:01,001} for 3661001
   */
  public static String format(long millis) {
    if (millis < 0) {
      throw new IllegalArgumentException("timecode offset must not be negative: " + millis);
    }
    long hours = millis / MILLIS_PER_HOUR;
    long remainder = millis % MILLIS_PER_HOUR;
    long minutes = remainder / MILLIS_PER_MINUTE;
    remainder %= MILLIS_PER_MINUTE;
    long seconds = remainder / MILLIS_PER_SECOND;
    long ms = remainder % MILLIS_PER_SECOND;

    return String.format(Locale.ROOT, "%02d:%02d:%02d,%03d", hours, minutes, seconds, ms);
  }
}
