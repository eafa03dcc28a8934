package com.scholary.subtitles.segmentation;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcript segmentation.
 *
 * <p>The merge thresholds and split ratio are heuristics tuned on Japanese variety-show audio;
 * other languages or genres may need different values.
 *
 * @param channelId recognizer channel used when generating subtitles
 * @param maxChars maximum characters per subtitle cue
 * @param mergeGapMs largest gap between two sentences that still allows an abbreviation merge
 * @param shortSentenceChars a following sentence this short counts as an abbreviation tail
 * @param splitTargetRatio fraction of {@code maxChars} targeted when splitting long sentences
 */
@ConfigurationProperties(prefix = "segmentation")
@Validated
public record SegmentationProperties(
    @Min(0) int channelId,
    @Positive int maxChars,
    @PositiveOrZero long mergeGapMs,
    @PositiveOrZero int shortSentenceChars,
    @Positive @DecimalMax("1.0") double splitTargetRatio) {

  public static final int DEFAULT_MAX_CHARS = 40;

  public static SegmentationProperties defaults() {
    return new SegmentationProperties(0, DEFAULT_MAX_CHARS, 500, 5, 0.8);
  }
}
