package com.scholary.subtitles.segmentation;

import com.scholary.subtitles.logging.StructuredLogger;
import com.scholary.subtitles.segmentation.SentenceMerger.MergeResult;
import com.scholary.subtitles.transcript.AsrResult;
import com.scholary.subtitles.transcript.ChannelTranscript;
import com.scholary.subtitles.transcript.Sentence;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a recognizer transcript into subtitle cues.
 *
 * <p>Two phases:
 *
 * <ol>
 *   <li>Merge sentences that were split on an abbreviation period ({@link SentenceMerger})
 *   <li>Split sentences longer than {@code maxChars} ({@link SentenceSplitter})
 * </ol>
 *
 * <p>Pure and deterministic: the same transcript always yields the same cues.
 */
@Component
public class TranscriptNormalizer {

  private static final StructuredLogger STRUCTURED_LOGGER =
      new StructuredLogger(LoggerFactory.getLogger(TranscriptNormalizer.class));

  private final SentenceMerger merger;
  private final SentenceSplitter splitter;
  private final SegmentationProperties properties;

  public TranscriptNormalizer(
      SentenceMerger merger, SentenceSplitter splitter, SegmentationProperties properties) {
    this.merger = merger;
    this.splitter = splitter;
    this.properties = properties;
  }

  public static TranscriptNormalizer withProperties(SegmentationProperties properties) {
    return new TranscriptNormalizer(
        new SentenceMerger(properties), new SentenceSplitter(properties), properties);
  }

  /** Normalize the configured channel of a recognizer result. */
  public List<DisplayCue> normalize(AsrResult result) {
    return normalize(result, properties.channelId(), properties.maxChars());
  }

  public List<DisplayCue> normalize(AsrResult result, int channelId, int maxChars) {
    ChannelTranscript transcript =
        result.channel(channelId).orElseThrow(() -> new ChannelNotFoundException(channelId));
    return normalize(transcript, maxChars);
  }

  public List<DisplayCue> normalize(ChannelTranscript transcript) {
    return normalize(transcript, properties.maxChars());
  }

  public List<DisplayCue> normalize(ChannelTranscript transcript, int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive: " + maxChars);
    }

    MergeResult merged = merger.merge(transcript.sentences());

    List<DisplayCue> cues = new ArrayList<>();
    int splitCount = 0;
    for (Sentence sentence : merged.sentences()) {
      List<DisplayCue> segments = splitter.split(sentence, maxChars);
      if (segments.size() > 1) {
        splitCount++;
      }
      cues.addAll(segments);
    }

    STRUCTURED_LOGGER.logSegmentationSummary(
        transcript.channelId(),
        transcript.sentences().size(),
        merged.mergeCount(),
        splitCount,
        cues.size());
    return List.copyOf(cues);
  }
}
