package com.scholary.subtitles.segmentation;

import com.scholary.subtitles.transcript.Sentence;
import com.scholary.subtitles.transcript.Word;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits overlong sentences into display-safe cues.
 *
 * <p>Two strategies, both cutting only at word boundaries:
 *
 * <ul>
 *   <li>By punctuation: when any word but the last carries a split mark, cut after the most recent
 *       mark once the buffer reaches the target length.
 *   <li>By length: otherwise, divide the text into {@code ceil(total / target)} segments of
 *       roughly equal length.
 * </ul>
 *
 * <p>The target length is {@code floor(maxChars * splitTargetRatio)}. A single word longer than
 * the limit is never cut.
 */
@Component
public class SentenceSplitter {

  private static final Logger LOGGER = LoggerFactory.getLogger(SentenceSplitter.class);

  static final Set<String> SPLIT_PUNCTUATION = Set.of("、", "。", "！", "？", "!", "?", "，", ",");

  private final SegmentationProperties properties;

  public SentenceSplitter(SegmentationProperties properties) {
    this.properties = properties;
  }

  public List<DisplayCue> split(Sentence sentence, int maxChars) {
    String trimmed = sentence.text().strip();
    if (Texts.length(trimmed) <= maxChars) {
      return List.of(new DisplayCue(sentence.beginTime(), sentence.endTime(), trimmed));
    }

    int targetLength = (int) Math.floor(maxChars * properties.splitTargetRatio());
    boolean byPunctuation = hasSplitPunctuation(sentence.words());

    List<DisplayCue> cues =
        byPunctuation
            ? splitByPunctuation(sentence, targetLength)
            : splitByLength(sentence, targetLength);

    LOGGER.debug(
        "Splitting by {} into {} cues: '{}'",
        byPunctuation ? "punctuation" : "length",
        cues.size(),
        abbreviate(trimmed));
    return cues;
  }

  /** The last word's punctuation cannot be an internal cut point, so only earlier words count. */
  static boolean hasSplitPunctuation(List<Word> words) {
    if (words.size() <= 1) {
      return false;
    }
    for (Word word : words.subList(0, words.size() - 1)) {
      if (isSplitMark(word)) {
        return true;
      }
    }
    return false;
  }

  List<DisplayCue> splitByPunctuation(Sentence sentence, int targetLength) {
    List<DisplayCue> cues = new ArrayList<>();
    List<Word> buffer = new ArrayList<>();
    StringBuilder bufferText = new StringBuilder();
    int cutWordCount = -1;
    String cutText = null;

    for (Word word : sentence.words()) {
      buffer.add(word);
      bufferText.append(word.displayText());

      if (isSplitMark(word)) {
        cutWordCount = buffer.size();
        cutText = bufferText.toString();
      }

      if (Texts.length(bufferText) >= targetLength && cutWordCount > 0) {
        List<Word> segment = buffer.subList(0, cutWordCount);
        cues.add(cueOf(segment, cutText));

        buffer = new ArrayList<>(buffer.subList(cutWordCount, buffer.size()));
        bufferText = new StringBuilder(Texts.join(buffer));
        cutWordCount = -1;
        cutText = null;
      }
    }

    if (!buffer.isEmpty()) {
      cues.add(cueOf(buffer, bufferText.toString()));
    }
    return cues;
  }

  List<DisplayCue> splitByLength(Sentence sentence, int targetLength) {
    if (!sentence.hasWords()) {
      return List.of(
          new DisplayCue(sentence.beginTime(), sentence.endTime(), sentence.text().strip()));
    }

    String totalText = Texts.join(sentence.words());
    int totalChars = Texts.length(totalText);
    if (totalChars <= targetLength) {
      return List.of(new DisplayCue(sentence.beginTime(), sentence.endTime(), totalText.strip()));
    }

    int segmentCount = (totalChars + targetLength - 1) / targetLength;
    double perSegment = (double) totalChars / segmentCount;

    List<DisplayCue> cues = new ArrayList<>(segmentCount);
    List<Word> buffer = new ArrayList<>();
    StringBuilder bufferText = new StringBuilder();

    for (Word word : sentence.words()) {
      buffer.add(word);
      bufferText.append(word.displayText());

      if (Texts.length(bufferText) >= perSegment && cues.size() < segmentCount - 1) {
        cues.add(cueOf(buffer, bufferText.toString()));
        buffer = new ArrayList<>();
        bufferText = new StringBuilder();
      }
    }

    if (!buffer.isEmpty()) {
      cues.add(cueOf(buffer, bufferText.toString()));
    }
    return cues;
  }

  private static boolean isSplitMark(Word word) {
    return SPLIT_PUNCTUATION.contains(word.punctuation().strip());
  }

  private static DisplayCue cueOf(List<Word> words, String text) {
    return new DisplayCue(
        words.get(0).beginTime(), words.get(words.size() - 1).endTime(), text.strip());
  }

  private static String abbreviate(String text) {
    return text.length() <= 30 ? text : text.substring(0, 30) + "...";
  }
}
