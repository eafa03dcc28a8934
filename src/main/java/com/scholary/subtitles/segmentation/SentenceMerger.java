package com.scholary.subtitles.segmentation;

import com.scholary.subtitles.transcript.Sentence;
import com.scholary.subtitles.transcript.Word;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Re-joins sentences the recognizer split on an abbreviation period.
 *
 * <p>Recognizers treat the period in "N.G." or "Dr." as a sentence end and emit "N." and "G." as
 * separate sentences. A sentence is merged into the next one when:
 *
 * <ul>
 *   <li>its last word carries a half-width "." (not the full-width "。")
 *   <li>that word ends with a Latin letter
 *   <li>the next sentence starts within {@code mergeGapMs}
 *   <li>the next sentence starts with a Latin letter
 *   <li>the next sentence is short, or also ends with "."
 * </ul>
 *
 * <p>Merging is greedy: the merged sentence is checked against the following one again.
 */
@Component
public class SentenceMerger {

  private static final Logger LOGGER = LoggerFactory.getLogger(SentenceMerger.class);
  private static final String ABBREVIATION_PERIOD = ".";

  private final SegmentationProperties properties;

  public SentenceMerger(SegmentationProperties properties) {
    this.properties = properties;
  }

  /** Result of the merge phase. */
  public record MergeResult(List<Sentence> sentences, int mergeCount) {}

  public MergeResult merge(List<Sentence> sentences) {
    List<Sentence> result = new ArrayList<>(sentences.size());
    int mergeCount = 0;
    int i = 0;

    while (i < sentences.size()) {
      Sentence current = sentences.get(i);

      while (i + 1 < sentences.size() && shouldMerge(current, sentences.get(i + 1))) {
        Sentence next = sentences.get(i + 1);
        LOGGER.debug("Merging sentences: '{}' + '{}'", current.text(), next.text());
        current = mergeTwo(current, next);
        mergeCount++;
        i++;
      }

      result.add(current);
      i++;
    }

    return new MergeResult(List.copyOf(result), mergeCount);
  }

  boolean shouldMerge(Sentence current, Sentence next) {
    if (!current.hasWords() || !next.hasWords()) {
      return false;
    }

    Word lastWord = current.lastWord();
    if (!ABBREVIATION_PERIOD.equals(lastWord.punctuation().strip())) {
      return false;
    }

    // filters out non-Latin text that happens to end in "."
    if (!Texts.endsWithLatinLetter(lastWord.text().strip())) {
      return false;
    }

    if (next.beginTime() - current.endTime() > properties.mergeGapMs()) {
      return false;
    }

    if (!Texts.startsWithLatinLetter(next.firstWord().text().strip())) {
      return false;
    }

    if (Texts.length(next.text().strip()) <= properties.shortSentenceChars()) {
      return true;
    }

    // chained abbreviation, e.g. "N." + "G."
    return ABBREVIATION_PERIOD.equals(next.lastWord().punctuation().strip());
  }

  static Sentence mergeTwo(Sentence first, Sentence second) {
    List<Word> words = new ArrayList<>(first.words().size() + second.words().size());
    words.addAll(first.words());
    words.addAll(second.words());

    return new Sentence(
        words.get(0).beginTime(),
        words.get(words.size() - 1).endTime(),
        first.text().stripTrailing() + second.text(),
        first.sentenceId(),
        first.speakerId(),
        words);
  }
}
