package com.scholary.subtitles.segmentation;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.subtitles.transcript.Sentence;
import com.scholary.subtitles.transcript.Word;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SentenceSplitterTest {

  private final SentenceSplitter splitter = new SentenceSplitter(SegmentationProperties.defaults());

  @Test
  void split_shouldKeepShortSentenceTrimmed() {
    Sentence sentence =
        new Sentence(0, 500, " hello ", 1, null, List.of(new Word(0, 500, "hello", "")));

    List<DisplayCue> cues = splitter.split(sentence, 40);

    assertThat(cues).containsExactly(new DisplayCue(0, 500, "hello"));
  }

  @Test
  void split_shouldDivideIntoEqualSegmentsWithoutPunctuation() {
    List<Word> words = new ArrayList<>();
    for (int i = 0; i < 30; i++) {
      words.add(new Word(i * 100L, i * 100L + 100, "abc", ""));
    }
    Sentence sentence = new Sentence(0, 3000, "abc".repeat(30), 1, null, words);

    List<DisplayCue> cues = splitter.split(sentence, 40);

    assertThat(cues)
        .containsExactly(
            new DisplayCue(0, 1000, "abc".repeat(10)),
            new DisplayCue(1000, 2000, "abc".repeat(10)),
            new DisplayCue(2000, 3000, "abc".repeat(10)));
  }

  @Test
  void split_shouldCutAfterMostRecentPunctuation() {
    List<Word> words =
        List.of(
            new Word(0, 100, "aaaa", "、"),
            new Word(100, 200, "bbbb", "、"),
            new Word(200, 300, "cccc", ""),
            new Word(300, 400, "dd", "。"));
    Sentence sentence = new Sentence(0, 400, "aaaa、bbbb、ccccdd。", 1, null, words);

    List<DisplayCue> cues = splitter.split(sentence, 10);

    assertThat(cues)
        .containsExactly(
            new DisplayCue(0, 200, "aaaa、bbbb、"), new DisplayCue(200, 400, "ccccdd。"));
  }

  @Test
  void split_shouldNeverCutInsideWord() {
    Sentence sentence =
        new Sentence(0, 800, "abcdefghij", 1, null, List.of(new Word(0, 800, "abcdefghij", "")));

    List<DisplayCue> cues = splitter.split(sentence, 5);

    assertThat(cues).containsExactly(new DisplayCue(0, 800, "abcdefghij"));
  }

  @Test
  void split_shouldEmitSingleCueForSentenceWithoutWords() {
    String text = "x".repeat(50);
    Sentence sentence = new Sentence(0, 5000, text, 1, null, List.of());

    List<DisplayCue> cues = splitter.split(sentence, 40);

    assertThat(cues).containsExactly(new DisplayCue(0, 5000, text));
  }

  @Test
  void hasSplitPunctuation_shouldIgnoreLastWord() {
    List<Word> words = List.of(new Word(0, 100, "abc", ""), new Word(100, 200, "def", "。"));

    assertThat(SentenceSplitter.hasSplitPunctuation(words)).isFalse();
  }
}
