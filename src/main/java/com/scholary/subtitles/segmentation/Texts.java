package com.scholary.subtitles.segmentation;

import com.scholary.subtitles.transcript.Word;
import java.util.List;

/** Character helpers shared by the merge and split phases. Lengths count code points. */
final class Texts {

  private Texts() {}

  static int length(CharSequence text) {
    return Character.codePointCount(text, 0, text.length());
  }

  static boolean isLatinLetter(int codePoint) {
    return (codePoint >= 'A' && codePoint <= 'Z') || (codePoint >= 'a' && codePoint <= 'z');
  }

  static boolean startsWithLatinLetter(String text) {
    return !text.isEmpty() && isLatinLetter(text.codePointAt(0));
  }

  static boolean endsWithLatinLetter(String text) {
    return !text.isEmpty() && isLatinLetter(text.codePointBefore(text.length()));
  }

  static String join(List<Word> words) {
    StringBuilder sb = new StringBuilder();
    for (Word word : words) {
      sb.append(word.displayText());
    }
    return sb.toString();
  }
}
