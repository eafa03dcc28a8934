package com.scholary.subtitles.translation;

/**
 * One turn of a conversation with the model.
 *
 * @param role {@code user} or {@code model}
 * @param attachment file sent along with the text, or null
 */
public record ChatTurn(String role, String text, GeminiFile attachment) {

  public static ChatTurn user(String text) {
    return new ChatTurn("user", text, null);
  }

  public static ChatTurn user(GeminiFile attachment, String text) {
    return new ChatTurn("user", text, attachment);
  }

  public static ChatTurn model(String text) {
    return new ChatTurn("model", text, null);
  }
}
