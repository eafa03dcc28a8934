package com.scholary.subtitles.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class GeminiTranslationClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void parseReply_shouldSkipThoughtParts() throws Exception {
    String response =
        """
        {
          "candidates": [{
            "content": {"role": "model", "parts": [
              {"text": "thinking about it", "thought": true},
              {"text": "1\\n00:00:00,000 --> 00:00:01,000\\n"},
              {"text": "你好\\n"}
            ]},
            "finishReason": "STOP"
          }],
          "usageMetadata": {
            "promptTokenCount": 1200,
            "cachedContentTokenCount": 200,
            "candidatesTokenCount": 300,
            "thoughtsTokenCount": 50,
            "totalTokenCount": 1550
          }
        }
        """;

    GeminiReply reply = client("key").parseReply(objectMapper.readTree(response));

    assertThat(reply.text()).isEqualTo("1\n00:00:00,000 --> 00:00:01,000\n你好\n");
    assertThat(reply.isComplete()).isTrue();
    assertThat(reply.usage()).isEqualTo(new UsageMetadata(1200, 200, 300, 50));
  }

  @Test
  void parseReply_shouldReportTruncationWithoutUsage() throws Exception {
    String response =
        """
        {"candidates": [{"content": {"parts": [{"text": "partial"}]},
          "finishReason": "MAX_TOKENS"}]}
        """;

    GeminiReply reply = client("key").parseReply(objectMapper.readTree(response));

    assertThat(reply.isTruncated()).isTrue();
    assertThat(reply.usage()).isNull();
  }

  @Test
  void parseReply_shouldRejectResponseWithoutCandidates() throws Exception {
    GeminiTranslationClient client = client("key");

    assertThatThrownBy(() -> client.parseReply(objectMapper.readTree("{\"candidates\": []}")))
        .isInstanceOf(TranslationException.class);
  }

  @Test
  void getFile_shouldRequireApiKey() {
    assertThatThrownBy(() -> client("").getFile("files/abc"))
        .isInstanceOf(TranslationException.class)
        .hasMessageContaining("translation.apiKey");
  }

  private GeminiTranslationClient client(String apiKey) {
    return new GeminiTranslationClient(
        new TranslationProperties(
            "https://gemini.example.com",
            apiKey,
            "gemini-3-flash-preview",
            3,
            5,
            5,
            1,
            1,
            "translation-instruction.md"),
        objectMapper);
  }
}
