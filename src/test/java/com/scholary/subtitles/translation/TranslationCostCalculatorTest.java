package com.scholary.subtitles.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class TranslationCostCalculatorTest {

  private final TranslationCostCalculator calculator = new TranslationCostCalculator();

  @Test
  void cost_shouldBillCachedAndThinkingTokensSeparately() {
    UsageMetadata usage = new UsageMetadata(1_000_000, 200_000, 100_000, 100_000);

    double cost = calculator.cost("gemini-3-flash-preview", usage);

    // 0.8M new input at 0.50, 0.2M cached at 0.10, 0.2M output at 3.00
    assertThat(cost).isCloseTo(1.02, within(1e-9));
  }

  @Test
  void cost_shouldUseModelSpecificPricing() {
    UsageMetadata usage = new UsageMetadata(1_000_000, 0, 0, 0);

    assertThat(calculator.cost("gemini-3-pro-preview", usage)).isCloseTo(2.0, within(1e-9));
  }

  @Test
  void cost_shouldBeZeroForUnknownModelOrMissingUsage() {
    assertThat(calculator.cost("some-other-model", new UsageMetadata(10, 0, 10, 0))).isZero();
    assertThat(calculator.cost("gemini-3-flash-preview", null)).isZero();
  }
}
