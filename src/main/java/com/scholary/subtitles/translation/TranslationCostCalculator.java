package com.scholary.subtitles.translation;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Estimates the USD cost of a generation request from its token counts.
 *
 * <p>Prices are per million tokens. Cached prompt tokens are billed at the cache rate and the rest
 * of the prompt at the input rate; thinking tokens are billed as output. Unknown models cost 0.
 */
@Component
public class TranslationCostCalculator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranslationCostCalculator.class);
  private static final double PER_TOKENS = 1_000_000d;

  static final Map<String, ModelPricing> PRICING =
      Map.of(
          "gemini-3-flash-preview", new ModelPricing(0.50, 0.10, 3.00),
          "gemini-3-pro-preview", new ModelPricing(2.00, 0.20, 12.00));

  public double cost(String model, UsageMetadata usage) {
    if (usage == null) {
      LOGGER.warn("No usage metadata in reply, counting cost as 0");
      return 0d;
    }
    ModelPricing pricing = PRICING.get(model);
    if (pricing == null) {
      LOGGER.warn("No pricing for model {}, counting cost as 0", model);
      return 0d;
    }

    long newInput = usage.promptTokenCount() - usage.cachedContentTokenCount();
    double inputCost = newInput / PER_TOKENS * pricing.input();
    double cacheCost = usage.cachedContentTokenCount() / PER_TOKENS * pricing.cacheHit();
    double outputCost = usage.candidatesTokenCount() / PER_TOKENS * pricing.output();
    double thinkingCost = usage.thoughtsTokenCount() / PER_TOKENS * pricing.output();
    double total = inputCost + cacheCost + outputCost + thinkingCost;

    LOGGER.info(
        "Cost ({}): input={} cached={} output={} thinking={} total=${}",
        model,
        newInput,
        usage.cachedContentTokenCount(),
        usage.candidatesTokenCount(),
        usage.thoughtsTokenCount(),
        String.format("%.6f", total));
    return total;
  }

  /** USD per million tokens. */
  record ModelPricing(double input, double cacheHit, double output) {}
}
