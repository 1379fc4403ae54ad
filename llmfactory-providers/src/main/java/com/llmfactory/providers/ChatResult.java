package com.llmfactory.providers;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a single model call.
 */
@Value
@Builder
public class ChatResult {
    String text;
    /** Model identifier reported by the provider. */
    String model;
    String stopReason;
    long inputTokens;
    long outputTokens;
    /** USD, computed from the definition's token prices. */
    double cost;
}
