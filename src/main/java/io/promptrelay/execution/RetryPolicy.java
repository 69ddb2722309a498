package io.promptrelay.execution;

import io.promptrelay.config.PromptRelayConfig;

import java.time.Duration;

public record RetryPolicy(boolean autoRetry, int maxRetries, Duration retryDelay) {
    public RetryPolicy {
        maxRetries = Math.max(0, maxRetries);
        retryDelay = retryDelay == null || retryDelay.isNegative() ? Duration.ZERO : retryDelay;
    }

    public static RetryPolicy from(PromptRelayConfig config) {
        return new RetryPolicy(config.autoRetry(), config.maxRetries(), config.retryDelay());
    }

    public static RetryPolicy none() {
        return new RetryPolicy(false, 0, Duration.ZERO);
    }

    /**
     * Dispatches allowed for one step, the first attempt included.
     */
    public int maxAttempts() {
        return autoRetry ? 1 + maxRetries : 1;
    }
}
