package io.reviewdeck.cli;

import io.reviewdeck.core.config.model.ReviewDeckConfig;
import io.reviewdeck.core.provider.LlmProvider;

@FunctionalInterface
public interface ProviderFactory {
    LlmProvider create(ReviewDeckConfig config);
}
