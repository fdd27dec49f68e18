package com.scholary.mediascribe.llm;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the chat-completion service and its model cascade.
 *
 * <p>{@code primaryModel} is tried first; {@code fallbackModels} are tried in order after it.
 */
@ConfigurationProperties(prefix = "llm")
@Validated
public record LlmProperties(
    @NotBlank String baseUrl,
    String apiKey,
    String referer,
    String title,
    @NotBlank String primaryModel,
    List<String> fallbackModels,
    @PositiveOrZero double temperature,
    @Positive int maxTokens,
    @Positive int connectTimeout,
    @Positive int readTimeout) {

  public LlmProperties {
    fallbackModels = fallbackModels == null ? List.of() : List.copyOf(fallbackModels);
  }
}
