package com.scholary.mediascribe.llm;

import com.scholary.mediascribe.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs one chat completion against an ordered list of models until one answers.
 *
 * <p>Any failure moves on to the next model, except HTTP 401: that gets exactly one more try on the
 * same model with {@link RequestEncoding#PRESERIALIZED_STRING} first. Model failures never escape
 * as exceptions; running out of models yields {@link CascadeResult.Outcome#EXHAUSTED}.
 */
@Component
public class ModelCascadeExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelCascadeExecutor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ChatCompletionClient client;
  private final ModelCascade defaultCascade;

  @Autowired
  public ModelCascadeExecutor(ChatCompletionClient client, LlmProperties properties) {
    this(client, ModelCascade.of(properties.primaryModel(), properties.fallbackModels()));
  }

  ModelCascadeExecutor(ChatCompletionClient client, ModelCascade defaultCascade) {
    this.client = client;
    this.defaultCascade = defaultCascade;
    LOGGER.info("Model cascade: {}", defaultCascade.models());
  }

  public ModelCascade defaultCascade() {
    return defaultCascade;
  }

  /** Run against the configured cascade. */
  public CascadeResult execute(List<ChatMessage> messages) {
    return execute(defaultCascade, messages);
  }

  /**
   * Run against an explicit cascade.
   *
   * @param cascade models in the order to try them
   * @param messages the conversation
   * @return the first successful answer, or the full attempt log
   */
  public CascadeResult execute(ModelCascade cascade, List<ChatMessage> messages) {
    List<CascadeAttempt> attempts = new ArrayList<>();

    for (String model : cascade.models()) {
      try {
        String text = client.complete(model, messages, RequestEncoding.STRUCTURED);
        return success(text, model, attempts);
      } catch (ModelCallException e) {
        record(attempts, model, RequestEncoding.STRUCTURED, e);
        if (!e.isAuthorizationFailure()) {
          continue;
        }
      } catch (RuntimeException e) {
        record(attempts, model, RequestEncoding.STRUCTURED, e);
        continue;
      }

      try {
        String text = client.complete(model, messages, RequestEncoding.PRESERIALIZED_STRING);
        return success(text, model, attempts);
      } catch (RuntimeException e) {
        record(attempts, model, RequestEncoding.PRESERIALIZED_STRING, e);
      }
    }

    structuredLogger.logCascadeExhausted(cascade.size(), attempts.size());
    return CascadeResult.exhausted(attempts);
  }

  private CascadeResult success(String text, String model, List<CascadeAttempt> attempts) {
    if (!attempts.isEmpty()) {
      LOGGER.info("Model {} answered after {} failed attempts", model, attempts.size());
    }
    return CascadeResult.success(text, model, attempts);
  }

  private void record(
      List<CascadeAttempt> attempts, String model, RequestEncoding encoding, RuntimeException e) {
    int status = ModelCallException.TRANSPORT_FAILURE;
    if (e instanceof ModelCallException) {
      status = ((ModelCallException) e).getStatus();
    }
    attempts.add(new CascadeAttempt(model, encoding, status, e.getMessage()));
    structuredLogger.logCascadeAttempt(model, encoding.name(), status, e.getMessage());
  }
}
