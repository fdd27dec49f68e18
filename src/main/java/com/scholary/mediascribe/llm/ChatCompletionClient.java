package com.scholary.mediascribe.llm;

import java.util.List;

/** A chat-completion endpoint that can be asked to use a specific model. */
public interface ChatCompletionClient {

  /**
   * Run one completion.
   *
   * @param model the model identifier
   * @param messages the conversation
   * @param encoding how to encode the request body
   * @return the assistant message content
   * @throws ModelCallException on a non-2xx status, a transport failure, or an empty answer
   */
  String complete(String model, List<ChatMessage> messages, RequestEncoding encoding);
}
