package com.scholary.mediascribe.llm;

/**
 * How a chat-completion request body is put on the wire.
 *
 * <p>Some gateways reject one encoding with HTTP 401 and accept the other for the same payload.
 */
public enum RequestEncoding {
  /** JSON tree serialized straight to UTF-8 bytes. */
  STRUCTURED,
  /** JSON rendered to an ASCII-escaped string first, then sent as text. */
  PRESERIALIZED_STRING
}
