package com.scholary.mediascribe.llm;

/** One failed model call recorded by the cascade. */
public record CascadeAttempt(String model, RequestEncoding encoding, int status, String error) {}
