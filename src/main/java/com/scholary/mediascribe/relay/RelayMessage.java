package com.scholary.mediascribe.relay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A message in the relay chat as seen by the secondary account. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RelayMessage(
    long id, String caption, boolean hasMedia, String fileName, long sizeBytes) {}
