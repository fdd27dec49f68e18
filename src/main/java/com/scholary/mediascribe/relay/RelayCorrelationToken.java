package com.scholary.mediascribe.relay;

import java.time.Instant;

/**
 * A relay in flight: which original message the copy stands for and where to report progress.
 *
 * @param progressMessageId status message in the requester's chat, null if none was sent
 */
public record RelayCorrelationToken(
    RelayTag origin,
    long copyMessageId,
    Long progressMessageId,
    String requesterId,
    Instant issuedAt) {}
