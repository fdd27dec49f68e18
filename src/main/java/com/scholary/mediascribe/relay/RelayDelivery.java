package com.scholary.mediascribe.relay;

import java.nio.file.Path;

/**
 * A relayed file written to local disk.
 *
 * @param awaited whether a request was waiting for it; orphans are processed on their own
 */
public record RelayDelivery(RelayTag origin, Path file, boolean awaited) {}
