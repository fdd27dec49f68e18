package com.scholary.mediascribe.acquisition;

/** How the media for a request reaches local disk. */
public enum AcquisitionRoute {
  /** Uploaded file, or a Bot API file small enough to download directly. */
  DIRECT,
  /** Forwarded message whose origin is fetched through the secondary account. */
  FORWARDED,
  /** Public link (YouTube family or Google Drive). */
  URL,
  /** File above the Bot API limit, copied into the relay chat for the secondary account. */
  RELAY
}
