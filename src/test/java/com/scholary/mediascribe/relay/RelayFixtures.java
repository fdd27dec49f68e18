package com.scholary.mediascribe.relay;

import com.scholary.mediascribe.acquisition.AcquisitionRoute;
import com.scholary.mediascribe.acquisition.MediaRequest;

/** Shared test values for the relay package. */
final class RelayFixtures {

  static final long RELAY_CHAT = -100500;

  private RelayFixtures() {}

  static RelayProperties properties(boolean enabled) {
    return new RelayProperties(
        enabled, RELAY_CHAT, "http://gateway.local", "token", 10, 10, 50, 2, 0, 1, 100, 1000, 3);
  }

  static MediaRequest relayRequest(long chatId, long messageId) {
    return new MediaRequest(
        String.valueOf(chatId),
        chatId,
        messageId,
        3_000_000_000L,
        0,
        AcquisitionRoute.RELAY,
        "file-id",
        "talk.mp4",
        null,
        null,
        null,
        null);
  }

  static RelayMessage media(long id, String caption) {
    return new RelayMessage(id, caption, true, "talk.mp4", 3_000_000_000L);
  }

  static RelayMessage text(long id, String caption) {
    return new RelayMessage(id, caption, false, null, 0);
  }
}
