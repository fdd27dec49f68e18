package com.scholary.mediascribe.relay;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The secondary (user) identity that can read the relay chat and download files of any size.
 *
 * <p>All methods throw {@link SecondaryAccountException} when the account cannot be reached.
 */
public interface SecondaryAccountClient {

  /** Whether a logged-in session is available. Never throws. */
  boolean isAuthorized();

  Optional<RelayMessage> getMessage(long chatId, long messageId);

  /** The most recent messages of a chat, in any order. */
  List<RelayMessage> getRecentMessages(long chatId, int limit);

  /** Messages with an id greater than {@code minId}, at most {@code limit}, in any order. */
  List<RelayMessage> getMessagesAfter(long chatId, long minId, int limit);

  /** Download the media of a message to {@code target}, replacing it. */
  void downloadMedia(long chatId, RelayMessage message, Path target);

  /** Drop and re-establish the session. */
  void reconnect();
}
