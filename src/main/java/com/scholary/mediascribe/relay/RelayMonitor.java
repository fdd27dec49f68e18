package com.scholary.mediascribe.relay;

import com.scholary.mediascribe.acquisition.AcquisitionException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Watches the relay chat for tagged copies.
 *
 * <p>Keeps a high-water mark of the last message id seen. The mark advances past every message,
 * including ones without media or without a tag, so nothing is looked at twice. The first poll
 * reads the most recent batch so copies sent shortly before a restart are still picked up.
 */
@Component
public class RelayMonitor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RelayMonitor.class);

  private final SecondaryAccountClient secondary;
  private final RelayCorrelator correlator;
  private final RelayedMediaHandler orphanHandler;
  private final RelayProperties properties;
  private final AtomicLong highWaterMark = new AtomicLong();

  public RelayMonitor(
      SecondaryAccountClient secondary,
      RelayCorrelator correlator,
      RelayedMediaHandler orphanHandler,
      RelayProperties properties) {
    this.secondary = secondary;
    this.correlator = correlator;
    this.orphanHandler = orphanHandler;
    this.properties = properties;
  }

  /**
   * Poll the relay chat once.
   *
   * @return number of relayed files delivered
   * @throws RelayMonitorException if the relay chat cannot be read
   */
  public int pollOnce() {
    long mark = highWaterMark.get();
    List<RelayMessage> batch;
    try {
      batch =
          mark == 0
              ? secondary.getRecentMessages(properties.chatId(), properties.pollBatchSize())
              : secondary.getMessagesAfter(properties.chatId(), mark, properties.pollBatchSize());
    } catch (SecondaryAccountException e) {
      throw new RelayMonitorException("Failed to poll relay chat: " + e.getMessage(), e);
    }

    List<RelayMessage> ordered = new ArrayList<>(batch);
    ordered.sort(Comparator.comparingLong(RelayMessage::id));

    int delivered = 0;
    for (RelayMessage message : ordered) {
      if (message.id() <= highWaterMark.get()) {
        continue;
      }
      highWaterMark.accumulateAndGet(message.id(), Math::max);

      if (!message.hasMedia()) {
        continue;
      }
      Optional<RelayTag> origin = RelayTag.parse(message.caption());
      if (origin.isEmpty()) {
        continue;
      }
      if (handle(message, origin.get())) {
        delivered++;
      }
    }
    return delivered;
  }

  /** Drop and re-establish the secondary session after a fault. */
  public void reconnect() {
    secondary.reconnect();
  }

  public long highWaterMark() {
    return highWaterMark.get();
  }

  private boolean handle(RelayMessage message, RelayTag origin) {
    try {
      Optional<RelayDelivery> delivery = correlator.deliver(message, origin);
      if (delivery.isEmpty()) {
        return false;
      }
      if (!delivery.get().awaited()) {
        orphanHandler.handleRelayed(origin, delivery.get().file());
      }
      return true;
    } catch (AcquisitionException e) {
      LOGGER.error(
          "Failed to deliver relayed file: copy={}, origin={}, error={}",
          message.id(),
          origin.format(),
          e.getMessage());
      return false;
    }
  }
}
