package com.scholary.mediascribe.relay;

import com.scholary.mediascribe.logging.StructuredLogger;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Runs the {@link RelayMonitor} on its own thread and restarts it after faults.
 *
 * <p>State model:
 *
 * <ul>
 *   <li>RUNNING: polling every {@code pollIntervalMillis}
 *   <li>BACKING_OFF: a poll failed; sleeping {@code min(initial * 2^(n-1), max)} before
 *       reconnecting
 *   <li>OPEN: more than {@code maxConsecutiveRestarts} faults in a row; the loop has stopped and
 *       relayed requests are refused
 *   <li>STOPPED: not started, or shut down
 * </ul>
 *
 * <p>A successful poll resets the restart count.
 */
@Component
public class RelayMonitorSupervisor implements SmartLifecycle {

  private static final Logger LOGGER = LoggerFactory.getLogger(RelayMonitorSupervisor.class);

  public enum State {
    STOPPED,
    RUNNING,
    BACKING_OFF,
    OPEN
  }

  /** Sleep hook, replaced in tests. */
  interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final RelayMonitor monitor;
  private final RelayCorrelator correlator;
  private final RelayProperties properties;
  private final Sleeper sleeper;
  private final AtomicInteger consecutiveRestarts = new AtomicInteger();

  private volatile State state = State.STOPPED;
  private volatile boolean running;
  private Thread worker;

  @Autowired
  public RelayMonitorSupervisor(
      RelayMonitor monitor, RelayCorrelator correlator, RelayProperties properties) {
    this(monitor, correlator, properties, Thread::sleep);
  }

  RelayMonitorSupervisor(
      RelayMonitor monitor,
      RelayCorrelator correlator,
      RelayProperties properties,
      Sleeper sleeper) {
    this.monitor = monitor;
    this.correlator = correlator;
    this.properties = properties;
    this.sleeper = sleeper;
  }

  @Override
  public synchronized void start() {
    if (!properties.enabled()) {
      LOGGER.info("Relay disabled, monitor not started");
      return;
    }
    if (running) {
      return;
    }
    running = true;
    state = State.RUNNING;
    consecutiveRestarts.set(0);
    correlator.setMonitorAvailable(true);
    worker = new Thread(this::runLoop, "relay-monitor");
    worker.setDaemon(true);
    worker.start();
    LOGGER.info("Relay monitor started: chat={}", properties.chatId());
  }

  @Override
  public synchronized void stop() {
    running = false;
    if (worker != null) {
      worker.interrupt();
      try {
        worker.join(TimeUnit.SECONDS.toMillis(5));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      worker = null;
    }
    if (state != State.OPEN) {
      state = State.STOPPED;
    }
    LOGGER.info("Relay monitor stopped: state={}", state);
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  public State getState() {
    return state;
  }

  public int getConsecutiveRestarts() {
    return consecutiveRestarts.get();
  }

  void runLoop() {
    while (running && !Thread.currentThread().isInterrupted()) {
      if (!step()) {
        break;
      }
    }
  }

  /**
   * One poll, plus either the poll interval or the fault handling.
   *
   * @return false when the loop must end
   */
  boolean step() {
    try {
      monitor.pollOnce();
    } catch (RuntimeException e) {
      return handleFault(e);
    }

    if (consecutiveRestarts.getAndSet(0) > 0) {
      LOGGER.info("Relay monitor recovered");
    }
    state = State.RUNNING;
    try {
      sleeper.sleep(properties.pollIntervalMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private boolean handleFault(RuntimeException fault) {
    int restarts = consecutiveRestarts.incrementAndGet();
    if (restarts > properties.maxConsecutiveRestarts()) {
      state = State.OPEN;
      running = false;
      correlator.setMonitorAvailable(false);
      LOGGER.error(
          "Relay monitor circuit open after {} consecutive faults, last error: {}",
          restarts - 1,
          fault.getMessage());
      return false;
    }

    long backoff =
        backoffMillis(restarts, properties.backoffInitialMillis(), properties.backoffMaxMillis());
    structuredLogger.logMonitorRestart(
        restarts, properties.maxConsecutiveRestarts(), backoff, fault.getMessage());
    state = State.BACKING_OFF;
    try {
      sleeper.sleep(backoff);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }

    try {
      monitor.reconnect();
    } catch (RuntimeException e) {
      // The next poll fails too and counts as another fault.
      LOGGER.warn("Relay monitor reconnect failed: {}", e.getMessage());
    }
    return true;
  }

  static long backoffMillis(int restart, long initialMillis, long maxMillis) {
    int exponent = Math.max(0, restart - 1);
    if (exponent >= 30) {
      return maxMillis;
    }
    return Math.min(initialMillis * (1L << exponent), maxMillis);
  }
}
