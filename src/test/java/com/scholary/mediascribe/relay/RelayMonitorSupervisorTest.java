package com.scholary.mediascribe.relay;

import static com.scholary.mediascribe.relay.RelayFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for RelayMonitorSupervisor backoff and circuit breaker. */
@ExtendWith(MockitoExtension.class)
class RelayMonitorSupervisorTest {

  @Mock private RelayMonitor monitor;
  @Mock private RelayCorrelator correlator;

  private final List<Long> sleeps = new ArrayList<>();
  private RelayMonitorSupervisor supervisor;

  @BeforeEach
  void setUp() {
    // initial 100 ms, max 1000 ms, at most 3 consecutive restarts
    supervisor = new RelayMonitorSupervisor(monitor, correlator, properties(true), sleeps::add);
  }

  @Test
  void backoffMillis_shouldDoubleUpToMaximum() {
    assertThat(RelayMonitorSupervisor.backoffMillis(1, 100, 1000)).isEqualTo(100);
    assertThat(RelayMonitorSupervisor.backoffMillis(2, 100, 1000)).isEqualTo(200);
    assertThat(RelayMonitorSupervisor.backoffMillis(4, 100, 1000)).isEqualTo(800);
    assertThat(RelayMonitorSupervisor.backoffMillis(5, 100, 1000)).isEqualTo(1000);
    assertThat(RelayMonitorSupervisor.backoffMillis(64, 100, 1000)).isEqualTo(1000);
  }

  @Test
  void step_shouldBackOffAndReconnectAfterFault() {
    when(monitor.pollOnce()).thenThrow(new RelayMonitorException("read failed"));

    assertThat(supervisor.step()).isTrue();

    assertThat(supervisor.getState()).isEqualTo(RelayMonitorSupervisor.State.BACKING_OFF);
    assertThat(supervisor.getConsecutiveRestarts()).isEqualTo(1);
    assertThat(sleeps).containsExactly(100L);
    verify(monitor).reconnect();
  }

  @Test
  void step_shouldOpenCircuitAfterTooManyConsecutiveFaults() {
    when(monitor.pollOnce()).thenThrow(new RelayMonitorException("read failed"));

    assertThat(supervisor.step()).isTrue();
    assertThat(supervisor.step()).isTrue();
    assertThat(supervisor.step()).isTrue();
    assertThat(supervisor.step()).isFalse();

    assertThat(supervisor.getState()).isEqualTo(RelayMonitorSupervisor.State.OPEN);
    assertThat(sleeps).containsExactly(100L, 200L, 400L);
    verify(monitor, times(3)).reconnect();
    verify(correlator).setMonitorAvailable(false);
  }

  @Test
  void step_shouldResetRestartCountAfterSuccessfulPoll() {
    when(monitor.pollOnce())
        .thenThrow(new RelayMonitorException("blip"))
        .thenThrow(new RelayMonitorException("blip"))
        .thenReturn(0)
        .thenThrow(new RelayMonitorException("blip"));

    supervisor.step();
    supervisor.step();
    supervisor.step();

    assertThat(supervisor.getState()).isEqualTo(RelayMonitorSupervisor.State.RUNNING);
    assertThat(supervisor.getConsecutiveRestarts()).isZero();

    supervisor.step();
    assertThat(supervisor.getConsecutiveRestarts()).isEqualTo(1);
    assertThat(sleeps).containsExactly(100L, 200L, 10L, 100L);
  }

  @Test
  void step_shouldKeepGoingWhenReconnectFails() {
    when(monitor.pollOnce()).thenThrow(new RelayMonitorException("read failed"));
    doThrow(new SecondaryAccountException("not authorized")).when(monitor).reconnect();

    assertThat(supervisor.step()).isTrue();
    verify(correlator, never()).setMonitorAvailable(false);
  }

  @Test
  void start_shouldDoNothingWhenRelayIsDisabled() {
    supervisor = new RelayMonitorSupervisor(monitor, correlator, properties(false), sleeps::add);

    supervisor.start();

    assertThat(supervisor.isRunning()).isFalse();
    assertThat(supervisor.getState()).isEqualTo(RelayMonitorSupervisor.State.STOPPED);
  }
}
