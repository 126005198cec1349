package com.civic.realtime.service.heartbeat;

import com.civic.realtime.service.config.MetricsConfig;
import com.civic.realtime.service.config.RealtimeConfig;
import com.civic.realtime.service.metrics.DefaultMetricsAggregator;
import com.civic.realtime.service.metrics.MetricsAggregator;
import com.civic.realtime.service.support.MutableClock;
import com.civic.realtime.service.transport.BroadcastPayload;
import com.civic.realtime.service.transport.ChannelHandle;
import com.civic.realtime.service.transport.ChannelStatus;
import com.civic.realtime.service.transport.InMemoryRealtimeTransport;
import com.civic.realtime.service.transport.RealtimeTransport;
import com.civic.realtime.service.transport.TransportException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HeartbeatMonitorTest {

    private MutableClock clock;
    private InMemoryRealtimeTransport transport;
    private TaskScheduler scheduler;
    private ScheduledFuture<?> future;
    private MetricsAggregator metrics;
    private HeartbeatMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_000_000);
        transport = new InMemoryRealtimeTransport();
        scheduler = mock(TaskScheduler.class);
        future = mock(ScheduledFuture.class);
        when(scheduler.getClock()).thenReturn(clock);
        doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        metrics = new DefaultMetricsAggregator(new MetricsConfig(new SimpleMeterRegistry()), clock);

        RealtimeConfig.Heartbeat config = new RealtimeConfig.Heartbeat();
        config.setIntervalMs(30_000);
        monitor = new HeartbeatMonitor(config, transport, scheduler, metrics, clock);
    }

    @Test
    void startOpensChannelAndSchedulesAtInterval() {
        monitor.start();

        assertThat(monitor.isRunning()).isTrue();
        assertThat(transport.openChannelNames()).containsExactly("heartbeat");
        assertThat(metrics.lastHeartbeat()).isEqualTo(clock.instant());
        verify(scheduler).scheduleAtFixedRate(any(Runnable.class),
                eq(clock.instant().plusMillis(30_000)), eq(Duration.ofMillis(30_000)));
    }

    @Test
    void beatBroadcastsTimestamp() {
        monitor.start();
        clock.advanceMillis(30_000);

        assertThat(monitor.beat()).isTrue();

        BroadcastPayload sent = transport.broadcasts().get(0);
        assertThat(sent.type()).isEqualTo("broadcast");
        assertThat(sent.event()).isEqualTo("heartbeat");
        assertThat(sent.payload()).containsEntry("timestamp", clock.millis());
        assertThat(metrics.lastHeartbeat()).isEqualTo(clock.instant());
    }

    @Test
    void staleAfterTwoSilentIntervals() {
        monitor.start();

        clock.advanceMillis(60_000);
        assertThat(monitor.isStale(clock.instant())).isFalse();

        clock.advanceMillis(1);
        assertThat(monitor.isStale(clock.instant())).isTrue();

        monitor.beat();
        assertThat(monitor.isStale(clock.instant())).isFalse();
    }

    @Test
    void failedSendIsReportedNotThrown() {
        RealtimeTransport failing = mock(RealtimeTransport.class);
        ChannelHandle channel = mock(ChannelHandle.class);
        when(failing.channel("heartbeat")).thenReturn(channel);
        doThrow(new TransportException("socket closed")).when(channel).send(any(BroadcastPayload.class));
        var failingMonitor = new HeartbeatMonitor(new RealtimeConfig.Heartbeat(), failing, scheduler, metrics, clock);

        failingMonitor.start();

        assertThat(failingMonitor.beat()).isFalse();
        assertThat(metrics.lastHeartbeat()).isNull();
    }

    @Test
    void beatReopensChannelLazily() {
        RealtimeTransport flaky = mock(RealtimeTransport.class);
        ChannelHandle channel = mock(ChannelHandle.class);
        when(flaky.channel("heartbeat"))
                .thenThrow(new TransportException("not yet"))
                .thenReturn(channel);
        var flakyMonitor = new HeartbeatMonitor(new RealtimeConfig.Heartbeat(), flaky, scheduler, metrics, clock);

        flakyMonitor.start();

        assertThat(flakyMonitor.beat()).isTrue();
        verify(channel).send(any(BroadcastPayload.class));
    }

    @Test
    void droppedChannelIsReopenedOnNextBeat() {
        monitor.start();

        transport.simulateStatus("heartbeat", ChannelStatus.TIMED_OUT, null);
        assertThat(transport.openChannelNames()).isEmpty();

        clock.advanceMillis(30_000);
        assertThat(monitor.beat()).isTrue();
        clock.advanceMillis(30_000);
        assertThat(monitor.beat()).isTrue();

        assertThat(transport.channelsCreated()).isEqualTo(2);
        assertThat(transport.openChannelNames()).containsExactly("heartbeat");
        assertThat(metrics.lastHeartbeat()).isEqualTo(clock.instant());
        assertThat(monitor.isStale(clock.instant())).isFalse();
    }

    @Test
    void failedSendReleasesChannelForTheNextBeat() {
        RealtimeTransport flaky = mock(RealtimeTransport.class);
        ChannelHandle dead = mock(ChannelHandle.class);
        ChannelHandle fresh = mock(ChannelHandle.class);
        when(flaky.channel("heartbeat")).thenReturn(dead, fresh);
        doThrow(new TransportException("socket closed")).when(dead).send(any(BroadcastPayload.class));
        var flakyMonitor = new HeartbeatMonitor(new RealtimeConfig.Heartbeat(), flaky, scheduler, metrics, clock);

        flakyMonitor.start();

        assertThat(flakyMonitor.beat()).isFalse();
        verify(flaky).removeChannel(dead);

        assertThat(flakyMonitor.beat()).isTrue();
        verify(fresh).send(any(BroadcastPayload.class));
        assertThat(metrics.lastHeartbeat()).isEqualTo(clock.instant());
    }

    @Test
    void stopCancelsAndReleasesChannel() {
        monitor.start();
        monitor.stop();

        verify(future).cancel(false);
        assertThat(monitor.isRunning()).isFalse();
        assertThat(transport.openChannelNames()).isEmpty();
        assertThat(monitor.isStale(clock.instant().plusSeconds(3600))).isFalse();
    }
}
