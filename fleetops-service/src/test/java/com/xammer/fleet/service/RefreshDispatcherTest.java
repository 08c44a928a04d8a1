package com.xammer.fleet.service;

import com.xammer.fleet.domain.DispatchResult;
import com.xammer.fleet.domain.DispatcherState;
import com.xammer.fleet.domain.FleetState;
import com.xammer.fleet.domain.RefreshOutcome;
import com.xammer.fleet.domain.RefreshSchedule;
import com.xammer.fleet.exception.TransientDispatchFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RefreshDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
    private static final FleetState WEB = FleetState.builder().fleetId("web").build();

    private FleetRefreshApi refreshApi;
    private Clock clock;

    @BeforeEach
    void setUp() {
        refreshApi = mock(FleetRefreshApi.class);
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private RefreshDispatcher dispatcher(String fleetId) {
        return new RefreshDispatcher(new RefreshSchedule(30, fleetId), refreshApi, clock);
    }

    @Test
    void schedulesAtFixedRateStartingOneIntervalOut() {
        TaskScheduler scheduler = mock(TaskScheduler.class);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        RefreshDispatcher dispatcher = dispatcher("web");

        dispatcher.start(scheduler);
        dispatcher.start(scheduler);
        dispatcher.stop();

        verify(scheduler, times(1)).scheduleAtFixedRate(any(Runnable.class),
                eq(NOW.plus(Duration.ofDays(30))), eq(Duration.ofDays(30)));
        verify(future).cancel(false);
    }

    @Test
    void missingFleetFailsTickAndNextTickSucceeds() {
        when(refreshApi.describe("web")).thenReturn(Optional.empty(), Optional.of(WEB));
        when(refreshApi.startRefresh("web")).thenReturn(RefreshOutcome.accepted("r-2"));
        RefreshDispatcher dispatcher = dispatcher("web");

        DispatchResult first = dispatcher.tick();

        assertThat(first.getStatus()).isEqualTo(DispatchResult.ERROR);
        assertThat(first.getCode()).isEqualTo("NotFound");
        assertThat(first.getMessage()).isEqualTo("fleet not found");
        assertThat(dispatcher.getState()).isEqualTo(DispatcherState.IDLE);
        verify(refreshApi, never()).startRefresh("web");

        DispatchResult second = dispatcher.tick();

        assertThat(second.isStarted()).isTrue();
        assertThat(second.getRefreshId()).isEqualTo("r-2");
        assertThat(dispatcher.getState()).isEqualTo(DispatcherState.IDLE);
        assertThat(dispatcher.getLastResult()).isEqualTo(second);
    }

    @Test
    void rejectedRefreshIsReportedWithErrorCode() {
        when(refreshApi.describe("web")).thenReturn(Optional.of(WEB));
        when(refreshApi.startRefresh("web")).thenReturn(RefreshOutcome.rejected("not authorized", "AccessDenied"));

        DispatchResult result = dispatcher("web").tick();

        assertThat(result.getStatus()).isEqualTo(DispatchResult.ERROR);
        assertThat(result.getMessage()).isEqualTo("not authorized");
        assertThat(result.getCode()).isEqualTo("AccessDenied");
    }

    @Test
    void alreadyRunningRefreshCountsAsStarted() {
        when(refreshApi.describe("web")).thenReturn(Optional.of(WEB));
        when(refreshApi.startRefresh("web")).thenReturn(RefreshOutcome.alreadyInProgress("r-1"));

        DispatchResult result = dispatcher("web").tick();

        assertThat(result.isStarted()).isTrue();
        assertThat(result.getRefreshId()).isEqualTo("r-1");
    }

    @Test
    void unexpectedErrorReturnsDispatcherToIdle() {
        when(refreshApi.describe("web")).thenThrow(new IllegalStateException("endpoint unreachable"));
        RefreshDispatcher dispatcher = dispatcher("web");

        DispatchResult result = dispatcher.tick();

        assertThat(result.getStatus()).isEqualTo(DispatchResult.ERROR);
        assertThat(result.getMessage()).isEqualTo("endpoint unreachable");
        assertThat(result.getCode()).isNull();
        assertThat(dispatcher.getState()).isEqualTo(DispatcherState.IDLE);
    }

    @Test
    void triggerFailureRaisedByRefreshApiKeepsItsCode() {
        when(refreshApi.describe("web")).thenReturn(Optional.of(WEB));
        when(refreshApi.startRefresh("web"))
                .thenThrow(new TransientDispatchFailure("web", "throttled", "Throttling"));
        RefreshDispatcher dispatcher = dispatcher("web");

        DispatchResult result = dispatcher.tick();

        assertThat(result.getStatus()).isEqualTo(DispatchResult.ERROR);
        assertThat(result.getMessage()).isEqualTo("throttled");
        assertThat(result.getCode()).isEqualTo("Throttling");
        assertThat(dispatcher.getLastResult()).isEqualTo(result);
        assertThat(dispatcher.getState()).isEqualTo(DispatcherState.IDLE);
    }

    @Test
    void blankFleetIdIsAnError() {
        DispatchResult result = dispatcher(" ").tick();

        assertThat(result.getStatus()).isEqualTo(DispatchResult.ERROR);
        assertThat(result.getMessage()).isEqualTo("fleet id not set");
        verify(refreshApi, never()).describe(any());
    }

    @Test
    void overlappingTickIsSkipped() {
        RefreshDispatcher dispatcher = dispatcher("web");
        AtomicReference<DispatchResult> nested = new AtomicReference<>();
        when(refreshApi.describe("web")).thenAnswer(invocation -> {
            assertThat(dispatcher.getState()).isEqualTo(DispatcherState.INVOKING);
            nested.set(dispatcher.tick());
            return Optional.of(WEB);
        });
        when(refreshApi.startRefresh("web")).thenReturn(RefreshOutcome.accepted("r-1"));

        DispatchResult outer = dispatcher.tick();

        assertThat(outer.isStarted()).isTrue();
        assertThat(nested.get().getStatus()).isEqualTo(DispatchResult.SKIPPED);
        verify(refreshApi, times(1)).startRefresh("web");
    }
}
