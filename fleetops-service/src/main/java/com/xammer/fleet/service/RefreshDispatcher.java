package com.xammer.fleet.service;

import com.xammer.fleet.domain.DispatchResult;
import com.xammer.fleet.domain.DispatcherState;
import com.xammer.fleet.domain.FleetState;
import com.xammer.fleet.domain.RefreshOutcome;
import com.xammer.fleet.domain.RefreshSchedule;
import com.xammer.fleet.exception.TransientDispatchFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fires a rolling refresh of one fleet every {@code intervalDays}. Knows the fleet only by id.
 *
 * <p>A tick moves IDLE to INVOKING, makes the trigger call, and returns to IDLE whatever the outcome.
 * Failed triggers are logged; the next tick is the retry.
 */
public class RefreshDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(RefreshDispatcher.class);

    private final RefreshSchedule schedule;
    private final FleetRefreshApi refreshApi;
    private final Clock clock;

    private final AtomicReference<DispatcherState> state = new AtomicReference<>(DispatcherState.IDLE);
    // diagnostics only, never read by tick()
    private volatile DispatchResult lastResult;
    private ScheduledFuture<?> future;

    public RefreshDispatcher(RefreshSchedule schedule, FleetRefreshApi refreshApi, Clock clock) {
        this.schedule = schedule;
        this.refreshApi = refreshApi;
        this.clock = clock;
    }

    public String getFleetId() {
        return schedule.getTargetFleetId();
    }

    public RefreshSchedule getSchedule() {
        return schedule;
    }

    public DispatcherState getState() {
        return state.get();
    }

    public DispatchResult getLastResult() {
        return lastResult;
    }

    /**
     * Schedules ticks at a fixed rate; the first one fires one full interval from now.
     */
    public synchronized void start(TaskScheduler scheduler) {
        if (future != null) {
            return;
        }
        Duration interval = schedule.getInterval();
        future = scheduler.scheduleAtFixedRate(this::tick, clock.instant().plus(interval), interval);
        logger.info("Dispatcher: fleet {} refresh scheduled every {} day(s)", getFleetId(), schedule.getIntervalDays());
    }

    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
            logger.info("Dispatcher: fleet {} schedule cancelled", getFleetId());
        }
    }

    public DispatchResult tick() {
        String fleetId = getFleetId();
        if (fleetId == null || fleetId.isBlank()) {
            logger.error("Dispatcher: fleet id is not set, nothing to refresh");
            return record(DispatchResult.error(fleetId, "fleet id not set", null, clock.instant()));
        }
        if (!state.compareAndSet(DispatcherState.IDLE, DispatcherState.INVOKING)) {
            logger.warn("Dispatcher: fleet {} previous tick still invoking, skipping", fleetId);
            return DispatchResult.skipped(fleetId, clock.instant());
        }
        try {
            return record(invoke(fleetId));
        } catch (TransientDispatchFailure e) {
            return record(failed(fleetId, e));
        } catch (RuntimeException e) {
            return record(failed(fleetId, new TransientDispatchFailure(fleetId, e)));
        } finally {
            state.set(DispatcherState.IDLE);
        }
    }

    private DispatchResult invoke(String fleetId) {
        Optional<FleetState> fleet = refreshApi.describe(fleetId);
        if (fleet.isEmpty()) {
            throw new TransientDispatchFailure(fleetId, "fleet not found", "NotFound");
        }
        RefreshOutcome outcome = refreshApi.startRefresh(fleetId);
        if (!outcome.isAccepted()) {
            throw new TransientDispatchFailure(fleetId, outcome.getReason(), outcome.getErrorCode());
        }
        logger.info("Dispatcher: fleet {} refresh {} {}", fleetId, outcome.getRefreshId(),
                outcome.isAlreadyInProgress() ? "already in progress" : "started");
        return DispatchResult.started(fleetId, outcome, clock.instant());
    }

    private DispatchResult failed(String fleetId, TransientDispatchFailure failure) {
        if (failure.getCause() != null) {
            logger.error("Dispatcher: {}. Next attempt at the next tick.", failure.getMessage(), failure.getCause());
        } else {
            logger.error("Dispatcher: {} (code {}). Next attempt at the next tick.",
                    failure.getMessage(), failure.getErrorCode());
        }
        return DispatchResult.error(fleetId, failure.getReason(), failure.getErrorCode(), clock.instant());
    }

    private DispatchResult record(DispatchResult result) {
        lastResult = result;
        return result;
    }
}
