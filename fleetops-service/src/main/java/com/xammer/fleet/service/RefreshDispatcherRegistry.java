package com.xammer.fleet.service;

import com.xammer.fleet.domain.RefreshSchedule;
import com.xammer.fleet.dto.DispatcherStatusDto;
import com.xammer.fleet.exception.FleetNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link RefreshDispatcher} per fleet id.
 */
@Service
public class RefreshDispatcherRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RefreshDispatcherRegistry.class);

    private final FleetRefreshApi refreshApi;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Map<String, RefreshDispatcher> dispatchers = new ConcurrentHashMap<>();

    public RefreshDispatcherRegistry(FleetRefreshApi refreshApi, TaskScheduler taskScheduler, Clock clock) {
        this.refreshApi = refreshApi;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    public RefreshDispatcher register(RefreshSchedule schedule) {
        RefreshDispatcher dispatcher = new RefreshDispatcher(schedule, refreshApi, clock);
        RefreshDispatcher existing = dispatchers.putIfAbsent(schedule.getTargetFleetId(), dispatcher);
        if (existing != null) {
            logger.info("Dispatcher: fleet {} already has a schedule, keeping it", schedule.getTargetFleetId());
            return existing;
        }
        dispatcher.start(taskScheduler);
        return dispatcher;
    }

    public void cancel(String fleetId) {
        RefreshDispatcher dispatcher = dispatchers.remove(fleetId);
        if (dispatcher != null) {
            dispatcher.stop();
        }
    }

    public Optional<RefreshDispatcher> find(String fleetId) {
        return Optional.ofNullable(dispatchers.get(fleetId));
    }

    public DispatcherStatusDto status(String fleetId) {
        RefreshDispatcher dispatcher = find(fleetId).orElseThrow(() -> new FleetNotFoundException(fleetId));
        return new DispatcherStatusDto(fleetId, dispatcher.getSchedule().getIntervalDays(),
                dispatcher.getState(), dispatcher.getLastResult());
    }

    @PreDestroy
    public void shutdown() {
        dispatchers.values().forEach(RefreshDispatcher::stop);
        dispatchers.clear();
    }
}
