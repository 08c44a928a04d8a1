package com.xammer.fleet.config;

import com.xammer.fleet.domain.RefreshSchedule;
import com.xammer.fleet.service.RefreshDispatcherRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Schedules refreshes for fleets that exist outside this service, e.g. Auto Scaling groups.
 * Entries of {@code fleet.dispatch.targets} are {@code name} or {@code name:intervalDays}.
 */
@Component
public class DispatchTargetsInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(DispatchTargetsInitializer.class);

    private final RefreshDispatcherRegistry dispatcherRegistry;
    private final List<String> targets;
    private final int defaultIntervalDays;

    public DispatchTargetsInitializer(RefreshDispatcherRegistry dispatcherRegistry,
            @Value("${fleet.dispatch.targets:}") List<String> targets,
            @Value("${fleet.refresh.default-interval-days:30}") int defaultIntervalDays) {
        this.dispatcherRegistry = dispatcherRegistry;
        this.targets = targets;
        this.defaultIntervalDays = defaultIntervalDays;
    }

    @Override
    public void run(String... args) {
        for (String entry : targets) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String[] parts = entry.trim().split(":");
            int intervalDays = defaultIntervalDays;
            if (parts.length > 1) {
                try {
                    intervalDays = Integer.parseInt(parts[1].trim());
                } catch (NumberFormatException e) {
                    logger.error("Ignoring dispatch target '{}': interval is not a number", entry);
                    continue;
                }
            }
            if (intervalDays <= 0) {
                logger.error("Ignoring dispatch target '{}': interval must be positive", entry);
                continue;
            }
            dispatcherRegistry.register(new RefreshSchedule(intervalDays, parts[0].trim()));
            logger.info("Registered external dispatch target {} every {} day(s)", parts[0].trim(), intervalDays);
        }
    }
}
