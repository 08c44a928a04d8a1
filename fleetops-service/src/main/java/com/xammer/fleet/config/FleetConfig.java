package com.xammer.fleet.config;

import com.xammer.fleet.domain.RefreshPreferences;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class FleetConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RefreshPreferences refreshPreferences(
            @Value("${fleet.refresh.min-healthy-percentage:90}") int minHealthyPercentage,
            @Value("${fleet.refresh.instance-warmup:300s}") Duration instanceWarmup,
            @Value("${fleet.refresh.step-interval:30s}") Duration stepInterval,
            @Value("${fleet.capacity.reconcile-interval:60s}") Duration reconcileInterval) {
        return new RefreshPreferences(minHealthyPercentage, instanceWarmup, stepInterval, reconcileInterval);
    }
}
