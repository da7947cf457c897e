package com.example.lxmon.monitoring;

import com.example.lxmon.config.EngineProperties;
import com.example.lxmon.repository.MetricRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Retention Sweeper - deletes metrics older than the retention horizon.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionSweeper implements EngineTask {

    private final MetricRepository metricRepository;
    private final EngineProperties properties;
    private final MeterRegistry meterRegistry;

    @Override
    public String name() {
        return "retention-sweeper";
    }

    @Override
    public Duration interval() {
        return Duration.ofSeconds(properties.getRetention().getIntervalSeconds());
    }

    @Override
    public int runPass() {
        Instant cutoff = Instant.now().minus(Duration.ofDays(properties.getRetention().getRetentionDays()));
        int deleted = metricRepository.deleteOlderThan(cutoff);
        if (deleted > 0) {
            meterRegistry.counter("lxmon.metrics.deleted").increment(deleted);
            log.info("Cleaned up {} old metrics (older than {})", deleted, cutoff);
        }
        return deleted;
    }
}
