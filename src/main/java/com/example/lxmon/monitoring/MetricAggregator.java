package com.example.lxmon.monitoring;

import com.example.lxmon.config.EngineProperties;
import com.example.lxmon.domain.Metric;
import com.example.lxmon.queue.QueueCacheClient;
import com.example.lxmon.repository.MetricRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Metric Aggregator - keeps a "latest value per metric type" snapshot for each
 * server in the cache so dashboards do not scan metric history.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricAggregator implements EngineTask {

    private static final TypeReference<Map<String, MetricSnapshot>> SNAPSHOT_TYPE = new TypeReference<>() {};

    private final MetricRepository metricRepository;
    private final QueueCacheClient queueCacheClient;
    private final EngineProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return "metric-aggregator";
    }

    @Override
    public Duration interval() {
        return Duration.ofSeconds(properties.getAggregator().getIntervalSeconds());
    }

    @Override
    public int runPass() {
        EngineProperties.AggregatorConfig config = properties.getAggregator();
        Instant since = Instant.now().minus(Duration.ofMinutes(config.getRecentWindowMinutes()));

        List<Metric> recent = metricRepository.findRecent(since, PageRequest.of(0, config.getBatchSize()));
        if (recent.isEmpty()) return 0;

        Map<Long, Map<String, Metric>> latestByServer = new LinkedHashMap<>();
        for (Metric metric : recent) {
            latestByServer
                    .computeIfAbsent(metric.getServerId(), id -> new LinkedHashMap<>())
                    .merge(metric.getMetricType(), metric, MetricAggregator::later);
        }

        Duration ttl = Duration.ofSeconds(config.getSnapshotTtlSeconds());
        for (Map.Entry<Long, Map<String, Metric>> entry : latestByServer.entrySet()) {
            Map<String, MetricSnapshot> snapshot = new LinkedHashMap<>();
            entry.getValue().forEach((type, metric) -> snapshot.put(type, MetricSnapshot.of(metric)));
            queueCacheClient.setCache(snapshotKey(entry.getKey()), toJson(snapshot), ttl);
        }

        log.info("Processed {} metrics for {} servers", recent.size(), latestByServer.size());
        return latestByServer.size();
    }

    /**
     * Read back the cached snapshot for a server. Empty when no pass has covered
     * the server within the snapshot TTL.
     */
    public Optional<Map<String, MetricSnapshot>> latestSnapshot(long serverId) {
        return queueCacheClient.getCache(snapshotKey(serverId)).map(json -> {
            try {
                return objectMapper.readValue(json, SNAPSHOT_TYPE);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt metric snapshot for server " + serverId, e);
            }
        });
    }

    public static String snapshotKey(long serverId) {
        return "server:" + serverId + ":latest_metrics";
    }

    // Ties go to the metric seen last.
    private static Metric later(Metric current, Metric candidate) {
        return candidate.getCollectedAt().isBefore(current.getCollectedAt()) ? current : candidate;
    }

    private String toJson(Map<String, MetricSnapshot> snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize metric snapshot", e);
        }
    }

    public record MetricSnapshot(double value, String unit, Instant timestamp) {
        static MetricSnapshot of(Metric metric) {
            return new MetricSnapshot(metric.getValue(), metric.getUnit(), metric.getCollectedAt());
        }
    }
}
