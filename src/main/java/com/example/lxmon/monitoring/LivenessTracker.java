package com.example.lxmon.monitoring;

import com.example.lxmon.config.EngineProperties;
import com.example.lxmon.domain.Server;
import com.example.lxmon.repository.ServerRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Liveness Tracker - marks servers OFFLINE once their heartbeat is older than
 * the staleness window. Only heartbeat receipt brings a server back ONLINE.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LivenessTracker implements EngineTask {

    private final ServerRepository serverRepository;
    private final EngineProperties properties;
    private final MeterRegistry meterRegistry;

    @Override
    public String name() {
        return "liveness-tracker";
    }

    @Override
    public Duration interval() {
        return Duration.ofSeconds(properties.getLiveness().getIntervalSeconds());
    }

    /**
     * @return number of servers marked offline in this pass
     */
    @Override
    @Transactional
    public int runPass() {
        Instant now = Instant.now();
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getLiveness().getStaleAfterMinutes()));

        List<Server> stale = serverRepository.findByLastHeartbeatBeforeAndStatusNot(cutoff, Server.Status.OFFLINE);
        if (stale.isEmpty()) return 0;

        for (Server server : stale) {
            server.setStatus(Server.Status.OFFLINE);
            server.setUpdatedAt(now);
            log.warn("Server {} marked as offline (last heartbeat {})", server.getHostname(), server.getLastHeartbeat());
        }
        serverRepository.saveAll(stale);

        meterRegistry.counter("lxmon.servers.offline").increment(stale.size());
        return stale.size();
    }
}
