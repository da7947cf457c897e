package com.example.lxmon.monitoring;

import com.example.lxmon.config.EngineProperties;
import com.example.lxmon.domain.Alert;
import com.example.lxmon.domain.AlertRule;
import com.example.lxmon.domain.Command;
import com.example.lxmon.domain.Metric;
import com.example.lxmon.domain.Server;
import com.example.lxmon.repository.AlertRepository;
import com.example.lxmon.repository.AlertRuleRepository;
import com.example.lxmon.repository.CommandRepository;
import com.example.lxmon.repository.MetricRepository;
import com.example.lxmon.repository.ServerRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Liveness, retention and alert evaluation against a real (H2) store.
 */
@DataJpaTest
class StoreBackedLoopsTest {

    @Autowired
    private ServerRepository serverRepository;

    @Autowired
    private MetricRepository metricRepository;

    @Autowired
    private AlertRuleRepository alertRuleRepository;

    @Autowired
    private AlertRepository alertRepository;

    @Autowired
    private CommandRepository commandRepository;

    private EngineProperties properties;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void staleServerGoesOfflineAndFreshServerDoesNot() {
        Instant now = Instant.now();
        Server stale = serverRepository.save(server("web-1", "acme", Server.Status.ONLINE, now.minus(Duration.ofMinutes(6))));
        Server fresh = serverRepository.save(server("web-2", "acme", Server.Status.ONLINE, now.minus(Duration.ofMinutes(4))));
        LivenessTracker tracker = new LivenessTracker(serverRepository, properties, meterRegistry);

        int marked = tracker.runPass();

        assertEquals(1, marked);
        Server staleAfter = serverRepository.findById(stale.getId()).orElseThrow();
        assertEquals(Server.Status.OFFLINE, staleAfter.getStatus());
        assertFalse(staleAfter.getUpdatedAt().isBefore(now));
        assertEquals(Server.Status.ONLINE, serverRepository.findById(fresh.getId()).orElseThrow().getStatus());
    }

    @Test
    void livenessPassIsIdempotent() {
        serverRepository.save(server("db-1", "acme", Server.Status.ONLINE, Instant.now().minus(Duration.ofMinutes(30))));
        serverRepository.save(server("db-2", "acme", Server.Status.OFFLINE, Instant.now().minus(Duration.ofHours(2))));
        serverRepository.save(server("db-3", "acme", Server.Status.UNKNOWN, null));
        LivenessTracker tracker = new LivenessTracker(serverRepository, properties, meterRegistry);

        assertEquals(1, tracker.runPass());
        assertEquals(0, tracker.runPass());
        assertEquals(Server.Status.UNKNOWN,
                serverRepository.findByHostname("db-3").orElseThrow().getStatus());
    }

    @Test
    void sweeperDeletesOnlyMetricsPastRetention() {
        Server server = serverRepository.save(server("app-1", "acme", Server.Status.ONLINE, Instant.now()));
        Instant now = Instant.now();
        List<Metric> metrics = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            Instant collectedAt = i < 40 ? now.minus(Duration.ofDays(31 + i % 5)) : now.minus(Duration.ofDays(i % 29));
            metrics.add(metric(server.getId(), "cpu", "usage", i, collectedAt));
        }
        metricRepository.saveAll(metrics);
        AlertRule rule = alertRuleRepository.save(rule("acme", AlertRule.Condition.GT, 90.0));
        alertRepository.save(Alert.builder()
                .alertRuleId(rule.getId())
                .serverId(server.getId())
                .message("High CPU: usage is gt 90.0")
                .severity(Alert.Severity.CRITICAL)
                .status(Alert.AlertStatus.ACTIVE)
                .triggeredAt(now.minus(Duration.ofDays(60)))
                .build());
        commandRepository.save(Command.builder()
                .serverId(server.getId())
                .command("uptime")
                .status(Command.CommandStatus.COMPLETED)
                .createdAt(now.minus(Duration.ofDays(90)))
                .build());
        RetentionSweeper sweeper = new RetentionSweeper(metricRepository, properties, meterRegistry);

        assertEquals(40, sweeper.runPass());
        assertEquals(0, sweeper.runPass());
        assertEquals(60, metricRepository.count());
        assertEquals(40.0, meterRegistry.counter("lxmon.metrics.deleted").count());

        assertEquals(1, serverRepository.count());
        assertEquals(1, alertRuleRepository.count());
        assertEquals(1, alertRepository.count());
        assertEquals(1, commandRepository.count());
    }

    @Test
    void ruleOnlySeesMetricsOfItsOwnTenant() {
        Server ours = serverRepository.save(server("acme-1", "acme", Server.Status.ONLINE, Instant.now()));
        Server theirs = serverRepository.save(server("other-1", "globex", Server.Status.ONLINE, Instant.now()));
        Instant now = Instant.now();
        metricRepository.save(metric(ours.getId(), "cpu", "usage", 50.0, now.minusSeconds(30)));
        metricRepository.save(metric(theirs.getId(), "cpu", "usage", 99.0, now.minusSeconds(10)));
        metricRepository.save(metric(ours.getId(), "cpu", "steal", 99.0, now.minusSeconds(10)));
        metricRepository.save(metric(ours.getId(), "cpu", "usage", 97.0, now.minus(Duration.ofMinutes(20))));

        List<Metric> found = metricRepository.findForRule("cpu", "usage", "acme", now.minus(Duration.ofMinutes(10)));

        assertEquals(1, found.size());
        assertEquals(ours.getId(), found.get(0).getServerId());
        assertEquals(50.0, found.get(0).getValue());
    }

    @Test
    void repeatedEvaluationKeepsAtMostOneActiveAlert() {
        Server server = serverRepository.save(server("cache-1", "acme", Server.Status.ONLINE, Instant.now()));
        AlertRule rule = alertRuleRepository.save(rule("acme", AlertRule.Condition.GT, 90.0));
        Instant now = Instant.now();
        metricRepository.save(metric(server.getId(), "cpu", "usage", 85.0, now.minusSeconds(90)));
        metricRepository.save(metric(server.getId(), "cpu", "usage", 91.0, now.minusSeconds(60)));
        Metric latest = metricRepository.save(metric(server.getId(), "cpu", "usage", 92.0, now.minusSeconds(30)));
        AlertEvaluator evaluator = new AlertEvaluator(alertRuleRepository, metricRepository, alertRepository,
                properties, meterRegistry);

        assertEquals(1, evaluator.runPass());
        assertEquals(0, evaluator.runPass());
        assertEquals(0, evaluator.runPass());

        assertEquals(1, alertRepository.countByAlertRuleIdAndServerIdAndStatus(
                rule.getId(), latest.getServerId(), Alert.AlertStatus.ACTIVE));
        Alert alert = alertRepository.findAll().get(0);
        assertEquals("High CPU: usage is gt 90.0", alert.getMessage());
        assertEquals(Alert.Severity.CRITICAL, alert.getSeverity());
    }

    @Test
    void resolvedAlertAllowsANewOne() {
        Server server = serverRepository.save(server("cache-2", "acme", Server.Status.ONLINE, Instant.now()));
        AlertRule rule = alertRuleRepository.save(rule("acme", AlertRule.Condition.GT, 90.0));
        metricRepository.save(metric(server.getId(), "cpu", "usage", 95.0, Instant.now().minusSeconds(5)));
        AlertEvaluator evaluator = new AlertEvaluator(alertRuleRepository, metricRepository, alertRepository,
                properties, meterRegistry);

        assertEquals(1, evaluator.runPass());
        Alert first = alertRepository.findAll().get(0);
        first.setStatus(Alert.AlertStatus.RESOLVED);
        first.setResolvedAt(Instant.now());
        alertRepository.save(first);

        assertEquals(1, evaluator.runPass());
        assertEquals(2, alertRepository.count());
        assertEquals(1, alertRepository.countByAlertRuleIdAndServerIdAndStatus(
                rule.getId(), server.getId(), Alert.AlertStatus.ACTIVE));
    }

    @Test
    void disabledRulesAreNotEvaluated() {
        Server server = serverRepository.save(server("cache-3", "acme", Server.Status.ONLINE, Instant.now()));
        AlertRule rule = rule("acme", AlertRule.Condition.GT, 10.0);
        rule.setEnabled(false);
        alertRuleRepository.save(rule);
        metricRepository.save(metric(server.getId(), "cpu", "usage", 95.0, Instant.now()));
        AlertEvaluator evaluator = new AlertEvaluator(alertRuleRepository, metricRepository, alertRepository,
                properties, meterRegistry);

        assertEquals(0, evaluator.runPass());
        assertEquals(0, alertRepository.count());
    }

    private Server server(String hostname, String tenant, Server.Status status, Instant lastHeartbeat) {
        return Server.builder()
                .name(hostname)
                .hostname(hostname)
                .ipAddress("10.0.0.1")
                .tenantId(tenant)
                .status(status)
                .lastHeartbeat(lastHeartbeat)
                .build();
    }

    private Metric metric(Long serverId, String type, String name, double value, Instant collectedAt) {
        return Metric.builder()
                .serverId(serverId)
                .metricType(type)
                .metricName(name)
                .value(value)
                .unit("%")
                .collectedAt(collectedAt)
                .build();
    }

    private AlertRule rule(String tenant, AlertRule.Condition condition, double threshold) {
        return AlertRule.builder()
                .name("High CPU")
                .metricType("cpu")
                .metricName("usage")
                .condition(condition)
                .threshold(threshold)
                .severity(Alert.Severity.CRITICAL)
                .enabled(true)
                .tenantId(tenant)
                .build();
    }
}
