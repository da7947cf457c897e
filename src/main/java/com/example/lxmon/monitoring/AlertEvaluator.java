package com.example.lxmon.monitoring;

import com.example.lxmon.config.EngineProperties;
import com.example.lxmon.domain.Alert;
import com.example.lxmon.domain.AlertRule;
import com.example.lxmon.domain.Metric;
import com.example.lxmon.repository.AlertRepository;
import com.example.lxmon.repository.AlertRuleRepository;
import com.example.lxmon.repository.MetricRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Alert Evaluator - evaluates enabled alert rules against recent metrics of the
 * rule's tenant and opens at most one active alert per (rule, server).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertEvaluator implements EngineTask {

    private final AlertRuleRepository alertRuleRepository;
    private final MetricRepository metricRepository;
    private final AlertRepository alertRepository;
    private final EngineProperties properties;
    private final MeterRegistry meterRegistry;

    @Override
    public String name() {
        return "alert-evaluator";
    }

    @Override
    public Duration interval() {
        return Duration.ofSeconds(properties.getAlerts().getIntervalSeconds());
    }

    /**
     * Evaluate all enabled rules. A rule that fails is logged and skipped.
     *
     * @return number of alerts opened
     */
    @Override
    public int runPass() {
        List<AlertRule> rules = alertRuleRepository.findByEnabled(true);
        int opened = 0;
        for (AlertRule rule : rules) {
            try {
                if (evaluateRule(rule).isPresent()) opened++;
            } catch (Exception e) {
                log.error("Error evaluating alert rule {} ({}): {}", rule.getId(), rule.getName(), e.getMessage());
            }
        }
        return opened;
    }

    /**
     * Evaluate a single alert rule.
     *
     * @return the alert opened by this evaluation, empty if nothing violated the
     *         rule or an active alert already covers the violating server
     */
    public Optional<Alert> evaluateRule(AlertRule rule) {
        Instant since = Instant.now().minus(Duration.ofMinutes(properties.getAlerts().getLookbackMinutes()));
        List<Metric> recent = metricRepository.findForRule(
                rule.getMetricType(), rule.getMetricName(), rule.getTenantId(), since);
        if (recent.isEmpty()) return Optional.empty();

        Optional<Metric> representative = recent.stream()
                .filter(m -> rule.getCondition().isViolatedBy(m.getValue(), rule.getThreshold()))
                .max(Comparator.comparing(Metric::getCollectedAt));
        if (representative.isEmpty()) return Optional.empty();

        Metric violation = representative.get();
        if (alertRepository.existsByAlertRuleIdAndServerIdAndStatus(
                rule.getId(), violation.getServerId(), Alert.AlertStatus.ACTIVE)) {
            log.debug("Alert rule {} already active for server {}", rule.getId(), violation.getServerId());
            return Optional.empty();
        }

        return Optional.of(openAlert(rule, violation));
    }

    private Alert openAlert(AlertRule rule, Metric violation) {
        Alert alert = Alert.builder()
                .alertRuleId(rule.getId())
                .serverId(violation.getServerId())
                .message(describe(rule))
                .severity(rule.getSeverity())
                .status(Alert.AlertStatus.ACTIVE)
                .triggeredAt(Instant.now())
                .build();
        alert = alertRepository.save(alert);

        meterRegistry.counter("lxmon.alerts.opened", "severity", rule.getSeverity().name()).increment();
        log.warn("Alert triggered: {} (server {}, value {})",
                alert.getMessage(), violation.getServerId(), violation.getValue());
        return alert;
    }

    static String describe(AlertRule rule) {
        return String.format("%s: %s is %s %s",
                rule.getName(), rule.getMetricName(), rule.getCondition().code(), rule.getThreshold());
    }
}
