package com.example.lxmon.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An alert opened by the evaluator when a rule is violated on a server.
 * At most one ACTIVE alert exists per (rule, server).
 */
@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alert_rule_server_status", columnList = "alert_rule_id, server_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_rule_id", nullable = false)
    private Long alertRuleId;

    @Column(name = "server_id", nullable = false)
    private Long serverId;

    @Column(nullable = false, length = 2048)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AlertStatus status;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    public enum Severity {
        INFO, WARNING, ERROR, CRITICAL
    }

    public enum AlertStatus {
        ACTIVE, RESOLVED, ACKNOWLEDGED
    }

    @PrePersist
    protected void onCreate() {
        if (triggeredAt == null) triggeredAt = Instant.now();
        if (status == null) status = AlertStatus.ACTIVE;
    }
}
