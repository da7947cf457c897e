package com.example.lxmon.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * Tenant-scoped threshold rule over one (metric type, metric name) pair.
 */
@Entity
@Table(name = "alert_rules", indexes = {
        @Index(name = "idx_alert_rule_tenant", columnList = "tenant_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 2048)
    private String description;

    @Column(name = "metric_type", nullable = false, length = 50)
    private String metricType;

    @Column(name = "metric_name", nullable = false, length = 100)
    private String metricName;

    @Enumerated(EnumType.STRING)
    @Column(name = "rule_condition", nullable = false, length = 20)
    private Condition condition;

    @Column(nullable = false)
    private double threshold;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Alert.Severity severity = Alert.Severity.WARNING;

    private boolean enabled;

    @Column(name = "tenant_id", nullable = false, length = 50)
    @Builder.Default
    private String tenantId = "default";

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public enum Condition {
        GT, LT, EQ, NE;

        /**
         * True when {@code value} violates {@code threshold}.
         * EQ and NE compare doubles exactly, so sensor readings rarely hit EQ.
         */
        public boolean isViolatedBy(double value, double threshold) {
            return switch (this) {
                case GT -> value > threshold;
                case LT -> value < threshold;
                case EQ -> value == threshold;
                case NE -> value != threshold;
            };
        }

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
