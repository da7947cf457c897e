package com.example.lxmon.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * A single telemetry sample collected from a server. Immutable once written.
 */
@Entity
@Table(name = "metrics", indexes = {
        @Index(name = "idx_metric_collected", columnList = "collected_at"),
        @Index(name = "idx_metric_server_collected", columnList = "server_id, collected_at"),
        @Index(name = "idx_metric_type_name", columnList = "metric_type, metric_name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Metric {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "server_id", nullable = false)
    private Long serverId;

    // Read-only side of server_id, used for tenant joins.
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "server_id", insertable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Server server;

    @Column(name = "metric_type", nullable = false, length = 50)
    private String metricType;

    @Column(name = "metric_name", nullable = false, length = 100)
    private String metricName;

    @Column(name = "metric_value", nullable = false)
    private double value;

    @Column(length = 20)
    private String unit;

    @Convert(converter = MetadataConverter.class)
    @Column(name = "metric_metadata", length = 4096)
    private Map<String, Object> metadata;

    @Column(name = "collected_at", nullable = false)
    private Instant collectedAt;

    @PrePersist
    protected void onCreate() {
        if (collectedAt == null) collectedAt = Instant.now();
    }
}
