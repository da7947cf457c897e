package com.example.lxmon.repository;

import com.example.lxmon.domain.Metric;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface MetricRepository extends JpaRepository<Metric, Long> {

    @Query("SELECT m FROM Metric m WHERE m.collectedAt >= :since ORDER BY m.collectedAt DESC")
    List<Metric> findRecent(@Param("since") Instant since, Pageable pageable);

    /**
     * Metrics of one (type, name) pair, restricted to servers of the given tenant,
     * newest first.
     */
    @Query("SELECT m FROM Metric m JOIN m.server s " +
            "WHERE m.metricType = :metricType AND m.metricName = :metricName " +
            "AND m.collectedAt >= :since AND s.tenantId = :tenantId " +
            "ORDER BY m.collectedAt DESC")
    List<Metric> findForRule(@Param("metricType") String metricType,
                             @Param("metricName") String metricName,
                             @Param("tenantId") String tenantId,
                             @Param("since") Instant since);

    @Modifying
    @Transactional
    @Query("DELETE FROM Metric m WHERE m.collectedAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
