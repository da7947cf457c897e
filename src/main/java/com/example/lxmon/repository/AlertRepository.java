package com.example.lxmon.repository;

import com.example.lxmon.domain.Alert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AlertRepository extends JpaRepository<Alert, Long> {

    boolean existsByAlertRuleIdAndServerIdAndStatus(Long alertRuleId, Long serverId, Alert.AlertStatus status);

    long countByAlertRuleIdAndServerIdAndStatus(Long alertRuleId, Long serverId, Alert.AlertStatus status);
}
