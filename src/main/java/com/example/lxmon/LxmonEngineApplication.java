package com.example.lxmon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * lxmon engine - background orchestration for the lxmon monitoring server.
 *
 * Loops (see {@link com.example.lxmon.monitoring.BackgroundTaskManager}):
 * - Metric Aggregator → latest value per metric type, cached per server
 * - Alert Evaluator → threshold rules, one active alert per rule and server
 * - Liveness Tracker → servers without recent heartbeats go offline
 * - Retention Sweeper → old metrics are deleted
 *
 * Commands flow through {@link com.example.lxmon.command.CommandDispatchQueue}.
 */
@SpringBootApplication
public class LxmonEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LxmonEngineApplication.class, args);
    }
}
