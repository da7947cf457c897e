package com.example.lxmon.monitoring;

import java.time.Duration;

/**
 * One periodic loop of the engine. The orchestrator calls {@link #runPass()}
 * with a fixed delay of {@link #interval()} between passes.
 */
public interface EngineTask {

    String name();

    Duration interval();

    /**
     * Run one pass. Exceptions are caught and logged by the orchestrator.
     *
     * @return number of items the pass acted on, for logging and metrics
     */
    int runPass();
}
