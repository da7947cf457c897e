package com.example.lxmon.monitoring;

import com.example.lxmon.config.EngineProperties;
import com.example.lxmon.queue.QueueCacheClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Background Task Manager - owns the lifecycle of the engine's periodic loops.
 *
 * Each {@link EngineTask} runs on the engine scheduler with a fixed delay between
 * passes, so passes of one loop never overlap while different loops interleave
 * freely. A failed pass is logged and the loop carries on at its next tick.
 *
 * Stopping cancels the schedules without interrupting a running pass and waits
 * (up to the configured shutdown timeout) for in-flight passes to finish.
 */
@Slf4j
@Component
public class BackgroundTaskManager implements SmartLifecycle {

    private final List<EngineTask> tasks;
    private final TaskScheduler scheduler;
    private final EngineProperties properties;
    private final MeterRegistry meterRegistry;
    private final QueueCacheClient queueCacheClient;

    private final Object lifecycleMonitor = new Object();
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();
    private final Map<String, TaskState> states = new LinkedHashMap<>();
    private volatile boolean running;

    public BackgroundTaskManager(List<EngineTask> tasks,
                                 @Qualifier("engineScheduler") TaskScheduler scheduler,
                                 EngineProperties properties,
                                 MeterRegistry meterRegistry,
                                 QueueCacheClient queueCacheClient) {
        this.tasks = List.copyOf(tasks);
        this.scheduler = scheduler;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.queueCacheClient = queueCacheClient;
        for (EngineTask task : this.tasks) {
            states.put(task.name(), new TaskState(task.name(), task.interval()));
        }
    }

    /**
     * Start all loops. No-op if already running.
     */
    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (running) return;
            running = true;
            log.info("Starting background task manager");

            for (EngineTask task : tasks) {
                TaskState state = states.get(task.name());
                scheduled.add(scheduler.scheduleWithFixedDelay(() -> runPass(task, state), task.interval()));
            }
            log.info("Started {} background tasks", scheduled.size());
        }
    }

    /**
     * Cancel all loops and wait for in-flight passes. No-op if not running.
     */
    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (!running) return;
            running = false;
            log.info("Stopping background task manager");

            scheduled.forEach(future -> future.cancel(false));
            scheduled.clear();
        }
        awaitInFlightPasses(Duration.ofSeconds(properties.getEngine().getShutdownTimeoutSeconds()));
        log.info("Background task manager stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getEngine().isEnabled();
    }

    public int getScheduledTaskCount() {
        synchronized (lifecycleMonitor) {
            return scheduled.size();
        }
    }

    /**
     * Status summary of the engine and each of its loops.
     */
    public Map<String, Object> getStatus() {
        boolean queueReachable;
        try {
            queueReachable = queueCacheClient.ping();
        } catch (Exception e) {
            queueReachable = false;
        }

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", running);
        status.put("queueReachable", queueReachable);
        status.put("tasks", states.values().stream().map(TaskState::toMap).toList());
        return status;
    }

    private void runPass(EngineTask task, TaskState state) {
        if (!running) return;
        state.passLock.lock();
        try {
            // stop() may have won the race for the lock
            if (!running) return;

            Timer.Sample sample = Timer.start(meterRegistry);
            String outcome = "success";
            try {
                int affected = task.runPass();
                state.recordSuccess(affected);
                log.debug("{} pass complete: {} items", task.name(), affected);
            } catch (Exception e) {
                outcome = "failure";
                state.recordFailure(e);
                log.error("Error in {} pass: {}", task.name(), e.getMessage(), e);
            } finally {
                sample.stop(Timer.builder("lxmon.engine.pass.duration")
                        .tag("task", task.name())
                        .tag("outcome", outcome)
                        .register(meterRegistry));
                meterRegistry.counter("lxmon.engine.pass.total", "task", task.name(), "outcome", outcome)
                        .increment();
            }
        } finally {
            state.passLock.unlock();
        }
    }

    private void awaitInFlightPasses(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (TaskState state : states.values()) {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            try {
                if (state.passLock.tryLock(remaining, TimeUnit.NANOSECONDS)) {
                    state.passLock.unlock();
                } else {
                    log.warn("Timed out waiting for {} to finish its current pass", state.name);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for background tasks to finish");
                return;
            }
        }
    }

    private static final class TaskState {
        private final String name;
        private final Duration interval;
        private final ReentrantLock passLock = new ReentrantLock();
        private final AtomicLong passes = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
        private volatile Instant lastRunAt;
        private volatile String lastOutcome = "never";
        private volatile String lastError;
        private volatile int lastAffected;

        TaskState(String name, Duration interval) {
            this.name = name;
            this.interval = interval;
        }

        void recordSuccess(int affected) {
            passes.incrementAndGet();
            lastRunAt = Instant.now();
            lastOutcome = "success";
            lastAffected = affected;
        }

        void recordFailure(Exception e) {
            passes.incrementAndGet();
            failures.incrementAndGet();
            lastRunAt = Instant.now();
            lastOutcome = "failure";
            lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("name", name);
            map.put("intervalSeconds", interval.toSeconds());
            map.put("passes", passes.get());
            map.put("failures", failures.get());
            map.put("lastRun", lastRunAt != null ? lastRunAt.toString() : "never");
            map.put("lastOutcome", lastOutcome);
            map.put("lastAffected", lastAffected);
            map.put("lastError", lastError != null ? lastError : "");
            return map;
        }
    }
}
