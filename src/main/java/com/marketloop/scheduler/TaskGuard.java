package com.marketloop.scheduler;

import com.marketloop.domain.enums.LoopTask;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * One in-progress marker per {@link LoopTask}. An invocation that finds its task
 * already running is skipped, never queued. Once {@link #stopAccepting()} is called no
 * new invocation starts.
 */
@Component
public class TaskGuard {

    private static final Logger log = LoggerFactory.getLogger(TaskGuard.class);

    private final Clock clock;
    private final Map<LoopTask, AtomicBoolean> inProgress = new EnumMap<>(LoopTask.class);
    private final Map<LoopTask, AtomicReference<LocalDateTime>> lastRun = new EnumMap<>(LoopTask.class);
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public TaskGuard(Clock clock) {
        this.clock = clock;
        for (LoopTask task : LoopTask.values()) {
            inProgress.put(task, new AtomicBoolean(false));
            lastRun.put(task, new AtomicReference<>());
        }
    }

    /** @return false when skipped because the task is running or shutdown has begun */
    public boolean runExclusive(LoopTask task, Runnable body) {
        if (!accepting.get()) {
            log.debug("Shutting down, not starting {}", task);
            return false;
        }
        AtomicBoolean flag = inProgress.get(task);
        if (!flag.compareAndSet(false, true)) {
            log.info("Skipping {}: previous invocation still in progress", task);
            return false;
        }
        try {
            lastRun.get(task).set(LocalDateTime.now(clock));
            body.run();
            return true;
        } finally {
            flag.set(false);
        }
    }

    public boolean isInProgress(LoopTask task) {
        return inProgress.get(task).get();
    }

    public LocalDateTime getLastRun(LoopTask task) {
        return lastRun.get(task).get();
    }

    public void stopAccepting() {
        accepting.set(false);
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    /**
     * Waits until no task is in progress or the timeout elapses.
     *
     * @return true when all tasks finished in time
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inProgress.values().stream().anyMatch(AtomicBoolean::get)) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(100);
        }
        return true;
    }

    /** Per-task last run and in-progress flag, for the detailed health view. */
    public Map<String, Map<String, Object>> status() {
        Map<String, Map<String, Object>> status = new LinkedHashMap<>();
        for (LoopTask task : LoopTask.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("lastRun", lastRun.get(task).get());
            entry.put("inProgress", inProgress.get(task).get());
            status.put(task.name().toLowerCase(), entry);
        }
        return status;
    }
}
