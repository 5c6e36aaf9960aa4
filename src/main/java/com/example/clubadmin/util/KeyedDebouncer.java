package com.example.clubadmin.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs the most recent task per key once the key has been quiet for the delay.
 * Scheduling a task for a key cancels the one still pending for it.
 */
@Slf4j
public class KeyedDebouncer<K> {

    private final TaskScheduler scheduler;
    private final Map<K, Pending> pending = new ConcurrentHashMap<>();

    public KeyedDebouncer(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public void delay(K key, Runnable task, Duration delay) {
        Pending next = new Pending();
        Pending previous = pending.put(key, next);
        if (previous != null) {
            previous.cancel();
        }
        next.future = scheduler.schedule(() -> run(key, next, task), Instant.now().plus(delay));
    }

    public boolean isPending(K key) {
        return pending.containsKey(key);
    }

    private void run(K key, Pending self, Runnable task) {
        // a newer task for the key replaces this one until it starts running
        if (!pending.remove(key, self)) {
            return;
        }
        try {
            task.run();
        } catch (RuntimeException ex) {
            log.error("Debounced task for {} failed", key, ex);
        }
    }

    private static final class Pending {
        private volatile ScheduledFuture<?> future;

        void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
