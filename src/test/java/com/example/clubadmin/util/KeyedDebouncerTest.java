package com.example.clubadmin.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class KeyedDebouncerTest {

    private ThreadPoolTaskScheduler scheduler;
    private KeyedDebouncer<Long> debouncer;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.initialize();
        debouncer = new KeyedDebouncer<>(scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void onlyTheLatestTaskPerKeyRuns() throws InterruptedException {
        List<String> ran = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        debouncer.delay(1L, () -> ran.add("first"), Duration.ofMillis(200));
        debouncer.delay(1L, () -> ran.add("second"), Duration.ofMillis(200));
        debouncer.delay(1L, () -> { ran.add("third"); done.countDown(); }, Duration.ofMillis(200));
        assertThat(debouncer.isPending(1L)).isTrue();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(300);
        assertThat(ran).containsExactly("third");
        assertThat(debouncer.isPending(1L)).isFalse();
    }

    @Test
    void keysAreIndependent() throws InterruptedException {
        CountDownLatch both = new CountDownLatch(2);
        debouncer.delay(1L, both::countDown, Duration.ofMillis(50));
        debouncer.delay(2L, both::countDown, Duration.ofMillis(50));
        assertThat(both.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void failingTaskDoesNotStickAsPending() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        debouncer.delay(7L, () -> { started.countDown(); throw new IllegalStateException("boom"); }, Duration.ofMillis(20));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        assertThat(debouncer.isPending(7L)).isFalse();
    }
}
