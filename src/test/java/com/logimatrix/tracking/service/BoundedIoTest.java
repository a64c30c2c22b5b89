package com.logimatrix.tracking.service;

import com.logimatrix.tracking.exception.DeadlineExceededException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedIoTest {

    private ExecutorService executor;
    private BoundedIo boundedIo;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        boundedIo = new BoundedIo(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void returnsTheResultWithinTheDeadline() {
        assertThat(boundedIo.call("read", Duration.ofSeconds(1), () -> 42)).isEqualTo(42);
    }

    @Test
    void slowCallExceedsTheDeadline() {
        CountDownLatch never = new CountDownLatch(1);

        assertThatThrownBy(() -> boundedIo.call("position store write", Duration.ofMillis(50), () -> {
            try {
                never.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return true;
        }))
            .isInstanceOf(DeadlineExceededException.class)
            .hasMessageContaining("position store write");
    }

    @Test
    void startedCallStillCompletesAfterItsDeadline() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Boolean> write = boundedIo.start(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return true;
        });

        assertThatThrownBy(() -> boundedIo.await("position store write", Duration.ofMillis(50), write))
            .isInstanceOf(DeadlineExceededException.class);
        release.countDown();

        assertThat(write.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void failureOfTheCallIsRethrownUnwrapped() {
        assertThatThrownBy(() -> boundedIo.run("alert log write", Duration.ofSeconds(1), () -> {
            throw new IllegalArgumentException("bad row");
        }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("bad row");
    }
}
