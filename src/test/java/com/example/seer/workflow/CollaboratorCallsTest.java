package com.example.seer.workflow;

import com.example.seer.exception.CollaboratorException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollaboratorCallsTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final CollaboratorCalls calls = new CollaboratorCalls(executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void returnsResultWithinTimeout() {
        assertThat(calls.call("code-search", Duration.ofSeconds(5), () -> "ok")).isEqualTo("ok");
    }

    @Test
    void slowCollaboratorTimesOut() {
        CountDownLatch never = new CountDownLatch(1);

        assertThatThrownBy(() -> calls.call("fix-generation", Duration.ofMillis(100), () -> {
            try {
                never.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("timed out")
                .satisfies(e -> assertThat(((CollaboratorException) e).getCollaborator()).isEqualTo("fix-generation"));
    }

    @Test
    void collaboratorExceptionsPassThrough() {
        CollaboratorException failure = new CollaboratorException("pull-request", "HTTP 500");

        assertThatThrownBy(() -> calls.call("pull-request", Duration.ofSeconds(5), () -> {
            throw failure;
        })).isSameAs(failure);
    }

    @Test
    void otherErrorsAreWrapped() {
        assertThatThrownBy(() -> calls.call("ticket", Duration.ofSeconds(5), () -> {
            throw new IllegalStateException("boom");
        }))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("boom")
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
