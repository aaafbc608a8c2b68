package com.example.seer.workflow;

import com.example.seer.exception.CollaboratorException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs collaborator calls on their own executor so a step can give up after
 * its timeout. A timeout surfaces as a {@link CollaboratorException}, like
 * any other collaborator failure.
 */
@Component
public class CollaboratorCalls {

    private final Executor executor;

    public CollaboratorCalls(@Qualifier("collaboratorExecutor") Executor executor) {
        this.executor = executor;
    }

    public <T> T call(String collaborator, Duration timeout, Supplier<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CollaboratorException(collaborator, "timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CollaboratorException collaboratorException) {
                throw collaboratorException;
            }
            throw new CollaboratorException(collaborator, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CollaboratorException(collaborator, "interrupted", e);
        }
    }
}
