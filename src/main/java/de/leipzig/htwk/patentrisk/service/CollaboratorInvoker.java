package de.leipzig.htwk.patentrisk.service;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import de.leipzig.htwk.patentrisk.config.RiskEngineConfig;
import de.leipzig.htwk.patentrisk.exception.CollaboratorTimeoutException;
import de.leipzig.htwk.patentrisk.exception.EngineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs calls to external collaborators (embedding service, vector index, explanation service)
 * with a per-attempt timeout and bounded retries with exponential backoff.
 * <p>
 * Each attempt runs on the collaborator pool so the caller can give up on it. When the calling
 * thread is interrupted the in-flight attempt is cancelled with interruption and no further
 * attempts are made.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CollaboratorInvoker {

    private final RiskEngineConfig config;

    @Qualifier("collaboratorExecutor")
    private final ExecutorService collaboratorExecutor;

    /**
     * @param operation      name used in logs and timeout errors
     * @param failureMapper  turns the last failure into the collaborator's unavailable exception
     * @throws CollaboratorTimeoutException if the last attempt timed out or the caller was interrupted
     */
    public <T> T invoke(String operation, Callable<T> call, Function<Throwable, ? extends EngineException> failureMapper) {
        int maxAttempts = config.getMaxRetries() + 1;
        long backoff = config.getInitialBackoffMillis();
        Throwable lastFailure = null;
        boolean lastWasTimeout = false;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Future<T> future = collaboratorExecutor.submit(call);
            try {
                return future.get(config.getCallTimeoutMillis(), TimeUnit.MILLISECONDS);

            } catch (TimeoutException e) {
                future.cancel(true);
                lastFailure = e;
                lastWasTimeout = true;
                log.warn("{} timed out after {} ms (attempt {}/{})", operation, config.getCallTimeoutMillis(), attempt, maxAttempts);

            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new CollaboratorTimeoutException(operation, operation + " cancelled", e);

            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof EngineException engine && !engine.isRecoverable()) {
                    throw engine;
                }
                lastFailure = cause;
                lastWasTimeout = false;
                log.warn("{} failed (attempt {}/{}): {}", operation, attempt, maxAttempts, cause.getMessage());
            }

            if (attempt < maxAttempts) {
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CollaboratorTimeoutException(operation, operation + " cancelled during backoff", e);
                }
                backoff = (long) (backoff * config.getBackoffMultiplier());
            }
        }

        if (lastWasTimeout) {
            throw new CollaboratorTimeoutException(operation,
                String.format("%s timed out after %d attempts", operation, maxAttempts), lastFailure);
        }
        throw failureMapper.apply(lastFailure);
    }
}
