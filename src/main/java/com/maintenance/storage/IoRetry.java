package com.maintenance.storage;

import com.maintenance.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

/**
 * Bounded retry with exponential backoff for storage reads.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IoRetry {

    private final PipelineProperties properties;

    @FunctionalInterface
    public interface IoCall<T> {
        T call() throws IOException;
    }

    /**
     * Runs {@code call}, retrying on {@link IOException} up to the configured attempts.
     *
     * @throws IOException the last failure once attempts are exhausted
     */
    public <T> T execute(String description, IoCall<T> call) throws IOException {
        int maxAttempts = properties.getRetry().getMaxAttempts();
        Duration backoff = properties.getRetry().getInitialBackoff();

        for (int attempt = 1; ; attempt++) {
            try {
                return call.call();
            } catch (IOException e) {
                if (attempt >= maxAttempts) {
                    log.error("{} failed after {} attempts", description, attempt);
                    throw e;
                }
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                    description, attempt, maxAttempts, backoff.toMillis(), e.getMessage());
                sleep(backoff);
                backoff = backoff.multipliedBy(2);
            }
        }
    }

    private void sleep(Duration backoff) throws IOException {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while backing off", e);
        }
    }
}
