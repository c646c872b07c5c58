package com.moviebot.recommendation;

import com.moviebot.config.ExecutorConfig;
import com.moviebot.config.RecommendationProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.*;
import java.util.function.Supplier;

/**
 * Runs blocking calls into the graph store or vector index with a bounded timeout. Every failure,
 * timeout included, surfaces as {@link ExternalCallException}.
 */
@Component
public class ExternalCalls {
    private final ExecutorService executor;
    private final RecommendationProperties properties;

    public ExternalCalls(@Qualifier(ExecutorConfig.EXTERNAL_CALL_EXECUTOR) ExecutorService executor,
                         RecommendationProperties properties) {
        this.executor = executor;
        this.properties = properties;
    }

    public <T> T call(String what, Supplier<T> call) {
        Future<T> future = executor.submit(call::get);
        long timeoutMs = properties.getExternalCallTimeoutMs();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExternalCallException(what + " timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new ExternalCallException(what + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalCallException(what + " interrupted", e);
        }
    }
}
