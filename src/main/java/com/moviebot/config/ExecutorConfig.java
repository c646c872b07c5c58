package com.moviebot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Two pools: one runs whole candidate sources side by side, the other runs the individual
 * time-bounded calls into the graph store and vector index. A source blocked on its calls must
 * never hold the threads those calls run on.
 */
@Configuration
public class ExecutorConfig {
    public static final String SOURCE_EXECUTOR = "candidateSourceExecutor";
    public static final String EXTERNAL_CALL_EXECUTOR = "externalCallExecutor";

    @Bean(name = SOURCE_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService candidateSourceExecutor(RecommendationProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutorThreads(), named("candidate-source"));
    }

    @Bean(name = EXTERNAL_CALL_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService externalCallExecutor(RecommendationProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutorThreads() * 2, named("external-call"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
