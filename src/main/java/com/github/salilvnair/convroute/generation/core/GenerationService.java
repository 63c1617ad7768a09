package com.github.salilvnair.convroute.generation.core;

import com.github.salilvnair.convroute.config.ConvRouteGenerationConfig;
import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds every backend call by the configured timeout. Calls run on a dedicated
 * pool so that a stalled backend only ties up generation workers.
 */
@Component
@Slf4j
public class GenerationService {

    private final GenerationClient client;
    private final long timeoutMs;
    private final ThreadPoolExecutor executor;

    public GenerationService(GenerationClient client, ConvRouteGenerationConfig config) {
        this.client = client;
        this.timeoutMs = Math.max(1, config.getTimeoutMs());
        int workers = Math.max(1, config.getWorkerThreads());
        AtomicInteger sequence = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                workers,
                workers,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                task -> {
                    Thread thread = new Thread(task, "convroute-generation-" + sequence.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                }
        );
        this.executor.allowCoreThreadTimeOut(true);
    }

    public boolean isAvailable() {
        return client.isAvailable();
    }

    public String generate(String prompt) {
        if (!client.isAvailable()) {
            throw new GenerationException(ConvRouteErrorCode.GENERATION_DISABLED,
                    ConvRouteErrorCode.GENERATION_DISABLED.defaultMessage());
        }
        Future<String> future = executor.submit(() -> client.generate(prompt));
        try {
            String text = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                throw new GenerationException(ConvRouteErrorCode.GENERATION_FAILED, "Generation backend returned empty text");
            }
            return text;
        }
        catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Generation call timed out after {} ms", timeoutMs);
            throw new GenerationException(ConvRouteErrorCode.GENERATION_TIMEOUT,
                    "Generation backend call timed out after " + timeoutMs + " ms", e);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GenerationException(ConvRouteErrorCode.GENERATION_FAILED, "Generation call interrupted", e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof GenerationException generationException) {
                throw generationException;
            }
            throw new GenerationException(ConvRouteErrorCode.GENERATION_FAILED,
                    "Generation backend call failed: " + cause.getMessage(), cause);
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
