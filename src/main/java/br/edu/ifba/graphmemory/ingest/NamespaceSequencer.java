package br.edu.ifba.graphmemory.ingest;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs tasks of one namespace strictly in submission order while tasks of different
 * namespaces run in parallel.
 *
 * <p>Each namespace keeps the future of its last submitted task; a new task is chained
 * behind it regardless of how the previous one completed. Chains are dropped once they
 * drain.</p>
 */
public class NamespaceSequencer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NamespaceSequencer.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ThreadFactory THREAD_FACTORY = task -> {
        Thread thread = new Thread(task, "graph-memory-episode-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    };

    private final ExecutorService executor;
    private final Map<String, CompletableFuture<?>> tails = new HashMap<>();
    private volatile boolean closed = false;

    public NamespaceSequencer() {
        this(Executors.newCachedThreadPool(THREAD_FACTORY));
    }

    public NamespaceSequencer(@NotNull ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Queues {@code task} behind every earlier task of {@code namespace}.
     */
    @NotNull
    public <T> CompletableFuture<T> submit(@NotNull String namespace, @NotNull Supplier<T> task) {
        if (closed) {
            throw new IllegalStateException("Sequencer is closed");
        }
        synchronized (tails) {
            CompletableFuture<?> tail = tails.getOrDefault(namespace, CompletableFuture.completedFuture(null));
            CompletableFuture<T> next = tail
                .handle((ignored, error) -> null)
                .thenApplyAsync(ignored -> task.get(), executor);
            tails.put(namespace, next);
            next.whenComplete((ignored, error) -> {
                synchronized (tails) {
                    tails.remove(namespace, next);
                }
            });
            return next;
        }
    }

    /**
     * Namespaces with queued or running tasks.
     */
    public int activeNamespaces() {
        synchronized (tails) {
            return tails.size();
        }
    }

    @Override
    public void close() {
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Episode workers did not finish within 30s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
