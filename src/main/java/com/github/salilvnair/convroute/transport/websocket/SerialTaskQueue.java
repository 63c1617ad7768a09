package com.github.salilvnair.convroute.transport.websocket;

import lombok.extern.slf4j.Slf4j;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared executor. At
 * most one drain loop per queue is scheduled at any time, so tasks of one queue never
 * overlap while different queues run in parallel.
 */
@Slf4j
public class SerialTaskQueue {

    private final Executor executor;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();

    public SerialTaskQueue(Executor executor) {
        this.executor = executor;
    }

    public void submit(Runnable task) {
        tasks.add(task);
        scheduleDrain();
    }

    int pending() {
        return tasks.size();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        }
        catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Worker pool rejected connection task, {} task(s) left queued", tasks.size());
        }
    }

    private void drain() {
        try {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                try {
                    task.run();
                }
                catch (RuntimeException e) {
                    log.error("Connection task failed", e);
                }
            }
        }
        finally {
            draining.set(false);
        }
        // a task may have been added after the last poll but before the flag was cleared
        if (!tasks.isEmpty()) {
            scheduleDrain();
        }
    }
}
