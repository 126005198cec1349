package com.civic.realtime.service.subscription;

import com.civic.realtime.service.model.ChangeEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Bounded per-subscription queue drained serially on a shared executor.
 *
 * At most one drain runs at a time, so events reach the sink in the order
 * they were offered. A slow sink only backs up its own mailbox. Events that
 * cannot be delivered (mailbox full, drain rejected by the executor) are
 * reported through the drop callback.
 */
@Slf4j
class EventMailbox {

    private final String name;
    private final int capacity;
    private final BlockingQueue<ChangeEvent<Map<String, Object>>> queue;
    private final Executor executor;
    private final Consumer<ChangeEvent<Map<String, Object>>> sink;
    private final Runnable onDropped;
    private final AtomicBoolean draining = new AtomicBoolean(false);

    EventMailbox(String name,
                 int capacity,
                 Executor executor,
                 Consumer<ChangeEvent<Map<String, Object>>> sink,
                 Runnable onDropped) {
        this.name = name;
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.executor = executor;
        this.sink = sink;
        this.onDropped = onDropped;
    }

    /**
     * Enqueues an event without blocking.
     *
     * @return false if the event was dropped
     */
    boolean offer(ChangeEvent<Map<String, Object>> event) {
        if (!queue.offer(event)) {
            log.warn("Mailbox full, dropping {} event for {} (capacity {})", event.kind(), name, capacity);
            onDropped.run();
            return false;
        }
        return scheduleDrain();
    }

    int size() {
        return queue.size();
    }

    void clear() {
        queue.clear();
    }

    /**
     * @return false if the executor rejected the drain and the pending events were discarded
     */
    private boolean scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return true;
        }
        try {
            executor.execute(this::drain);
            return true;
        } catch (RejectedExecutionException e) {
            // nothing else would ever drain what is queued now
            List<ChangeEvent<Map<String, Object>>> discarded = new ArrayList<>();
            queue.drainTo(discarded);
            draining.set(false);
            log.error("Dispatch executor rejected drain for {}, dropping {} pending events",
                    name, discarded.size(), e);
            discarded.forEach(ignored -> onDropped.run());
            return false;
        }
    }

    private void drain() {
        try {
            ChangeEvent<Map<String, Object>> event;
            while ((event = queue.poll()) != null) {
                sink.accept(event);
            }
        } finally {
            draining.set(false);
            if (!queue.isEmpty()) {
                scheduleDrain();
            }
        }
    }
}
