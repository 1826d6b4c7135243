package com.quillflow.quillflow_backend.engine;

import com.quillflow.quillflow_backend.model.pipeline.PipelineEvent;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * One consumer's view of a task channel. The buffer is bounded: when the consumer falls behind,
 * the oldest undelivered event is dropped and the subscription is flagged as lagging.
 * The publisher never blocks on a subscription.
 */
public class TaskSubscription implements AutoCloseable {

    private final TaskEventChannel channel;
    private final LinkedBlockingDeque<PipelineEvent> buffer;
    private volatile boolean lagging;
    private volatile boolean completed;
    private volatile long droppedEvents;

    TaskSubscription(TaskEventChannel channel, int capacity) {
        this.channel = channel;
        this.buffer = new LinkedBlockingDeque<>(Math.max(1, capacity));
    }

    synchronized void offer(PipelineEvent event) {
        while (!buffer.offerLast(event)) {
            buffer.pollFirst();
            droppedEvents++;
            lagging = true;
        }
    }

    void complete() {
        completed = true;
    }

    void markLagging() {
        lagging = true;
    }

    /** Next event, or null if none arrived within {@code timeout}. */
    public PipelineEvent poll(Duration timeout) throws InterruptedException {
        return buffer.pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** True once the terminal event was delivered into the buffer and the buffer is drained. */
    public boolean isFinished() {
        return completed && buffer.isEmpty();
    }

    public boolean isLagging() {
        return lagging;
    }

    public long getDroppedEvents() {
        return droppedEvents;
    }

    @Override
    public void close() {
        channel.unsubscribe(this);
    }
}
