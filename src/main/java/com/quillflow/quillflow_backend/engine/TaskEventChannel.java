package com.quillflow.quillflow_backend.engine;

import com.quillflow.quillflow_backend.model.pipeline.PipelineEvent;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-task, multi-consumer event stream. Events are numbered from 1 in publish order;
 * a bounded history lets late subscribers replay what they missed. The terminal event
 * closes the channel and nothing is accepted after it.
 */
public class TaskEventChannel {

    private final UUID taskId;
    private final int historyLimit;
    private final int subscriberBuffer;

    private final Deque<PipelineEvent> history = new ArrayDeque<>();
    private final List<TaskSubscription> subscribers = new CopyOnWriteArrayList<>();

    private long nextSequence = 1;
    private volatile boolean closed;
    private volatile Instant closedAt;

    public TaskEventChannel(UUID taskId, int historyLimit, int subscriberBuffer) {
        this.taskId = taskId;
        this.historyLimit = Math.max(1, historyLimit);
        this.subscriberBuffer = subscriberBuffer;
    }

    /**
     * Stamps the next sequence number on the event and fans it out.
     * Returns the stamped event, or null if the channel is already closed.
     */
    public synchronized PipelineEvent publish(PipelineEvent event) {
        if (closed) {
            return null;
        }
        PipelineEvent stamped = event.withSequence(nextSequence++);
        history.addLast(stamped);
        while (history.size() > historyLimit) {
            history.pollFirst();
        }
        for (TaskSubscription s : subscribers) {
            s.offer(stamped);
        }
        if (stamped.terminal()) {
            closed = true;
            closedAt = Instant.now();
            for (TaskSubscription s : subscribers) {
                s.complete();
            }
            subscribers.clear();
        }
        return stamped;
    }

    /**
     * Subscribes and replays retained events with a sequence above {@code afterSequence}.
     * A subscription to a closed channel gets the replay and is already complete.
     */
    public synchronized TaskSubscription subscribe(long afterSequence) {
        TaskSubscription subscription = new TaskSubscription(this, subscriberBuffer);
        PipelineEvent oldest = history.peekFirst();
        if (oldest != null && oldest.sequence() > afterSequence + 1) {
            // events between afterSequence and the oldest retained one are gone
            subscription.markLagging();
        }
        for (PipelineEvent e : history) {
            if (e.sequence() > afterSequence) {
                subscription.offer(e);
            }
        }
        if (closed) {
            subscription.complete();
        } else {
            subscribers.add(subscription);
        }
        return subscription;
    }

    void unsubscribe(TaskSubscription subscription) {
        subscribers.remove(subscription);
    }

    public synchronized List<PipelineEvent> history() {
        return new ArrayList<>(history);
    }

    public synchronized long lastSequence() {
        return nextSequence - 1;
    }

    public UUID getTaskId() {
        return taskId;
    }

    public boolean isClosed() {
        return closed;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
