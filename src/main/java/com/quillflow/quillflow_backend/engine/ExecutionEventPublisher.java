package com.quillflow.quillflow_backend.engine;

import com.quillflow.quillflow_backend.model.pipeline.PipelineEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Sends every task event to the task's in-process channel (SSE and blocking waiters read it)
 * and to the task's STOMP topic. Transport problems are logged; the run never waits on consumers.
 */
@Slf4j
@Component
public class ExecutionEventPublisher {

    // Dashboard subscribes to /topic/tasks/{taskId} to receive live updates
    public static final String TOPIC = "/topic/tasks/";

    private final TaskEventChannelRegistry channels;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;

    public ExecutionEventPublisher(TaskEventChannelRegistry channels,
                                   SimpMessagingTemplate messagingTemplate,
                                   ObjectProvider<RedisWebSocketBridge> redisBridgeProvider) {
        this.channels = channels;
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    public PipelineEvent publish(PipelineEvent event) {
        TaskEventChannel channel = channels.open(UUID.fromString(event.taskId()));
        PipelineEvent stamped = channel.publish(event);
        if (stamped == null) {
            log.warn("Dropped event for task {} published after its terminal event", event.taskId());
            return null;
        }

        String destination = TOPIC + stamped.taskId();
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        log.debug("Publishing seq={} status={} phase={} to {} via {}", stamped.sequence(), stamped.status(),
                stamped.phase(), destination, bridge != null ? "Redis" : "Direct");
        try {
            if (bridge != null) {
                bridge.publish(destination, stamped);
            } else {
                messagingTemplate.convertAndSend(destination, stamped);
            }
        } catch (MessagingException | DataAccessException e) {
            log.warn("STOMP delivery to {} failed: {}", destination, e.getMessage());
        }
        return stamped;
    }
}
