package com.quillflow.quillflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Relays STOMP task events through Redis pub/sub so every instance delivers them.
 * A task may run on instance A while its dashboard is connected to instance B.
 * Registered by {@code RedisWebSocketConfig} when app.redis-bridge.enabled is true.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisWebSocketBridge implements MessageListener {

    public static final String REDIS_CHANNEL = "quillflow:websocket:topic";

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    public void publish(String destination, Object payload) {
        try {
            String json = objectMapper.writeValueAsString(
                    new StompMessage(destination, objectMapper.valueToTree(payload)));
            redisTemplate.convertAndSend(REDIS_CHANNEL, json);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize task event for {}", destination, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            StompMessage stomp = objectMapper.readValue(body, StompMessage.class);
            messagingTemplate.convertAndSend(stomp.destination(), stomp.payload());
        } catch (IOException e) {
            log.error("Failed to forward Redis message to WebSocket", e);
        }
    }

    record StompMessage(String destination, JsonNode payload) {}
}
