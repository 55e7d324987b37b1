package com.example.Orin.service;

import com.example.Orin.config.OrinProperties;
import com.example.Orin.exception.ConversationMemoryException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversation memory in a Redis list per session ({@code chat:memory:<sessionId>}).
 * <p>
 * Temporary sessions get a short TTL; other sessions keep a rolling TTL refreshed on
 * each new exchange.
 */
@Service
@ConditionalOnProperty(prefix = "orin.memory", name = "backend", havingValue = "redis", matchIfMissing = true)
public class RedisChatMemoryStore implements ChatMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(RedisChatMemoryStore.class);

    private static final String KEY_PREFIX = "chat:memory:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final OrinProperties properties;

    public RedisChatMemoryStore(StringRedisTemplate redisTemplate,
                                ObjectMapper objectMapper,
                                OrinProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public List<StoredMessage> loadHistory(String sessionId) {
        String key = buildKey(sessionId);
        List<String> rawMessages;
        try {
            Long size = redisTemplate.opsForList().size(key);
            if (size == null || size == 0L) {
                return List.of();
            }
            long start = Math.max(0, size - maxMessages());
            rawMessages = redisTemplate.opsForList().range(key, start, size - 1);
        } catch (DataAccessException e) {
            throw new ConversationMemoryException(sessionId, "Conversation memory is unreachable", e);
        }
        if (rawMessages == null || rawMessages.isEmpty()) {
            return List.of();
        }

        List<StoredMessage> messages = new ArrayList<>(rawMessages.size());
        for (String raw : rawMessages) {
            try {
                messages.add(objectMapper.readValue(raw, StoredMessage.class));
            } catch (JsonProcessingException e) {
                throw new ConversationMemoryException(sessionId, "Conversation memory entry is corrupted", e);
            }
        }
        return messages;
    }

    @Override
    public void appendTurn(String sessionId, String userMessage, String assistantMessage, boolean temporary) {
        String key = buildKey(sessionId);
        long now = Instant.now().toEpochMilli();
        List<StoredMessage> turn = List.of(
                new StoredMessage(StoredMessage.USER, userMessage, now),
                new StoredMessage(StoredMessage.ASSISTANT, assistantMessage, now)
        );

        List<String> serialized = new ArrayList<>(turn.size());
        for (StoredMessage message : turn) {
            try {
                serialized.add(objectMapper.writeValueAsString(message));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unserializable memory entry for session {}", sessionId, e);
                return;
            }
        }
        redisTemplate.opsForList().rightPushAll(key, serialized);

        // keep at most the configured window per session
        Long size = redisTemplate.opsForList().size(key);
        if (size != null && size > maxMessages()) {
            redisTemplate.opsForList().trim(key, size - maxMessages(), size - 1);
        }

        OrinProperties.Memory memory = properties.getMemory();
        redisTemplate.expire(key, temporary ? memory.getTemporaryTtl() : memory.getSessionTtl());
    }

    @Override
    public void clear(String sessionId) {
        redisTemplate.delete(buildKey(sessionId));
    }

    private long maxMessages() {
        return 2L * properties.getOrchestrator().getMemoryWindow();
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId;
    }
}
