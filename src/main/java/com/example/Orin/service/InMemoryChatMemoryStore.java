package com.example.Orin.service;

import com.example.Orin.config.OrinProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local conversation memory, for single-node deployments and tests.
 * Temporary sessions are not kept at all.
 */
@Service
@ConditionalOnProperty(prefix = "orin.memory", name = "backend", havingValue = "memory")
public class InMemoryChatMemoryStore implements ChatMemoryStore {

    private final Map<String, List<StoredMessage>> sessions = new ConcurrentHashMap<>();
    private final OrinProperties properties;

    public InMemoryChatMemoryStore(OrinProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<StoredMessage> loadHistory(String sessionId) {
        List<StoredMessage> messages = sessions.get(sessionId);
        if (messages == null) {
            return List.of();
        }
        synchronized (messages) {
            return List.copyOf(messages);
        }
    }

    @Override
    public void appendTurn(String sessionId, String userMessage, String assistantMessage, boolean temporary) {
        if (temporary) {
            return;
        }
        long now = Instant.now().toEpochMilli();
        List<StoredMessage> messages = sessions.computeIfAbsent(sessionId, id -> new ArrayList<>());
        synchronized (messages) {
            messages.add(new StoredMessage(StoredMessage.USER, userMessage, now));
            messages.add(new StoredMessage(StoredMessage.ASSISTANT, assistantMessage, now));
            int max = 2 * properties.getOrchestrator().getMemoryWindow();
            if (messages.size() > max) {
                messages.subList(0, messages.size() - max).clear();
            }
        }
    }

    @Override
    public void clear(String sessionId) {
        sessions.remove(sessionId);
    }
}
