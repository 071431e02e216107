package org.example.storybook.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.persistence.OptimisticLockException;
import org.example.storybook.entity.ConversationContextEntity;
import org.example.storybook.model.ConversationContext;
import org.example.storybook.repository.ConversationContextRepository;
import org.example.storybook.service.llm.ChatSession;
import org.example.storybook.service.llm.ChatSessionContinuation;
import org.example.storybook.service.llm.ContinuationKind;
import org.example.storybook.service.llm.ProviderContinuation;
import org.example.storybook.service.llm.ResponseIdContinuation;
import org.example.storybook.service.llm.StatelessContinuation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores per-run conversation contexts with one continuation slot per provider.
 * <p>
 * Response-id slots are persisted as JSON. Chat session slots only persist their kind; the session
 * handle itself lives in this process and is gone after a restart, in which case the slot is reported
 * as {@link ChatSessionContinuation#lost()}.
 */
@Service
public class ConversationContextManager {

    private static final Logger log = LoggerFactory.getLogger(ConversationContextManager.class);
    static final int MAX_UPDATE_ATTEMPTS = 3;

    private final ConversationContextRepository repository;
    private final ObjectMapper objectMapper;
    private final Map<String, Map<String, ChatSession>> liveSessions = new ConcurrentHashMap<>();

    public ConversationContextManager(ConversationContextRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the context, or replaces the system prompt of an existing one. Existing slots are kept.
     */
    public void initializeContext(String contextId, String storyId, String systemPrompt) {
        Optional<ConversationContextEntity> existing = repository.findById(contextId);
        if (existing.isPresent()) {
            ConversationContextEntity context = existing.get();
            context.setSystemPrompt(systemPrompt);
            context.setUpdatedAt(LocalDateTime.now());
            repository.save(context);
            log.debug("Updated system prompt of conversation context {}", contextId);
            return;
        }

        ConversationContextEntity context = new ConversationContextEntity(contextId, storyId);
        context.setSystemPrompt(systemPrompt);
        context.setProviderDataJson("{}");
        try {
            repository.saveAndFlush(context);
            log.info("Initialized conversation context {} for story {}", contextId, storyId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Conversation context {} already exists (race condition handled)", contextId);
        }
    }

    public Optional<ConversationContext> getContext(String contextId) {
        if (contextId == null || contextId.isBlank()) {
            return Optional.empty();
        }
        return repository.findById(contextId).map(this::toContext);
    }

    /**
     * Replaces one provider's slot. Other providers' slots are left untouched.
     * <p>
     * Concurrent writers to the same context are detected through the entity version; the losing
     * write re-reads the context and applies its slot again.
     */
    public void updateProviderData(String contextId, String providerKey, ProviderContinuation continuation) {
        if (providerKey == null || providerKey.isBlank()) {
            throw new IllegalArgumentException("providerKey is required");
        }
        ProviderContinuation slot = continuation != null ? continuation : StatelessContinuation.INSTANCE;

        for (int attempt = 1; ; attempt++) {
            ConversationContextEntity context = repository.findById(contextId)
                    .orElseThrow(() -> new ContextNotFoundException(contextId));
            ObjectNode providerData = readProviderData(context.getProviderDataJson());
            providerData.set(providerKey, toSlotJson(slot));
            context.setProviderDataJson(writeJson(providerData));
            context.setUpdatedAt(LocalDateTime.now());
            try {
                repository.saveAndFlush(context);
                break;
            } catch (ObjectOptimisticLockingFailureException | OptimisticLockException e) {
                if (attempt >= MAX_UPDATE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Concurrent update of context {} (attempt {}/{}), retrying",
                        contextId, attempt, MAX_UPDATE_ATTEMPTS);
            }
        }

        if (slot instanceof ChatSessionContinuation chat && chat.isLive()) {
            liveSessions.computeIfAbsent(contextId, id -> new ConcurrentHashMap<>())
                    .put(providerKey, chat.session());
        } else {
            Map<String, ChatSession> sessions = liveSessions.get(contextId);
            if (sessions != null) {
                sessions.remove(providerKey);
            }
        }
        log.debug("Updated {} continuation for provider {} on context {}", slot.kind(), providerKey, contextId);
    }

    @Transactional
    public void clearContext(String contextId) {
        liveSessions.remove(contextId);
        if (repository.existsById(contextId)) {
            repository.deleteById(contextId);
            log.info("Cleared conversation context {}", contextId);
        }
    }

    /**
     * Removes contexts that have not been touched within {@code maxAge}.
     *
     * @return number of contexts removed
     */
    public int cleanupStaleContexts(Duration maxAge) {
        LocalDateTime cutoff = LocalDateTime.now().minus(maxAge);
        List<String> staleIds = repository.findStaleContextIds(cutoff);
        int removed = repository.deleteStale(cutoff);
        staleIds.forEach(liveSessions::remove);
        if (removed > 0) {
            log.info("Removed {} conversation contexts idle since before {}", removed, cutoff);
        }
        return removed;
    }

    int liveSessionCount(String contextId) {
        Map<String, ChatSession> sessions = liveSessions.get(contextId);
        return sessions != null ? sessions.size() : 0;
    }

    private ConversationContext toContext(ConversationContextEntity entity) {
        Map<String, ProviderContinuation> slots = new LinkedHashMap<>();
        Map<String, ChatSession> sessions = liveSessions.getOrDefault(entity.getContextId(), Map.of());

        Iterator<Map.Entry<String, JsonNode>> fields = readProviderData(entity.getProviderDataJson()).fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            ProviderContinuation slot = fromSlotJson(field.getValue(), sessions.get(field.getKey()));
            if (slot != null) {
                slots.put(field.getKey(), slot);
            }
        }

        return new ConversationContext(
                entity.getContextId(),
                entity.getStoryId(),
                entity.getSystemPrompt(),
                Collections.unmodifiableMap(slots),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    private ObjectNode toSlotJson(ProviderContinuation slot) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("kind", slot.kind().name());
        if (slot instanceof ResponseIdContinuation responseId) {
            node.put("previousResponseId", responseId.previousResponseId());
        } else if (slot instanceof ChatSessionContinuation chat && chat.isLive()) {
            node.put("sessionId", chat.session().getSessionId());
        }
        return node;
    }

    private ProviderContinuation fromSlotJson(JsonNode node, ChatSession liveSession) {
        ContinuationKind kind;
        try {
            kind = ContinuationKind.valueOf(node.path("kind").asText());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring continuation slot with unknown kind: {}", node.path("kind").asText());
            return null;
        }
        return switch (kind) {
            case RESPONSE_ID -> new ResponseIdContinuation(node.path("previousResponseId").asText(null));
            case CHAT_SESSION -> liveSession != null
                    ? new ChatSessionContinuation(liveSession)
                    : ChatSessionContinuation.lost();
            case STATELESS -> StatelessContinuation.INSTANCE;
        };
    }

    private ObjectNode readProviderData(String json) {
        if (json == null || json.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            return node instanceof ObjectNode objectNode ? objectNode : objectMapper.createObjectNode();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse conversation provider data JSON", e);
            return objectMapper.createObjectNode();
        }
    }

    private String writeJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conversation provider data", e);
        }
    }
}
