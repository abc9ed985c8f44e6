package com.tradecodes.classifier.service;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.Striped;
import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.ConversationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Process-wide store of open classification dialogues, keyed by conversation id.
 * <p>
 * Entries expire after a period without access. Callers mutate a context only inside
 * {@link #withLock(String, Supplier)}, which serializes work per conversation id.
 */
@Component
public class ConversationContextStore {

    private static final Logger logger = LoggerFactory.getLogger(ConversationContextStore.class);

    private final Cache<String, ConversationContext> contexts;
    private final Striped<Lock> locks;
    private final AtomicBoolean cleaning = new AtomicBoolean(false);

    @Autowired
    public ConversationContextStore(ClassifierProperties properties) {
        this(properties.getConversation(), Ticker.systemTicker());
    }

    @VisibleForTesting
    ConversationContextStore(ClassifierProperties.Conversation settings, Ticker ticker) {
        Duration idleTtl = settings.getIdleTtl();
        this.contexts = CacheBuilder.newBuilder()
                .expireAfterAccess(idleTtl)
                .maximumSize(settings.getMaxEntries())
                .ticker(ticker)
                .build();
        this.locks = Striped.lazyWeakLock(Math.max(1, settings.getLockStripes()));
        logger.info("Conversation store initialized: idle TTL {}, max {} entries", idleTtl, settings.getMaxEntries());
    }

    /**
     * Opens a new conversation under a fresh id.
     */
    public ConversationContext create(String originalQuery) {
        return start(newConversationId(), originalQuery);
    }

    /**
     * Registers a fresh conversation under the id, replacing whatever was stored there.
     */
    public ConversationContext start(String conversationId, String originalQuery) {
        ConversationContext context = new ConversationContext(conversationId, originalQuery);
        contexts.put(conversationId, context);
        return context;
    }

    public String newConversationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Existing conversation for the id, or a new one registered under it.
     */
    public ConversationContext getOrCreate(String conversationId, String originalQuery) {
        if (conversationId == null || conversationId.isBlank()) {
            return create(originalQuery);
        }
        return contexts.asMap().computeIfAbsent(conversationId, id -> new ConversationContext(id, originalQuery));
    }

    public Optional<ConversationContext> find(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(contexts.getIfPresent(conversationId));
    }

    /**
     * Runs the action while holding the lock for the conversation id.
     */
    public <T> T withLock(String conversationId, Supplier<T> action) {
        Lock lock = locks.get(conversationId == null ? "" : conversationId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void remove(String conversationId) {
        if (conversationId != null) {
            contexts.invalidate(conversationId);
        }
    }

    public long size() {
        return contexts.size();
    }

    /**
     * Evicts idle conversations; expiry otherwise happens lazily on access.
     */
    @Scheduled(fixedDelayString = "${app.classifier.conversation.cleanup-delay-ms:60000}")
    public void evictIdle() {
        if (!cleaning.compareAndSet(false, true)) {
            logger.debug("Conversation cleanup already running; skipping tick.");
            return;
        }
        try {
            long before = contexts.size();
            contexts.cleanUp();
            long evicted = before - contexts.size();
            if (evicted > 0) {
                logger.info("Evicted {} idle conversations, {} remain", evicted, contexts.size());
            }
        } finally {
            cleaning.set(false);
        }
    }
}
