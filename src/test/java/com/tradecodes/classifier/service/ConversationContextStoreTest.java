package com.tradecodes.classifier.service;

import com.google.common.base.Ticker;
import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.ConversationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationContextStoreTest {

    private ManualTicker ticker;
    private ConversationContextStore store;

    @BeforeEach
    void setUp() {
        ClassifierProperties.Conversation settings = new ClassifierProperties.Conversation();
        settings.setIdleTtl(Duration.ofMinutes(30));
        ticker = new ManualTicker();
        store = new ConversationContextStore(settings, ticker);
    }

    @Test
    void getOrCreateReturnsTheSameContextForAnId() {
        ConversationContext first = store.getOrCreate("conv-1", "coffee");
        ConversationContext second = store.getOrCreate("conv-1", "something else");

        assertThat(second).isSameAs(first);
        assertThat(second.getOriginalQuery()).isEqualTo("coffee");
    }

    @Test
    void startReplacesTheContextStoredUnderAnId() {
        ConversationContext first = store.getOrCreate("conv-1", "coffee");

        ConversationContext restarted = store.start("conv-1", "instant coffee");

        assertThat(restarted).isNotSameAs(first);
        assertThat(restarted.getOriginalQuery()).isEqualTo("instant coffee");
        assertThat(store.find("conv-1")).containsSame(restarted);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void missingIdCreatesFreshConversation() {
        ConversationContext context = store.getOrCreate(null, "steel bolts");

        assertThat(context.getConversationId()).isNotBlank();
        assertThat(store.find(context.getConversationId())).containsSame(context);
    }

    @Test
    void idleConversationsExpire() {
        store.getOrCreate("conv-1", "coffee");

        ticker.advance(Duration.ofMinutes(29));
        assertThat(store.find("conv-1")).isPresent();

        ticker.advance(Duration.ofMinutes(29));
        assertThat(store.find("conv-1")).isPresent();

        ticker.advance(Duration.ofMinutes(31));
        store.evictIdle();
        assertThat(store.find("conv-1")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void removeDropsTheConversation() {
        store.getOrCreate("conv-1", "coffee");

        store.remove("conv-1");
        store.remove(null);

        assertThat(store.find("conv-1")).isEmpty();
    }

    @Test
    void withLockSerializesWorkOnOneConversation() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Integer> rounds = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int i = 0; i < 20; i++) {
                pool.submit(() -> {
                    start.await();
                    return store.withLock("conv-1", () -> {
                        ConversationContext context = store.getOrCreate("conv-1", "coffee");
                        int seen = context.getRound();
                        context.nextRound();
                        rounds.add(seen);
                        return seen;
                    });
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(rounds).hasSize(20).doesNotHaveDuplicates();
        assertThat(store.find("conv-1")).get().extracting(ConversationContext::getRound).isEqualTo(21);
    }

    private static final class ManualTicker extends Ticker {

        private final AtomicLong nanos = new AtomicLong();

        @Override
        public long read() {
            return nanos.get();
        }

        void advance(Duration duration) {
            nanos.addAndGet(duration.toNanos());
        }
    }
}
