/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.unit;

import com.chatrelay.auth.UserRegistry;
import com.chatrelay.protocol.ChatSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class UserRegistryTest {

    private UserRegistry registry;
    private ChatSession session1;
    private ChatSession session2;

    @BeforeEach
    void setUp() {
        registry = new UserRegistry();
        session1 = mock(ChatSession.class);
        session2 = mock(ChatSession.class);
    }

    @AfterEach
    void tearDown() {
        registry.clear();
    }

    @Test
    void shouldRegisterUser() {
        assertTrue(registry.register("alice", session1));

        assertTrue(registry.isOnline("alice"));
        assertSame(session1, registry.getSession("alice"));
        assertEquals(1, registry.getOnlineCount());
    }

    @Test
    void shouldRejectSecondClaimOnSameName() {
        assertTrue(registry.register("alice", session1));

        assertFalse(registry.register("alice", session2));

        assertSame(session1, registry.getSession("alice"));
        assertEquals(1, registry.getOnlineCount());
    }

    @Test
    void shouldTreatNamesCaseSensitively() {
        assertTrue(registry.register("alice", session1));
        assertTrue(registry.register("ALICE", session2));

        assertEquals(2, registry.getOnlineCount());
        assertFalse(registry.isOnline("Alice"));
    }

    @Test
    void shouldRejectEmptyOrNullArguments() {
        assertFalse(registry.register("", session1));
        assertFalse(registry.register(null, session1));
        assertFalse(registry.register("alice", null));
        assertEquals(0, registry.getOnlineCount());
    }

    @Test
    void shouldUnregisterUser() {
        registry.register("alice", session1);

        assertTrue(registry.unregister("alice", session1));

        assertFalse(registry.isOnline("alice"));
        assertEquals(0, registry.getOnlineCount());
    }

    @Test
    void shouldOnlyLetOwnerUnregister() {
        registry.register("alice", session1);

        assertFalse(registry.unregister("alice", session2));

        assertTrue(registry.isOnline("alice"));
    }

    @Test
    void shouldReturnFalseWhenUnregisteringNonexistentUser() {
        assertFalse(registry.unregister("nobody", session1));
        assertFalse(registry.unregister("", session1));
    }

    @Test
    void shouldAllowNameReuseAfterUnregister() {
        registry.register("alice", session1);
        registry.unregister("alice", session1);

        assertTrue(registry.register("alice", session2));
        assertSame(session2, registry.getSession("alice"));
    }

    @Test
    void snapshotShouldBeDetachedFromLaterChanges() {
        registry.register("alice", session1);
        registry.register("bob", session2);

        List<ChatSession> snapshot = registry.snapshot();
        registry.unregister("bob", session2);

        assertEquals(2, snapshot.size());
        assertTrue(snapshot.contains(session1));
        assertTrue(snapshot.contains(session2));
        assertEquals(List.of("alice"), registry.getOnlineUsernames());
    }

    @Test
    void concurrentClaimsOnOneNameAdmitExactlyOne() throws Exception {
        int contenders = 16;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch startGate = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                ChatSession contender = mock(ChatSession.class);
                futures.add(pool.submit(() -> {
                    startGate.await();
                    if (registry.register("SAME", contender)) {
                        winners.incrementAndGet();
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, winners.get());
        assertEquals(1, registry.getOnlineCount());
    }
}
