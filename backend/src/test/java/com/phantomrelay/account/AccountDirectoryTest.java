package com.phantomrelay.account;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.phantomrelay.protocol.NewMessageFrame;
import com.phantomrelay.protocol.OutboundFrame;
import com.phantomrelay.protocol.RegisteredFrame;
import com.phantomrelay.protocol.ConnectionHandle;
import com.phantomrelay.protocol.ValidationException;
import com.phantomrelay.queue.OfflineQueue;
import com.phantomrelay.queue.QueuedMessage;
import com.phantomrelay.support.MutableClock;
import com.phantomrelay.support.RecordingConnection;

import reactor.test.StepVerifier;

/**
 * Unit tests for AccountDirectory.
 *
 * Connections are in-memory recorders (or Mockito mocks where only an
 * interaction matters), so no transport is needed.
 */
@ExtendWith(MockitoExtension.class)
class AccountDirectoryTest {

    private static final JsonNode KEY_A = TextNode.valueOf("pub-key-alice");
    private static final JsonNode KEY_B = TextNode.valueOf("pub-key-other");

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));

    private OfflineQueue offlineQueue;
    private AccountDirectory directory;

    @Mock
    private ConnectionHandle mockConnection;

    @BeforeEach
    void setup() {
        offlineQueue = new OfflineQueue();
        directory = new AccountDirectory(offlineQueue, new AccountLocks(8), clock);
    }

    // ── register ──────────────────────────────────────────────────────────────

    @Test
    void registerCreatesAccountOnce() {
        RecordingConnection first = new RecordingConnection("c1");

        StepVerifier.create(directory.register("alice", KEY_A, "Alice", first))
                .assertNext(result -> {
                    assertTrue(result.created());
                    assertEquals(1, result.onlineUsers());
                    assertEquals(0, result.flushed());
                })
                .verifyComplete();

        Account account = directory.find("alice").orElseThrow();
        assertEquals(KEY_A, account.publicKey());
        assertEquals("Alice", account.username());
        assertEquals(clock.millis(), account.registeredAt());
        assertEquals(1, directory.size());
    }

    @Test
    void reRegistrationKeepsOriginalKeyAndAddsConnection() {
        RecordingConnection first = new RecordingConnection("c1");
        RecordingConnection second = new RecordingConnection("c2");
        directory.register("alice", KEY_A, "Alice", first).block();

        StepVerifier.create(directory.register("alice", KEY_B, "Mallory", second))
                .assertNext(result -> assertFalse(result.created()))
                .verifyComplete();

        Account account = directory.find("alice").orElseThrow();
        assertEquals(KEY_A, account.publicKey(), "Stored key must not be overwritten");
        assertEquals("Alice", account.username());
        assertEquals(2, account.connectionCount());
        assertEquals(1, directory.size());
    }

    @Test
    void registeringSameConnectionTwiceIsIdempotent() {
        RecordingConnection connection = new RecordingConnection("c1");
        directory.register("alice", KEY_A, null, connection).block();
        directory.register("alice", KEY_A, null, connection).block();

        assertEquals(1, directory.find("alice").orElseThrow().connectionCount());
    }

    @Test
    void missingUsernameDefaultsToAnonymous() {
        directory.register("alice", KEY_A, "", new RecordingConnection("c1")).block();

        assertEquals("Anonymous", directory.find("alice").orElseThrow().username());
    }

    @Test
    void registerRepliesWithKnownAccountCount() {
        directory.register("alice", KEY_A, null, new RecordingConnection("c1")).block();
        RecordingConnection bob = new RecordingConnection("c2");

        directory.register("bob", KEY_B, null, bob).block();

        assertEquals(List.of(new RegisteredFrame("bob", 2)), bob.frames());
    }

    @Test
    void registerWithoutPublicKeyFailsWithoutStateChange() {
        StepVerifier.create(directory.register("alice", NullNode.getInstance(), "Alice", mockConnection))
                .expectErrorMatches(ex -> ex instanceof ValidationException
                        && ex.getMessage().equals("Missing accountId or publicKey"))
                .verify();

        assertEquals(0, directory.size());
        verify(mockConnection, never()).send(any());
    }

    @Test
    void registerWithoutAccountIdFails() {
        StepVerifier.create(directory.register(null, KEY_A, "Alice", mockConnection))
                .expectError(ValidationException.class)
                .verify();

        assertEquals(0, directory.size());
    }

    // ── offline flush ─────────────────────────────────────────────────────────

    @Test
    void registerFlushesQueueInOrderAfterConfirmation() {
        offlineQueue.enqueue("bob", new QueuedMessage("m1", "alice", TextNode.valueOf("c1"), 1L));
        offlineQueue.enqueue("bob", new QueuedMessage("m2", "carol", TextNode.valueOf("c2"), 2L));
        RecordingConnection bob = new RecordingConnection("bob-1");

        StepVerifier.create(directory.register("bob", KEY_B, "Bob", bob))
                .assertNext(result -> assertEquals(2, result.flushed()))
                .verifyComplete();

        List<OutboundFrame> frames = bob.frames();
        assertEquals(3, frames.size());
        assertInstanceOf(RegisteredFrame.class, frames.get(0));
        assertEquals(new NewMessageFrame("alice", TextNode.valueOf("c1"), 1L, "m1"), frames.get(1));
        assertEquals(new NewMessageFrame("carol", TextNode.valueOf("c2"), 2L, "m2"), frames.get(2));
        assertEquals(0, offlineQueue.size(), "Queue must be empty after flush");
    }

    @Test
    void secondRegistrationDeliversNothingFurther() {
        offlineQueue.enqueue("bob", new QueuedMessage("m1", "alice", TextNode.valueOf("c1"), 1L));
        directory.register("bob", KEY_B, "Bob", new RecordingConnection("bob-1")).block();
        RecordingConnection again = new RecordingConnection("bob-2");

        StepVerifier.create(directory.register("bob", KEY_B, "Bob", again))
                .assertNext(result -> assertEquals(0, result.flushed()))
                .verifyComplete();

        assertTrue(again.framesOf(NewMessageFrame.class).isEmpty());
    }

    // ── lookup / removeConnection / online ───────────────────────────────────

    @Test
    void lookupUnknownAccountFails() {
        StepVerifier.create(directory.lookup("ghost"))
                .expectErrorMatches(ex -> ex instanceof AccountNotFoundException
                        && ex.getMessage().contains("User not found"))
                .verify();
    }

    @Test
    void lookupKnownAccount() {
        directory.register("alice", KEY_A, "Alice", new RecordingConnection("c1")).block();

        StepVerifier.create(directory.lookup("alice"))
                .assertNext(account -> assertEquals(KEY_A, account.publicKey()))
                .verifyComplete();
    }

    @Test
    void removeConnectionIsIdempotentAndKeepsAccount() {
        RecordingConnection connection = new RecordingConnection("c1");
        directory.register("alice", KEY_A, "Alice", connection).block();

        StepVerifier.create(directory.removeConnection("alice", connection)).verifyComplete();
        StepVerifier.create(directory.removeConnection("alice", connection)).verifyComplete();
        StepVerifier.create(directory.removeConnection("nobody", connection)).verifyComplete();

        Account account = directory.find("alice").orElseThrow();
        assertEquals(0, account.connectionCount());
        assertFalse(account.isOnline());
        assertEquals(1, directory.size());
    }

    @Test
    void closedButAttachedConnectionIsNotOnline() {
        RecordingConnection connection = new RecordingConnection("c1");
        directory.register("alice", KEY_A, "Alice", connection).block();
        connection.close();

        Account account = directory.find("alice").orElseThrow();
        assertEquals(1, account.connectionCount());
        assertFalse(account.isOnline());
        assertTrue(account.openConnections().isEmpty());
    }

    @Test
    void registerOnClosedConnectionAttachesNothingAndKeepsQueue() {
        offlineQueue.enqueue("alice", new QueuedMessage("m1", "bob", TextNode.valueOf("c1"), clock.millis()));
        when(mockConnection.isOpen()).thenReturn(false);

        StepVerifier.create(directory.register("alice", KEY_A, "Alice", mockConnection))
                .assertNext(result -> {
                    assertFalse(result.created());
                    assertEquals(0, result.flushed());
                })
                .verifyComplete();

        verify(mockConnection, never()).send(any());
        assertTrue(directory.find("alice").isEmpty());
        assertEquals(1, offlineQueue.pending("alice").size());
    }
}
