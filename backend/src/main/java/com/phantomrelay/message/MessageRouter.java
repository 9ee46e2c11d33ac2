package com.phantomrelay.message;

import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.phantomrelay.account.Account;
import com.phantomrelay.account.AccountDirectory;
import com.phantomrelay.account.AccountLocks;
import com.phantomrelay.protocol.ConnectionHandle;
import com.phantomrelay.protocol.NewMessageFrame;
import com.phantomrelay.protocol.Payloads;
import com.phantomrelay.protocol.ValidationException;
import com.phantomrelay.queue.OfflineQueue;
import com.phantomrelay.queue.QueuedMessage;

import reactor.core.publisher.Mono;

/**
 * Blind carrier for encrypted messages.
 *
 * <p>A message goes to every open session of the recipient at once. When the
 * recipient has no open session, or none of them accepts the frame, the
 * message waits in the {@link OfflineQueue} until the recipient registers
 * again. Unknown recipients are queued as well: the relay cannot know who
 * will register later.
 *
 * <p>The decision and the delivery or enqueue run under the recipient's
 * stripe, the same one registration holds while it flushes the queue, so a
 * message can never be queued behind a flush that has already happened.
 */
public class MessageRouter {

    private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);

    private final AccountDirectory accountDirectory;
    private final OfflineQueue offlineQueue;
    private final AccountLocks locks;
    private final MessageIds messageIds;
    private final Clock clock;

    public MessageRouter(AccountDirectory accountDirectory, OfflineQueue offlineQueue, AccountLocks locks,
                         MessageIds messageIds, Clock clock) {
        this.accountDirectory = accountDirectory;
        this.offlineQueue = offlineQueue;
        this.locks = locks;
        this.messageIds = messageIds;
        this.clock = clock;
    }

    public Mono<RouteResult> route(String from, String to, JsonNode encryptedPayload) {
        return Mono.fromCallable(() -> {
            if (Payloads.isMissing(from) || Payloads.isMissing(to) || Payloads.isMissing(encryptedPayload)) {
                throw new ValidationException("Invalid message structure");
            }
            NewMessageFrame packet = new NewMessageFrame(from, encryptedPayload, clock.millis(), messageIds.next());
            return locks.withLock(to, () -> deliverOrQueue(to, packet));
        });
    }

    private RouteResult deliverOrQueue(String to, NewMessageFrame packet) {
        List<ConnectionHandle> open = accountDirectory.find(to)
                .map(Account::openConnections)
                .orElse(List.of());

        int deliveries = 0;
        for (ConnectionHandle connection : open) {
            if (connection.send(packet)) {
                deliveries++;
            }
        }
        if (deliveries > 0) {
            logger.debug("Message delivered: {} -> {} ({} session(s))", packet.from(), to, deliveries);
            return new RouteResult(packet.id(), DeliveryStatus.DELIVERED, deliveries);
        }

        offlineQueue.enqueue(to, QueuedMessage.of(packet));
        logger.debug("Message queued: {} -> {}", packet.from(), to);
        return new RouteResult(packet.id(), DeliveryStatus.QUEUED, 0);
    }
}
