package com.phantomrelay.relay;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phantomrelay.account.AccountDirectory;
import com.phantomrelay.account.AccountLocks;
import com.phantomrelay.config.RelayProperties;
import com.phantomrelay.message.MessageIds;
import com.phantomrelay.message.MessageRouter;
import com.phantomrelay.protocol.ConnectionHandle;
import com.phantomrelay.protocol.ErrorFrame;
import com.phantomrelay.protocol.FrameCodec;
import com.phantomrelay.protocol.InboundFrame;
import com.phantomrelay.protocol.MalformedFrameException;
import com.phantomrelay.protocol.MessageSentFrame;
import com.phantomrelay.protocol.OutboundFrame;
import com.phantomrelay.protocol.PongFrame;
import com.phantomrelay.protocol.PublicKeyFrame;
import com.phantomrelay.protocol.RelayException;
import com.phantomrelay.queue.CleanupScheduler;
import com.phantomrelay.queue.OfflineQueue;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * One relay instance: the account directory, the offline queue, the router,
 * the cleanup timer and the sessions currently connected.
 *
 * <p>Transport adapters call {@link #open}, {@link #onFrame} and
 * {@link #onClose}. Nothing a client sends can close its session; every
 * failure to handle a frame ends in an {@code error} frame to that client,
 * except unknown message types, which are only logged.
 */
public class RelayServer {

    private static final Logger logger = LoggerFactory.getLogger(RelayServer.class);

    private final FrameCodec codec;
    private final OfflineQueue offlineQueue;
    private final AccountDirectory accountDirectory;
    private final MessageRouter messageRouter;
    private final CleanupScheduler cleanupScheduler;

    private final Set<RelaySession> sessions = ConcurrentHashMap.newKeySet();

    public RelayServer(RelayProperties properties, FrameCodec codec, Clock clock, Scheduler timer) {
        AccountLocks locks = new AccountLocks(properties.lockStripes());
        this.codec = codec;
        this.offlineQueue = new OfflineQueue();
        this.accountDirectory = new AccountDirectory(offlineQueue, locks, clock);
        this.messageRouter = new MessageRouter(accountDirectory, offlineQueue, locks, new MessageIds(), clock);
        this.cleanupScheduler = new CleanupScheduler(offlineQueue, clock,
                properties.retention(), properties.cleanupInterval(), timer);
    }

    public void start() {
        cleanupScheduler.start();
        logger.info("Phantom relay started");
    }

    /** Stops the cleanup timer and closes every connected session. */
    public void shutdown() {
        logger.info("Shutting down relay, closing {} session(s)", sessions.size());
        cleanupScheduler.stop();
        for (RelaySession session : sessions) {
            session.connection().close();
        }
    }

    public RelaySession open(ConnectionHandle connection) {
        RelaySession session = new RelaySession(connection);
        sessions.add(session);
        logger.info("New connection established: {}", connection.id());
        return session;
    }

    /**
     * Handles one inbound text frame. The returned {@code Mono} never errors.
     */
    public Mono<Void> onFrame(RelaySession session, String text) {
        return Mono.defer(() -> dispatch(session, codec.decode(text)))
                .onErrorResume(MalformedFrameException.class, e -> {
                    logger.warn("Malformed frame from {}", session.connection().id());
                    logger.debug("Frame parse failure", e);
                    return reply(session, new ErrorFrame(e.getMessage()));
                })
                .onErrorResume(RelayException.class, e -> reply(session, new ErrorFrame(e.getMessage())))
                .onErrorResume(e -> {
                    logger.error("Error processing frame from {}", session.connection().id(), e);
                    return reply(session, new ErrorFrame(MalformedFrameException.MESSAGE));
                });
    }

    /** Detaches the session from its bound account. Repeated calls are no-ops. */
    public Mono<Void> onClose(RelaySession session) {
        return Mono.defer(() -> {
            if (!sessions.remove(session)) {
                return Mono.empty();
            }
            logger.info("Connection closed: {}", session.connection().id());
            String accountId = session.accountId();
            return accountId == null
                    ? Mono.empty()
                    : accountDirectory.removeConnection(accountId, session.connection());
        });
    }

    private Mono<Void> dispatch(RelaySession session, InboundFrame frame) {
        String type = frame.type();
        if (type == null) {
            return ignore(session, null);
        }
        return switch (type) {
            case InboundFrame.REGISTER -> register(session, frame);
            case InboundFrame.SEND_MESSAGE -> sendMessage(session, frame);
            case InboundFrame.GET_PUBLIC_KEY -> getPublicKey(session, frame);
            case InboundFrame.PING -> reply(session, new PongFrame());
            default -> ignore(session, type);
        };
    }

    /**
     * Validates first, so a rejected registration leaves the current binding
     * alone. The handle then leaves its previous account before it joins the
     * new one, and the session is bound before the handle becomes visible
     * there, so a close racing the registration always finds it.
     */
    private Mono<Void> register(RelaySession session, InboundFrame frame) {
        String accountId = frame.accountId();
        return Mono.fromRunnable(() -> accountDirectory.checkRegistration(accountId, frame.publicKey()))
                .then(Mono.defer(() -> detachPrevious(session, accountId)))
                .then(Mono.fromRunnable(() -> session.bind(accountId)))
                .then(accountDirectory.register(accountId, frame.publicKey(), frame.username(),
                        session.connection()))
                .then();
    }

    // a handle belongs to one account at a time
    private Mono<Void> detachPrevious(RelaySession session, String accountId) {
        String previous = session.accountId();
        if (previous == null || previous.equals(accountId)) {
            return Mono.empty();
        }
        return accountDirectory.removeConnection(previous, session.connection());
    }

    private Mono<Void> sendMessage(RelaySession session, InboundFrame frame) {
        return messageRouter.route(frame.from(), frame.to(), frame.encryptedMessage())
                .flatMap(result -> reply(session,
                        new MessageSentFrame(result.messageId(), result.status().wireName())));
    }

    private Mono<Void> getPublicKey(RelaySession session, InboundFrame frame) {
        return accountDirectory.lookup(frame.accountId())
                .flatMap(account -> reply(session,
                        new PublicKeyFrame(account.id(), account.publicKey(), account.username())));
    }

    private Mono<Void> ignore(RelaySession session, String type) {
        logger.info("Unknown message type from {}: {}", session.connection().id(), type);
        return Mono.empty();
    }

    private Mono<Void> reply(RelaySession session, OutboundFrame frame) {
        return Mono.fromRunnable(() -> session.connection().send(frame));
    }

    public AccountDirectory accountDirectory() {
        return accountDirectory;
    }

    public OfflineQueue offlineQueue() {
        return offlineQueue;
    }

    public MessageRouter messageRouter() {
        return messageRouter;
    }

    public CleanupScheduler cleanupScheduler() {
        return cleanupScheduler;
    }

    public int sessionCount() {
        return sessions.size();
    }
}
