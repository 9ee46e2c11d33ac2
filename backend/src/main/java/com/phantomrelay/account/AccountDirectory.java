package com.phantomrelay.account;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.phantomrelay.protocol.ConnectionHandle;
import com.phantomrelay.protocol.Payloads;
import com.phantomrelay.protocol.RegisteredFrame;
import com.phantomrelay.protocol.ValidationException;
import com.phantomrelay.queue.OfflineQueue;
import com.phantomrelay.queue.QueuedMessage;

import reactor.core.publisher.Mono;

/**
 * Zero-knowledge account registry.
 *
 * <p>Registration is trust-on-first-use: whoever first registers an id pins its
 * public key and display name. The relay does not verify ownership; clients
 * authenticate each other through the key material itself.
 *
 * <p>Registration, connection removal and routing to an account all run under
 * that account's stripe in {@link AccountLocks}.
 */
public class AccountDirectory {

    static final String DEFAULT_USERNAME = "Anonymous";

    private static final Logger logger = LoggerFactory.getLogger(AccountDirectory.class);

    private final ConcurrentHashMap<String, Account> accounts = new ConcurrentHashMap<>();

    private final OfflineQueue offlineQueue;
    private final AccountLocks locks;
    private final Clock clock;

    public AccountDirectory(OfflineQueue offlineQueue, AccountLocks locks, Clock clock) {
        this.offlineQueue = offlineQueue;
        this.locks = locks;
        this.clock = clock;
    }

    /**
     * Attaches {@code connection} to the account, creating the account on first
     * use, then confirms with a {@code registered} frame and drains the
     * account's offline queue to the same connection, oldest first.
     *
     * <p>A later registration of the same id with a different key or name keeps
     * the original values.
     */
    public Mono<RegistrationResult> register(String accountId, JsonNode publicKey, String username,
                                             ConnectionHandle connection) {
        return Mono.fromCallable(() -> {
            checkRegistration(accountId, publicKey);
            return locks.withLock(accountId, () -> attach(accountId, publicKey, username, connection));
        });
    }

    /**
     * @throws ValidationException if the id or the public key is missing
     */
    public void checkRegistration(String accountId, JsonNode publicKey) {
        if (Payloads.isMissing(accountId) || Payloads.isMissing(publicKey)) {
            throw new ValidationException("Missing accountId or publicKey");
        }
    }

    private RegistrationResult attach(String accountId, JsonNode publicKey, String username,
                                      ConnectionHandle connection) {
        // a handle that closed while its registration was in flight is never attached,
        // and the account's queue stays intact for the next session
        if (!connection.isOpen()) {
            logger.debug("Connection {} closed before registration of {}", connection.id(), accountId);
            return new RegistrationResult(accountId, accounts.size(), false, 0);
        }
        boolean created = !accounts.containsKey(accountId);
        Account account = accounts.computeIfAbsent(accountId, id -> new Account(
                id,
                publicKey,
                Payloads.isMissing(username) ? DEFAULT_USERNAME : username,
                clock.millis()));
        account.addConnection(connection);

        int known = accounts.size();
        connection.send(new RegisteredFrame(accountId, known));
        logger.info("User registered: {} ({})", accountId, account.username());

        List<QueuedMessage> pending = offlineQueue.flush(accountId);
        for (QueuedMessage message : pending) {
            connection.send(message.toFrame());
        }
        if (!pending.isEmpty()) {
            logger.info("Delivered {} queued message(s) to {}", pending.size(), accountId);
        }
        return new RegistrationResult(accountId, known, created, pending.size());
    }

    public Mono<Account> lookup(String accountId) {
        return Mono.justOrEmpty(find(accountId))
                .switchIfEmpty(Mono.error(() -> new AccountNotFoundException(accountId)));
    }

    public Optional<Account> find(String accountId) {
        return Payloads.isMissing(accountId) ? Optional.empty() : Optional.ofNullable(accounts.get(accountId));
    }

    /**
     * Detaches a closed or re-bound connection. Unknown ids and handles that
     * were never attached are ignored; the account itself is kept.
     */
    public Mono<Void> removeConnection(String accountId, ConnectionHandle connection) {
        return Mono.fromRunnable(() -> locks.withLock(accountId, () -> {
            Account account = accounts.get(accountId);
            if (account != null && account.removeConnection(connection) && account.connectionCount() == 0) {
                logger.info("User {} offline", accountId);
            }
        }));
    }

    /** Number of distinct account ids ever registered since startup. */
    public int size() {
        return accounts.size();
    }
}
