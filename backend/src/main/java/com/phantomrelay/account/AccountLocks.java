package com.phantomrelay.account;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-account mutual exclusion. Two ids may share a stripe; one id
 * always maps to the same stripe, so everything done for an account under
 * {@link #withLock} is atomic with respect to everything else done for it.
 *
 * <p>Never acquire two stripes at once.
 */
public class AccountLocks {

    private final ReentrantLock[] stripes;

    public AccountLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
        }
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String accountId, Supplier<T> action) {
        ReentrantLock lock = stripes[Math.floorMod(accountId.hashCode(), stripes.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String accountId, Runnable action) {
        withLock(accountId, () -> {
            action.run();
            return null;
        });
    }
}
