package com.zerotrust.access.session;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes work per session id using a fixed set of lock stripes. Two ids may
 * share a stripe; the same id always maps to the same one.
 */
@Component
public class SessionLockRegistry {

    private final ReentrantLock[] stripes;

    public SessionLockRegistry(@Value("${zerotrust.session.lock-stripes:256}") int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("lock-stripes must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String sessionId, Supplier<T> work) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String sessionId) {
        int hash = sessionId != null ? sessionId.hashCode() : 0;
        return stripes[Math.floorMod(hash, stripes.length)];
    }
}
