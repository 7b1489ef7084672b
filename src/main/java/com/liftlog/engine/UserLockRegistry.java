package com.liftlog.engine;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One exclusive lock per user. Everything that changes a user's log or views
 * runs under it; different users never contend.
 * <p>
 * Locks are kept for the life of the process, one small object per user who
 * ever wrote. Evicting one is unsafe while another thread may still hold it,
 * and the lock only serializes writers inside this JVM.
 */
public class UserLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String userId) {
        return locks.computeIfAbsent(userId, id -> new ReentrantLock());
    }
}
