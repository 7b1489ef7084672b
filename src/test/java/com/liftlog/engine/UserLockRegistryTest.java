package com.liftlog.engine;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class UserLockRegistryTest {

    private final UserLockRegistry locks = new UserLockRegistry();

    @Test
    void sameUser_getsTheSameLock() {
        assertSame(locks.lockFor("u1"), locks.lockFor("u1"));
    }

    @Test
    void differentUsers_doNotContend() throws Exception {
        locks.lockFor("u1").lock();
        try {
            AtomicBoolean acquired = new AtomicBoolean();
            Thread other = new Thread(() -> {
                if (locks.lockFor("u2").tryLock()) {
                    acquired.set(true);
                    locks.lockFor("u2").unlock();
                }
            });
            other.start();
            other.join(5000);
            assertTrue(acquired.get());
        } finally {
            locks.lockFor("u1").unlock();
        }
    }
}
