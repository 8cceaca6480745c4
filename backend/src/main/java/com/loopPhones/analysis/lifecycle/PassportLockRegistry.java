package com.loopPhones.analysis.lifecycle;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per passport id. Updates to the same passport run one at a
 * time in arrival order; different passports never contend. An entry lives
 * only while some thread holds or waits on it.
 */
@Component
public class PassportLockRegistry {

    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String passportId, Supplier<T> action) {
        Entry entry = locks.compute(passportId, (id, existing) -> {
            Entry held = existing == null ? new Entry() : existing;
            held.users++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(passportId, (id, held) -> --held.users == 0 ? null : held);
        }
    }

    /** Number of passport ids currently holding or waiting on a lock */
    int activeLocks() {
        return locks.size();
    }

    // users is only touched inside compute on the owning key
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
