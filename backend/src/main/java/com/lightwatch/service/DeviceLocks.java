package com.lightwatch.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import ru.tinkoff.kora.common.Component;

@Component
public final class DeviceLocks {
    private final ConcurrentHashMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(long deviceId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(deviceId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void forget(long deviceId) {
        locks.remove(deviceId);
    }

    int size() {
        return locks.size();
    }
}
