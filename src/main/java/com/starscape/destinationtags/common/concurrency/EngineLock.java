package com.starscape.destinationtags.common.concurrency;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Single reader/writer lock around the whole engine: one writer or many readers at a time.
 * Re-entrant, so a write section may call into other locked operations.
 */
@Component
public class EngineLock {
    
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    
    public <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    public void write(Runnable action) {
        write(() -> {
            action.run();
            return null;
        });
    }
}
