package cex.spot.matching.service;

import cex.spot.matching.exception.LockAcquisitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutation lock per symbol
 * Place and cancel on the same symbol are serialized; different symbols proceed in parallel
 */
@Slf4j
@Component
public class SymbolLockRegistry {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Fair locks hand the lock to waiters in arrival order
     */
    private final boolean fair;

    /**
     * Maximum wait in milliseconds, 0 waits without a timeout
     */
    private final long timeoutMs;

    public SymbolLockRegistry(@Value("${matching.lock.fair:true}") boolean fair,
                              @Value("${matching.lock.timeout-ms:0}") long timeoutMs) {
        this.fair = fair;
        this.timeoutMs = timeoutMs;
        log.info("Symbol lock registry initialized: fair={}, timeoutMs={}", fair, timeoutMs);
    }

    /**
     * Execute action while holding the lock of a symbol
     *
     * @param symbol the trading symbol
     * @param action the action to execute while holding the lock
     * @param <T> the return type of the action
     * @return the result of the action
     * @throws LockAcquisitionException if the bounded wait elapses or the thread is interrupted
     */
    public <T> T executeWithLock(String symbol, Supplier<T> action) {
        ReentrantLock lock = lockFor(symbol);
        acquire(lock, symbol);
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether the current thread holds the lock of a symbol
     */
    public boolean isHeldByCurrentThread(String symbol) {
        ReentrantLock lock = locks.get(symbol);
        return lock != null && lock.isHeldByCurrentThread();
    }

    /**
     * Number of threads waiting for the lock of a symbol (estimate)
     */
    public int getQueueLength(String symbol) {
        ReentrantLock lock = locks.get(symbol);
        return lock == null ? 0 : lock.getQueueLength();
    }

    private ReentrantLock lockFor(String symbol) {
        return locks.computeIfAbsent(symbol, s -> new ReentrantLock(fair));
    }

    private void acquire(ReentrantLock lock, String symbol) {
        if (timeoutMs <= 0) {
            lock.lock();
            return;
        }
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Failed to acquire symbol lock: {} after {}ms, queueLength={}",
                        symbol, timeoutMs, lock.getQueueLength());
                throw new LockAcquisitionException("Cannot acquire lock for symbol: " + symbol);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for symbol: " + symbol, e);
        }
    }
}
