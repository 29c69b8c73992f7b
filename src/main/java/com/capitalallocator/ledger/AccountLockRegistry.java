package com.capitalallocator.ledger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One {@link ReentrantLock} per account: the single-writer discipline for everything that mutates
 * an account's cash or pause state.
 *
 * <p>Locks are reentrant, so the allocation pipeline can hold the account lock across
 * size, evaluate and reserve while the ledger takes it again for each mutation.
 * {@link #withLocks} takes two locks in lexicographic id order so concurrent transfers in
 * opposite directions cannot deadlock.
 */
@Component
public class AccountLockRegistry {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String accountId) {
        return locks.computeIfAbsent(accountId, id -> new ReentrantLock());
    }

    public <T> T withLock(String accountId, Supplier<T> action) {
        ReentrantLock lock = lockFor(accountId);
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

    public <T> T withLocks(String firstAccountId, String secondAccountId, Supplier<T> action) {
        String lower = firstAccountId.compareTo(secondAccountId) <= 0 ? firstAccountId : secondAccountId;
        String higher = lower.equals(firstAccountId) ? secondAccountId : firstAccountId;
        return withLock(lower, () -> withLock(higher, action));
    }

    public boolean isHeldByCurrentThread(String accountId) {
        ReentrantLock lock = locks.get(accountId);
        return lock != null && lock.isHeldByCurrentThread();
    }
}
