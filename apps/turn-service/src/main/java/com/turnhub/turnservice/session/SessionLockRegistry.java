package com.turnhub.turnservice.session;

import com.turnhub.turnservice.common.error.ConcurrentAdvanceInProgressException;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 每个对局一把可重入锁。
 * 所有修改对局/计时器/回合记录的操作都在这把锁内进行；tick 循环只 tryLock，拿不到就跳过。
 */
@Component
public class SessionLockRegistry {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String sessionId) {
        return locks.computeIfAbsent(sessionId, k -> new ReentrantLock());
    }

    /** 是否被其他线程持有 */
    public boolean isLockedByOther(String sessionId) {
        ReentrantLock lock = locks.get(sessionId);
        return lock != null && lock.isLocked() && !lock.isHeldByCurrentThread();
    }

    /**
     * 在会话锁内执行；等待超时抛 ConcurrentAdvanceInProgressException。
     */
    public <T> T withLock(String sessionId, long waitMillis, Supplier<T> body) {
        ReentrantLock lock = lockFor(sessionId);
        boolean acquired;
        try {
            acquired = lock.tryLock(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrentAdvanceInProgressException(sessionId, "等待会话锁时被中断", e);
        }
        if (!acquired) {
            throw new ConcurrentAdvanceInProgressException(sessionId, "对局正在处理其他操作: " + sessionId);
        }
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String sessionId, long waitMillis, Runnable body) {
        withLock(sessionId, waitMillis, () -> {
            body.run();
            return null;
        });
    }

    /** 对局删除后释放锁对象 */
    public void forget(String sessionId) {
        locks.remove(sessionId);
    }
}
