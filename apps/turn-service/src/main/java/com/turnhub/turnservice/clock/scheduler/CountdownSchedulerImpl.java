package com.turnhub.turnservice.clock.scheduler;

import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.domain.repository.TimerRepository;
import com.turnhub.turnservice.session.SessionLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * CountdownSchedulerImpl
 * ---------------------------------------
 * 回合倒计时调度器的默认实现。
 *
 * 职责：
 *  - 使用 ScheduledThreadPoolExecutor 以固定间隔执行一个 tick 循环；
 *  - 计时状态（remaining/lastTick/闩锁）持久化到 TimerRepository，支持重启恢复；
 *  - tick 中对每个对局 tryLock，拿不到锁说明有推进或运维操作在进行，直接跳过；
 *  - 到期/提醒回调提交到工作线程池，tick 线程不执行任何业务。
 */
public class CountdownSchedulerImpl implements CountdownScheduler {

    private static final Logger log = LoggerFactory.getLogger(CountdownSchedulerImpl.class);

    private final TimerRepository timers;
    private final SessionLockRegistry locks;
    private final ScheduledThreadPoolExecutor scheduler;
    private final Executor workExecutor;
    private final Clock clock;
    private final long tickMillis;
    private final long warningMs;

    private volatile DeadlineHandler deadlineHandler;
    private volatile WarningListener warningListener;

    private ScheduledFuture<?> loop;

    /** 等待下一个 tick 重新派发到期事件的对局 */
    private final Set<String> requeued = ConcurrentHashMap.newKeySet();

    public CountdownSchedulerImpl(TimerRepository timers,
                                  SessionLockRegistry locks,
                                  ScheduledThreadPoolExecutor scheduler,
                                  Executor workExecutor,
                                  Clock clock,
                                  long tickMillis,
                                  long warningSeconds) {
        this.timers = timers;
        this.locks = locks;
        this.scheduler = scheduler;
        this.workExecutor = workExecutor;
        this.clock = clock;
        this.tickMillis = tickMillis;
        this.warningMs = warningSeconds * 1000;
    }

    @Override
    public void setDeadlineHandler(DeadlineHandler handler) {
        this.deadlineHandler = handler;
    }

    @Override
    public void setWarningListener(WarningListener listener) {
        this.warningListener = listener;
    }

    @Override
    public synchronized void start() {
        if (loop != null && !loop.isDone()) return;
        loop = scheduler.scheduleAtFixedRate(this::tickSafely, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        log.info("回合计时 tick 循环已启动: interval={}ms", tickMillis);
    }

    @Override
    public synchronized void stop() {
        if (loop != null) {
            loop.cancel(false);
            loop = null;
        }
    }

    /**
     * 周期任务入口：异常不能逃出，否则 scheduleAtFixedRate 会静默终止后续执行。
     */
    private void tickSafely() {
        try {
            tick();
        } catch (Exception e) {
            log.error("tick 循环异常", e);
        }
    }

    @Override
    public void tick() {
        List<Runnable> dispatch = new ArrayList<>();
        for (TimerState candidate : timers.findRunning()) {
            String sessionId = candidate.getSessionId();
            ReentrantLock lock = locks.lockFor(sessionId);
            if (!lock.tryLock()) {
                log.debug("对局忙，跳过本次 tick: sessionId={}", sessionId);
                continue;
            }
            try {
                settleOne(sessionId, dispatch);
            } catch (Exception e) {
                log.error("结算计时器失败: sessionId={}", sessionId, e);
            } finally {
                lock.unlock();
            }
        }
        for (Runnable r : dispatch) {
            try {
                workExecutor.execute(r);
            } catch (RejectedExecutionException e) {
                log.error("工作线程池已满，计时事件未能派发", e);
            }
        }
    }

    /**
     * 在会话锁内结算一个计时器，并把需要派发的事件加入 dispatch。
     */
    private void settleOne(String sessionId, List<Runnable> dispatch) {
        // 持锁后重新读取，以最新状态为准
        TimerState state = timers.findById(sessionId).orElse(null);
        if (state == null || !state.isRunning()) return;

        long before = state.getRemainingMs();
        state.settle(clock.millis());
        long after = state.getRemainingMs();

        if (!state.isWarningSent() && after > 0 && before > warningMs && after <= warningMs) {
            state.setWarningSent(true);
            long seconds = state.remainingSeconds();
            WarningListener l = warningListener;
            if (l != null) {
                dispatch.add(() -> l.onWarning(sessionId, seconds));
            }
            log.info("回合临期提醒: sessionId={}, remaining={}s", sessionId, seconds);
        }

        if (after == 0 && state.isDeadlineFired() && requeued.remove(sessionId)) {
            DeadlineHandler h = deadlineHandler;
            if (h != null) {
                dispatch.add(() -> h.onDeadline(sessionId));
            }
            log.info("重新派发到期事件: sessionId={}", sessionId);
        } else if (after == 0 && !state.isDeadlineFired()) {
            state.setDeadlineFired(true);
            DeadlineHandler h = deadlineHandler;
            if (h != null) {
                dispatch.add(() -> h.onDeadline(sessionId));
            }
            log.info("回合到期: sessionId={}", sessionId);
        }
        if (after > 0) {
            requeued.remove(sessionId);
        }
        timers.save(state);
    }

    @Override
    public void requeueDeadline(String sessionId) {
        requeued.add(sessionId);
    }

    @Override
    public int restoreAll() {
        long now = clock.millis();
        int running = 0;
        for (TimerState state : timers.findAll()) {
            ReentrantLock lock = locks.lockFor(state.getSessionId());
            lock.lock();
            try {
                TimerState latest = timers.findById(state.getSessionId()).orElse(null);
                if (latest == null) continue;
                if (latest.isRunning()) {
                    // 停机期间的真实流逝时间照常扣除
                    latest.settle(now);
                    running++;
                } else {
                    latest.setLastTickEpochMs(now);
                }
                timers.save(latest);
            } finally {
                lock.unlock();
            }
        }
        log.info("计时器恢复完成: running={}", running);
        return running;
    }
}
