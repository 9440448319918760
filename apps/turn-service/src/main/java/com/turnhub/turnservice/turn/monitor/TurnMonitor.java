package com.turnhub.turnservice.turn.monitor;

import com.turnhub.turnservice.common.error.TurnHubException;
import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.model.GameStatus;
import com.turnhub.turnservice.domain.model.TurnRecord;
import com.turnhub.turnservice.domain.repository.TurnRecordRepository;
import com.turnhub.turnservice.platform.config.TurnHostProperties;
import com.turnhub.turnservice.session.SessionLockRegistry;
import com.turnhub.turnservice.session.SessionStateMachine;
import com.turnhub.turnservice.turn.TurnOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 回合监控
 * -------------------------------------------------------
 * 定期检查每个托管中的对局：
 *  - 引擎进程意外退出 → 交给编排器处理（暂停计时、通知一次）；
 *  - 状态文件里的回合号超过已记录的回合 → 派发回合完成事件；
 * 正在推进（会话锁被持有）的对局本轮跳过。事件在工作线程上执行，同一对局同时只有一个待处理事件。
 */
@Slf4j
@Component
public class TurnMonitor {

    private final SessionStateMachine sessions;
    private final TurnRecordRepository records;
    private final TurnOrchestrator orchestrator;
    private final SessionLockRegistry locks;
    private final ScheduledThreadPoolExecutor scheduler;
    private final Executor workExecutor;
    private final long pollMillis;

    private final Set<String> pending = ConcurrentHashMap.newKeySet();
    private ScheduledFuture<?> loop;

    public TurnMonitor(SessionStateMachine sessions,
                       TurnRecordRepository records,
                       TurnOrchestrator orchestrator,
                       SessionLockRegistry locks,
                       @Qualifier("turnClockScheduler") ScheduledThreadPoolExecutor scheduler,
                       @Qualifier("turnWorkExecutor") Executor workExecutor,
                       TurnHostProperties props) {
        this.sessions = sessions;
        this.records = records;
        this.orchestrator = orchestrator;
        this.locks = locks;
        this.scheduler = scheduler;
        this.workExecutor = workExecutor;
        this.pollMillis = props.getMonitor().getPollMillis();
    }

    public synchronized void start() {
        if (loop != null && !loop.isDone()) return;
        loop = scheduler.scheduleAtFixedRate(this::pollSafely, pollMillis, pollMillis, TimeUnit.MILLISECONDS);
        log.info("回合监控已启动: interval={}ms", pollMillis);
    }

    public synchronized void stop() {
        if (loop != null) {
            loop.cancel(false);
            loop = null;
        }
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (Exception e) {
            log.error("回合监控轮询异常", e);
        }
    }

    /**
     * 轮询一次所有托管中的对局。
     */
    public void pollOnce() {
        for (GameSession session : sessions.list()) {
            if (!session.getPhase().hosting() || !session.isProcessRunning()) continue;
            String sessionId = session.getId();
            if (locks.isLockedByOther(sessionId) || pending.contains(sessionId)) continue;
            try {
                inspect(sessionId);
            } catch (RuntimeException e) {
                log.error("检查对局失败: sessionId={}", sessionId, e);
            }
        }
    }

    private void inspect(String sessionId) {
        if (!orchestrator.isProcessAlive(sessionId)) {
            dispatch(sessionId, "process-died", () -> orchestrator.handleProcessDeath(sessionId));
            return;
        }
        Optional<GameStatus> status = orchestrator.probeStatus(sessionId);
        if (status.isEmpty() || status.get().getTurn() < 1) return;
        int observed = status.get().getTurn();

        Optional<TurnRecord> latest = records.latest(sessionId);
        boolean completed;
        if (latest.isEmpty() || latest.get().isResolved()) {
            completed = observed > latest.map(TurnRecord::getTurnNumber).orElse(0);
        } else {
            // 未完成的记录：钩子或推进流程中途留下的，引擎已经到达该回合时由这里补完；失败记录等待运维
            completed = !latest.get().isFailed() && observed >= latest.get().getTurnNumber();
        }
        if (completed) {
            log.info("检测到新回合: sessionId={}, observed={}", sessionId, observed);
            dispatch(sessionId, "turn-completed", () -> orchestrator.onTurnCompleted(sessionId, observed));
        }
    }

    private void dispatch(String sessionId, String what, Runnable task) {
        if (!pending.add(sessionId)) return;
        try {
            workExecutor.execute(() -> {
                try {
                    task.run();
                } catch (TurnHubException e) {
                    log.warn("监控事件处理失败: sessionId={}, event={}, kind={}, msg={}",
                            sessionId, what, e.getKind(), e.getMessage());
                } catch (RuntimeException e) {
                    log.error("监控事件处理异常: sessionId={}, event={}", sessionId, what, e);
                } finally {
                    pending.remove(sessionId);
                }
            });
        } catch (RejectedExecutionException e) {
            pending.remove(sessionId);
            log.error("工作线程池已满，监控事件未派发: sessionId={}, event={}", sessionId, what);
        }
    }
}
