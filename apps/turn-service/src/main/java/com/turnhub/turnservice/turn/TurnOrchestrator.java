package com.turnhub.turnservice.turn;

import com.turnhub.turnkafkanotifier.event.TurnNotificationEvent;
import com.turnhub.turnkafkanotifier.event.TurnNotificationEvent.EventType;
import com.turnhub.turnservice.backup.BackupStore;
import com.turnhub.turnservice.clock.TurnTimerService;
import com.turnhub.turnservice.common.error.BackupFailureException;
import com.turnhub.turnservice.common.error.ConcurrentAdvanceInProgressException;
import com.turnhub.turnservice.common.error.InvalidStateTransitionException;
import com.turnhub.turnservice.common.error.ProcessUnresponsiveException;
import com.turnhub.turnservice.common.error.RecoveryRequiredException;
import com.turnhub.turnservice.common.error.SnapshotNotFoundException;
import com.turnhub.turnservice.common.error.TurnHubException;
import com.turnhub.turnservice.domain.dto.AdvanceOutcome;
import com.turnhub.turnservice.domain.enums.AdvanceTrigger;
import com.turnhub.turnservice.domain.enums.BackupPhase;
import com.turnhub.turnservice.domain.enums.OrchestratorState;
import com.turnhub.turnservice.domain.enums.SessionEvent;
import com.turnhub.turnservice.domain.enums.SessionPhase;
import com.turnhub.turnservice.domain.model.BackupSnapshot;
import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.model.GameStatus;
import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.domain.model.TurnRecord;
import com.turnhub.turnservice.domain.repository.TurnRecordRepository;
import com.turnhub.turnservice.ledger.ExtensionLedger;
import com.turnhub.turnservice.platform.config.TurnHostProperties;
import com.turnhub.turnservice.platform.notify.TurnNotifier;
import com.turnhub.turnservice.process.GameProcessHandle;
import com.turnhub.turnservice.process.GameProcessRegistry;
import com.turnhub.turnservice.session.SessionLockRegistry;
import com.turnhub.turnservice.session.SessionStateMachine;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * 回合编排器
 * -------------------------------------------------------
 * 唯一负责推进回合、控制引擎进程的组件。每次推进都在会话锁内按固定阶段执行：
 *
 *   IDLE → PRE_BACKUP_IN_FLIGHT → ADVANCING → POST_BACKUP_IN_FLIGHT → NOTIFYING → IDLE
 *
 * 当前阶段持久化在回合记录上，进程崩溃或失败后从最后完成的阶段继续。
 * 前置备份没有成功落盘之前，绝不向引擎发出推进信号。
 * 任一阶段失败时记录进入 FAILED，需要运维通过 resume 显式恢复；自动入口（到期、回合完成）不会越过失败记录。
 * -------------------------------------------------------
 */
@Slf4j
@Service
public class TurnOrchestrator {

    private final SessionStateMachine sessions;
    private final TurnRecordRepository records;
    private final BackupStore backups;
    private final GameProcessRegistry processes;
    private final TurnTimerService timers;
    private final ExtensionLedger ledger;
    private final TurnNotifier notifier;
    private final SessionLockRegistry locks;
    private final TurnHostProperties props;
    private final Clock clock;
    private final ExecutorService ioExecutor;

    public TurnOrchestrator(SessionStateMachine sessions,
                            TurnRecordRepository records,
                            BackupStore backups,
                            GameProcessRegistry processes,
                            TurnTimerService timers,
                            ExtensionLedger ledger,
                            TurnNotifier notifier,
                            SessionLockRegistry locks,
                            TurnHostProperties props,
                            Clock clock,
                            @Qualifier("turnIoExecutor") ExecutorService ioExecutor) {
        this.sessions = sessions;
        this.records = records;
        this.backups = backups;
        this.processes = processes;
        this.timers = timers;
        this.ledger = ledger;
        this.notifier = notifier;
        this.locks = locks;
        this.props = props;
        this.clock = clock;
        this.ioExecutor = ioExecutor;
    }

    // ==================== 推进入口 ====================

    /** 计时器到期 */
    public AdvanceOutcome onDeadline(String sessionId) {
        return advance(sessionId, AdvanceTrigger.DEADLINE);
    }

    /**
     * 引擎自行完成了回合（状态文件里的回合号变大）。
     * 已记录过的回合号直接忽略。
     */
    public AdvanceOutcome onTurnCompleted(String sessionId, int observedTurn) {
        return enter(sessionId, props.getLock().getEntryWaitMillis(), () -> {
            Optional<TurnRecord> latest = records.latest(sessionId);
            if (latest.isPresent() && latest.get().isResolved() && observedTurn <= latest.get().getTurnNumber()) {
                log.debug("回合已记录，忽略: sessionId={}, observed={}, latest={}",
                        sessionId, observedTurn, latest.get().getTurnNumber());
                return outcome(sessionId, latest.get(), AdvanceTrigger.TURN_COMPLETED, true);
            }
            return advanceLocked(sessionId, AdvanceTrigger.TURN_COMPLETED);
        });
    }

    /** 运维强制推进：与到期走同一条路径 */
    public AdvanceOutcome forceAdvance(String sessionId) {
        log.warn("强制推进回合: sessionId={}", sessionId);
        return advance(sessionId, AdvanceTrigger.FORCE);
    }

    /** 运维显式恢复未完成（含 FAILED）的回合记录 */
    public AdvanceOutcome resume(String sessionId) {
        log.warn("运维恢复回合: sessionId={}", sessionId);
        return advance(sessionId, AdvanceTrigger.RESUME);
    }

    /**
     * 引擎处理回合前的钩子：同步完成前置备份后返回，不推进引擎。
     * 即将处理的回合已有前置备份时直接返回（不取锁，推进流程持锁等待引擎期间引擎会调用这里）。
     */
    public AdvanceOutcome preAdvanceHook(String sessionId) {
        Optional<TurnRecord> peek = records.latest(sessionId);
        if (peek.isPresent() && !peek.get().isResolved() && peek.get().getPreBackupRef() != null) {
            log.info("前置备份已存在，钩子直接返回: sessionId={}, turn={}", sessionId, peek.get().getTurnNumber());
            return outcome(sessionId, peek.get(), AdvanceTrigger.PRE_HOOK, true);
        }
        return advance(sessionId, AdvanceTrigger.PRE_HOOK);
    }

    /**
     * 引擎处理回合后的钩子：完成后置备份、账本/计时重置与通知。
     * 对已完成的回合重复调用不产生第二次通知。
     */
    public AdvanceOutcome postAdvanceHook(String sessionId) {
        return enter(sessionId, props.getLock().getHookWaitMillis(), () -> {
            Optional<TurnRecord> latest = records.latest(sessionId);
            if (latest.isPresent() && latest.get().isResolved()) {
                Optional<GameStatus> status = probeStatus(sessionId);
                boolean advancedBeyond = status.isPresent() && status.get().getTurn() > latest.get().getTurnNumber();
                if (!advancedBeyond) {
                    log.info("回合已完成，钩子幂等返回: sessionId={}, turn={}", sessionId, latest.get().getTurnNumber());
                    return outcome(sessionId, latest.get(), AdvanceTrigger.POST_HOOK, true);
                }
            }
            return advanceLocked(sessionId, AdvanceTrigger.POST_HOOK);
        });
    }

    private AdvanceOutcome advance(String sessionId, AdvanceTrigger trigger) {
        if (trigger != AdvanceTrigger.DEADLINE && trigger != AdvanceTrigger.FORCE) {
            return enter(sessionId, props.getLock().getEntryWaitMillis(), () -> advanceLocked(sessionId, trigger));
        }
        // 到期/强制推进针对的是排队时看到的那一回合；拿到锁时回合已变化，说明别的入口已经推进过
        RecordMark observed = RecordMark.of(records.latest(sessionId));
        return enter(sessionId, props.getLock().getEntryWaitMillis(), () -> {
            RecordMark current = RecordMark.of(records.latest(sessionId));
            if (!current.equals(observed)) {
                throw new ConcurrentAdvanceInProgressException(sessionId,
                        "等待期间回合已被其他操作推进: " + observed + " -> " + current);
            }
            return advanceLocked(sessionId, trigger);
        });
    }

    /** 最新回合记录在某一时刻的回合号与阶段（取值拷贝，不受记录对象后续修改影响） */
    private record RecordMark(int turnNumber, OrchestratorState phase) {
        static RecordMark of(Optional<TurnRecord> latest) {
            return latest.map(r -> new RecordMark(r.getTurnNumber(), r.getPhase()))
                    .orElse(new RecordMark(0, OrchestratorState.IDLE));
        }
    }

    /**
     * 已持有会话锁：续跑未完成的记录，或创建下一回合的记录。
     */
    private AdvanceOutcome advanceLocked(String sessionId, AdvanceTrigger trigger) {
        GameSession session = requireHosting(sessionId);
        Optional<TurnRecord> latest = records.latest(sessionId);
        if (latest.isPresent() && !latest.get().isResolved()) {
            TurnRecord pending = latest.get();
            if (pending.isFailed() && trigger.automatic()) {
                throw new RecoveryRequiredException(sessionId,
                        "回合 " + pending.getTurnNumber() + " 推进失败，需要运维恢复: " + pending.getFailureReason());
            }
            log.info("续跑未完成的回合: sessionId={}, turn={}, phase={}, failedPhase={}, entry={}",
                    sessionId, pending.getTurnNumber(), pending.getPhase(), pending.getFailedPhase(), trigger);
            return runFrom(session, pending, trigger);
        }
        if (trigger == AdvanceTrigger.RESUME) {
            throw new IllegalStateException("没有需要恢复的回合: " + sessionId);
        }
        int next = latest.map(TurnRecord::getTurnNumber).orElse(0) + 1;
        TurnRecord record = TurnRecord.builder()
                .sessionId(sessionId)
                .turnNumber(next)
                .phase(OrchestratorState.PRE_BACKUP_IN_FLIGHT)
                .trigger(trigger)
                .startedAt(clock.millis())
                .build();
        records.append(record);
        log.info("开始推进回合: sessionId={}, turn={}, trigger={}", sessionId, next, trigger);
        return runFrom(session, record, trigger);
    }

    /**
     * 从记录当前（或失败时）所处的阶段开始，依次执行剩余阶段。
     */
    private AdvanceOutcome runFrom(GameSession session, TurnRecord record, AdvanceTrigger entry) {
        String sessionId = session.getId();
        OrchestratorState phase = record.isFailed() ? record.getFailedPhase() : record.getPhase();
        if (record.isFailed()) {
            record.setPhase(phase);
            record.setFailedPhase(null);
            record.setFailureReason(null);
            records.update(record);
        }
        try {
            if (phase == OrchestratorState.PRE_BACKUP_IN_FLIGHT) {
                BackupSnapshot pre = timedBackup(session, record.getTurnNumber(), BackupPhase.PRE);
                record.setPreBackupRef(pre.getLocationRef());
                phase = moveTo(record, OrchestratorState.ADVANCING);
            }
            if (phase == OrchestratorState.ADVANCING) {
                if (entry == AdvanceTrigger.PRE_HOOK) {
                    // 引擎已经开始处理，等 post 钩子或状态轮询来完成剩余阶段
                    return outcome(sessionId, record, entry, false);
                }
                if (!entry.externallyAdvanced()) {
                    confirmAdvance(session, record);
                }
                phase = moveTo(record, OrchestratorState.POST_BACKUP_IN_FLIGHT);
            }
            if (phase == OrchestratorState.POST_BACKUP_IN_FLIGHT) {
                BackupSnapshot post = timedBackup(session, record.getTurnNumber(), BackupPhase.POST);
                record.setPostBackupRef(post.getLocationRef());
                record.setCompletedAt(clock.millis());
                phase = moveTo(record, OrchestratorState.NOTIFYING);
            }
            if (phase == OrchestratorState.NOTIFYING) {
                return finish(session, record, entry);
            }
            return outcome(sessionId, record, entry, record.isResolved());
        } catch (RuntimeException e) {
            throw fail(session, record, e);
        }
    }

    private OrchestratorState moveTo(TurnRecord record, OrchestratorState next) {
        record.setPhase(next);
        records.update(record);
        return next;
    }

    /**
     * 收尾：首个回合触发 START_PLAY；重置账本与计时器；发送通知；记录回到 IDLE。
     */
    private AdvanceOutcome finish(GameSession session, TurnRecord record, AdvanceTrigger entry) {
        String sessionId = session.getId();
        boolean firstTurn = sessions.get(sessionId).getPhase() == SessionPhase.LAUNCHED;
        if (firstTurn) {
            sessions.transition(sessionId, SessionEvent.START_PLAY);
        }
        ledger.resetForNewTurn(sessionId);
        TimerState timer = timers.resetForNewTurn(sessionId);
        List<String> outstanding = probeStatus(sessionId).map(GameStatus::outstandingPlayers).orElse(List.of());

        notifier.notify(TurnNotificationEvent.builder()
                .sessionId(sessionId)
                .sessionName(session.getName())
                .eventType(firstTurn ? EventType.GAME_STARTED : EventType.TURN_ADVANCED)
                .turnNumber(record.getTurnNumber())
                .deadlineEpochMs(timers.deadlineEpochMs(timer))
                .remainingSeconds(timer.remainingSeconds())
                .outstandingPlayers(outstanding)
                .timestamp(clock.millis())
                .build());

        moveTo(record, OrchestratorState.IDLE);
        log.info("回合推进完成: sessionId={}, turn={}, trigger={}, entry={}, remaining={}s",
                sessionId, record.getTurnNumber(), record.getTrigger(), entry, timer.remainingSeconds());
        return AdvanceOutcome.builder()
                .sessionId(sessionId)
                .turnNumber(record.getTurnNumber())
                .deadlineEpochMs(timers.deadlineEpochMs(timer))
                .remainingSeconds(timer.remainingSeconds())
                .outstandingPlayers(outstanding)
                .trigger(entry)
                .alreadyCompleted(false)
                .build();
    }

    /**
     * 记录失败阶段并通知；返回原异常供调用方抛出。
     */
    private RuntimeException fail(GameSession session, TurnRecord record, RuntimeException cause) {
        OrchestratorState at = record.getPhase();
        record.setFailedPhase(at);
        record.setPhase(OrchestratorState.FAILED);
        record.setFailureReason(cause.getMessage());
        records.update(record);
        log.error("回合推进失败: sessionId={}, turn={}, phase={}, attempts={}",
                session.getId(), record.getTurnNumber(), at, record.getAttempts(), cause);

        String message = cause.getMessage();
        if (cause instanceof ProcessUnresponsiveException) {
            message = "回合 " + record.getTurnNumber() + " 卡住，已尝试 " + record.getAttempts() + " 次: " + message;
        }
        notifier.notify(TurnNotificationEvent.builder()
                .sessionId(session.getId())
                .sessionName(session.getName())
                .eventType(EventType.ADVANCE_FAILED)
                .turnNumber(record.getTurnNumber())
                .message(message)
                .timestamp(clock.millis())
                .build());
        return cause;
    }

    // ==================== 引擎推进与确认 ====================

    /**
     * 发送推进信号并等待引擎写出新回合号；带指数退避的有限次重试，耗尽抛 ProcessUnresponsiveException。
     * 引擎已经处于目标回合时不再发送信号。
     */
    private void confirmAdvance(GameSession session, TurnRecord record) {
        GameProcessHandle handle = processes.acquire(session);
        TurnHostProperties.Advance cfg = props.getAdvance();
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, cfg.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(Math.max(1, cfg.getBackoffMillis())),
                        Math.max(1.0, cfg.getBackoffMultiplier())))
                .retryExceptions(ProcessUnresponsiveException.class)
                .build();
        Retry retry = Retry.of("advance-" + session.getId(), retryConfig);
        retry.getEventPublisher().onRetry(e -> log.warn("推进未确认，准备重试: sessionId={}, turn={}, attempt={}, wait={}ms",
                session.getId(), record.getTurnNumber(), e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis()));
        try {
            retry.executeSupplier(() -> attemptAdvance(session, record, handle));
        } catch (ProcessUnresponsiveException e) {
            String summary = handle.readErrorSummary();
            throw new ProcessUnresponsiveException(session.getId(), e.getMessage() + "; 引擎日志: " + summary, e);
        }
    }

    private GameStatus attemptAdvance(GameSession session, TurnRecord record, GameProcessHandle handle) {
        String sessionId = session.getId();
        int target = record.getTurnNumber();
        record.setAttempts(record.getAttempts() + 1);
        records.update(record);

        Optional<GameStatus> already = safeProbe(handle);
        if (already.isPresent() && already.get().getTurn() >= target) {
            return already.get();
        }
        if (!handle.isAlive()) {
            throw new ProcessUnresponsiveException(sessionId, "引擎进程未运行");
        }
        if (signalNeeded(record)) {
            io(sessionId, props.getAdvance().getConfirmTimeoutMillis(), () -> {
                handle.signalAdvance();
                return null;
            }, (msg, cause) -> new ProcessUnresponsiveException(sessionId, "发送推进信号失败: " + msg, cause));
        }

        long deadline = clock.millis() + props.getAdvance().getConfirmTimeoutMillis();
        while (clock.millis() < deadline) {
            sleep(sessionId, props.getAdvance().getPollMillis());
            Optional<GameStatus> status = safeProbe(handle);
            if (status.isPresent() && status.get().getTurn() >= target) {
                log.info("引擎已确认新回合: sessionId={}, turn={}, attempt={}", sessionId, status.get().getTurn(), record.getAttempts());
                return status.get();
            }
            if (!handle.isAlive()) {
                throw new ProcessUnresponsiveException(sessionId, "等待确认期间引擎进程退出");
            }
        }
        throw new ProcessUnresponsiveException(sessionId,
                "引擎未在 " + props.getAdvance().getConfirmTimeoutMillis() + "ms 内进入回合 " + target);
    }

    /** 只有由计时到期/强制推进创建的回合需要主动通知引擎；其余情况引擎已经在处理 */
    private boolean signalNeeded(TurnRecord record) {
        return record.getTrigger() == AdvanceTrigger.DEADLINE || record.getTrigger() == AdvanceTrigger.FORCE;
    }

    private Optional<GameStatus> safeProbe(GameProcessHandle handle) {
        try {
            return handle.probeStatus();
        } catch (IOException e) {
            log.warn("读取引擎状态失败: sessionId={}, err={}", handle.sessionId(), e.getMessage());
            return Optional.empty();
        }
    }

    private void sleep(String sessionId, long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessUnresponsiveException(sessionId, "等待引擎确认时被中断", e);
        }
    }

    private BackupSnapshot timedBackup(GameSession session, int turn, BackupPhase phase) {
        return io(session.getId(), props.getAdvance().getBackupTimeoutMillis(),
                () -> backups.write(session, turn, phase),
                (msg, cause) -> new BackupFailureException(session.getId(),
                        "备份失败: turn=" + turn + ", phase=" + phase + ", " + msg, cause));
    }

    /**
     * 在 IO 线程池上执行并限时等待。超时不取消任务：备份/信号写入不可中途打断。
     */
    private <T> T io(String sessionId, long timeoutMillis, Callable<T> task,
                     BiFunction<String, Throwable, ? extends TurnHubException> onError) {
        Future<T> future = ioExecutor.submit(task);
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw onError.apply("超时 " + timeoutMillis + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw onError.apply("被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TurnHubException th) {
                throw th;
            }
            throw onError.apply(String.valueOf(cause.getMessage()), cause);
        }
    }

    // ==================== 回滚 ====================

    /**
     * 回滚到指定回合：恢复该回合的后置快照（没有则用前置快照），截断之后的记录并重置计时器。
     * 运行中的引擎先停止，恢复后重新拉起。
     */
    public AdvanceOutcome rollback(String sessionId, int toTurn) {
        return enter(sessionId, props.getLock().getEntryWaitMillis(), () -> {
            GameSession session = sessions.get(sessionId);
            Optional<TurnRecord> latest = records.latest(sessionId);
            if (latest.isPresent() && !latest.get().isResolved() && !latest.get().isFailed()) {
                throw new ConcurrentAdvanceInProgressException(sessionId,
                        "回合 " + latest.get().getTurnNumber() + " 正在推进，不能回滚");
            }
            if (latest.isEmpty() || toTurn < 1 || toTurn > latest.get().getTurnNumber()) {
                throw new IllegalArgumentException("回滚目标回合不存在: " + toTurn);
            }
            BackupSnapshot snapshot = backups.find(sessionId, toTurn, BackupPhase.POST)
                    .or(() -> backups.find(sessionId, toTurn, BackupPhase.PRE))
                    .orElseThrow(() -> new SnapshotNotFoundException(sessionId, "回合 " + toTurn + " 没有可用快照"));

            GameProcessHandle handle = processes.find(sessionId).orElse(null);
            boolean wasRunning = handle != null && handle.isAlive();
            if (wasRunning) {
                handle.stop();
            }
            backups.restore(session, snapshot);

            // 前置快照是该回合处理之前的状态，对应的记录一并截掉
            int keepUpTo = snapshot.getPhase() == BackupPhase.POST ? toTurn : toTurn - 1;
            int removed = records.truncateAfter(sessionId, keepUpTo);
            backups.discardAfter(sessionId, keepUpTo);
            records.find(sessionId, keepUpTo).filter(r -> !r.isResolved()).ifPresent(r -> {
                r.setPhase(OrchestratorState.IDLE);
                r.setFailedPhase(null);
                if (r.getCompletedAt() == null) r.setCompletedAt(clock.millis());
                records.update(r);
            });
            TimerState timer = timers.resetForNewTurn(sessionId);

            if (wasRunning) {
                try {
                    processes.acquire(session).start();
                } catch (IOException e) {
                    sessions.markProcessRunning(sessionId, false);
                    throw new ProcessUnresponsiveException(sessionId, "回滚后重启引擎失败: " + e.getMessage(), e);
                }
            }
            log.warn("对局已回滚: sessionId={}, toTurn={}, snapshot={}, removedRecords={}",
                    sessionId, toTurn, snapshot.getPhase(), removed);
            notifier.notify(TurnNotificationEvent.builder()
                    .sessionId(sessionId)
                    .sessionName(session.getName())
                    .eventType(EventType.ROLLED_BACK)
                    .turnNumber(keepUpTo)
                    .deadlineEpochMs(timers.deadlineEpochMs(timer))
                    .remainingSeconds(timer.remainingSeconds())
                    .message("回滚到回合 " + toTurn + " (" + snapshot.getPhase() + ")")
                    .timestamp(clock.millis())
                    .build());
            return AdvanceOutcome.builder()
                    .sessionId(sessionId)
                    .turnNumber(keepUpTo)
                    .deadlineEpochMs(timers.deadlineEpochMs(timer))
                    .remainingSeconds(timer.remainingSeconds())
                    .outstandingPlayers(List.of())
                    .trigger(AdvanceTrigger.RESUME)
                    .alreadyCompleted(false)
                    .build();
        });
    }

    // ==================== 进程控制 ====================

    /**
     * 启动（或重新拉起）对局的引擎进程。已开始的对局同时恢复计时器。
     */
    public GameSession launch(String sessionId) {
        return enter(sessionId, props.getLock().getWaitMillis(), () -> {
            GameSession session = sessions.transition(sessionId, SessionEvent.LAUNCH);
            GameProcessHandle handle = processes.acquire(session);
            if (!handle.isAlive()) {
                try {
                    handle.start();
                } catch (IOException e) {
                    throw new ProcessUnresponsiveException(sessionId,
                            "引擎启动失败: " + e.getMessage() + "; 引擎日志: " + handle.readErrorSummary(), e);
                }
            }
            GameSession updated = sessions.markProcessRunning(sessionId, true);
            if (updated.isStarted()) {
                timers.resume(sessionId);
            }
            return updated;
        });
    }

    /**
     * 停止引擎进程并暂停计时。
     */
    public GameSession stopProcess(String sessionId) {
        return enter(sessionId, props.getLock().getWaitMillis(), () -> {
            sessions.get(sessionId);
            processes.release(sessionId);
            timers.pause(sessionId);
            log.warn("引擎进程已由运维停止: sessionId={}", sessionId);
            return sessions.markProcessRunning(sessionId, false);
        });
    }

    /**
     * 结束对局：要求已开始；停止进程与计时。
     */
    public GameSession endGame(String sessionId) {
        return enter(sessionId, props.getLock().getWaitMillis(), () -> {
            GameSession session = sessions.transition(sessionId, SessionEvent.END_GAME);
            processes.release(sessionId);
            timers.pause(sessionId);
            sessions.markProcessRunning(sessionId, false);
            return session;
        });
    }

    /**
     * 删除对局：要求已结束。保留回合记录与备份，只移除计时器。
     */
    public GameSession deleteSession(String sessionId) {
        GameSession deleted = enter(sessionId, props.getLock().getWaitMillis(), () -> {
            GameSession session = sessions.transition(sessionId, SessionEvent.DELETE_LOBBY);
            processes.release(sessionId);
            timers.delete(sessionId);
            log.warn("对局已删除: sessionId={}", sessionId);
            return session;
        });
        locks.forget(sessionId);
        return deleted;
    }

    /**
     * 监控发现进程意外退出：标记未运行、暂停计时并通知一次。
     */
    public void handleProcessDeath(String sessionId) {
        enter(sessionId, props.getLock().getWaitMillis(), () -> {
            GameSession session = sessions.get(sessionId);
            if (!session.isProcessRunning()) {
                return null;
            }
            String summary = processes.find(sessionId)
                    .map(GameProcessHandle::readErrorSummary)
                    .orElse("No log file found");
            sessions.markProcessRunning(sessionId, false);
            timers.pause(sessionId);
            processes.release(sessionId);
            log.error("引擎进程意外退出: sessionId={}, name={}, log={}", sessionId, session.getName(), summary);
            notifier.notify(TurnNotificationEvent.builder()
                    .sessionId(sessionId)
                    .sessionName(session.getName())
                    .eventType(EventType.PROCESS_DIED)
                    .message(summary)
                    .timestamp(clock.millis())
                    .build());
            return null;
        });
    }

    // ==================== 查询 ====================

    public boolean isProcessAlive(String sessionId) {
        return processes.find(sessionId).map(GameProcessHandle::isAlive).orElse(false);
    }

    /**
     * 读取引擎状态；还没有句柄（例如服务刚重启）时按对局目录创建一个只读用的句柄。
     */
    public Optional<GameStatus> probeStatus(String sessionId) {
        GameProcessHandle handle = processes.find(sessionId)
                .orElseGet(() -> processes.acquire(sessions.get(sessionId)));
        return safeProbe(handle);
    }

    public OrchestratorState stateOf(String sessionId) {
        sessions.get(sessionId);
        return records.latest(sessionId).map(TurnRecord::getPhase).orElse(OrchestratorState.IDLE);
    }

    public List<TurnRecord> history(String sessionId) {
        sessions.get(sessionId);
        return records.findBySession(sessionId);
    }

    /**
     * 启动时续跑崩溃前未完成（非 FAILED）的回合。
     * @return 续跑成功的数量
     */
    public int recoverInFlight() {
        int recovered = 0;
        for (GameSession s : sessions.list()) {
            if (!s.getPhase().hosting()) continue;
            Optional<TurnRecord> latest = records.latest(s.getId());
            if (latest.isEmpty() || latest.get().isResolved() || latest.get().isFailed()) continue;
            try {
                advance(s.getId(), AdvanceTrigger.RESUME);
                recovered++;
            } catch (TurnHubException e) {
                log.error("启动恢复失败: sessionId={}, kind={}, msg={}", s.getId(), e.getKind(), e.getMessage());
            }
        }
        log.info("启动恢复完成: recovered={}", recovered);
        return recovered;
    }

    // ==================== 内部工具 ====================

    private GameSession requireHosting(String sessionId) {
        GameSession session = sessions.get(sessionId);
        if (!session.getPhase().hosting()) {
            throw new InvalidStateTransitionException(sessionId,
                    "对局当前阶段不能推进回合: " + session.getPhase());
        }
        return session;
    }

    private AdvanceOutcome outcome(String sessionId, TurnRecord record, AdvanceTrigger trigger, boolean alreadyCompleted) {
        TimerState timer = timers.get(sessionId);
        List<String> outstanding = probeStatus(sessionId).map(GameStatus::outstandingPlayers).orElse(List.of());
        return AdvanceOutcome.builder()
                .sessionId(sessionId)
                .turnNumber(record.getTurnNumber())
                .deadlineEpochMs(timers.deadlineEpochMs(timer))
                .remainingSeconds(timer.remainingSeconds())
                .outstandingPlayers(outstanding)
                .trigger(trigger)
                .alreadyCompleted(alreadyCompleted)
                .build();
    }

    private <T> T enter(String sessionId, long waitMillis, Supplier<T> body) {
        return locks.withLock(sessionId, waitMillis, body);
    }
}
