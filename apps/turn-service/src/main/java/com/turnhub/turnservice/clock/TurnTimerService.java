package com.turnhub.turnservice.clock;

import com.turnhub.turnservice.common.error.SessionNotFoundException;
import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.domain.repository.TimerRepository;
import com.turnhub.turnservice.platform.config.TurnHostProperties;
import com.turnhub.turnservice.session.SessionLockRegistry;
import com.turnhub.turnservice.session.SessionStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * 计时器操作（同步，在会话锁内执行）
 * -------------------------------------------------------
 * - pause：冻结 remaining；
 * - resume：从冻结值继续，暂停期间的时间不计入；
 * - extend：带符号的秒数增量，结果钳制到 0；
 * - setDefault / setNextTurnDuration：只影响之后的回合重置。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnTimerService {

    private final TimerRepository timers;
    private final SessionStateMachine sessions;
    private final SessionLockRegistry locks;
    private final TurnHostProperties props;
    private final Clock clock;

    public TimerState get(String sessionId) {
        return timers.findById(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public TimerState pause(String sessionId) {
        return locks.withLock(sessionId, props.getLock().getWaitMillis(), () -> {
            TimerState state = get(sessionId);
            if (!state.isRunning()) return state;
            long now = clock.millis();
            state.settle(now);
            state.setRunning(false);
            state.setPausedAtEpochMs(now);
            timers.save(state);
            log.info("计时器暂停: sessionId={}, remaining={}s", sessionId, state.remainingSeconds());
            return state;
        });
    }

    public TimerState resume(String sessionId) {
        return locks.withLock(sessionId, props.getLock().getWaitMillis(), () -> {
            TimerState state = get(sessionId);
            if (state.isRunning()) return state;
            state.setRunning(true);
            state.setPausedAtEpochMs(null);
            state.setLastTickEpochMs(clock.millis());
            timers.save(state);
            log.info("计时器恢复: sessionId={}, remaining={}s", sessionId, state.remainingSeconds());
            return state;
        });
    }

    /**
     * 调整剩余时间。
     * @param deltaSeconds 正数延长，负数缩短；结果不小于 0
     */
    public TimerState extend(String sessionId, long deltaSeconds) {
        return locks.withLock(sessionId, props.getLock().getWaitMillis(), () -> {
            TimerState state = get(sessionId);
            state.settle(clock.millis());
            long remaining = Math.max(0, state.getRemainingMs() + deltaSeconds * 1000);
            state.setRemainingMs(remaining);
            // 重新回到 0 以上才允许再次到期
            if (remaining > 0) {
                state.setDeadlineFired(false);
            }
            if (remaining > props.getClock().getWarningSeconds() * 1000) {
                state.setWarningSent(false);
            }
            timers.save(state);
            log.info("计时器调整: sessionId={}, delta={}s, remaining={}s", sessionId, deltaSeconds, state.remainingSeconds());
            return state;
        });
    }

    /**
     * 修改默认回合时长，从下一次回合重置开始生效。
     */
    public GameSession setDefault(String sessionId, long seconds) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("回合时长必须大于 0");
        }
        return locks.withLock(sessionId, props.getLock().getWaitMillis(), () -> {
            GameSession session = sessions.get(sessionId);
            session.setDefaultTurnSeconds(seconds);
            sessions.update(session);
            log.info("默认回合时长修改: sessionId={}, seconds={}", sessionId, seconds);
            return session;
        });
    }

    /**
     * 仅下一回合使用的时长，用完即清。
     */
    public TimerState setNextTurnDuration(String sessionId, long seconds) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("回合时长必须大于 0");
        }
        return locks.withLock(sessionId, props.getLock().getWaitMillis(), () -> {
            TimerState state = get(sessionId);
            state.setNextTurnOverrideSeconds(seconds);
            timers.save(state);
            return state;
        });
    }

    /**
     * 新回合开始：remaining 重置为默认时长（或一次性覆盖值），运行，清空闩锁。
     * 调用方需已持有会话锁。
     */
    public TimerState resetForNewTurn(String sessionId) {
        GameSession session = sessions.get(sessionId);
        TimerState state = timers.findById(sessionId).orElseGet(() -> TimerState.builder().sessionId(sessionId).build());
        long seconds = state.getNextTurnOverrideSeconds() != null
                ? state.getNextTurnOverrideSeconds()
                : session.getDefaultTurnSeconds();
        long now = clock.millis();
        state.setRemainingMs(seconds * 1000);
        state.setRunning(true);
        state.setPausedAtEpochMs(null);
        state.setLastTickEpochMs(now);
        state.setDeadlineFired(false);
        state.setWarningSent(false);
        state.setNextTurnOverrideSeconds(null);
        timers.save(state);
        return state;
    }

    /**
     * 运行中则返回绝对截止时间，暂停时为 null。
     */
    public Long deadlineEpochMs(TimerState state) {
        return state.isRunning() ? clock.millis() + state.getRemainingMs() : null;
    }

    public void delete(String sessionId) {
        timers.delete(sessionId);
    }
}
