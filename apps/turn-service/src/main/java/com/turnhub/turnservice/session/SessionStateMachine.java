package com.turnhub.turnservice.session;

import com.turnhub.turnservice.common.error.InvalidStateTransitionException;
import com.turnhub.turnservice.common.error.SessionNotFoundException;
import com.turnhub.turnservice.domain.dto.SessionSettings;
import com.turnhub.turnservice.domain.enums.SessionEvent;
import com.turnhub.turnservice.domain.enums.SessionPhase;
import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.domain.repository.SessionRepository;
import com.turnhub.turnservice.domain.repository.TimerRepository;
import com.turnhub.turnservice.platform.config.TurnHostProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;

/**
 * 对局生命周期状态机
 * -------------------------------------------------------
 * - 生命周期只通过 transition 修改，非法组合抛 InvalidStateTransitionException；
 * - 同一对局的迁移在会话锁内串行；
 * - RESET_STARTED 是特权操作，单独以 WARN 记录。
 */
@Slf4j
@Service
public class SessionStateMachine {

    private final SessionRepository sessions;
    private final TimerRepository timers;
    private final SessionLockRegistry locks;
    private final TurnHostProperties props;
    private final Clock clock;

    public SessionStateMachine(SessionRepository sessions,
                               TimerRepository timers,
                               SessionLockRegistry locks,
                               TurnHostProperties props,
                               Clock clock) {
        this.sessions = sessions;
        this.timers = timers;
        this.locks = locks;
        this.props = props;
        this.clock = clock;
    }

    /**
     * 创建对局：生命周期 CREATED（active=1, started=0, ended=0），并初始化一个暂停的计时器。
     * 对局名直接作为存档目录名：不能含路径分隔符或 "."/".."，且不能与其他未删除的对局重名。
     * @return 对局ID
     */
    public synchronized String create(SessionSettings settings) {
        String name = checkName(settings.getName());
        boolean duplicate = sessions.findAll().stream()
                .anyMatch(s -> s.isActive() && name.equals(s.getName()));
        if (duplicate) {
            throw new IllegalStateException("已存在同名且未删除的对局: " + name);
        }
        String id = UUID.randomUUID().toString();
        long turnSeconds = settings.getDefaultTurnSeconds() != null
                ? settings.getDefaultTurnSeconds()
                : props.getDefaults().getTurnSeconds();
        long now = clock.millis();
        GameSession session = GameSession.builder()
                .id(id)
                .name(name)
                .config(settings.getConfig() == null ? new HashMap<>() : new HashMap<>(settings.getConfig()))
                .phase(SessionPhase.CREATED)
                .defaultTurnSeconds(turnSeconds)
                .createdAt(now)
                .workDir(Paths.get(props.getProcess().getDataRoot(), "savedgames", name).toString())
                .chessClockEnabled(settings.isChessClockEnabled())
                .chessClockStartingSeconds(settings.getChessClockStartingSeconds())
                .chessClockPerTurnSeconds(settings.getChessClockPerTurnSeconds())
                .maxExtensionsPerTurn(settings.getMaxExtensionsPerTurn())
                .build();
        sessions.save(session);
        timers.save(TimerState.builder()
                .sessionId(id)
                .remainingMs(turnSeconds * 1000)
                .running(false)
                .pausedAtEpochMs(now)
                .lastTickEpochMs(now)
                .build());
        log.info("创建对局: id={}, name={}, turnSeconds={}", id, session.getName(), turnSeconds);
        return id;
    }

    /**
     * 执行一次生命周期迁移。
     * @return 迁移后的对局
     */
    public GameSession transition(String sessionId, SessionEvent event) {
        return locks.withLock(sessionId, props.getLock().getWaitMillis(), () -> {
            GameSession session = get(sessionId);
            SessionPhase from = session.getPhase();
            SessionPhase to = SessionTransitionTable.next(from, event)
                    .orElseThrow(() -> new InvalidStateTransitionException(sessionId, from, event));
            if (event == SessionEvent.RESET_STARTED) {
                log.warn("特权操作 RESET_STARTED: sessionId={}, {} -> {}", sessionId, from, to);
            } else {
                log.info("对局状态迁移: sessionId={}, {} --{}--> {}", sessionId, from, event, to);
            }
            session.setPhase(to);
            sessions.save(session);
            return session;
        });
    }

    /** 更新进程运行标记（由编排器在持锁状态下调用） */
    public GameSession markProcessRunning(String sessionId, boolean running) {
        GameSession session = get(sessionId);
        if (session.isProcessRunning() != running) {
            session.setProcessRunning(running);
            sessions.save(session);
        }
        return session;
    }

    /** 保存非生命周期字段（默认时长等） */
    public void update(GameSession session) {
        sessions.save(session);
    }

    private static String checkName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("对局名不能为空");
        }
        if (name.contains("/") || name.contains("\\") || name.equals(".") || name.equals("..")
                || name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("对局名不能包含空白、路径分隔符或 . / ..: " + name);
        }
        return name;
    }

    public GameSession get(String sessionId) {
        return sessions.findById(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public List<GameSession> list() {
        return sessions.findAll();
    }
}
