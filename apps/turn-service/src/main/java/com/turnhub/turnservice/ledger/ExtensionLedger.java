package com.turnhub.turnservice.ledger;

import com.turnhub.turnservice.clock.TurnTimerService;
import com.turnhub.turnservice.common.error.InsufficientBalanceException;
import com.turnhub.turnservice.common.error.LimitExceededException;
import com.turnhub.turnservice.domain.dto.ExtensionStat;
import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.model.PlayerTimeBank;
import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.domain.repository.TimeBankRepository;
import com.turnhub.turnservice.platform.config.TurnHostProperties;
import com.turnhub.turnservice.session.SessionLockRegistry;
import com.turnhub.turnservice.session.SessionStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * 延时 / 棋钟账本
 * -------------------------------------------------------
 * - 每回合延时次数上限（maxExtensionsPerTurn，null 表示不限）；
 * - 棋钟开启时，正向延时从玩家余额中扣除，每回合重置时补充 perTurn 秒；
 * - 被拒绝的请求（次数/余额）不修改任何状态。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtensionLedger {

    private final TimeBankRepository banks;
    private final SessionStateMachine sessions;
    private final TurnTimerService timerService;
    private final SessionLockRegistry locks;
    private final TurnHostProperties props;

    /**
     * 登记玩家；已登记则原样返回。棋钟开启时初始余额为 chessClockStartingSeconds。
     */
    public PlayerTimeBank registerPlayer(String sessionId, String playerId, String nation) {
        return locks.withLock(sessionId, props.getLock().getWaitMillis(), () -> {
            GameSession session = sessions.get(sessionId);
            return banks.find(sessionId, playerId).orElseGet(() -> {
                PlayerTimeBank bank = PlayerTimeBank.builder()
                        .sessionId(sessionId)
                        .playerId(playerId)
                        .nation(nation)
                        .balanceSeconds(session.isChessClockEnabled() ? session.getChessClockStartingSeconds() : 0)
                        .maxExtensionsPerTurn(session.getMaxExtensionsPerTurn())
                        .build();
                banks.save(bank);
                log.info("登记玩家: sessionId={}, playerId={}, nation={}, balance={}s",
                        sessionId, playerId, nation, bank.getBalanceSeconds());
                return bank;
            });
        });
    }

    /**
     * 玩家申请延时。
     * @param deltaSeconds 带符号的秒数
     * @return 调整后的计时器
     */
    public TimerState requestExtension(String sessionId, String playerId, long deltaSeconds) {
        return locks.withLock(sessionId, props.getLock().getWaitMillis(), () -> {
            GameSession session = sessions.get(sessionId);
            PlayerTimeBank bank = banks.find(sessionId, playerId)
                    .orElseThrow(() -> new IllegalArgumentException("玩家未登记: " + playerId));

            Integer max = bank.getMaxExtensionsPerTurn();
            if (max != null && bank.getExtensionsUsedThisTurn() >= max) {
                throw new LimitExceededException(sessionId,
                        "本回合延时次数已用完: " + bank.getExtensionsUsedThisTurn() + "/" + max);
            }
            boolean charged = session.isChessClockEnabled() && deltaSeconds > 0;
            if (charged && bank.getBalanceSeconds() < deltaSeconds) {
                throw new InsufficientBalanceException(sessionId,
                        "棋钟余额不足: balance=" + bank.getBalanceSeconds() + "s, requested=" + deltaSeconds + "s");
            }

            TimerState timer = timerService.extend(sessionId, deltaSeconds);

            bank.setExtensionsUsedThisTurn(bank.getExtensionsUsedThisTurn() + 1);
            if (charged) {
                bank.setBalanceSeconds(bank.getBalanceSeconds() - deltaSeconds);
            }
            if (deltaSeconds > 0) {
                bank.setTotalExtensionSeconds(bank.getTotalExtensionSeconds() + deltaSeconds);
            }
            banks.save(bank);
            log.info("延时成功: sessionId={}, playerId={}, delta={}s, balance={}s, used={}",
                    sessionId, playerId, deltaSeconds, bank.getBalanceSeconds(), bank.getExtensionsUsedThisTurn());
            return timer;
        });
    }

    /**
     * 新回合：清零本回合延时次数；棋钟开启时为每位玩家补充 perTurn 秒。调用方需已持有会话锁。
     */
    public void resetForNewTurn(String sessionId) {
        GameSession session = sessions.get(sessionId);
        long bonus = session.isChessClockEnabled() ? session.getChessClockPerTurnSeconds() : 0;
        for (PlayerTimeBank bank : banks.findBySession(sessionId)) {
            bank.setExtensionsUsedThisTurn(0);
            bank.setBalanceSeconds(bank.getBalanceSeconds() + bonus);
            banks.save(bank);
        }
    }

    /**
     * 延时统计，按累计延时秒数降序。
     */
    public List<ExtensionStat> stats(String sessionId) {
        sessions.get(sessionId);
        return banks.findBySession(sessionId).stream()
                .sorted(Comparator.comparingLong(PlayerTimeBank::getTotalExtensionSeconds).reversed())
                .map(b -> new ExtensionStat(b.getPlayerId(), b.getNation(), b.getTotalExtensionSeconds(),
                        b.getExtensionsUsedThisTurn(), b.getBalanceSeconds()))
                .toList();
    }
}
