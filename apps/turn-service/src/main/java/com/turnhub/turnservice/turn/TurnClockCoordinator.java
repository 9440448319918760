package com.turnhub.turnservice.turn;

import com.turnhub.turnkafkanotifier.event.TurnNotificationEvent;
import com.turnhub.turnkafkanotifier.event.TurnNotificationEvent.EventType;
import com.turnhub.turnservice.clock.TurnTimerService;
import com.turnhub.turnservice.clock.scheduler.CountdownScheduler;
import com.turnhub.turnservice.common.error.ConcurrentAdvanceInProgressException;
import com.turnhub.turnservice.common.error.TurnHubException;
import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.model.GameStatus;
import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.platform.notify.TurnNotifier;
import com.turnhub.turnservice.session.SessionStateMachine;
import com.turnhub.turnservice.turn.monitor.TurnMonitor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * TurnClockCoordinator
 * -------------------------------------------------
 * 倒计时与回合编排的对接层（应用编排层）。
 *
 * 职责：
 * 1) 启动时注册调度器的到期/提醒回调：
 *    - 到期：交给 TurnOrchestrator 推进回合；对局被占用时请调度器下个 tick 重新派发；
 *    - 提醒：带上未提交玩家列表发送 TIMER_WARNING；
 * 2) 依次恢复计时器、启动 tick 循环、续跑崩溃前未完成的回合、启动回合监控。
 *
 * 本类不管理线程池与持久化，也不做推进判定。
 */
@Component
@RequiredArgsConstructor
public class TurnClockCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TurnClockCoordinator.class);

    private final CountdownScheduler scheduler;
    private final TurnOrchestrator orchestrator;
    private final TurnMonitor monitor;
    private final TurnTimerService timers;
    private final SessionStateMachine sessions;
    private final TurnNotifier notifier;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("协调器启动：注册到期/提醒回调并恢复计时器");
        scheduler.setDeadlineHandler(this::onDeadline);
        scheduler.setWarningListener(this::onWarning);
        scheduler.restoreAll();
        scheduler.start();
        orchestrator.recoverInFlight();
        monitor.start();
    }

    void onDeadline(String sessionId) {
        try {
            orchestrator.onDeadline(sessionId);
        } catch (ConcurrentAdvanceInProgressException e) {
            // 没有产生记录，也没有通知；交回调度器在下个 tick 重新判断
            log.warn("对局忙，到期推进延后到下个 tick: sessionId={}, msg={}", sessionId, e.getMessage());
            scheduler.requeueDeadline(sessionId);
        } catch (TurnHubException e) {
            // 失败已经记录在回合记录上并发出通知
            log.warn("到期推进未完成: sessionId={}, kind={}, msg={}", sessionId, e.getKind(), e.getMessage());
        }
    }

    void onWarning(String sessionId, long remainingSeconds) {
        GameSession session = sessions.get(sessionId);
        List<String> outstanding = orchestrator.probeStatus(sessionId)
                .map(GameStatus::outstandingPlayers)
                .orElse(List.of());
        TimerState timer = timers.get(sessionId);
        notifier.notify(TurnNotificationEvent.builder()
                .sessionId(sessionId)
                .sessionName(session.getName())
                .eventType(EventType.TIMER_WARNING)
                .remainingSeconds(remainingSeconds)
                .deadlineEpochMs(timers.deadlineEpochMs(timer))
                .outstandingPlayers(outstanding)
                .message("剩余 " + remainingSeconds / 60 + " 分钟")
                .build());
    }
}
