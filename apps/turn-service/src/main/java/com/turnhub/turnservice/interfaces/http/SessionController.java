package com.turnhub.turnservice.interfaces.http;

import com.turnhub.turnservice.clock.TurnTimerService;
import com.turnhub.turnservice.common.ApiResponse;
import com.turnhub.turnservice.domain.dto.ExtensionStat;
import com.turnhub.turnservice.domain.dto.SessionSettings;
import com.turnhub.turnservice.domain.enums.SessionEvent;
import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.model.GameStatus;
import com.turnhub.turnservice.domain.model.PlayerTimeBank;
import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.interfaces.http.dto.RegisterPlayerRequest;
import com.turnhub.turnservice.interfaces.http.dto.SessionView;
import com.turnhub.turnservice.ledger.ExtensionLedger;
import com.turnhub.turnservice.session.SessionStateMachine;
import com.turnhub.turnservice.turn.TurnOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 对局生命周期与进程控制接口（运维/聊天层调用）。
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionStateMachine sessions;
    private final TurnOrchestrator orchestrator;
    private final TurnTimerService timers;
    private final ExtensionLedger ledger;

    @PostMapping
    public ResponseEntity<ApiResponse<String>> create(@Valid @RequestBody SessionSettings settings) {
        return ResponseEntity.ok(ApiResponse.success(sessions.create(settings)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<GameSession>>> list() {
        return ResponseEntity.ok(ApiResponse.success(sessions.list()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<SessionView>> get(@PathVariable("id") String id) {
        GameSession s = sessions.get(id);
        TimerState timer = timers.get(id);
        SessionView view = new SessionView(s, timer, timers.deadlineEpochMs(timer), orchestrator.stateOf(id),
                s.isActive(), s.isStarted(), s.isEnded());
        return ResponseEntity.ok(ApiResponse.success(view));
    }

    /** 引擎状态（未提交玩家等），尚无状态文件时 data 为 null */
    @GetMapping("/{id}/status")
    public ResponseEntity<ApiResponse<GameStatus>> status(@PathVariable("id") String id) {
        sessions.get(id);
        return ResponseEntity.ok(ApiResponse.success(orchestrator.probeStatus(id).orElse(null)));
    }

    @PostMapping("/{id}/launch")
    public ResponseEntity<ApiResponse<GameSession>> launch(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.launch(id)));
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<ApiResponse<GameSession>> stop(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.stopProcess(id)));
    }

    @PostMapping("/{id}/end")
    public ResponseEntity<ApiResponse<GameSession>> end(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.endGame(id)));
    }

    @PostMapping("/{id}/delete")
    public ResponseEntity<ApiResponse<GameSession>> delete(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.deleteSession(id)));
    }

    /** 特权操作：把已开始的对局退回 LAUNCHED */
    @PostMapping("/{id}/reset-started")
    public ResponseEntity<ApiResponse<GameSession>> resetStarted(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(sessions.transition(id, SessionEvent.RESET_STARTED)));
    }

    @PostMapping("/{id}/players")
    public ResponseEntity<ApiResponse<PlayerTimeBank>> registerPlayer(@PathVariable("id") String id,
                                                                      @Valid @RequestBody RegisterPlayerRequest req) {
        return ResponseEntity.ok(ApiResponse.success(ledger.registerPlayer(id, req.playerId(), req.nation())));
    }

    @GetMapping("/{id}/extensions")
    public ResponseEntity<ApiResponse<List<ExtensionStat>>> extensions(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(ledger.stats(id)));
    }
}
