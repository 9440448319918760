package com.turnhub.turnservice.interfaces.http;

import com.turnhub.turnservice.clock.TurnTimerService;
import com.turnhub.turnservice.common.ApiResponse;
import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.interfaces.http.dto.DurationRequest;
import com.turnhub.turnservice.interfaces.http.dto.ExtendRequest;
import com.turnhub.turnservice.ledger.ExtensionLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 计时器接口
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions/{id}/timer")
@RequiredArgsConstructor
public class TimerController {

    private final TurnTimerService timers;
    private final ExtensionLedger ledger;

    @GetMapping
    public ResponseEntity<ApiResponse<TimerState>> get(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(timers.get(id)));
    }

    @PostMapping("/pause")
    public ResponseEntity<ApiResponse<TimerState>> pause(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(timers.pause(id)));
    }

    @PostMapping("/resume")
    public ResponseEntity<ApiResponse<TimerState>> resume(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(timers.resume(id)));
    }

    /**
     * 延时：带 playerId 时走玩家账本（次数/棋钟余额），否则为运维直接调整。
     */
    @PostMapping("/extend")
    public ResponseEntity<ApiResponse<TimerState>> extend(@PathVariable("id") String id,
                                                          @RequestBody ExtendRequest req) {
        if (req.playerId() == null || req.playerId().isBlank()) {
            log.warn("运维调整计时: sessionId={}, delta={}s", id, req.deltaSeconds());
            return ResponseEntity.ok(ApiResponse.success(timers.extend(id, req.deltaSeconds())));
        }
        return ResponseEntity.ok(ApiResponse.success(ledger.requestExtension(id, req.playerId(), req.deltaSeconds())));
    }

    @PutMapping("/default")
    public ResponseEntity<ApiResponse<GameSession>> setDefault(@PathVariable("id") String id,
                                                               @Valid @RequestBody DurationRequest req) {
        return ResponseEntity.ok(ApiResponse.success(timers.setDefault(id, req.seconds())));
    }

    /** 仅对下一回合生效的时长 */
    @PutMapping("/next-turn")
    public ResponseEntity<ApiResponse<TimerState>> setNextTurn(@PathVariable("id") String id,
                                                               @Valid @RequestBody DurationRequest req) {
        return ResponseEntity.ok(ApiResponse.success(timers.setNextTurnDuration(id, req.seconds())));
    }
}
