package com.turnhub.turnservice.interfaces.http;

import com.turnhub.turnservice.common.ApiResponse;
import com.turnhub.turnservice.domain.dto.AdvanceOutcome;
import com.turnhub.turnservice.turn.TurnOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 引擎包装脚本回调接口（引擎的 preexec / postexec 命令通过 curl 调用）。
 */
@Slf4j
@RestController
@RequestMapping("/api/hooks")
@RequiredArgsConstructor
public class HookController {

    private final TurnOrchestrator orchestrator;

    /**
     * 引擎开始处理回合前：同步完成前置备份后返回。
     */
    @PostMapping("/pre-advance")
    public ResponseEntity<ApiResponse<AdvanceOutcome>> preAdvance(@RequestParam("sessionId") String sessionId) {
        log.info("收到 pre-advance 钩子: sessionId={}", sessionId);
        return ResponseEntity.ok(ApiResponse.success(orchestrator.preAdvanceHook(sessionId)));
    }

    /**
     * 引擎处理完回合后：完成后置备份与通知，返回新回合号、剩余秒数和未提交玩家。
     */
    @PostMapping("/post-advance")
    public ResponseEntity<ApiResponse<AdvanceOutcome>> postAdvance(@RequestParam("sessionId") String sessionId) {
        log.info("收到 post-advance 钩子: sessionId={}", sessionId);
        return ResponseEntity.ok(ApiResponse.success(orchestrator.postAdvanceHook(sessionId)));
    }
}
