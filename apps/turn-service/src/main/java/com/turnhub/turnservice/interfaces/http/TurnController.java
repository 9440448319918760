package com.turnhub.turnservice.interfaces.http;

import com.turnhub.turnservice.backup.BackupStore;
import com.turnhub.turnservice.common.ApiResponse;
import com.turnhub.turnservice.domain.dto.AdvanceOutcome;
import com.turnhub.turnservice.domain.model.BackupSnapshot;
import com.turnhub.turnservice.domain.model.TurnRecord;
import com.turnhub.turnservice.interfaces.http.dto.RollbackRequest;
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
 * 回合接口：历史、强制推进、恢复、回滚。
 */
@RestController
@RequestMapping("/api/sessions/{id}/turns")
@RequiredArgsConstructor
public class TurnController {

    private final TurnOrchestrator orchestrator;
    private final BackupStore backups;

    @GetMapping
    public ResponseEntity<ApiResponse<List<TurnRecord>>> history(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.history(id)));
    }

    @GetMapping("/backups")
    public ResponseEntity<ApiResponse<List<BackupSnapshot>>> backups(@PathVariable("id") String id) {
        orchestrator.stateOf(id);
        return ResponseEntity.ok(ApiResponse.success(backups.list(id)));
    }

    @PostMapping("/force")
    public ResponseEntity<ApiResponse<AdvanceOutcome>> force(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.forceAdvance(id)));
    }

    @PostMapping("/resume")
    public ResponseEntity<ApiResponse<AdvanceOutcome>> resume(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.resume(id)));
    }

    @PostMapping("/rollback")
    public ResponseEntity<ApiResponse<AdvanceOutcome>> rollback(@PathVariable("id") String id,
                                                                @Valid @RequestBody RollbackRequest req) {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.rollback(id, req.toTurn())));
    }
}
