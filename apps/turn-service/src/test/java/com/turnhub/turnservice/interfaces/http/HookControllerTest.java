package com.turnhub.turnservice.interfaces.http;

import com.turnhub.turnservice.common.WebExceptionAdvice;
import com.turnhub.turnservice.common.error.BackupFailureException;
import com.turnhub.turnservice.common.error.ConcurrentAdvanceInProgressException;
import com.turnhub.turnservice.domain.dto.AdvanceOutcome;
import com.turnhub.turnservice.domain.enums.AdvanceTrigger;
import com.turnhub.turnservice.turn.TurnOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class HookControllerTest {

    @Mock
    private TurnOrchestrator orchestrator;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new HookController(orchestrator))
                .setControllerAdvice(new WebExceptionAdvice())
                .build();
    }

    @Test
    void postAdvanceReturnsNewTurnAndOutstandingPlayers() throws Exception {
        when(orchestrator.postAdvanceHook("s-1")).thenReturn(AdvanceOutcome.builder()
                .sessionId("s-1")
                .turnNumber(5)
                .deadlineEpochMs(1_700_000_000_000L)
                .remainingSeconds(3600)
                .outstandingPlayers(List.of("Ermor", "Ulm"))
                .trigger(AdvanceTrigger.POST_HOOK)
                .alreadyCompleted(false)
                .build());

        mvc.perform(post("/api/hooks/post-advance").param("sessionId", "s-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.turnNumber").value(5))
                .andExpect(jsonPath("$.data.remainingSeconds").value(3600))
                .andExpect(jsonPath("$.data.outstandingPlayers[1]").value("Ulm"));
    }

    @Test
    void preAdvanceBackupFailureIsServerError() throws Exception {
        when(orchestrator.preAdvanceHook("s-1")).thenThrow(new BackupFailureException("s-1", "磁盘已满"));

        mvc.perform(post("/api/hooks/pre-advance").param("sessionId", "s-1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorKind").value("BACKUP_FAILURE"));
    }

    @Test
    void busySessionIsConflict() throws Exception {
        when(orchestrator.postAdvanceHook("s-1"))
                .thenThrow(new ConcurrentAdvanceInProgressException("s-1", "对局正在处理其他操作"));

        mvc.perform(post("/api/hooks/post-advance").param("sessionId", "s-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorKind").value("CONCURRENT_ADVANCE_IN_PROGRESS"));
    }

    @Test
    void missingSessionIdIsBadRequest() throws Exception {
        mvc.perform(post("/api/hooks/pre-advance"))
                .andExpect(status().isBadRequest());
    }
}
