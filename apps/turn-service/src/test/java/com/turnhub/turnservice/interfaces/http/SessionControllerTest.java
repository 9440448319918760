package com.turnhub.turnservice.interfaces.http;

import com.turnhub.turnservice.clock.TurnTimerService;
import com.turnhub.turnservice.common.WebExceptionAdvice;
import com.turnhub.turnservice.common.error.InvalidStateTransitionException;
import com.turnhub.turnservice.common.error.SessionNotFoundException;
import com.turnhub.turnservice.domain.dto.SessionSettings;
import com.turnhub.turnservice.domain.enums.OrchestratorState;
import com.turnhub.turnservice.domain.enums.SessionEvent;
import com.turnhub.turnservice.domain.enums.SessionPhase;
import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.ledger.ExtensionLedger;
import com.turnhub.turnservice.session.SessionStateMachine;
import com.turnhub.turnservice.turn.TurnOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    @Mock
    private SessionStateMachine sessions;

    @Mock
    private TurnOrchestrator orchestrator;

    @Mock
    private TurnTimerService timers;

    @Mock
    private ExtensionLedger ledger;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new SessionController(sessions, orchestrator, timers, ledger))
                .setControllerAdvice(new WebExceptionAdvice())
                .build();
    }

    @Test
    void createPassesSettingsThrough() throws Exception {
        when(sessions.create(any(SessionSettings.class))).thenReturn("s-1");

        mvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Ragnarok\",\"defaultTurnSeconds\":7200,\"chessClockEnabled\":true,"
                                + "\"chessClockStartingSeconds\":3600,\"maxExtensionsPerTurn\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("s-1"));

        ArgumentCaptor<SessionSettings> captor = ArgumentCaptor.forClass(SessionSettings.class);
        verify(sessions).create(captor.capture());
        assertThat(captor.getValue().getDefaultTurnSeconds()).isEqualTo(7200L);
        assertThat(captor.getValue().isChessClockEnabled()).isTrue();
        assertThat(captor.getValue().getMaxExtensionsPerTurn()).isEqualTo(2);
    }

    @Test
    void blankNameIsRejected() throws Exception {
        mvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\"}"))
                .andExpect(status().isBadRequest());
        verify(sessions, never()).create(any());
    }

    @Test
    void getCombinesLifecycleTimerAndOrchestratorState() throws Exception {
        TimerState timer = TimerState.builder().sessionId("s-1").remainingMs(90_000L).running(true).build();
        when(sessions.get("s-1")).thenReturn(GameSession.builder()
                .id("s-1").name("Ragnarok").phase(SessionPhase.STARTED).build());
        when(timers.get("s-1")).thenReturn(timer);
        when(timers.deadlineEpochMs(timer)).thenReturn(1_000L);
        when(orchestrator.stateOf("s-1")).thenReturn(OrchestratorState.POST_BACKUP_IN_FLIGHT);

        mvc.perform(get("/api/sessions/s-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.session.name").value("Ragnarok"))
                .andExpect(jsonPath("$.data.started").value(true))
                .andExpect(jsonPath("$.data.ended").value(false))
                .andExpect(jsonPath("$.data.orchestratorState").value("POST_BACKUP_IN_FLIGHT"))
                .andExpect(jsonPath("$.data.deadlineEpochMs").value(1000));
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        when(sessions.get("nope")).thenThrow(new SessionNotFoundException("nope"));

        mvc.perform(get("/api/sessions/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorKind").value("SESSION_NOT_FOUND"));
    }

    @Test
    void deletingRunningGameIsConflict() throws Exception {
        when(orchestrator.deleteSession("s-1"))
                .thenThrow(new InvalidStateTransitionException("s-1", SessionPhase.STARTED, SessionEvent.DELETE_LOBBY));

        mvc.perform(post("/api/sessions/s-1/delete"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorKind").value("INVALID_STATE_TRANSITION"));
    }

    @Test
    void resetStartedIsAPrivilegedTransition() throws Exception {
        when(sessions.transition("s-1", SessionEvent.RESET_STARTED)).thenReturn(GameSession.builder()
                .id("s-1").phase(SessionPhase.LAUNCHED).build());

        mvc.perform(post("/api/sessions/s-1/reset-started"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.phase").value("LAUNCHED"));
    }
}
