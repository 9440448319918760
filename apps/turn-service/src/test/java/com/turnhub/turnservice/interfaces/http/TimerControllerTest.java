package com.turnhub.turnservice.interfaces.http;

import com.turnhub.turnservice.clock.TurnTimerService;
import com.turnhub.turnservice.common.WebExceptionAdvice;
import com.turnhub.turnservice.common.error.InsufficientBalanceException;
import com.turnhub.turnservice.common.error.LimitExceededException;
import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.ledger.ExtensionLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class TimerControllerTest {

    @Mock
    private TurnTimerService timers;

    @Mock
    private ExtensionLedger ledger;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new TimerController(timers, ledger))
                .setControllerAdvice(new WebExceptionAdvice())
                .build();
    }

    @Test
    void playerExtensionGoesThroughLedger() throws Exception {
        when(ledger.requestExtension("s-1", "alice", 600))
                .thenReturn(TimerState.builder().sessionId("s-1").remainingMs(4_200_000L).running(true).build());

        mvc.perform(post("/api/sessions/s-1/timer/extend")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":\"alice\",\"deltaSeconds\":600}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.remainingMs").value(4200000));
        verify(timers, never()).extend("s-1", 600);
    }

    @Test
    void operatorAdjustmentBypassesLedger() throws Exception {
        when(timers.extend("s-1", -300))
                .thenReturn(TimerState.builder().sessionId("s-1").remainingMs(0L).build());

        mvc.perform(post("/api/sessions/s-1/timer/extend")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deltaSeconds\":-300}"))
                .andExpect(status().isOk());
        verify(ledger, never()).requestExtension(anyString(),
                anyString(), anyLong());
    }

    @Test
    void limitExceededIsUnprocessable() throws Exception {
        when(ledger.requestExtension("s-1", "alice", 60))
                .thenThrow(new LimitExceededException("s-1", "本回合延时次数已用完: 2/2"));

        mvc.perform(post("/api/sessions/s-1/timer/extend")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":\"alice\",\"deltaSeconds\":60}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorKind").value("LIMIT_EXCEEDED"));
    }

    @Test
    void insufficientBalanceIsUnprocessable() throws Exception {
        when(ledger.requestExtension("s-1", "alice", 9999))
                .thenThrow(new InsufficientBalanceException("s-1", "棋钟余额不足"));

        mvc.perform(post("/api/sessions/s-1/timer/extend")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":\"alice\",\"deltaSeconds\":9999}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorKind").value("INSUFFICIENT_BALANCE"));
    }

    @Test
    void nonPositiveDefaultIsRejectedByValidation() throws Exception {
        mvc.perform(put("/api/sessions/s-1/timer/default")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"seconds\":0}"))
                .andExpect(status().isBadRequest());
        verify(timers, never()).setDefault(anyString(), anyLong());
    }
}
