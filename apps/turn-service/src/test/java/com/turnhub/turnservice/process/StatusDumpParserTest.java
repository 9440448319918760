package com.turnhub.turnservice.process;

import com.turnhub.turnservice.domain.model.GameStatus;
import com.turnhub.turnservice.domain.model.NationStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatusDumpParserTest {

    @Test
    void parsesTurnAndNations() {
        GameStatus status = StatusDumpParser.parse(List.of(
                "Status for 'Ragnarok'",
                "turn 7, era 1, mods 0, turnlimit 0",
                "Nation\t5\t0\t1\t0\t2\tearly_arcoscephale\tArcoscephale\tGolden Era",
                "Nation\t6\t0\t1\t0\t0\tearly_ermor\tErmor\tNew Faith",
                "Nation\t7\t0\t2\t0\t0\tearly_ulm\tUlm\tEnigma of Steel",
                "Nation\t8\t0\t-1\t0\t0\tearly_marverni\tMarverni\tTime of Druids"));

        assertThat(status.getTurn()).isEqualTo(7);
        assertThat(status.getNations()).hasSize(4);
        NationStatus first = status.getNations().get(0);
        assertThat(first.getNationId()).isEqualTo(5);
        assertThat(first.getPlayerStatus()).isEqualTo(1);
        assertThat(first.getTurnStatus()).isEqualTo(2);
        assertThat(first.getName()).isEqualTo("Arcoscephale");
    }

    @Test
    void outstandingExcludesSubmittedAiAndDeadNations() {
        GameStatus status = StatusDumpParser.parse(List.of(
                "turn 3, era 1",
                "Nation\t5\t0\t1\t0\t2\ta\tDone",
                "Nation\t6\t0\t1\t0\t0\tb\tWaiting",
                "Nation\t7\t0\t1\t0\t1\tc\tPartial",
                "Nation\t8\t0\t2\t0\t0\td\tComputer",
                "Nation\t9\t0\t-1\t0\t0\te\tDead",
                "Nation\t10\t0\t-2\t0\t0\tf\tDyingNow"));

        assertThat(status.outstandingPlayers()).containsExactly("Waiting", "Partial", "DyingNow");
    }

    @Test
    void lobbyHasNoTurnLine() {
        GameStatus status = StatusDumpParser.parse(List.of("Status for 'Lobby'"));

        assertThat(status.getTurn()).isEqualTo(-1);
        assertThat(status.outstandingPlayers()).isEmpty();
    }

    @Test
    void shortNationRowUsesLastColumnAsName() {
        GameStatus status = StatusDumpParser.parse(List.of(
                "turn 1",
                "Nation\t5\t0\t1\t0\t0\tArco",
                "Nation\tbroken"));

        assertThat(status.getNations()).extracting(NationStatus::getName).containsExactly("Arco");
    }
}
