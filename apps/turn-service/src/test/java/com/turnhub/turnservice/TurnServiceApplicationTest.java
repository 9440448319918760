package com.turnhub.turnservice;

import com.turnhub.turnservice.domain.repository.TurnRecordRepository;
import com.turnhub.turnservice.infrastructure.memory.InMemoryTurnRecordRepository;
import com.turnhub.turnservice.turn.TurnOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "turnhost.store.type=memory",
                "turnhost.process.data-root=target/test-data",
                "turnhost.backup.root=target/test-backups"
        })
class TurnServiceApplicationTest {

    @Autowired
    private TurnOrchestrator orchestrator;

    @Autowired
    private TurnRecordRepository records;

    @Test
    void contextStartsWithInMemoryStore() {
        assertThat(orchestrator).isNotNull();
        assertThat(records).isInstanceOf(InMemoryTurnRecordRepository.class);
    }
}
