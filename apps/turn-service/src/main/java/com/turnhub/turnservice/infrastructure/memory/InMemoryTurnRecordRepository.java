package com.turnhub.turnservice.infrastructure.memory;

import com.turnhub.turnservice.domain.model.TurnRecord;
import com.turnhub.turnservice.domain.repository.TurnRecordRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;

@Repository
@ConditionalOnProperty(prefix = "turnhost.store", name = "type", havingValue = "memory")
public class InMemoryTurnRecordRepository implements TurnRecordRepository {

    private final ConcurrentMap<String, NavigableMap<Integer, TurnRecord>> store = new ConcurrentHashMap<>();

    @Override
    public void append(TurnRecord record) {
        NavigableMap<Integer, TurnRecord> turns = turnsOf(record.getSessionId());
        synchronized (turns) {
            int expected = turns.isEmpty() ? 1 : turns.lastKey() + 1;
            if (record.getTurnNumber() != expected) {
                throw new IllegalStateException("回合号不连续: expected=" + expected + ", actual=" + record.getTurnNumber());
            }
            turns.put(record.getTurnNumber(), record.toBuilder().build());
        }
    }

    @Override
    public void update(TurnRecord record) {
        NavigableMap<Integer, TurnRecord> turns = turnsOf(record.getSessionId());
        synchronized (turns) {
            if (!turns.containsKey(record.getTurnNumber())) {
                throw new IllegalStateException("回合记录不存在: " + record.getSessionId() + "#" + record.getTurnNumber());
            }
            turns.put(record.getTurnNumber(), record.toBuilder().build());
        }
    }

    @Override
    public Optional<TurnRecord> latest(String sessionId) {
        Map.Entry<Integer, TurnRecord> last = turnsOf(sessionId).lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue().toBuilder().build());
    }

    @Override
    public Optional<TurnRecord> find(String sessionId, int turnNumber) {
        return Optional.ofNullable(turnsOf(sessionId).get(turnNumber)).map(r -> r.toBuilder().build());
    }

    @Override
    public List<TurnRecord> findBySession(String sessionId) {
        return turnsOf(sessionId).values().stream().map(r -> r.toBuilder().build()).toList();
    }

    @Override
    public int truncateAfter(String sessionId, int toTurn) {
        NavigableMap<Integer, TurnRecord> turns = turnsOf(sessionId);
        synchronized (turns) {
            NavigableMap<Integer, TurnRecord> tail = turns.tailMap(toTurn, false);
            int removed = tail.size();
            tail.clear();
            return removed;
        }
    }

    private NavigableMap<Integer, TurnRecord> turnsOf(String sessionId) {
        return store.computeIfAbsent(sessionId, k -> new ConcurrentSkipListMap<>());
    }
}
