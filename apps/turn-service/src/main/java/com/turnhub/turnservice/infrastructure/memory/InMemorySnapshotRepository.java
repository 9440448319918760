package com.turnhub.turnservice.infrastructure.memory;

import com.turnhub.turnservice.domain.enums.BackupPhase;
import com.turnhub.turnservice.domain.model.BackupSnapshot;
import com.turnhub.turnservice.domain.repository.SnapshotRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Repository
@ConditionalOnProperty(prefix = "turnhost.store", name = "type", havingValue = "memory")
public class InMemorySnapshotRepository implements SnapshotRepository {

    private final ConcurrentMap<String, BackupSnapshot> store = new ConcurrentHashMap<>();

    @Override
    public boolean save(BackupSnapshot snapshot) {
        String key = key(snapshot.getSessionId(), snapshot.getTurnNumber(), snapshot.getPhase());
        return store.putIfAbsent(key, snapshot.toBuilder().build()) == null;
    }

    @Override
    public Optional<BackupSnapshot> find(String sessionId, int turnNumber, BackupPhase phase) {
        return Optional.ofNullable(store.get(key(sessionId, turnNumber, phase))).map(s -> s.toBuilder().build());
    }

    @Override
    public List<BackupSnapshot> findBySession(String sessionId) {
        return store.values().stream()
                .filter(s -> s.getSessionId().equals(sessionId))
                .map(s -> s.toBuilder().build())
                .sorted(Comparator.comparingInt(BackupSnapshot::getTurnNumber).thenComparing(BackupSnapshot::getPhase))
                .toList();
    }

    @Override
    public void delete(BackupSnapshot snapshot) {
        store.remove(key(snapshot.getSessionId(), snapshot.getTurnNumber(), snapshot.getPhase()));
    }

    private static String key(String sessionId, int turnNumber, BackupPhase phase) {
        return sessionId + "#" + turnNumber + "#" + phase;
    }
}
