package com.turnhub.turnservice.infrastructure.redis.repo;

import com.turnhub.turnservice.domain.enums.BackupPhase;
import com.turnhub.turnservice.domain.model.BackupSnapshot;
import com.turnhub.turnservice.domain.repository.SnapshotRepository;
import com.turnhub.turnservice.infrastructure.redis.RedisKeys;
import com.turnhub.turnservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "turnhost.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisSnapshotRepository implements SnapshotRepository {

    private final RedisOps ops;

    @Override
    public boolean save(BackupSnapshot snapshot) {
        return ops.hSetNx(RedisKeys.snapshots(snapshot.getSessionId()),
                RedisKeys.snapshotField(snapshot.getTurnNumber(), snapshot.getPhase().name()), snapshot);
    }

    @Override
    public Optional<BackupSnapshot> find(String sessionId, int turnNumber, BackupPhase phase) {
        return Optional.ofNullable(ops.hGet(RedisKeys.snapshots(sessionId),
                RedisKeys.snapshotField(turnNumber, phase.name()), BackupSnapshot.class));
    }

    @Override
    public List<BackupSnapshot> findBySession(String sessionId) {
        return ops.hGetAll(RedisKeys.snapshots(sessionId)).values().stream()
                .map(BackupSnapshot.class::cast)
                .sorted(Comparator.comparingInt(BackupSnapshot::getTurnNumber).thenComparing(BackupSnapshot::getPhase))
                .toList();
    }

    @Override
    public void delete(BackupSnapshot snapshot) {
        ops.hDel(RedisKeys.snapshots(snapshot.getSessionId()),
                RedisKeys.snapshotField(snapshot.getTurnNumber(), snapshot.getPhase().name()));
    }
}
