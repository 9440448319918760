package com.turnhub.turnservice.infrastructure.redis.repo;

import com.turnhub.turnservice.domain.model.TurnRecord;
import com.turnhub.turnservice.domain.repository.TurnRecordRepository;
import com.turnhub.turnservice.infrastructure.redis.RedisKeys;
import com.turnhub.turnservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * RedisTurnRecordRepository
 * -------------------------------------------------------
 * 回合记录的 Redis 仓储实现（Hash：turnNumber -> TurnRecord）。
 * 连续性检查依赖调用方持有会话锁；HSETNX 防止同一回合号被覆盖。
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "turnhost.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisTurnRecordRepository implements TurnRecordRepository {

    private final RedisOps ops;

    @Override
    public void append(TurnRecord record) {
        String sessionId = record.getSessionId();
        int expected = latest(sessionId).map(TurnRecord::getTurnNumber).orElse(0) + 1;
        if (record.getTurnNumber() != expected) {
            throw new IllegalStateException("回合号不连续: expected=" + expected + ", actual=" + record.getTurnNumber());
        }
        if (!ops.hSetNx(RedisKeys.turns(sessionId), field(record.getTurnNumber()), record)) {
            throw new IllegalStateException("回合记录已存在: " + sessionId + "#" + record.getTurnNumber());
        }
    }

    @Override
    public void update(TurnRecord record) {
        String key = RedisKeys.turns(record.getSessionId());
        if (ops.hGet(key, field(record.getTurnNumber()), TurnRecord.class) == null) {
            throw new IllegalStateException("回合记录不存在: " + record.getSessionId() + "#" + record.getTurnNumber());
        }
        ops.hSet(key, field(record.getTurnNumber()), record);
    }

    @Override
    public Optional<TurnRecord> latest(String sessionId) {
        List<TurnRecord> all = findBySession(sessionId);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    @Override
    public Optional<TurnRecord> find(String sessionId, int turnNumber) {
        return Optional.ofNullable(ops.hGet(RedisKeys.turns(sessionId), field(turnNumber), TurnRecord.class));
    }

    @Override
    public List<TurnRecord> findBySession(String sessionId) {
        return ops.hGetAll(RedisKeys.turns(sessionId)).values().stream()
                .map(TurnRecord.class::cast)
                .sorted(Comparator.comparingInt(TurnRecord::getTurnNumber))
                .toList();
    }

    @Override
    public int truncateAfter(String sessionId, int toTurn) {
        String[] fields = findBySession(sessionId).stream()
                .filter(r -> r.getTurnNumber() > toTurn)
                .map(r -> field(r.getTurnNumber()))
                .toArray(String[]::new);
        if (fields.length == 0) return 0;
        ops.hDel(RedisKeys.turns(sessionId), fields);
        return fields.length;
    }

    private static String field(int turnNumber) {
        return String.valueOf(turnNumber);
    }
}
