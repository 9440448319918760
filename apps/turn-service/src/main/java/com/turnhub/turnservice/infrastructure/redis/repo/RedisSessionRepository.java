package com.turnhub.turnservice.infrastructure.redis.repo;

import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.repository.SessionRepository;
import com.turnhub.turnservice.infrastructure.redis.RedisKeys;
import com.turnhub.turnservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 对局的 Redis 仓储实现：对象按 JSON 存储，ID 另存一个 SET 作索引。
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "turnhost.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisSessionRepository implements SessionRepository {

    private final RedisOps ops;

    @Override
    public void save(GameSession session) {
        ops.set(RedisKeys.session(session.getId()), session);
        ops.sAdd(RedisKeys.sessionIndex(), session.getId());
    }

    @Override
    public Optional<GameSession> findById(String sessionId) {
        return Optional.ofNullable(ops.get(RedisKeys.session(sessionId), GameSession.class));
    }

    @Override
    public List<GameSession> findAll() {
        return ops.sMembers(RedisKeys.sessionIndex()).stream()
                .map(id -> ops.get(RedisKeys.session(id), GameSession.class))
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingLong(GameSession::getCreatedAt))
                .toList();
    }
}
