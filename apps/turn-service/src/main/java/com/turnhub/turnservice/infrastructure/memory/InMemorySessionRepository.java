package com.turnhub.turnservice.infrastructure.memory;

import com.turnhub.turnservice.domain.model.GameSession;
import com.turnhub.turnservice.domain.repository.SessionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 单机/开发用的内存仓储。读写都复制对象，调用方拿到的实例修改后必须 save 才生效，与 Redis 实现一致。
 */
@Repository
@ConditionalOnProperty(prefix = "turnhost.store", name = "type", havingValue = "memory")
public class InMemorySessionRepository implements SessionRepository {

    private final ConcurrentMap<String, GameSession> store = new ConcurrentHashMap<>();

    @Override
    public void save(GameSession session) {
        store.put(session.getId(), session.toBuilder().build());
    }

    @Override
    public Optional<GameSession> findById(String sessionId) {
        return Optional.ofNullable(store.get(sessionId)).map(s -> s.toBuilder().build());
    }

    @Override
    public List<GameSession> findAll() {
        return store.values().stream()
                .map(s -> s.toBuilder().build())
                .sorted(Comparator.comparingLong(GameSession::getCreatedAt))
                .toList();
    }
}
