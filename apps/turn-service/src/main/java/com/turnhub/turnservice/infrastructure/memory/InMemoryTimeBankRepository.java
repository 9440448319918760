package com.turnhub.turnservice.infrastructure.memory;

import com.turnhub.turnservice.domain.model.PlayerTimeBank;
import com.turnhub.turnservice.domain.repository.TimeBankRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Repository
@ConditionalOnProperty(prefix = "turnhost.store", name = "type", havingValue = "memory")
public class InMemoryTimeBankRepository implements TimeBankRepository {

    private final ConcurrentMap<String, Map<String, PlayerTimeBank>> store = new ConcurrentHashMap<>();

    @Override
    public void save(PlayerTimeBank bank) {
        store.computeIfAbsent(bank.getSessionId(), k -> new ConcurrentHashMap<>())
                .put(bank.getPlayerId(), bank.toBuilder().build());
    }

    @Override
    public Optional<PlayerTimeBank> find(String sessionId, String playerId) {
        return Optional.ofNullable(store.getOrDefault(sessionId, Map.of()).get(playerId))
                .map(b -> b.toBuilder().build());
    }

    @Override
    public List<PlayerTimeBank> findBySession(String sessionId) {
        return store.getOrDefault(sessionId, Map.of()).values().stream()
                .map(b -> b.toBuilder().build())
                .sorted(Comparator.comparing(PlayerTimeBank::getPlayerId))
                .toList();
    }
}
