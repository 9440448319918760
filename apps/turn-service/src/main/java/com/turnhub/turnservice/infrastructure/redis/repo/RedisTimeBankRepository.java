package com.turnhub.turnservice.infrastructure.redis.repo;

import com.turnhub.turnservice.domain.model.PlayerTimeBank;
import com.turnhub.turnservice.domain.repository.TimeBankRepository;
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
public class RedisTimeBankRepository implements TimeBankRepository {

    private final RedisOps ops;

    @Override
    public void save(PlayerTimeBank bank) {
        ops.hSet(RedisKeys.timeBanks(bank.getSessionId()), bank.getPlayerId(), bank);
    }

    @Override
    public Optional<PlayerTimeBank> find(String sessionId, String playerId) {
        return Optional.ofNullable(ops.hGet(RedisKeys.timeBanks(sessionId), playerId, PlayerTimeBank.class));
    }

    @Override
    public List<PlayerTimeBank> findBySession(String sessionId) {
        return ops.hGetAll(RedisKeys.timeBanks(sessionId)).values().stream()
                .map(PlayerTimeBank.class::cast)
                .sorted(Comparator.comparing(PlayerTimeBank::getPlayerId))
                .toList();
    }
}
