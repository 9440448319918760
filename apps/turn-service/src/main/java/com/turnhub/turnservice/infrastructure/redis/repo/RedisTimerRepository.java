package com.turnhub.turnservice.infrastructure.redis.repo;

import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.domain.repository.TimerRepository;
import com.turnhub.turnservice.infrastructure.redis.RedisKeys;
import com.turnhub.turnservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * RedisTimerRepository
 * -------------------------------------------------------
 * 回合计时状态的 Redis 仓储实现。
 * - 只保存 remaining/lastTick/闩锁等数据，不保存调度任务句柄；
 * - 不设 TTL：暂停中的对局可能几天后才恢复。
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "turnhost.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisTimerRepository implements TimerRepository {

    private final RedisOps ops;

    @Override
    public void save(TimerState state) {
        ops.set(RedisKeys.timer(state.getSessionId()), state);
        ops.sAdd(RedisKeys.timerIndex(), state.getSessionId());
    }

    @Override
    public Optional<TimerState> findById(String sessionId) {
        return Optional.ofNullable(ops.get(RedisKeys.timer(sessionId), TimerState.class));
    }

    @Override
    public List<TimerState> findAll() {
        return ops.sMembers(RedisKeys.timerIndex()).stream()
                .map(id -> ops.get(RedisKeys.timer(id), TimerState.class))
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public void delete(String sessionId) {
        ops.del(RedisKeys.timer(sessionId));
        ops.sRem(RedisKeys.timerIndex(), sessionId);
    }
}
