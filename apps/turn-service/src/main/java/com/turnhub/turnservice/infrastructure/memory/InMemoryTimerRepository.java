package com.turnhub.turnservice.infrastructure.memory;

import com.turnhub.turnservice.domain.model.TimerState;
import com.turnhub.turnservice.domain.repository.TimerRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Repository
@ConditionalOnProperty(prefix = "turnhost.store", name = "type", havingValue = "memory")
public class InMemoryTimerRepository implements TimerRepository {

    private final ConcurrentMap<String, TimerState> store = new ConcurrentHashMap<>();

    @Override
    public void save(TimerState state) {
        store.put(state.getSessionId(), state.toBuilder().build());
    }

    @Override
    public Optional<TimerState> findById(String sessionId) {
        return Optional.ofNullable(store.get(sessionId)).map(t -> t.toBuilder().build());
    }

    @Override
    public List<TimerState> findAll() {
        return store.values().stream().map(t -> t.toBuilder().build()).toList();
    }

    @Override
    public void delete(String sessionId) {
        store.remove(sessionId);
    }
}
