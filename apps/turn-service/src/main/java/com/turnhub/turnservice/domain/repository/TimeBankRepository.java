package com.turnhub.turnservice.domain.repository;

import com.turnhub.turnservice.domain.model.PlayerTimeBank;

import java.util.List;
import java.util.Optional;

public interface TimeBankRepository {

    void save(PlayerTimeBank bank);

    Optional<PlayerTimeBank> find(String sessionId, String playerId);

    List<PlayerTimeBank> findBySession(String sessionId);
}
