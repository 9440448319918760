package com.turnhub.turnservice.domain.repository;

import com.turnhub.turnservice.domain.model.GameSession;

import java.util.List;
import java.util.Optional;

/**
 * 对局仓储。
 */
public interface SessionRepository {

    void save(GameSession session);

    Optional<GameSession> findById(String sessionId);

    List<GameSession> findAll();
}
