package com.turnhub.turnservice.process;

import com.turnhub.turnservice.domain.model.GameSession;

public interface GameProcessFactory {

    GameProcessHandle create(GameSession session);
}
