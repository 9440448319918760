package com.turnhub.turnservice.process;

import com.turnhub.turnservice.domain.model.GameSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 进程句柄注册表：每个对局至多一个句柄，只有编排器通过这里拿到句柄。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameProcessRegistry {

    private final GameProcessFactory factory;

    private final ConcurrentMap<String, GameProcessHandle> handles = new ConcurrentHashMap<>();

    /**
     * 取得对局的句柄，不存在则创建（不启动）。
     */
    public GameProcessHandle acquire(GameSession session) {
        return handles.computeIfAbsent(session.getId(), id -> factory.create(session));
    }

    public Optional<GameProcessHandle> find(String sessionId) {
        return Optional.ofNullable(handles.get(sessionId));
    }

    /**
     * 停止并移除句柄。
     */
    public void release(String sessionId) {
        GameProcessHandle h = handles.remove(sessionId);
        if (h != null) {
            h.stop();
            log.info("进程句柄已释放: sessionId={}", sessionId);
        }
    }
}
