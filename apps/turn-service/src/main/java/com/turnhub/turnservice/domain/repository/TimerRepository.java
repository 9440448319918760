package com.turnhub.turnservice.domain.repository;

import com.turnhub.turnservice.domain.model.TimerState;

import java.util.List;
import java.util.Optional;

/**
 * 回合计时状态仓储
 * ----------------------------------------
 * - 每个对局一条 TimerState；
 * - 用于进程重启后恢复倒计时（remaining + lastTick）。
 * ----------------------------------------
 */
public interface TimerRepository {

    void save(TimerState state);

    Optional<TimerState> findById(String sessionId);

    List<TimerState> findAll();

    /** 所有 running=true 的计时器 */
    default List<TimerState> findRunning() {
        return findAll().stream().filter(TimerState::isRunning).toList();
    }

    void delete(String sessionId);
}
