package com.turnhub.turnservice.domain.repository;

import com.turnhub.turnservice.domain.model.TurnRecord;

import java.util.List;
import java.util.Optional;

/**
 * 回合记录仓储（只追加）
 * ----------------------------------------
 * - append 要求 turnNumber = 最新回合 + 1，否则抛 IllegalStateException；
 * - update 只允许修改已存在的记录（阶段推进、备份指针、完成时间）；
 * - truncateAfter 仅供回滚使用。
 * ----------------------------------------
 */
public interface TurnRecordRepository {

    void append(TurnRecord record);

    void update(TurnRecord record);

    Optional<TurnRecord> latest(String sessionId);

    Optional<TurnRecord> find(String sessionId, int turnNumber);

    /** 按 turnNumber 升序 */
    List<TurnRecord> findBySession(String sessionId);

    /**
     * 删除 turnNumber > toTurn 的所有记录
     * @return 删除条数
     */
    int truncateAfter(String sessionId, int toTurn);
}
