package com.turnhub.turnservice.backup;

import com.turnhub.turnservice.domain.enums.BackupPhase;
import com.turnhub.turnservice.domain.model.BackupSnapshot;
import com.turnhub.turnservice.domain.model.GameSession;

import java.util.List;
import java.util.Optional;

/**
 * 回合存档备份
 * ----------------------------------------
 * - write 返回前快照必须已完整落盘并通过校验，否则抛 BackupFailureException；
 * - 同一 (session, turn, phase) 已有索引时直接返回已有快照；
 * - restore 先校验快照，再覆盖对局工作目录；
 * - 回滚截断的回合，其快照由 discardAfter 作废。
 * ----------------------------------------
 */
public interface BackupStore {

    BackupSnapshot write(GameSession session, int turnNumber, BackupPhase phase);

    Optional<BackupSnapshot> find(String sessionId, int turnNumber, BackupPhase phase);

    List<BackupSnapshot> list(String sessionId);

    void restore(GameSession session, BackupSnapshot snapshot);

    /**
     * 作废 afterTurn 之后的全部快照（索引与目录），回滚后重新推进这些回合时重新备份。
     * @return 作废的快照数
     */
    int discardAfter(String sessionId, int afterTurn);
}
