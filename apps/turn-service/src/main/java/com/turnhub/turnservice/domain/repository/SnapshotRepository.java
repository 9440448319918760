package com.turnhub.turnservice.domain.repository;

import com.turnhub.turnservice.domain.enums.BackupPhase;
import com.turnhub.turnservice.domain.model.BackupSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * 备份快照索引。索引项一经写入不可覆盖。
 */
public interface SnapshotRepository {

    /**
     * 写入索引
     * @return false 表示同一 (session, turn, phase) 已存在，未写入
     */
    boolean save(BackupSnapshot snapshot);

    Optional<BackupSnapshot> find(String sessionId, int turnNumber, BackupPhase phase);

    List<BackupSnapshot> findBySession(String sessionId);

    /** 移除索引项（仅用于回滚后作废被截掉的回合） */
    void delete(BackupSnapshot snapshot);
}
